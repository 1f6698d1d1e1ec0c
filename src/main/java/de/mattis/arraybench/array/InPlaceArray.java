package de.mattis.arraybench.array;

import java.util.Arrays;

/**
 * In-place initialisierbares Array: {@code init(v)} kostet O(1), {@code read}/{@code write} ebenfalls O(1),
 * und außer den {@code N} Slots wird kein weiterer Speicher proportional zu {@code N} gebraucht.
 *
 * <p>Die Slots sind in Blöcke fester Größe ({@code 2^blockShift}) aufgeteilt. Eine Grenze {@code b} trennt</p>
 * <ul>
 *   <li>Blöcke {@code < b} (initialisierter Bereich): Inhalt ist echt, außer der Block ist verkettet</li>
 *   <li>Blöcke {@code >= b} (Rest): Inhalt ist {@code initValue}, außer der Block ist verkettet</li>
 * </ul>
 *
 * <p>Eine Kette verbindet je einen Block links und rechts der Grenze: das erste Wort beider Blöcke
 * zeigt auf den Anfang des Partners. Ein verketteter linker Block ist unbeschrieben (liest
 * {@code initValue}) und leiht dem rechten Block seine restlichen Worte. Der rechte Block speichert
 * seine ersten {@code blockSize - 1} Werte dort und nur den letzten Wert bei sich selbst.</p>
 *
 * <p>Ob eine Kette besteht, wird bei jedem Zugriff aus dem Inhalt geprüft (Alignment, Bereich,
 * Gegenzeiger, Lage zur Grenze). Benutzerwerte, die zufällig wie ein Zeiger aussehen, werden beim
 * Schreiben über {@link #breakChain(int)} entschärft.</p>
 *
 * <p>{@code init(v)} setzt nur {@code initValue} und {@code b = 0}. Jeder Schreibzugriff, der einen
 * Block neu braucht, schiebt die Grenze um genau einen Block weiter ({@link #extend()}). Sind alle
 * Blöcke links der Grenze, greifen {@code read}/{@code write} direkt auf die Slots zu.</p>
 *
 * <p>{@code N} muss ein Vielfaches der Blockgröße sein, sonst wirft der Konstruktor
 * {@link IllegalArgumentException}. Der Runner überspringt solche Größen.</p>
 */
public abstract class InPlaceArray implements InitializableArray {

    private final String name;
    private final int blockShift;
    private final int blockSize;
    private final int blockMask;
    private final int blocks;

    /**
     * Die {@code N} Slots. Unterklassen dürfen freie Worte für Metadaten nutzen.
     */
    protected final long[] slots;

    private int boundary;
    private long initValue;

    /**
     * @param name       Implementierungs-Name
     * @param n          Anzahl der Slots, Vielfaches von {@code 2^blockShift}
     * @param blockShift Zweierlogarithmus der Blockgröße
     * @throws IllegalArgumentException wenn {@code n} nicht passt
     */
    protected InPlaceArray(String name, long n, int blockShift) {
        int size = 1 << blockShift;
        if (n <= 0 || n > LongArray.MAX_SIZE) {
            throw new IllegalArgumentException(
                    name + " supports 0 < N <= " + LongArray.MAX_SIZE + ", got N=" + n);
        }
        if (n % size != 0) {
            throw new IllegalArgumentException(name + " requires N % " + size + " == 0, got N=" + n);
        }
        this.name = name;
        this.blockShift = blockShift;
        this.blockSize = size;
        this.blockMask = size - 1;
        this.blocks = (int) (n >>> blockShift);
        this.slots = new long[(int) n];
        this.boundary = 0;
        this.initValue = 0;
    }

    @Override
    public long init(long value) {
        long start = System.nanoTime();
        initValue = value;
        boundary = 0;
        onBoundaryMoved();
        return System.nanoTime() - start;
    }

    @Override
    public long read(long index) {
        int i = (int) index;
        if (boundary >= blocks) {
            return slots[i];
        }
        int bi = i >>> blockShift;
        int partner = chainedTo(bi);
        if (bi < boundary) {
            return partner >= 0 ? initValue : slots[i];
        }
        return partner >= 0 ? slots[slotOf(i, partner)] : initValue;
    }

    @Override
    public void write(long index, long value) {
        int i = (int) index;
        if (boundary >= blocks) {
            slots[i] = value;
            return;
        }
        int bi = i >>> blockShift;
        int partner = chainedTo(bi);

        if (bi < boundary) {
            if (partner < 0) {
                slots[i] = value;
                breakChain(bi);
                return;
            }
            // bi leiht gerade seine Worte an partner: partner in einen frischen Block umziehen
            int free = extend();
            if (free == bi) {
                slots[i] = value;
                breakChain(bi);
                return;
            }
            swapBlocks(free, bi);
            makeChain(free, partner);
            fillBlock(bi);
            slots[i] = value;
            breakChain(bi);
            return;
        }

        if (partner >= 0) {
            slots[slotOf(i, partner)] = value;
            return;
        }
        int free = extend();
        if (free == bi) {
            slots[i] = value;
            breakChain(bi);
            return;
        }
        fillBlock(bi);
        makeChain(free, bi);
        slots[slotOf(i, free)] = value;
    }

    @Override
    public long size() {
        return slots.length;
    }

    @Override
    public String name() {
        return name;
    }

    /**
     * Wird nach jeder Änderung der Grenze aufgerufen ({@code init} und {@link #extend()}).
     */
    protected void onBoundaryMoved() {
    }

    /**
     * @return Anzahl Blöcke links der Grenze
     */
    protected final int boundary() {
        return boundary;
    }

    /**
     * @return aktueller Initialwert
     */
    protected final long initValue() {
        return initValue;
    }

    /**
     * @return Anzahl Blöcke insgesamt
     */
    protected final int blockCount() {
        return blocks;
    }

    /**
     * @param block Blocknummer
     * @return Index des ersten Slots im Block
     */
    protected final int firstOf(int block) {
        return block << blockShift;
    }

    /**
     * Partner des Blocks, wenn eine gültige Kette über die Grenze besteht.
     *
     * @param bi Blocknummer
     * @return Blocknummer des Partners oder {@code -1}
     */
    private int chainedTo(int bi) {
        long target = slots[firstOf(bi)];
        if ((target & blockMask) != 0 || target < 0 || target >= slots.length) {
            return -1;
        }
        int k = (int) (target >>> blockShift);
        if ((bi < boundary) == (k < boundary)) {
            return -1;
        }
        if (slots[(int) target] != firstOf(bi)) {
            return -1;
        }
        return k;
    }

    private void makeChain(int bi, int bj) {
        slots[firstOf(bi)] = firstOf(bj);
        slots[firstOf(bj)] = firstOf(bi);
    }

    /**
     * Löst eine (evtl. nur scheinbare) Kette von {@code bi}, indem der Gegenzeiger auf sich selbst zeigt.
     */
    private void breakChain(int bi) {
        int k = chainedTo(bi);
        if (k >= 0) {
            slots[firstOf(k)] = firstOf(k);
        }
    }

    private void fillBlock(int bi) {
        int first = firstOf(bi);
        Arrays.fill(slots, first, first + blockSize, initValue);
    }

    private void swapBlocks(int bi, int bj) {
        int fi = firstOf(bi);
        int fj = firstOf(bj);
        for (int t = 0; t < blockSize; t++) {
            long tmp = slots[fi + t];
            slots[fi + t] = slots[fj + t];
            slots[fj + t] = tmp;
        }
    }

    /**
     * Physischer Slot eines Werts aus einem rechten Block, der an {@code partner} gekettet ist.
     */
    private int slotOf(int i, int partner) {
        int offset = i & blockMask;
        return offset < blockMask ? firstOf(partner) + 1 + offset : i;
    }

    /**
     * Schiebt die Grenze um einen Block weiter und liefert einen initialisierten, unverketteten
     * Block links der Grenze, der frei beschrieben werden darf.
     *
     * <p>War der Block an der Grenze verkettet, ziehen seine Werte aus dem Partner zurück und der
     * Partner wird zum freien Block.</p>
     */
    private int extend() {
        int s = boundary;
        int k = chainedTo(s);
        boundary++;
        if (k < 0) {
            fillBlock(s);
            breakChain(s);
            onBoundaryMoved();
            return s;
        }
        System.arraycopy(slots, firstOf(k) + 1, slots, firstOf(s), blockSize - 1);
        breakChain(s);
        fillBlock(k);
        breakChain(k);
        onBoundaryMoved();
        return k;
    }
}
