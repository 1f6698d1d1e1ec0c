package de.mattis.arraybench.array;

/**
 * {@link InPlaceArray} mit Blöcken aus 4 Slots. {@code N} muss durch 4 teilbar sein.
 *
 * <p>Solange nicht alle Blöcke initialisiert sind, spiegelt die Klasse Initialwert und Grenze in die
 * Worte 1 und 2 des letzten Blocks. Dieser Block liegt dann rechts der Grenze, und die beiden Worte
 * werden dort nie für Daten gebraucht: unverkettet liest der Block {@code initValue}, verkettet
 * liegen seine Werte 0..2 beim Partner.</p>
 */
public final class QuadBlockInPlaceArray extends InPlaceArray {

    public static final String NAME = "sec4";

    public QuadBlockInPlaceArray(long n) {
        super(NAME, n, 2);
    }

    @Override
    protected void onBoundaryMoved() {
        if (boundary() < blockCount()) {
            int meta = firstOf(blockCount() - 1);
            slots[meta + 1] = initValue();
            slots[meta + 2] = boundary();
        }
    }

    /**
     * @return im Array abgelegter Initialwert (nur gültig, solange nicht alle Blöcke initialisiert sind)
     */
    long storedInitValue() {
        return slots[firstOf(blockCount() - 1) + 1];
    }

    /**
     * @return im Array abgelegte Grenze (nur gültig, solange nicht alle Blöcke initialisiert sind)
     */
    long storedBoundary() {
        return slots[firstOf(blockCount() - 1) + 2];
    }
}
