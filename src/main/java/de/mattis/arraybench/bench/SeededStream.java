package de.mattis.arraybench.bench;

import org.apache.commons.math3.random.MersenneTwister;

/**
 * Deterministischer Zufallsstrom für genau eine Szenario-Ausführung.
 *
 * <p>Basis ist MT19937 ({@link MersenneTwister}). Die 32-Bit-Rohwerte entsprechen für Seeds
 * unter {@code 2^31} exakt denen von {@code std::mt19937}. Alle abgeleiteten Ziehungen sind hier
 * explizit definiert und hängen nicht von Interna einer Distribution-Klasse ab:</p>
 * <ul>
 *   <li>{@link #nextRaw()}: nächster Rohwert, unsigned in {@code [0, 2^32)}</li>
 *   <li>{@link #nextIndex(long)}: gleichverteilt in {@code [0, n)}, per Rejection Sampling</li>
 *   <li>{@link #nextValue()}: gleichverteilt in {@code [-1000, 1000]}</li>
 *   <li>{@link #nextPercent()}: {@code nextRaw() % 100}</li>
 *   <li>{@link #nextCoin()}: {@code nextRaw() % 2 == 0}</li>
 *   <li>{@link #nextBelowRaw(long)}: {@code nextRaw() % k}</li>
 * </ul>
 *
 * <p>Eine Instanz gehört immer genau einer Ausführung und wird explizit durchgereicht.</p>
 */
public final class SeededStream {

    public static final long MAX_SEED = 0xFFFF_FFFFL;

    static final int MIN_VALUE = -1000;
    static final int MAX_VALUE = 1000;

    private static final long TWO_POW_32 = 1L << 32;

    private final MersenneTwister mt;
    private final long seed;

    /**
     * Seeds ab {@code 2^31} sind erlaubt und deterministisch, commons-math initialisiert aber mit dem
     * vorzeichenerweiterten {@code int}. Diese Ströme weichen deshalb von {@code std::mt19937} ab.
     *
     * @param seed unsigned 32-Bit-Seed ({@code 0 .. 4294967295})
     * @throws IllegalArgumentException wenn der Seed außerhalb des Bereichs liegt
     */
    public SeededStream(long seed) {
        if (seed < 0 || seed > MAX_SEED) {
            throw new IllegalArgumentException("seed must be in [0, " + MAX_SEED + "], got " + seed);
        }
        this.seed = seed;
        this.mt = new MersenneTwister((int) seed);
    }

    /**
     * @return Seed, mit dem der Strom erzeugt wurde
     */
    public long seed() {
        return seed;
    }

    /**
     * @return nächster 32-Bit-Rohwert, unsigned in {@code [0, 2^32)}
     */
    public long nextRaw() {
        return mt.nextInt() & 0xFFFF_FFFFL;
    }

    /**
     * Gleichverteilter Index in {@code [0, n)}.
     *
     * <p>Für {@code n <= 2^32} wird ein Rohwert gezogen und unterhalb von
     * {@code 2^32 - (2^32 % n)} per Modulo reduziert (sonst neu gezogen). Für größere {@code n}
     * bilden zwei Rohwerte ein 64-Bit-Wort, davon werden 63 Bit genutzt.</p>
     *
     * @param n obere Grenze (exklusiv), {@code n > 0}
     * @return Index
     */
    public long nextIndex(long n) {
        if (n <= 0) {
            throw new IllegalArgumentException("bound must be positive, got " + n);
        }
        if (n <= TWO_POW_32) {
            long limit = TWO_POW_32 - (TWO_POW_32 % n);
            long raw = nextRaw();
            while (raw >= limit) {
                raw = nextRaw();
            }
            return raw % n;
        }
        long u = nextWide();
        long r = u % n;
        while (u - r + (n - 1) < 0) {
            u = nextWide();
            r = u % n;
        }
        return r;
    }

    /**
     * @return gleichverteilter Wert in {@code [-1000, 1000]} (ein {@link #nextIndex(long)} über 2001 Werte)
     */
    public long nextValue() {
        return nextIndex(MAX_VALUE - MIN_VALUE + 1) + MIN_VALUE;
    }

    /**
     * @return {@code nextRaw() % 100}, für die Read/Write-Entscheidung der Mixed-Szenarien
     */
    public int nextPercent() {
        return (int) (nextRaw() % 100);
    }

    /**
     * @return {@code true}, wenn der nächste Rohwert gerade ist
     */
    public boolean nextCoin() {
        return nextRaw() % 2 == 0;
    }

    /**
     * Index im Hot-Bereich, ohne Rejection Sampling.
     *
     * @param k obere Grenze (exklusiv), {@code k > 0}
     * @return {@code nextRaw() % k}
     */
    public long nextBelowRaw(long k) {
        return nextRaw() % k;
    }

    // 63 Bit aus zwei Rohwerten (hi, lo)
    private long nextWide() {
        long hi = nextRaw();
        long lo = nextRaw();
        return ((hi << 32) | lo) >>> 1;
    }
}
