package de.mattis.arraybench.array;

/**
 * Die einfachste mögliche Implementierung: ein zusammenhängendes {@code long[]}.
 *
 * <p>Gemessene Unterschiede sollen vom Zugriffsmuster kommen, nicht vom Overhead der Abstraktion.
 * Deshalb gibt es hier keine Bounds-Checks über das hinaus, was die JVM ohnehin macht.</p>
 */
public final class LongArray implements InitializableArray {

    public static final String NAME = "java_long_array";

    /**
     * Größtes {@code N}, das ein einzelnes Java-Array sicher halten kann.
     */
    public static final long MAX_SIZE = Integer.MAX_VALUE - 8;

    private final long[] data;

    /**
     * @param n Anzahl der Slots, {@code 0 < n <= MAX_SIZE}
     * @throws IllegalArgumentException wenn {@code n} nicht in ein einzelnes Array passt
     */
    public LongArray(long n) {
        if (n <= 0 || n > MAX_SIZE) {
            throw new IllegalArgumentException(
                    NAME + " supports 0 < N <= " + MAX_SIZE + ", got N=" + n);
        }
        this.data = new long[(int) n];
    }

    @Override
    public long init(long value) {
        long start = System.nanoTime();
        long[] a = data;
        for (int i = 0; i < a.length; i++) {
            a[i] = value;
        }
        return System.nanoTime() - start;
    }

    @Override
    public long read(long index) {
        return data[(int) index];
    }

    @Override
    public void write(long index, long value) {
        data[(int) index] = value;
    }

    @Override
    public long size() {
        return data.length;
    }

    @Override
    public String name() {
        return NAME;
    }
}
