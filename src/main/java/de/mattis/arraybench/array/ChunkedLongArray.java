package de.mattis.arraybench.array;

/**
 * Alternative Speicher-Darstellung: das Array wird in Pages zu je {@value #PAGE_SIZE} Slots zerlegt.
 *
 * <p>Zugriffe bleiben O(1) (Shift + Maske), {@link #init(long)} läuft Page für Page in
 * Index-Reihenfolge. Anders als {@link LongArray} ist {@code N} nicht auf die maximale
 * Java-Array-Länge begrenzt, d. h. auch {@code --Ns 3g} ist möglich, solange der Heap reicht.</p>
 *
 * <p>Die letzte Page wird auf die tatsächlich benötigte Länge gekürzt.</p>
 */
public final class ChunkedLongArray implements InitializableArray {

    public static final String NAME = "java_chunked_long_array";

    private static final int PAGE_SHIFT = 16;
    public static final int PAGE_SIZE = 1 << PAGE_SHIFT;
    private static final long PAGE_MASK = PAGE_SIZE - 1;

    private final long n;
    private final long[][] pages;

    /**
     * @param n Anzahl der Slots, {@code n > 0}
     * @throws IllegalArgumentException wenn {@code n <= 0} oder die Anzahl Pages nicht adressierbar ist
     */
    public ChunkedLongArray(long n) {
        if (n <= 0) {
            throw new IllegalArgumentException(NAME + " requires N > 0, got N=" + n);
        }
        long pageCount = (n + PAGE_SIZE - 1) >>> PAGE_SHIFT;
        if (pageCount > Integer.MAX_VALUE - 8) {
            throw new IllegalArgumentException(NAME + " cannot address N=" + n);
        }
        this.n = n;
        this.pages = new long[(int) pageCount][];
        for (int p = 0; p < pages.length; p++) {
            long remaining = n - ((long) p << PAGE_SHIFT);
            pages[p] = new long[(int) Math.min(PAGE_SIZE, remaining)];
        }
    }

    @Override
    public long init(long value) {
        long start = System.nanoTime();
        for (long[] page : pages) {
            for (int i = 0; i < page.length; i++) {
                page[i] = value;
            }
        }
        return System.nanoTime() - start;
    }

    @Override
    public long read(long index) {
        return pages[(int) (index >>> PAGE_SHIFT)][(int) (index & PAGE_MASK)];
    }

    @Override
    public void write(long index, long value) {
        pages[(int) (index >>> PAGE_SHIFT)][(int) (index & PAGE_MASK)] = value;
    }

    @Override
    public long size() {
        return n;
    }

    @Override
    public String name() {
        return NAME;
    }

    int pageCount() {
        return pages.length;
    }
}
