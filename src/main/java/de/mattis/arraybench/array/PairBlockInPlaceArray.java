package de.mattis.arraybench.array;

/**
 * {@link InPlaceArray} mit Blöcken aus 2 Slots. {@code N} muss gerade sein.
 *
 * <p>Initialwert und Grenze liegen in Feldern.</p>
 */
public final class PairBlockInPlaceArray extends InPlaceArray {

    public static final String NAME = "sec3";

    public PairBlockInPlaceArray(long n) {
        super(NAME, n, 1);
    }
}
