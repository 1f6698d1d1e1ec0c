package de.mattis.arraybench.bench;

import de.mattis.arraybench.array.ChunkedLongArray;
import de.mattis.arraybench.array.InitializableArray;
import de.mattis.arraybench.array.LongArray;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prüft eine Array-Implementierung gegen eine Referenz ({@link LongArray}, ab
 * {@link LongArray#MAX_SIZE} Slots {@link ChunkedLongArray}).
 *
 * <p>Beide Instanzen bekommen dieselbe zufällige Folge von Operationen aus einem
 * {@link SeededStream}. Pro Operation entscheidet {@code nextRaw() % 3}:</p>
 * <ul>
 *   <li>{@code 0}: {@code init(nextValue())} auf beiden</li>
 *   <li>{@code 1}: {@code read(nextIndex(N))} auf beiden, Werte müssen gleich sein</li>
 *   <li>{@code 2}: {@code write(nextIndex(N), nextValue())} auf beiden</li>
 * </ul>
 * <p>Am Ende werden alle Slots verglichen. Der erste Unterschied beendet die Prüfung.</p>
 *
 * <p>Gedacht vor allem für die In-place-Arrays ({@code sec3}, {@code sec4}), deren Verkettungslogik
 * sich nur über viele gemischte {@code init}/{@code write}-Folgen sinnvoll prüfen lässt.</p>
 */
public class CorrectnessVerifier {

    public static final int DEFAULT_OPERATIONS = 1000;

    private static final Logger log = LoggerFactory.getLogger(CorrectnessVerifier.class);

    /**
     * @param dut        zu prüfende Instanz (wird verändert)
     * @param seed       Seed für die Operationsfolge
     * @param operations Anzahl zufälliger Operationen
     * @return Ergebnis der Prüfung
     */
    public VerificationResult verify(InitializableArray dut, long seed, int operations) {
        long n = dut.size();
        InitializableArray reference = referenceFor(n);
        SeededStream rng = new SeededStream(seed);

        for (int op = 0; op < operations; op++) {
            int kind = (int) (rng.nextRaw() % 3);
            if (kind == 0) {
                long value = rng.nextValue();
                reference.init(value);
                dut.init(value);
            } else if (kind == 1) {
                long idx = rng.nextIndex(n);
                long expected = reference.read(idx);
                long actual = dut.read(idx);
                if (expected != actual) {
                    log.error("Mismatch at read({}) after {} operations: reference={}, {}={}",
                            idx, op + 1, expected, dut.name(), actual);
                    return VerificationResult.mismatch(op + 1, idx, expected, actual);
                }
            } else {
                long idx = rng.nextIndex(n);
                long value = rng.nextValue();
                reference.write(idx, value);
                dut.write(idx, value);
            }
        }

        // Vollvergleich
        for (long i = 0; i < n; i++) {
            long expected = reference.read(i);
            long actual = dut.read(i);
            if (expected != actual) {
                log.error("Final state mismatch at index {}: reference={}, {}={}", i, expected, dut.name(), actual);
                return VerificationResult.mismatch(operations, i, expected, actual);
            }
        }
        return VerificationResult.passed(operations);
    }

    /**
     * Referenz für {@code n} Slots. Größen jenseits eines einzelnen {@code long[]} landen im {@link ChunkedLongArray}.
     */
    static InitializableArray referenceFor(long n) {
        return n <= LongArray.MAX_SIZE ? new LongArray(n) : new ChunkedLongArray(n);
    }
}
