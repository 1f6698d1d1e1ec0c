package de.mattis.arraybench.bench;

/**
 * Ergebnis von {@link CorrectnessVerifier#verify}.
 *
 * @param passed             {@code true}, wenn keine Abweichung gefunden wurde
 * @param operationsExecuted Anzahl ausgeführter Operationen bis zum Ende bzw. zur Abweichung
 * @param mismatchIndex      Index der ersten Abweichung, {@code -1} wenn keine
 * @param expected           Wert der Referenz an {@code mismatchIndex}
 * @param actual             Wert der geprüften Implementierung an {@code mismatchIndex}
 */
public record VerificationResult(boolean passed, int operationsExecuted, long mismatchIndex, long expected, long actual) {

    static VerificationResult passed(int operations) {
        return new VerificationResult(true, operations, -1, 0, 0);
    }

    static VerificationResult mismatch(int operations, long index, long expected, long actual) {
        return new VerificationResult(false, operations, index, expected, actual);
    }
}
