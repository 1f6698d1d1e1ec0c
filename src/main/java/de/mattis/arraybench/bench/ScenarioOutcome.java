package de.mattis.arraybench.bench;

/**
 * Kennzahlen einer einzelnen Szenario-Ausführung.
 *
 * @param opsInRun    Anzahl der Operationen in der Messregion
 * @param totalTimeNs gemessene Dauer der Messregion in Nanosekunden
 * @param nsPerOp     {@code totalTimeNs / opsInRun}
 * @param initTimeNs  Dauer von {@code init} für {@link Scenario#INIT_ONLY}, sonst {@code 0}
 */
public record ScenarioOutcome(long opsInRun, long totalTimeNs, double nsPerOp, long initTimeNs) {

    static ScenarioOutcome of(long opsInRun, long totalTimeNs) {
        return new ScenarioOutcome(opsInRun, totalTimeNs, perOp(totalTimeNs, opsInRun), 0L);
    }

    static ScenarioOutcome initOnly(long totalTimeNs) {
        return new ScenarioOutcome(1, totalTimeNs, perOp(totalTimeNs, 1), totalTimeNs);
    }

    private static double perOp(long totalTimeNs, long opsInRun) {
        return opsInRun > 0 ? (double) totalTimeNs / opsInRun : 0.0;
    }
}
