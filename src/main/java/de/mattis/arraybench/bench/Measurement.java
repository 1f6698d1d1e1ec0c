package de.mattis.arraybench.bench;

import java.time.Instant;

/**
 * Ergebnisdatensatz einer einzelnen Szenario-Ausführung.
 *
 * <p>Ein {@code Measurement} entspricht genau <b>einem</b> Tupel aus Implementierung,
 * Array-Größe {@code N}, {@link Scenario}, Seed und Wiederholung. Der Record ist immutable und
 * wird nach dem Export nie verändert (Append-only).</p>
 *
 * <p>Typische Nutzung:</p>
 * <ul>
 *   <li>{@link SingleRun} erstellt dieses Objekt am Ende einer Ausführung.</li>
 *   <li>{@link CsvMeasurementSink} schreibt es sofort als CSV-Zeile.</li>
 *   <li>{@link ResultExporters}, {@link ExcelWriter} und {@link ConsoleSummaryPrinter} lesen die Felder am Ende.</li>
 * </ul>
 *
 * @param timestamp   Startzeitpunkt der Ausführung (UTC, Sekunden-genau)
 * @param implName    Name der Array-Implementierung (z. B. {@code java_long_array})
 * @param scenario    ausgeführtes Szenario
 * @param n           Array-Größe
 * @param seed        Seed des Zufallsstroms
 * @param repetition  Wiederholung, beginnt bei 1
 * @param opsInRun    Anzahl Operationen in der Messregion
 * @param totalTimeNs Dauer der Messregion in Nanosekunden
 * @param nsPerOp     {@code totalTimeNs / opsInRun}
 * @param initTimeNs  Init-Dauer, nur für {@link Scenario#INIT_ONLY} ungleich 0
 * @param relocations reserviert für Implementierungen mit Umlagerungen, hier immer 0
 * @param conversions reserviert für Implementierungen mit Block-Konvertierungen, hier immer 0
 */
public record Measurement(
        Instant timestamp,
        String implName,
        Scenario scenario,
        long n,
        long seed,
        int repetition,
        long opsInRun,
        long totalTimeNs,
        double nsPerOp,
        long initTimeNs,
        long relocations,
        long conversions) {

    static Measurement of(Instant timestamp, String implName, Scenario scenario, long n, long seed,
                          int repetition, ScenarioOutcome outcome) {
        return new Measurement(timestamp, implName, scenario, n, seed, repetition,
                outcome.opsInRun(), outcome.totalTimeNs(), outcome.nsPerOp(), outcome.initTimeNs(),
                0L, 0L);
    }
}
