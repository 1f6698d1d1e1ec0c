package de.mattis.arraybench.bench;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Gibt die Messdatensätze als Tabelle auf der Konsole aus.
 *
 * Der ConsoleSummaryPrinter ist nur für die Darstellung zuständig.
 * Er führt keine Benchmarks aus, verändert keine Daten und rechnet keine
 * Statistiken über Wiederholungen (jede Zeile ist genau ein Datensatz).
 *
 * Was ausgegeben wird:
 * - Gruppierung nach Scenario (Reihenfolge wie im Lauf)
 * - pro Datensatz: Implementierung, N, Seed, Wiederholung, ops, Gesamtzeit, ns/op, Init-Zeit
 */
public final class ConsoleSummaryPrinter {

    private ConsoleSummaryPrinter() {}

    public static void print(List<Measurement> results) {
        print(results, System.out);
    }

    /**
     * Gibt alle Datensätze aus.
     *
     * @param results Datensätze in Lauf-Reihenfolge
     * @param out     Ziel (normalerweise {@code System.out})
     */
    public static void print(List<Measurement> results, PrintStream out) {
        out.println("=== Benchmark Results ===");

        if (results == null || results.isEmpty()) {
            out.println("No results.");
            return;
        }

        // Gruppieren nach Scenario (stabile Reihenfolge)
        Map<Scenario, List<Measurement>> byScenario = new LinkedHashMap<>();
        for (Measurement m : results) {
            byScenario.computeIfAbsent(m.scenario(), k -> new ArrayList<>()).add(m);
        }

        for (Map.Entry<Scenario, List<Measurement>> entry : byScenario.entrySet()) {
            out.println();
            out.println("=== Scenario: " + entry.getKey() + " ===");
            out.printf(Locale.ROOT, " %-24s %12s %10s %4s %10s %15s %12s %15s%n",
                    "impl", "N", "seed", "rep", "ops", "total_ns", "ns/op", "init_ns");

            for (Measurement m : entry.getValue()) {
                out.printf(Locale.ROOT, " %-24s %12d %10d %4d %10d %15d %12.4f %15d%n",
                        m.implName(),
                        m.n(),
                        m.seed(),
                        m.repetition(),
                        m.opsInRun(),
                        m.totalTimeNs(),
                        m.nsPerOp(),
                        m.initTimeNs());
            }
        }
    }
}
