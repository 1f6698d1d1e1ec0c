package de.mattis.arraybench.bench;

import de.mattis.arraybench.array.ArrayImplementations;

import java.nio.file.Path;
import java.util.List;

/**
 * Beschreibt einen vollständigen Benchmark-Plan.
 *
 * <p>Ein {@code BenchmarkPlan} definiert das Kreuzprodukt, das der {@link BenchmarkRunner}
 * abarbeitet: Implementierung × {@code N} × Szenario × Seed × Wiederholung.
 * Die Reihenfolge der Listen bestimmt die Reihenfolge der Ausführung und damit der Ausgabe.</p>
 *
 * <p>Der Plan enthält keinerlei Logik zur Ausführung oder Messung. Unbekannte Szenarien
 * oder Implementierungen fallen schon beim Bauen des Plans auf, also bevor irgendeine
 * Ausgabedatei angelegt wird.</p>
 *
 * @param implementations Namen der Array-Implementierungen
 * @param sizes           Array-Größen {@code N}
 * @param scenarios       Szenarien
 * @param seeds           Seeds (unsigned 32 Bit)
 * @param repetitions     Wiederholungen pro Tupel, mindestens 1
 * @param outfile         CSV-Zielpfad
 * @param jsonFile        optionaler JSON-Export, {@code null} = aus
 * @param xlsxFile        optionaler Excel-Export, {@code null} = aus
 */
public record BenchmarkPlan(
        List<String> implementations,
        List<Long> sizes,
        List<Scenario> scenarios,
        List<Long> seeds,
        int repetitions,
        Path outfile,
        Path jsonFile,
        Path xlsxFile) {

    public BenchmarkPlan {
        implementations = implementations.stream().map(ArrayImplementations::requireKnown).toList();
        sizes = List.copyOf(sizes);
        scenarios = List.copyOf(scenarios);
        seeds = List.copyOf(seeds);
        if (implementations.isEmpty() || sizes.isEmpty() || scenarios.isEmpty() || seeds.isEmpty()) {
            throw new IllegalArgumentException("benchmark plan must not have an empty dimension");
        }
        if (repetitions < 1) {
            throw new IllegalArgumentException("repetitions must be >= 1, got " + repetitions);
        }
    }

    /**
     * @return Anzahl der Ausführungen, die der Plan höchstens erzeugt
     */
    public long plannedRuns() {
        return (long) implementations.size() * sizes.size() * scenarios.size() * seeds.size() * repetitions;
    }
}
