package de.mattis.arraybench.bench;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Führt einen vollständigen Benchmark-Durchlauf aus.
 *
 * <p>Der {@code BenchmarkRunner} iteriert das Kreuzprodukt des {@link BenchmarkPlan} in fester
 * Reihenfolge: Implementierung → {@code N} → Szenario → Seed → Wiederholung. Für jedes Tupel
 * wird genau ein {@link SingleRun} erzeugt und ausgeführt. Jeder Datensatz geht sofort nach der
 * Wiederholung an den {@link MeasurementSink}, die Ausgabe-Reihenfolge ist damit deterministisch.</p>
 *
 * <p>Alles läuft single-threaded. Es gibt keinen Timeout und keine Retries.</p>
 *
 * <p>Kann eine Implementierung ein {@code N} nicht anlegen (Größe nicht unterstützt oder
 * {@link OutOfMemoryError}), wird dieses {@code N} für die Implementierung mit einer Warnung
 * übersprungen und der Durchlauf geht weiter. I/O-Fehler des Sinks brechen dagegen den
 * gesamten Durchlauf ab.</p>
 */
public class BenchmarkRunner {

    private static final Logger log = LoggerFactory.getLogger(BenchmarkRunner.class);

    private final BenchmarkPlan plan;
    private final ScenarioEngine engine;
    private final Clock clock;

    public BenchmarkRunner(BenchmarkPlan plan) {
        this(plan, new ScenarioEngine(), Clock.systemUTC());
    }

    public BenchmarkRunner(BenchmarkPlan plan, ScenarioEngine engine, Clock clock) {
        this.plan = plan;
        this.engine = engine;
        this.clock = clock;
    }

    /**
     * Führt alle Tupel des Plans aus.
     *
     * @param sink Ziel für jeden Datensatz, wird nicht geschlossen
     * @return alle Datensätze in Ausführungs-Reihenfolge
     * @throws IOException wenn der Sink nicht schreiben kann
     */
    public List<Measurement> runAll(MeasurementSink sink) throws IOException {
        List<Measurement> results = new ArrayList<>();
        log.info("Starting benchmark: {} planned runs", plan.plannedRuns());

        for (String impl : plan.implementations()) {
            for (long n : plan.sizes()) {
                try {
                    runSize(impl, n, sink, results);
                } catch (ArrayAllocationException e) {
                    log.warn("Skipping {} at N={}: {}", impl, n, e.getCause().toString());
                }
            }
        }

        log.info("Benchmark finished: {} measurements", results.size());
        return results;
    }

    private void runSize(String impl, long n, MeasurementSink sink, List<Measurement> results) throws IOException {
        for (Scenario scenario : plan.scenarios()) {
            for (long seed : plan.seeds()) {
                for (int rep = 1; rep <= plan.repetitions(); rep++) {
                    log.info("Running: {} {} N={} seed={} rep={}", impl, scenario, n, seed, rep);
                    Measurement m = new SingleRun(impl, n, scenario, seed, rep, engine, clock).execute();
                    sink.accept(m);
                    results.add(m);
                    log.debug("{} {} N={} rep={}: {} ops, {} ns", impl, scenario, n, rep, m.opsInRun(), m.totalTimeNs());
                }
            }
        }
    }
}
