package de.mattis.arraybench.bench;

import de.mattis.arraybench.array.ArrayImplementations;
import de.mattis.arraybench.array.InitializableArray;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Genau eine Ausführung: ein Tupel aus Implementierung, {@code N}, Szenario, Seed und Wiederholung.
 *
 * <p>Ablauf:</p>
 * <ol>
 *   <li>Zeitstempel nehmen</li>
 *   <li>frische Array-Instanz anlegen (keine Wiederverwendung zwischen Wiederholungen)</li>
 *   <li>Szenario über {@link ScenarioEngine} ausführen (frischer Zufallsstrom aus dem Seed)</li>
 *   <li>{@link Measurement} bauen</li>
 * </ol>
 *
 * <p>Die Instanz wird danach verworfen. Cache-Effekte zwischen Wiederholungen werden nicht
 * versteckt, sondern sind Teil der Messung.</p>
 */
public class SingleRun {

    private final String implName;
    private final long n;
    private final Scenario scenario;
    private final long seed;
    private final int repetition;
    private final ScenarioEngine engine;
    private final Clock clock;

    public SingleRun(String implName, long n, Scenario scenario, long seed, int repetition,
                     ScenarioEngine engine, Clock clock) {
        this.implName = implName;
        this.n = n;
        this.scenario = scenario;
        this.seed = seed;
        this.repetition = repetition;
        this.engine = engine;
        this.clock = clock;
    }

    /**
     * @return Messdatensatz dieser Ausführung
     * @throws ArrayAllocationException wenn die Implementierung {@code N} nicht anlegen kann
     */
    public Measurement execute() {
        Instant timestamp = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        InitializableArray array = allocate();
        ScenarioOutcome outcome = engine.execute(array, scenario, seed);
        return Measurement.of(timestamp, array.name(), scenario, n, seed, repetition, outcome);
    }

    private InitializableArray allocate() {
        try {
            return ArrayImplementations.create(implName, n);
        } catch (IllegalArgumentException | OutOfMemoryError e) {
            throw new ArrayAllocationException(implName, n, e);
        }
    }
}
