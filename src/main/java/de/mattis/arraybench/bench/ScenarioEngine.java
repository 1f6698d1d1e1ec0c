package de.mattis.arraybench.bench;

import de.mattis.arraybench.array.InitializableArray;

/**
 * Führt ein {@link Scenario} gegen eine {@link InitializableArray}-Instanz aus und misst die Messregion.
 *
 * <p>Jedes Szenario ist eine reine Funktion von {@code (N, seed)}:</p>
 * <ol>
 *   <li>Setup (nicht gemessen): {@code init(..)}, Index-Strom und ggf. Op-Arten vorab ziehen</li>
 *   <li>Messregion: nur die eigentlichen Zugriffe, umschlossen von {@link System#nanoTime()}</li>
 *   <li>Ergebnis: {@link ScenarioOutcome}</li>
 * </ol>
 *
 * <p><b>Messregionen</b> ({@code m = min(1_000_000, N)}):</p>
 * <ul>
 *   <li>{@code INIT_ONLY}: {@code init(42)}, 1 Op, {@code initTimeNs = totalTimeNs}</li>
 *   <li>{@code READ_UNWRITTEN}: {@code init(123)}, dann {@code min(1_000_000, 10·N)} Reads an vorab gezogenen Indizes</li>
 *   <li>{@code WRITE_SEQUENTIAL}: {@code init(0)}, dann {@code arr[i] = i} für alle {@code N} Slots (ohne Deckel)</li>
 *   <li>{@code WRITE_RANDOM}: {@code init(0)}, dann {@code m} Writes an vorab gezogenen Indizes, Wert pro Write gezogen</li>
 *   <li>{@code MIXED_R{p}W{100-p}}: {@code init(42)}, Indizes und danach Op-Arten vorab, Werte nur für Writes (lazy)</li>
 *   <li>{@code ADVERSARIAL_HOTSPOT}: {@code init(0)}, dann {@code m} Writes, je 50 % im Hot-Bereich {@code [0, max(1, N/10))}</li>
 * </ul>
 *
 * <p>Der Zufallsstrom wird pro Aufruf von {@link #execute} frisch aus dem Seed erzeugt.
 * Die Reihenfolge der Ziehungen ist Teil des Vertrags, siehe {@link SeededStream}.</p>
 *
 * <p>Die Summen der Reads landen in einem {@code volatile}-Feld, damit der JIT die Reads
 * nicht als toten Code entfernt.</p>
 */
public class ScenarioEngine {

    /**
     * Obergrenze der Operationen für alle Random-Access-Szenarien.
     */
    public static final long MAX_RANDOM_OPS = 1_000_000L;

    /**
     * Summe der gelesenen Werte der letzten Ausführung, verhindert Wegoptimierung der Reads.
     */
    private volatile long readSink;

    /**
     * Führt ein Szenario aus.
     *
     * @param array    frische Array-Instanz (wird verändert)
     * @param scenario auszuführendes Szenario
     * @param seed     unsigned 32-Bit-Seed für den Zufallsstrom
     * @return gemessene Kennzahlen
     */
    public ScenarioOutcome execute(InitializableArray array, Scenario scenario, long seed) {
        SeededStream rng = new SeededStream(seed);
        long n = array.size();

        return switch (scenario) {
            case INIT_ONLY -> initOnly(array);
            case READ_UNWRITTEN -> readUnwritten(array, rng, n);
            case WRITE_SEQUENTIAL -> writeSequential(array, n);
            case WRITE_RANDOM -> writeRandom(array, rng, n);
            case MIXED_R90W10, MIXED_R80W20, MIXED_R70W30, MIXED_R50W50, MIXED_R30W70, MIXED_R10W90 ->
                    mixed(array, rng, n, scenario.readPercent());
            case ADVERSARIAL_HOTSPOT -> adversarialHotspot(array, rng, n);
        };
    }

    /**
     * Summe der Reads aus der letzten Ausführung (0, wenn das Szenario nicht liest).
     */
    public long lastReadSum() {
        return readSink;
    }

    /**
     * Anzahl Operationen der Messregion für {@code N} Slots.
     *
     * @param scenario Szenario
     * @param n        Anzahl Slots
     * @return {@code ops_in_run}
     */
    public static long opsFor(Scenario scenario, long n) {
        return switch (scenario) {
            case INIT_ONLY -> 1;
            case READ_UNWRITTEN -> Math.min(MAX_RANDOM_OPS, 10 * n);
            case WRITE_SEQUENTIAL -> n;
            default -> Math.min(MAX_RANDOM_OPS, n);
        };
    }

    /**
     * Größe des Hot-Bereichs für {@code ADVERSARIAL_HOTSPOT}.
     *
     * @param n Anzahl Slots
     * @return {@code max(1, N/10)}
     */
    public static long hotspotSize(long n) {
        return Math.max(1, n / 10);
    }

    private ScenarioOutcome initOnly(InitializableArray array) {
        long start = System.nanoTime();
        array.init(42);
        long elapsed = System.nanoTime() - start;
        readSink = 0;
        return ScenarioOutcome.initOnly(elapsed);
    }

    private ScenarioOutcome readUnwritten(InitializableArray array, SeededStream rng, long n) {
        array.init(123);
        int m = (int) opsFor(Scenario.READ_UNWRITTEN, n);
        long[] indices = drawIndices(rng, m, n);

        long start = System.nanoTime();
        long sum = 0;
        for (int i = 0; i < m; i++) {
            sum += array.read(indices[i]);
        }
        long elapsed = System.nanoTime() - start;

        readSink = sum;
        return ScenarioOutcome.of(m, elapsed);
    }

    private ScenarioOutcome writeSequential(InitializableArray array, long n) {
        array.init(0);

        long start = System.nanoTime();
        for (long i = 0; i < n; i++) {
            array.write(i, i);
        }
        long elapsed = System.nanoTime() - start;

        readSink = 0;
        return ScenarioOutcome.of(n, elapsed);
    }

    private ScenarioOutcome writeRandom(InitializableArray array, SeededStream rng, long n) {
        array.init(0);
        int m = (int) opsFor(Scenario.WRITE_RANDOM, n);
        long[] indices = drawIndices(rng, m, n);

        long start = System.nanoTime();
        for (int i = 0; i < m; i++) {
            array.write(indices[i], rng.nextValue());
        }
        long elapsed = System.nanoTime() - start;

        readSink = 0;
        return ScenarioOutcome.of(m, elapsed);
    }

    private ScenarioOutcome mixed(InitializableArray array, SeededStream rng, long n, int readPercent) {
        array.init(42);
        int m = (int) Math.min(MAX_RANDOM_OPS, n);
        long[] indices = drawIndices(rng, m, n);
        boolean[] isRead = new boolean[m];
        for (int i = 0; i < m; i++) {
            isRead[i] = rng.nextPercent() < readPercent;
        }

        long start = System.nanoTime();
        long sum = 0;
        for (int i = 0; i < m; i++) {
            if (isRead[i]) {
                sum += array.read(indices[i]);
            } else {
                array.write(indices[i], rng.nextValue());
            }
        }
        long elapsed = System.nanoTime() - start;

        readSink = sum;
        return ScenarioOutcome.of(m, elapsed);
    }

    private ScenarioOutcome adversarialHotspot(InitializableArray array, SeededStream rng, long n) {
        array.init(0);
        long m = opsFor(Scenario.ADVERSARIAL_HOTSPOT, n);
        long hot = hotspotSize(n);

        long start = System.nanoTime();
        for (long i = 0; i < m; i++) {
            long idx = rng.nextCoin() ? rng.nextBelowRaw(hot) : rng.nextIndex(n);
            array.write(idx, rng.nextValue());
        }
        long elapsed = System.nanoTime() - start;

        readSink = 0;
        return ScenarioOutcome.of(m, elapsed);
    }

    private static long[] drawIndices(SeededStream rng, int m, long n) {
        long[] indices = new long[m];
        for (int i = 0; i < m; i++) {
            indices[i] = rng.nextIndex(n);
        }
        return indices;
    }
}
