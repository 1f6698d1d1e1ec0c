package de.mattis.arraybench.bench;

import de.mattis.arraybench.array.LongArray;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.Arrays;
import java.util.List;

/**
 * Defaults für einen Benchmark-Durchlauf, gebunden aus {@code application.properties}
 * (Prefix {@code arraybench}).
 *
 * <p>Kommandozeilen-Argumente in {@link BenchCli} überschreiben diese Werte.</p>
 *
 * @param sizes           Komma-Liste der Array-Größen, Format wie {@code --Ns}
 * @param repetitions     Wiederholungen pro Tupel
 * @param seeds           Komma-Liste der Seeds
 * @param outfile         CSV-Zielpfad
 * @param implementations Array-Implementierungen; leer = nur {@code java_long_array}
 * @param scenarios       Szenarien; leer = kompletter Katalog
 */
@ConfigurationProperties(prefix = "arraybench")
public record BenchDefaults(
        @DefaultValue("10000,100000,1000000") String sizes,
        @DefaultValue("3") int repetitions,
        @DefaultValue("42") String seeds,
        @DefaultValue("results.csv") String outfile,
        @DefaultValue(LongArray.NAME) List<String> implementations,
        List<String> scenarios) {

    public static final int DEFAULT_REPETITIONS = 3;
    public static final long DEFAULT_SEED = 42L;

    public BenchDefaults {
        implementations = nonBlank(implementations);
        if (implementations.isEmpty()) {
            implementations = List.of(LongArray.NAME);
        }
        scenarios = nonBlank(scenarios);
        if (repetitions < 1) {
            repetitions = DEFAULT_REPETITIONS;
        }
    }

    private static List<String> nonBlank(List<String> values) {
        if (values == null) return List.of();
        return values.stream().map(String::trim).filter(v -> !v.isEmpty()).toList();
    }

    /**
     * Defaults ohne Spring-Kontext (Tests, direkte Nutzung von {@link BenchCli}).
     */
    public static BenchDefaults builtIn() {
        return new BenchDefaults("10000,100000,1000000", DEFAULT_REPETITIONS, Long.toString(DEFAULT_SEED),
                "results.csv", List.of(LongArray.NAME), List.of());
    }

    /**
     * @return konfigurierte Szenarien oder der komplette Katalog
     */
    public List<Scenario> scenarioList() {
        if (scenarios.isEmpty()) {
            return Arrays.asList(Scenario.values());
        }
        return scenarios.stream().map(Scenario::fromName).toList();
    }
}
