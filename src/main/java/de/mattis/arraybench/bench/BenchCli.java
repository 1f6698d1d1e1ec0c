package de.mattis.arraybench.bench;

import de.mattis.arraybench.array.ArrayImplementations;
import de.mattis.arraybench.array.InitializableArray;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Command-Line Entry-Point für das Benchmarking.
 *
 * <p>Diese Klasse ist die "Hauptsteuerung" für einen Benchmark-Durchlauf:</p>
 * <ol>
 *   <li>Plan aus Defaults ({@link BenchDefaults}) und CLI-Argumenten bauen</li>
 *   <li>CSV-Datei öffnen ({@link CsvMeasurementSink})</li>
 *   <li>Alle Ausführungen laufen lassen (über {@link BenchmarkRunner})</li>
 *   <li>Optional JSON/XLSX exportieren ({@link ResultExporters})</li>
 *   <li>Ergebnisse auf der Konsole ausgeben ({@link ConsoleSummaryPrinter})</li>
 * </ol>
 *
 * <p><b>CLI-Argumente</b> (jeweils {@code --key value} oder {@code --key=value})</p>
 * <ul>
 *   <li><b>--Ns</b>: Array-Größen, z. B. {@code 10k,100k,1m}. Ungültige Einträge werden verworfen,
 *       bleibt nichts übrig, gilt die Default-Liste.</li>
 *   <li><b>--reps</b>: Wiederholungen pro Tupel. Ungültig oder {@code < 1} → Default.</li>
 *   <li><b>--seed</b>: ein oder mehrere Seeds (Komma-Liste, unsigned 32 Bit). Ungültige Einträge werden verworfen.</li>
 *   <li><b>--impls</b>: Array-Implementierungen (Default {@code java_long_array}). Unbekannter Name → Abbruch.
 *       {@code sec3}/{@code sec4} überspringen Größen, die nicht durch 2 bzw. 4 teilbar sind.</li>
 *   <li><b>--scenarios</b>: Teilmenge des Katalogs. Unbekannter Name → Abbruch, bevor irgendetwas geschrieben wird.</li>
 *   <li><b>--outfile</b>: CSV-Zielpfad.</li>
 *   <li><b>--json</b>, <b>--xlsx</b>: optionale zusätzliche Exporte.</li>
 *   <li><b>--verify &lt;impl&gt; [N] [seed]</b>: statt Benchmark die Korrektheitsprüfung ausführen.</li>
 * </ul>
 */
public class BenchCli {

    private static final Logger log = LoggerFactory.getLogger(BenchCli.class);

    static final long DEFAULT_VERIFY_N = 10_000L;

    private final BenchDefaults defaults;
    private final PrintStream out;

    public BenchCli(BenchDefaults defaults) {
        this(defaults, System.out);
    }

    public BenchCli(BenchDefaults defaults, PrintStream out) {
        this.defaults = defaults;
        this.out = out;
    }

    /**
     * Startet einen Benchmark-Durchlauf oder die Korrektheitsprüfung.
     *
     * @param args Kommandozeilenargumente (siehe Klassendoku)
     * @return Exit-Code ({@code 0} = ok, {@code 1} = Prüfung fehlgeschlagen / Usage-Fehler)
     * @throws IOException              wenn die Ausgabe nicht geschrieben werden kann
     * @throws IllegalArgumentException bei unbekanntem Szenario oder unbekannter Implementierung
     */
    public int run(String[] args) throws IOException {
        if (hasFlag(args, "--help") || hasFlag(args, "-h")) {
            printUsage();
            return 0;
        }
        if (args.length > 0 && args[0].equals("--verify")) {
            return runVerify(args);
        }

        BenchmarkPlan plan = buildPlan(args, defaults);
        log.info("Plan: impls={} Ns={} scenarios={} seeds={} reps={} outfile={}",
                plan.implementations(), plan.sizes(), plan.scenarios().size(), plan.seeds(),
                plan.repetitions(), plan.outfile());

        List<Measurement> results;
        try (CsvMeasurementSink sink = CsvMeasurementSink.open(plan.outfile())) {
            results = new BenchmarkRunner(plan).runAll(sink);
        }

        if (plan.jsonFile() != null) {
            ResultExporters.writeJson(results, plan.jsonFile());
            log.info("JSON export written to {}", plan.jsonFile());
        }
        if (plan.xlsxFile() != null) {
            ResultExporters.writeXlsx(results, plan.xlsxFile());
            log.info("Excel export written to {}", plan.xlsxFile());
        }

        ConsoleSummaryPrinter.print(results, out);
        out.println();
        out.println("Experiment suite finished. Results saved to " + plan.outfile());
        return 0;
    }

    /**
     * Baut den Plan aus Defaults und CLI-Argumenten.
     *
     * <p>Szenarien und Implementierungen werden hier vollständig validiert, damit ein
     * Konfigurationsfehler auffällt, bevor die Ausgabedatei angelegt wird.</p>
     *
     * @param args     CLI-Argumente
     * @param defaults Defaults
     * @return fertiger Plan
     * @throws IllegalArgumentException bei unbekanntem Szenario oder unbekannter Implementierung
     */
    public static BenchmarkPlan buildPlan(String[] args, BenchDefaults defaults) {
        String rawSizes = findArgValue(args, "--Ns");
        List<Long> sizes = rawSizes != null
                ? SizeParser.parseOrDefault(rawSizes)
                : SizeParser.parseOrDefault(defaults.sizes());

        int reps = parseReps(findArgValue(args, "--reps"), defaults.repetitions());

        String rawSeeds = findArgValue(args, "--seed");
        List<Long> seeds = parseSeedsOrDefault(rawSeeds != null ? rawSeeds : defaults.seeds());

        String rawImpls = findArgValue(args, "--impls");
        List<String> impls = rawImpls != null ? splitNames(rawImpls) : defaults.implementations();
        impls.forEach(ArrayImplementations::requireKnown);

        String rawScenarios = findArgValue(args, "--scenarios");
        List<Scenario> scenarios = rawScenarios != null
                ? splitNames(rawScenarios).stream().map(Scenario::fromName).toList()
                : defaults.scenarioList();

        String outfile = findArgValue(args, "--outfile");
        String json = findArgValue(args, "--json");
        String xlsx = findArgValue(args, "--xlsx");

        return new BenchmarkPlan(
                impls,
                sizes,
                scenarios,
                seeds,
                reps,
                Path.of(outfile != null ? outfile : defaults.outfile()),
                json != null ? Path.of(json) : null,
                xlsx != null ? Path.of(xlsx) : null);
    }

    /**
     * {@code --verify <impl> [N] [seed]}.
     */
    private int runVerify(String[] args) {
        if (args.length < 2) {
            printUsage();
            return 1;
        }
        String impl = ArrayImplementations.requireKnown(args[1]);

        long n = DEFAULT_VERIFY_N;
        if (args.length > 2) {
            List<Long> parsed = SizeParser.parse(args[2]);
            if (!parsed.isEmpty()) n = parsed.get(0);
        }
        long seed = BenchDefaults.DEFAULT_SEED;
        if (args.length > 3) {
            List<Long> parsed = parseSeeds(args[3]);
            if (!parsed.isEmpty()) seed = parsed.get(0);
        }

        out.println();
        out.println("--- Running Correctness Verification for " + impl + " with N=" + n + " seed=" + seed + " ---");

        VerificationResult result;
        try {
            InitializableArray dut = ArrayImplementations.create(impl, n);
            result = new CorrectnessVerifier().verify(dut, seed, CorrectnessVerifier.DEFAULT_OPERATIONS);
        } catch (IllegalArgumentException | OutOfMemoryError e) {
            log.error("Cannot verify {} with N={}: {}", impl, n, e.toString());
            out.println("--- Correctness Verification for " + impl + " FAILED ---");
            return 1;
        }
        if (result.passed()) {
            out.println("--- Correctness Verification for " + impl + " PASSED ---");
            return 0;
        }
        out.println("--- Correctness Verification for " + impl + " FAILED ---");
        return 1;
    }

    /**
     * Parst die Anzahl Wiederholungen.
     *
     * @param raw      CLI-Wert oder {@code null}
     * @param fallback Default, wenn {@code raw} fehlt, nicht parsebar oder {@code < 1} ist
     * @return Wiederholungen, mindestens 1
     */
    static int parseReps(String raw, int fallback) {
        if (raw == null) return fallback;
        try {
            int reps = Integer.parseInt(raw.trim());
            return reps >= 1 ? reps : fallback;
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid --reps value '{}', using {}", raw, fallback);
            return fallback;
        }
    }

    /**
     * Parst eine Komma-Liste von Seeds. Ungültige Einträge (nicht numerisch, negativ,
     * größer als {@code 2^32 - 1}) werden verworfen.
     *
     * @param raw Komma-Liste (kann null sein)
     * @return gültige Seeds, evtl. leer
     */
    static List<Long> parseSeeds(String raw) {
        List<Long> out = new ArrayList<>();
        if (raw == null) return out;
        for (String part : raw.split(",")) {
            String tok = part.trim();
            if (tok.isEmpty()) continue;
            try {
                long seed = Long.parseLong(tok);
                if (seed >= 0 && seed <= SeededStream.MAX_SEED) {
                    out.add(seed);
                }
            } catch (NumberFormatException e) {
                log.warn("Ignoring invalid seed '{}'", tok);
            }
        }
        return out;
    }

    /**
     * Wie {@link #parseSeeds(String)}, fällt aber auf {@link BenchDefaults#DEFAULT_SEED} zurück.
     *
     * @param raw Komma-Liste (kann null sein)
     * @return nie leere Liste von Seeds
     */
    static List<Long> parseSeedsOrDefault(String raw) {
        List<Long> seeds = parseSeeds(raw);
        return seeds.isEmpty() ? List.of(BenchDefaults.DEFAULT_SEED) : seeds;
    }

    private static List<String> splitNames(String raw) {
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private void printUsage() {
        out.println("Usage:");
        out.println("  array-bench --verify <" + String.join("|", ArrayImplementations.names()) + "> [N] [seed]");
        out.println("  array-bench [--Ns 10000,100000,1000000] [--reps 3] [--seed 42]");
        out.println("              [--impls " + String.join(",", ArrayImplementations.names()) + "]");
        out.println("              [--scenarios INIT_ONLY,WRITE_RANDOM,...] [--outfile results.csv]");
        out.println("              [--json results.json] [--xlsx results.xlsx]");
    }

    private static boolean hasFlag(String[] args, String flag) {
        for (String a : args) {
            if (a.equals(flag)) return true;
        }
        return false;
    }

    /**
     * Sucht den Wert eines CLI-Arguments.
     *
     * <p>Unterstützte Formen:</p>
     * <ul>
     *   <li>{@code --key value}</li>
     *   <li>{@code --key=value}</li>
     * </ul>
     *
     * @param args CLI-Argumente
     * @param key  Argument-Name, z. B. {@code "--Ns"}
     * @return Wert als String, oder {@code null} wenn nicht vorhanden
     */
    static String findArgValue(String[] args, String key) {
        for (int i = 0; i < args.length; i++) {
            if (args[i].equals(key) && i + 1 < args.length) return args[i + 1];
            if (args[i].startsWith(key + "=")) return args[i].substring((key + "=").length());
        }
        return null;
    }
}
