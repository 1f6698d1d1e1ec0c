package de.mattis.arraybench.bench;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Exportiert alle Messdatensätze ({@link Measurement}) nach dem Lauf in zusätzliche Formate.
 *
 * <p>Die CSV-Datei wird schon während des Laufs von {@link CsvMeasurementSink} geschrieben.
 * Hier kommen die optionalen Formate dazu:</p>
 * <ul>
 *   <li><b>JSON</b>: für automatisierte Auswertung (z. B. Python-Scripts)</li>
 *   <li><b>XLSX</b>: für Excel, über {@link ExcelWriter}</li>
 * </ul>
 *
 * <p>Hinweis: Das JSON wird ohne externe Library gebaut. Alle Strings im Export sind
 * Implementierungs- oder Szenario-Namen, daher reicht minimales Escaping.</p>
 */
public final class ResultExporters {

    private ResultExporters() {}

    /**
     * Schreibt die Datensätze als JSON-Datei.
     *
     * <p>Format: {@code {"results":[{...},{...}]}}, Feldnamen wie die CSV-Spalten.</p>
     *
     * @param results Datensätze in Lauf-Reihenfolge
     * @param path    Zielpfad
     * @throws IOException wenn Schreiben fehlschlägt
     */
    public static void writeJson(List<Measurement> results, Path path) throws IOException {
        StringBuilder sb = new StringBuilder();
        sb.append("{\"results\":[");
        for (int i = 0; i < results.size(); i++) {
            Measurement m = results.get(i);
            if (i > 0) sb.append(",");
            sb.append("{");

            // Identität
            sb.append("\"timestamp_iso\":").append(js(CsvMeasurementSink.TIMESTAMP.format(m.timestamp()))).append(",");
            sb.append("\"impl_name\":").append(js(m.implName())).append(",");
            sb.append("\"scenario\":").append(js(m.scenario().name())).append(",");
            sb.append("\"N\":").append(m.n()).append(",");
            sb.append("\"seed\":").append(m.seed()).append(",");
            sb.append("\"rep_id\":").append(m.repetition()).append(",");

            // Kennzahlen
            sb.append("\"ops_in_run\":").append(m.opsInRun()).append(",");
            sb.append("\"total_time_ns\":").append(m.totalTimeNs()).append(",");
            sb.append("\"ns_per_op\":").append(String.format(Locale.ROOT, "%.4f", m.nsPerOp())).append(",");
            sb.append("\"init_time_ns_if_recorded\":").append(m.initTimeNs()).append(",");
            sb.append("\"relocations_count\":").append(m.relocations()).append(",");
            sb.append("\"conversions_count\":").append(m.conversions());

            sb.append("}");
        }
        sb.append("]}");
        createParent(path);
        Files.writeString(path, sb.toString(), StandardCharsets.UTF_8);
    }

    /**
     * Schreibt die Datensätze als Excel-Workbook (ein Sheet {@code Measurements}).
     *
     * @param results Datensätze in Lauf-Reihenfolge
     * @param path    Zielpfad
     * @throws IOException wenn Schreiben fehlschlägt
     */
    public static void writeXlsx(List<Measurement> results, Path path) throws IOException {
        createParent(path);
        try (ExcelWriter excel = new ExcelWriter()) {
            excel.writeMeasurements(results);
            excel.write(path);
        }
    }

    // ---- helpers ----

    private static void createParent(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    /**
     * Escaped einen String für JSON (minimal).
     *
     * @param s Roh-String (kann null sein)
     * @return JSON-Stringliteral, z. B. {@code "abc"}, oder {@code null}
     */
    private static String js(String s) {
        if (s == null) return "null";
        return "\"" + s.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
