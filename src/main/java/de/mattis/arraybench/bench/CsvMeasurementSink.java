package de.mattis.arraybench.bench;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Schreibt Messdatensätze als CSV, eine Zeile pro Ausführung.
 *
 * <p>Die Datei wird beim Öffnen neu angelegt (bzw. geleert) und bekommt sofort den Header.
 * Danach wird jede Zeile angehängt und direkt geflusht, damit bei einem Abbruch alle bereits
 * fertigen Ausführungen auf der Platte stehen.</p>
 *
 * <p>Spalten (Header):</p>
 * <ul>
 *   <li>{@code timestamp_iso}: {@code yyyy-MM-dd'T'HH:mm:ss'Z'}</li>
 *   <li>{@code impl_name}, {@code scenario}, {@code N}, {@code seed}, {@code rep_id}</li>
 *   <li>{@code ops_in_run}, {@code total_time_ns}</li>
 *   <li>{@code ns_per_op}: immer mit 4 Nachkommastellen</li>
 *   <li>{@code init_time_ns_if_recorded}</li>
 *   <li>{@code relocations_count}, {@code conversions_count}: reserviert, immer {@code 0}</li>
 * </ul>
 */
public final class CsvMeasurementSink implements MeasurementSink {

    public static final String HEADER =
            "timestamp_iso,impl_name,scenario,N,seed,rep_id,ops_in_run,total_time_ns,ns_per_op,"
                    + "init_time_ns_if_recorded,relocations_count,conversions_count";

    static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);

    private final BufferedWriter w;

    private CsvMeasurementSink(BufferedWriter w) {
        this.w = w;
    }

    /**
     * Öffnet die Datei und schreibt den Header.
     *
     * @param path Zielpfad
     * @return offener Sink
     * @throws IOException wenn die Datei nicht angelegt oder beschrieben werden kann
     */
    public static CsvMeasurementSink open(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        BufferedWriter w = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
        try {
            w.write(HEADER);
            w.newLine();
            w.flush();
        } catch (IOException e) {
            w.close();
            throw e;
        }
        return new CsvMeasurementSink(w);
    }

    @Override
    public void accept(Measurement m) throws IOException {
        w.write(row(m));
        w.newLine();
        w.flush();
    }

    @Override
    public void close() throws IOException {
        w.close();
    }

    /**
     * Formatiert einen Datensatz als CSV-Zeile (ohne Zeilenumbruch).
     *
     * @param m Datensatz
     * @return CSV-Zeile
     */
    static String row(Measurement m) {
        return TIMESTAMP.format(m.timestamp()) + ","
                + m.implName() + ","
                + m.scenario().name() + ","
                + m.n() + ","
                + m.seed() + ","
                + m.repetition() + ","
                + m.opsInRun() + ","
                + m.totalTimeNs() + ","
                + String.format(Locale.ROOT, "%.4f", m.nsPerOp()) + ","
                + m.initTimeNs() + ","
                + m.relocations() + ","
                + m.conversions();
    }
}
