package de.mattis.arraybench.bench;

import java.io.IOException;

/**
 * Ziel für Messdatensätze. Der {@link BenchmarkRunner} übergibt jeden Datensatz direkt nach
 * Abschluss der Wiederholung, in deterministischer Reihenfolge.
 */
public interface MeasurementSink extends AutoCloseable {

    void accept(Measurement measurement) throws IOException;

    @Override
    default void close() throws IOException {
    }
}
