package de.mattis.arraybench.bench;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class CsvMeasurementSinkTest {

    @TempDir
    Path tmp;

    private static Measurement sample(Scenario scenario, long total, long ops, long init, int rep) {
        return new Measurement(Instant.parse("2025-09-10T11:19:27Z"), "java_long_array", scenario,
                100, 7, rep, ops, total, (double) total / ops, init, 0, 0);
    }

    @Test
    void shouldFormatRowWithFourDecimals() {
        Measurement m = new Measurement(Instant.parse("2025-09-10T11:19:27Z"), "java_long_array",
                Scenario.WRITE_RANDOM, 1000, 42, 2, 1000, 12_345, 12.3456789, 0, 0, 0);
        assertEquals("2025-09-10T11:19:27Z,java_long_array,WRITE_RANDOM,1000,42,2,1000,12345,12.3457,0,0,0",
                CsvMeasurementSink.row(m));
    }

    @Test
    void shouldWriteHeaderAndAppendRowsInOrder() throws Exception {
        Path file = tmp.resolve("out/results.csv");
        try (CsvMeasurementSink sink = CsvMeasurementSink.open(file)) {
            // Header steht sofort nach dem Öffnen auf der Platte
            assertEquals(List.of(CsvMeasurementSink.HEADER), Files.readAllLines(file));

            sink.accept(sample(Scenario.INIT_ONLY, 500, 1, 500, 1));
            sink.accept(sample(Scenario.WRITE_SEQUENTIAL, 250, 100, 0, 1));
        }

        List<String> lines = Files.readAllLines(file);
        assertEquals(3, lines.size());
        assertEquals("timestamp_iso,impl_name,scenario,N,seed,rep_id,ops_in_run,total_time_ns,ns_per_op,"
                + "init_time_ns_if_recorded,relocations_count,conversions_count", lines.get(0));
        assertEquals("2025-09-10T11:19:27Z,java_long_array,INIT_ONLY,100,7,1,1,500,500.0000,500,0,0", lines.get(1));
        assertEquals("2025-09-10T11:19:27Z,java_long_array,WRITE_SEQUENTIAL,100,7,1,100,250,2.5000,0,0,0", lines.get(2));
    }

    @Test
    void shouldTruncateExistingFile() throws Exception {
        Path file = tmp.resolve("results.csv");
        Files.writeString(file, "old content\nmore\n");
        try (CsvMeasurementSink ignored = CsvMeasurementSink.open(file)) {
            assertEquals(List.of(CsvMeasurementSink.HEADER), Files.readAllLines(file));
        }
    }
}
