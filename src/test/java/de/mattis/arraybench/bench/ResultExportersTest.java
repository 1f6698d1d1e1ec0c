package de.mattis.arraybench.bench;

import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class ResultExportersTest {

    @TempDir
    Path tmp;

    private final List<Measurement> results = List.of(
            new Measurement(Instant.parse("2025-09-10T11:19:27Z"), "java_long_array", Scenario.INIT_ONLY,
                    1000, 42, 1, 1, 800, 800.0, 800, 0, 0),
            new Measurement(Instant.parse("2025-09-10T11:19:28Z"), "java_long_array", Scenario.MIXED_R70W30,
                    1000, 42, 1, 1000, 2500, 2.5, 0, 0, 0));

    @Test
    void shouldWriteJsonWithCsvFieldNames() throws Exception {
        Path json = tmp.resolve("results.json");
        ResultExporters.writeJson(results, json);

        assertEquals("{\"results\":["
                + "{\"timestamp_iso\":\"2025-09-10T11:19:27Z\",\"impl_name\":\"java_long_array\",\"scenario\":\"INIT_ONLY\","
                + "\"N\":1000,\"seed\":42,\"rep_id\":1,\"ops_in_run\":1,\"total_time_ns\":800,\"ns_per_op\":800.0000,"
                + "\"init_time_ns_if_recorded\":800,\"relocations_count\":0,\"conversions_count\":0},"
                + "{\"timestamp_iso\":\"2025-09-10T11:19:28Z\",\"impl_name\":\"java_long_array\",\"scenario\":\"MIXED_R70W30\","
                + "\"N\":1000,\"seed\":42,\"rep_id\":1,\"ops_in_run\":1000,\"total_time_ns\":2500,\"ns_per_op\":2.5000,"
                + "\"init_time_ns_if_recorded\":0,\"relocations_count\":0,\"conversions_count\":0}"
                + "]}", Files.readString(json));
    }

    @Test
    void shouldWriteWorkbookWithHeaderAndOneRowPerRecord() throws Exception {
        Path xlsx = tmp.resolve("nested/results.xlsx");
        ResultExporters.writeXlsx(results, xlsx);

        try (InputStream in = Files.newInputStream(xlsx); XSSFWorkbook wb = new XSSFWorkbook(in)) {
            XSSFSheet sheet = wb.getSheet("Measurements");
            assertNotNull(sheet);
            assertEquals(2, sheet.getLastRowNum());
            assertEquals("timestamp_iso", sheet.getRow(0).getCell(0).getStringCellValue());
            assertEquals("conversions_count", sheet.getRow(0).getCell(11).getStringCellValue());
            assertEquals("MIXED_R70W30", sheet.getRow(2).getCell(2).getStringCellValue());
            assertEquals(1000.0, sheet.getRow(2).getCell(6).getNumericCellValue());
            assertEquals(2.5, sheet.getRow(2).getCell(8).getNumericCellValue());
            assertEquals(800.0, sheet.getRow(1).getCell(9).getNumericCellValue());
        }
    }
}
