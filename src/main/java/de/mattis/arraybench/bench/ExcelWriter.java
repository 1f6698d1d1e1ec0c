package de.mattis.arraybench.bench;

import org.apache.poi.xssf.usermodel.XSSFRow;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public class ExcelWriter implements AutoCloseable {

    static final String SHEET_NAME = "Measurements";

    private final XSSFWorkbook workbook = new XSSFWorkbook();

    public void write(Path file) throws IOException {
        try (OutputStream out = Files.newOutputStream(file)) {
            workbook.write(out);
        }
    }

    public XSSFSheet measurementsSheet() {
        XSSFSheet sheet = workbook.getSheet(SHEET_NAME);
        return sheet != null ? sheet : workbook.createSheet(SHEET_NAME);
    }

    /**
     * Header wie in der CSV, danach eine Zeile pro Datensatz.
     * Zahlen landen als numerische Zellen, damit Excel direkt damit rechnen kann.
     */
    public void writeMeasurements(List<Measurement> results) {
        XSSFSheet sheet = measurementsSheet();

        String[] header = CsvMeasurementSink.HEADER.split(",");
        XSSFRow head = sheet.createRow(0);
        for (int c = 0; c < header.length; c++) {
            head.createCell(c).setCellValue(header[c]);
        }

        int r = 1;
        for (Measurement m : results) {
            XSSFRow row = sheet.createRow(r++);
            int c = 0;
            row.createCell(c++).setCellValue(CsvMeasurementSink.TIMESTAMP.format(m.timestamp()));
            row.createCell(c++).setCellValue(m.implName());
            row.createCell(c++).setCellValue(m.scenario().name());
            row.createCell(c++).setCellValue(m.n());
            row.createCell(c++).setCellValue(m.seed());
            row.createCell(c++).setCellValue(m.repetition());
            row.createCell(c++).setCellValue(m.opsInRun());
            row.createCell(c++).setCellValue(m.totalTimeNs());
            row.createCell(c++).setCellValue(m.nsPerOp());
            row.createCell(c++).setCellValue(m.initTimeNs());
            row.createCell(c++).setCellValue(m.relocations());
            row.createCell(c).setCellValue(m.conversions());
        }
    }

    @Override
    public void close() throws IOException {
        workbook.close();
    }
}
