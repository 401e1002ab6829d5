package InvoiceOcr;

import InvoiceOcr.export.ExcelExporter;
import InvoiceOcr.model.Analysis;
import InvoiceOcr.model.Classification;
import InvoiceOcr.model.ErrorTags;
import InvoiceOcr.model.ExtractionStatus;
import InvoiceOcr.model.InvoiceRecord;
import InvoiceOcr.model.RiskLevel;
import InvoiceOcr.model.Verification;
import InvoiceOcr.validation.InvoiceAnalyzer;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExcelExporterTest {

    // JUnit erstellt den Ordner und räumt ihn danach weg
    @TempDir
    Path tempDir;

    private final ExcelExporter exporter = new ExcelExporter();
    private final InvoiceAnalyzer analyzer = new InvoiceAnalyzer();

    private List<InvoiceRecord> sampleRecords() {
        InvoiceRecord ok = new InvoiceRecord(tempDir.resolve("rechnung.pdf"), new BigDecimal("1234.50"),
                LocalDate.of(2024, 12, 1), "Muster GmbH", "Käufer AG", "INV-2024-001", "{}",
                ExtractionStatus.SUCCESS, List.of());
        InvoiceRecord broken = InvoiceRecord.failed(tempDir.resolve("kaputt.pdf"),
                ErrorTags.withDetail(ErrorTags.PDF_RENDER_ERROR, "not a PDF"));
        return List.of(ok, broken);
    }

    @Test
    void testExportCreatesInvoicesAndSummarySheets() throws IOException {
        // 1. ARRANGE
        List<InvoiceRecord> records = sampleRecords();
        Analysis analysis = analyzer.analyze(records);
        Path target = tempDir.resolve("reports").resolve(exporter.defaultFileName());

        // 2. ACT
        exporter.export(records, analysis, target);

        // 3. ASSERT
        assertTrue(Files.exists(target), "Excel-Datei wurde nicht erstellt");
        try (InputStream in = Files.newInputStream(target); Workbook workbook = new XSSFWorkbook(in)) {
            assertEquals(2, workbook.getNumberOfSheets());

            Sheet invoices = workbook.getSheet(ExcelExporter.INVOICES_SHEET);
            assertNotNull(invoices);
            Row header = invoices.getRow(0);
            assertEquals("Datei", header.getCell(0).getStringCellValue());
            assertEquals("Betrag", header.getCell(5).getStringCellValue());
            assertEquals("Fehler", header.getCell(7).getStringCellValue());

            Row first = invoices.getRow(1);
            assertEquals("rechnung.pdf", first.getCell(0).getStringCellValue());
            assertNotNull(first.getCell(0).getHyperlink(), "Datei-Zelle sollte verlinkt sein");
            assertEquals("INV-2024-001", first.getCell(1).getStringCellValue());
            assertEquals("2024-12-01", first.getCell(2).getStringCellValue());

            Cell amount = first.getCell(5);
            assertEquals(CellType.NUMERIC, amount.getCellType());
            assertEquals(1234.50, amount.getNumericCellValue(), 0.001);
            assertEquals("#,##0.00", amount.getCellStyle().getDataFormatString());
            assertEquals("SUCCESS", first.getCell(6).getStringCellValue());

            Row second = invoices.getRow(2);
            assertEquals("FAILED", second.getCell(6).getStringCellValue());
            assertEquals("pdf_render_error: not a PDF", second.getCell(7).getStringCellValue());
            assertEquals(0.0, second.getCell(5).getNumericCellValue(), 0.001);

            Sheet summary = workbook.getSheet(ExcelExporter.SUMMARY_SHEET);
            assertNotNull(summary);
            assertEquals("Übersicht", summary.getRow(0).getCell(0).getStringCellValue());
            assertEquals(2, (int) summary.getRow(1).getCell(1).getNumericCellValue());
            assertEquals(1, (int) summary.getRow(2).getCell(1).getNumericCellValue());
            assertEquals(1234.50, summary.getRow(4).getCell(1).getNumericCellValue(), 0.001);
        }
    }

    @Test
    void testExportWithoutRecordsWritesOnlyHeaders() throws IOException {
        Path target = tempDir.resolve("leer.xlsx");

        exporter.export(List.of(), analyzer.analyze(List.of()), target);

        try (InputStream in = Files.newInputStream(target); Workbook workbook = new XSSFWorkbook(in)) {
            Sheet invoices = workbook.getSheet(ExcelExporter.INVOICES_SHEET);
            assertEquals(0, invoices.getLastRowNum());
        }
    }

    @Test
    void testExportWritesFullFieldsAndCheckSections() throws IOException {
        InvoiceRecord full = new InvoiceRecord(tempDir.resolve("taxi.pdf"), new BigDecimal("113.00"),
                LocalDate.of(2024, 6, 1), "Taxi AG", "Käufer AG", "T-1", "{}", ExtractionStatus.SUCCESS, List.of(),
                new BigDecimal("13"), new BigDecimal("100"), "Fahrt", null, null)
                .withChecks(new Verification(RiskLevel.HIGH, false, "poor", "kein Stempel"),
                        new Classification("taxi", "出租车发票", "transport", "交通"));
        List<InvoiceRecord> records = List.of(full);
        Path target = tempDir.resolve("voll.xlsx");

        exporter.export(records, analyzer.analyze(records), target);

        try (InputStream in = Files.newInputStream(target); Workbook workbook = new XSSFWorkbook(in)) {
            Sheet invoices = workbook.getSheet(ExcelExporter.INVOICES_SHEET);
            Row header = invoices.getRow(0);
            assertEquals("Steuer", header.getCell(8).getStringCellValue());
            assertEquals("Risikohinweis", header.getCell(14).getStringCellValue());

            Row row = invoices.getRow(1);
            assertEquals(13.0, row.getCell(8).getNumericCellValue(), 0.001);
            assertEquals(100.0, row.getCell(9).getNumericCellValue(), 0.001);
            assertEquals("Fahrt", row.getCell(10).getStringCellValue());
            assertEquals("出租车发票", row.getCell(11).getStringCellValue());
            assertEquals("交通", row.getCell(12).getStringCellValue());
            assertEquals("high", row.getCell(13).getStringCellValue());
            assertEquals("kein Stempel", row.getCell(14).getStringCellValue());

            Sheet summary = workbook.getSheet(ExcelExporter.SUMMARY_SHEET);
            List<String> labels = new ArrayList<>();
            for (Row summaryRow : summary) {
                Cell first = summaryRow.getCell(0);
                if (first != null && first.getCellType() == CellType.STRING) {
                    labels.add(first.getStringCellValue());
                }
            }
            assertTrue(labels.contains("Nach Rechnungsart"));
            assertTrue(labels.contains("Nach Kostenart"));
            assertTrue(labels.contains("Nach Risiko"));
            assertTrue(labels.contains("出租车发票"));
        }
    }
}
