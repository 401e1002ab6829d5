package InvoiceOcr.export;

import InvoiceOcr.model.AmountBucket;
import InvoiceOcr.model.Analysis;
import InvoiceOcr.model.Analysis.BucketStats;
import InvoiceOcr.model.InvoiceRecord;
import InvoiceOcr.model.RiskLevel;
import org.apache.poi.common.usermodel.HyperlinkType;
import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * Verantwortlich für den Export der Rechnungsdaten nach Excel.
 * Blatt "Invoices" mit einer Zeile pro Datei, Blatt "Summary" mit der Auswertung.
 *
 * Responsible for exporting invoice data to Excel.
 * Sheet "Invoices" has one row per file, sheet "Summary" the analysis.
 */
@Component
public class ExcelExporter implements ReportExporter {

    private static final Logger log = LoggerFactory.getLogger(ExcelExporter.class);

    public static final String INVOICES_SHEET = "Invoices";
    public static final String SUMMARY_SHEET = "Summary";

    static final String[] COLUMN_HEADERS = {
        "Datei",
        "Rechnungsnummer",
        "Rechnungsdatum",
        "Verkäufer",
        "Käufer",
        "Betrag",
        "Status",
        "Fehler",
        "Steuer",
        "Zwischensumme",
        "Positionen",
        "Rechnungsart",
        "Kostenart",
        "Risiko",
        "Risikohinweis"
    };

    private static final int AMOUNT_COLUMN = 5;
    private static final int TAX_COLUMN = 8;
    private static final int SUBTOTAL_COLUMN = 9;

    @Override
    public String defaultFileName() {
        return "invoice_summary.xlsx";
    }

    @Override
    public void export(List<InvoiceRecord> records, Analysis analysis, Path target) throws IOException {
        try (Workbook workbook = new XSSFWorkbook()) {
            // Styles erstellen
            CellStyle headerStyle = createHeaderStyle(workbook);
            CellStyle dataStyle = createDataStyle(workbook);
            CellStyle amountStyle = createAmountStyle(workbook, dataStyle);

            Sheet invoices = workbook.createSheet(INVOICES_SHEET);
            createHeaderRow(invoices, headerStyle);
            fillDataRows(invoices, records, dataStyle, amountStyle);
            autoSizeColumns(invoices, COLUMN_HEADERS.length);

            Sheet summary = workbook.createSheet(SUMMARY_SHEET);
            fillSummary(summary, analysis, headerStyle, amountStyle);
            autoSizeColumns(summary, 3);

            writeToFile(workbook, target);
        }
        log.info("Excel report written to {}", target);
    }

    private CellStyle createHeaderStyle(Workbook workbook) {
        CellStyle style = workbook.createCellStyle();

        Font font = workbook.createFont();
        font.setBold(true);
        font.setFontHeightInPoints((short) 12);
        style.setFont(font);

        style.setFillForegroundColor(IndexedColors.GREY_25_PERCENT.getIndex());
        style.setFillPattern(FillPatternType.SOLID_FOREGROUND);

        setThinBorders(style);
        return style;
    }

    private CellStyle createDataStyle(Workbook workbook) {
        CellStyle style = workbook.createCellStyle();
        setThinBorders(style);
        return style;
    }

    private CellStyle createAmountStyle(Workbook workbook, CellStyle dataStyle) {
        CellStyle style = workbook.createCellStyle();
        style.cloneStyleFrom(dataStyle);
        style.setDataFormat(workbook.createDataFormat().getFormat("#,##0.00"));
        return style;
    }

    private void setThinBorders(CellStyle style) {
        style.setBorderBottom(BorderStyle.THIN);
        style.setBorderTop(BorderStyle.THIN);
        style.setBorderLeft(BorderStyle.THIN);
        style.setBorderRight(BorderStyle.THIN);
    }

    private void createHeaderRow(Sheet sheet, CellStyle headerStyle) {
        Row headerRow = sheet.createRow(0);

        for (int i = 0; i < COLUMN_HEADERS.length; i++) {
            Cell cell = headerRow.createCell(i);
            cell.setCellValue(COLUMN_HEADERS[i]);
            cell.setCellStyle(headerStyle);
        }
    }

    private void fillDataRows(Sheet sheet, List<InvoiceRecord> records, CellStyle dataStyle, CellStyle amountStyle) {
        int rowNum = 1;

        for (InvoiceRecord record : records) {
            Row row = sheet.createRow(rowNum++);

            // Spalte 0: Datei mit Hyperlink
            createCellWithHyperlink(row, 0, record.fileName(), record.sourcePath(), dataStyle);
            createCell(row, 1, record.invoiceNumber(), dataStyle);
            createCell(row, 2, record.invoiceDate() != null
                    ? record.invoiceDate().format(DateTimeFormatter.ISO_LOCAL_DATE) : null, dataStyle);
            createCell(row, 3, record.vendorName(), dataStyle);
            createCell(row, 4, record.buyerName(), dataStyle);

            // Spalte 5: Betrag als Zahl, damit Excel summieren kann
            Cell amountCell = row.createCell(AMOUNT_COLUMN);
            amountCell.setCellValue(record.amountTotal().doubleValue());
            amountCell.setCellStyle(amountStyle);

            createCell(row, 6, record.extractionStatus().name(), dataStyle);
            createCell(row, 7, record.firstError(), dataStyle);

            // Spalten 8-14: FULL-Felder und Zusatzprüfungen, leer wenn nicht vorhanden
            createAmountCell(row, TAX_COLUMN, record.tax(), dataStyle, amountStyle);
            createAmountCell(row, SUBTOTAL_COLUMN, record.subtotal(), dataStyle, amountStyle);
            createCell(row, 10, record.items(), dataStyle);
            if (record.classification() != null) {
                createCell(row, 11, record.classification().invoiceTypeName(), dataStyle);
                createCell(row, 12, record.classification().expenseCategoryName(), dataStyle);
            } else {
                createCell(row, 11, null, dataStyle);
                createCell(row, 12, null, dataStyle);
            }
            if (record.verification() != null) {
                createCell(row, 13, record.verification().riskLevel().getCode(), dataStyle);
                createCell(row, 14, record.verification().riskNotes(), dataStyle);
            } else {
                createCell(row, 13, null, dataStyle);
                createCell(row, 14, null, dataStyle);
            }
        }
    }

    private void fillSummary(Sheet sheet, Analysis analysis, CellStyle headerStyle, CellStyle amountStyle) {
        int rowNum = 0;

        rowNum = sectionHeader(sheet, rowNum, headerStyle, "Übersicht", "Wert");
        rowNum = countRow(sheet, rowNum, "Dateien gesamt", analysis.totalCount());
        rowNum = countRow(sheet, rowNum, "Gültig", analysis.validCount());
        rowNum = countRow(sheet, rowNum, "Fehlgeschlagen", analysis.failedCount());
        rowNum = amountRow(sheet, rowNum, "Gesamtbetrag", analysis.totalAmount(), amountStyle);
        rowNum = amountRow(sheet, rowNum, "Durchschnitt", analysis.averageAmount(), amountStyle);
        rowNum++;

        rowNum = sectionHeader(sheet, rowNum, headerStyle, "Nach Monat", "Summe");
        for (Map.Entry<String, BigDecimal> entry : analysis.byMonth().entrySet()) {
            rowNum = amountRow(sheet, rowNum, entry.getKey(), entry.getValue(), amountStyle);
        }
        rowNum++;

        rowNum = sectionHeader(sheet, rowNum, headerStyle, "Nach Verkäufer", "Summe");
        for (Map.Entry<String, BigDecimal> entry : analysis.byVendor().entrySet()) {
            rowNum = amountRow(sheet, rowNum, entry.getKey(), entry.getValue(), amountStyle);
        }
        rowNum++;

        rowNum = sectionHeader(sheet, rowNum, headerStyle, "Betragsbereich", "Summe", "Anzahl");
        for (Map.Entry<AmountBucket, BucketStats> entry : analysis.byBucket().entrySet()) {
            Row row = sheet.createRow(rowNum);
            rowNum = amountRow(sheet, rowNum, entry.getKey().getLabel(), entry.getValue().subtotal(), amountStyle);
            row.createCell(2).setCellValue(entry.getValue().count());
        }

        if (!analysis.byInvoiceType().isEmpty()) {
            rowNum++;
            rowNum = sectionHeader(sheet, rowNum, headerStyle, "Nach Rechnungsart", "Summe", "Anzahl");
            rowNum = statsRows(sheet, rowNum, analysis.byInvoiceType(), amountStyle);
        }
        if (!analysis.byExpenseCategory().isEmpty()) {
            rowNum++;
            rowNum = sectionHeader(sheet, rowNum, headerStyle, "Nach Kostenart", "Summe", "Anzahl");
            rowNum = statsRows(sheet, rowNum, analysis.byExpenseCategory(), amountStyle);
        }
        if (!analysis.byRiskLevel().isEmpty()) {
            rowNum++;
            rowNum = sectionHeader(sheet, rowNum, headerStyle, "Nach Risiko", "Anzahl");
            for (Map.Entry<RiskLevel, Integer> entry : analysis.byRiskLevel().entrySet()) {
                rowNum = countRow(sheet, rowNum, entry.getKey().getCode(), entry.getValue());
            }
        }

        if (!analysis.duplicateInvoiceNumbers().isEmpty()) {
            rowNum++;
            rowNum = sectionHeader(sheet, rowNum, headerStyle, "Doppelte Rechnungsnummern");
            for (String number : analysis.duplicateInvoiceNumbers()) {
                sheet.createRow(rowNum++).createCell(0).setCellValue(number);
            }
        }
        if (!analysis.warnings().isEmpty()) {
            rowNum++;
            rowNum = sectionHeader(sheet, rowNum, headerStyle, "Warnungen");
            for (String warning : analysis.warnings()) {
                sheet.createRow(rowNum++).createCell(0).setCellValue(warning);
            }
        }
    }

    private int sectionHeader(Sheet sheet, int rowNum, CellStyle headerStyle, String... titles) {
        Row row = sheet.createRow(rowNum);
        for (int i = 0; i < titles.length; i++) {
            Cell cell = row.createCell(i);
            cell.setCellValue(titles[i]);
            cell.setCellStyle(headerStyle);
        }
        return rowNum + 1;
    }

    private int statsRows(Sheet sheet, int rowNum, Map<String, BucketStats> stats, CellStyle amountStyle) {
        for (Map.Entry<String, BucketStats> entry : stats.entrySet()) {
            Row row = sheet.createRow(rowNum);
            rowNum = amountRow(sheet, rowNum, entry.getKey(), entry.getValue().subtotal(), amountStyle);
            row.createCell(2).setCellValue(entry.getValue().count());
        }
        return rowNum;
    }

    private int countRow(Sheet sheet, int rowNum, String label, int value) {
        Row row = sheet.createRow(rowNum);
        row.createCell(0).setCellValue(label);
        row.createCell(1).setCellValue(value);
        return rowNum + 1;
    }

    private int amountRow(Sheet sheet, int rowNum, String label, BigDecimal value, CellStyle amountStyle) {
        Row row = sheet.getRow(rowNum) != null ? sheet.getRow(rowNum) : sheet.createRow(rowNum);
        row.createCell(0).setCellValue(label);
        Cell cell = row.createCell(1);
        cell.setCellValue(value.doubleValue());
        cell.setCellStyle(amountStyle);
        return rowNum + 1;
    }

    private void createCell(Row row, int columnIndex, String value, CellStyle style) {
        Cell cell = row.createCell(columnIndex);
        cell.setCellValue(value != null ? value : "");
        cell.setCellStyle(style);
    }

    private void createAmountCell(Row row, int columnIndex, BigDecimal value, CellStyle dataStyle,
                                  CellStyle amountStyle) {
        if (value == null) {
            createCell(row, columnIndex, null, dataStyle);
            return;
        }
        Cell cell = row.createCell(columnIndex);
        cell.setCellValue(value.doubleValue());
        cell.setCellStyle(amountStyle);
    }

    private void createCellWithHyperlink(Row row, int columnIndex, String fileName, Path filePath, CellStyle style) {
        Cell cell = row.createCell(columnIndex);
        cell.setCellValue(fileName);

        try {
            Workbook workbook = row.getSheet().getWorkbook();
            Hyperlink link = workbook.getCreationHelper().createHyperlink(HyperlinkType.FILE);
            link.setAddress(filePath.toAbsolutePath().toUri().toString());
            cell.setHyperlink(link);

            // Hyperlink-Style
            CellStyle linkStyle = workbook.createCellStyle();
            linkStyle.cloneStyleFrom(style);
            Font linkFont = workbook.createFont();
            linkFont.setUnderline(Font.U_SINGLE);
            linkFont.setColor(IndexedColors.BLUE.getIndex());
            linkStyle.setFont(linkFont);

            cell.setCellStyle(linkStyle);
        } catch (IllegalArgumentException e) {
            cell.setCellStyle(style);
            log.warn("Could not create hyperlink for {}: {}", fileName, e.getMessage());
        }
    }

    private void autoSizeColumns(Sheet sheet, int columns) {
        for (int i = 0; i < columns; i++) {
            sheet.autoSizeColumn(i);
            int currentWidth = sheet.getColumnWidth(i);
            sheet.setColumnWidth(i, Math.min(currentWidth + 1000, 255 * 256));
        }
    }

    private void writeToFile(Workbook workbook, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (OutputStream fileOut = Files.newOutputStream(target)) {
            workbook.write(fileOut);
        }
    }
}
