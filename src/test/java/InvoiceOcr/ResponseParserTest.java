package InvoiceOcr;

import InvoiceOcr.model.Classification;
import InvoiceOcr.model.ErrorTags;
import InvoiceOcr.model.ExtractionMode;
import InvoiceOcr.model.ExtractionStatus;
import InvoiceOcr.model.InvoiceRecord;
import InvoiceOcr.model.RiskLevel;
import InvoiceOcr.model.Verification;
import InvoiceOcr.parser.ResponseParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ResponseParserTest {

    private final ResponseParser parser = new ResponseParser();
    private final Path file = Path.of("/tmp/invoices/a.pdf");

    @Test
    @DisplayName("FULL: vollständiges JSON ergibt SUCCESS")
    void testFullJson_AllFields() {
        String raw = """
            ```json
            {
              "invoice_no": "00123456",
              "issue_date": "2024-12-01",
              "seller": "Beijing Supplier Co.",
              "buyer": "Shanghai Buyer Ltd",
              "total": 1234.56,
              "tax": 0,
              "subtotal": 0,
              "items": "",
              "notes": ""
            }
            ```
            """;

        InvoiceRecord record = parser.parse(file, raw, ExtractionMode.FULL);

        assertEquals(ExtractionStatus.SUCCESS, record.extractionStatus());
        assertEquals(new BigDecimal("1234.56"), record.amountTotal());
        assertEquals(LocalDate.of(2024, 12, 1), record.invoiceDate());
        assertEquals("Beijing Supplier Co.", record.vendorName());
        assertEquals("Shanghai Buyer Ltd", record.buyerName());
        assertEquals("00123456", record.invoiceNumber());
        assertTrue(record.errors().isEmpty());
        assertEquals(raw, record.rawModelText());
    }

    @Test
    @DisplayName("FULL: fehlende Felder ergeben PARTIAL_FAILURE mit einem Tag pro Feld")
    void testFullJson_MissingFields() {
        String raw = "{\"total\": \"¥88.00\", \"issue_date\": \"YYYY-MM-DD\", \"seller\": \"Shop\", \"buyer\": \"\"}";

        InvoiceRecord record = parser.parse(file, raw, ExtractionMode.FULL);

        assertEquals(ExtractionStatus.PARTIAL_FAILURE, record.extractionStatus());
        assertEquals(new BigDecimal("88.00"), record.amountTotal());
        assertTrue(record.hasErrorTag(ErrorTags.DATE_NOT_FOUND));
        assertTrue(record.hasErrorTag(ErrorTags.BUYER_NOT_FOUND));
        assertTrue(record.hasErrorTag(ErrorTags.INVOICE_NUMBER_NOT_FOUND));
        assertFalse(record.hasErrorTag(ErrorTags.VENDOR_NOT_FOUND));
    }

    @Test
    void testInvalidDateIsTaggedWithDetail() {
        String raw = "{\"total\": 10, \"issue_date\": \"2024-13-45\", \"seller\": \"S\", \"buyer\": \"B\", \"invoice_no\": \"1\"}";

        InvoiceRecord record = parser.parse(file, raw, ExtractionMode.FULL);

        assertEquals(ExtractionStatus.PARTIAL_FAILURE, record.extractionStatus());
        assertTrue(record.hasErrorTag(ErrorTags.DATE_INVALID));
        assertEquals("date_invalid: 2024-13-45", record.firstError());
    }

    @Test
    @DisplayName("Betrag 0 gilt als nicht gefunden")
    void testZeroAmountFails() {
        InvoiceRecord record = parser.parse(file, "{\"total\": 0}", ExtractionMode.SIMPLE);

        assertEquals(ExtractionStatus.FAILED, record.extractionStatus());
        assertEquals(InvoiceRecord.ZERO_AMOUNT, record.amountTotal());
        assertTrue(record.hasErrorTag(ErrorTags.AMOUNT_NOT_FOUND));
    }

    @Test
    @DisplayName("SIMPLE: nur Betrag, keine Teilfehler")
    void testSimpleModeIgnoresOtherFields() {
        InvoiceRecord record = parser.parse(file, "{\"total\": 250.5}", ExtractionMode.SIMPLE);

        assertEquals(ExtractionStatus.SUCCESS, record.extractionStatus());
        assertEquals(new BigDecimal("250.50"), record.amountTotal());
        assertNull(record.buyerName());
        assertTrue(record.errors().isEmpty());
    }

    @Test
    @DisplayName("Kein JSON: Schlüsselwortsuche auf Chinesisch")
    void testKeywordFallback_Chinese() {
        String raw = """
            发票号码：12345678
            开票日期：2024年03月05日
            购买方名称：上海某某科技有限公司
            销售方名称：北京某某餐饮有限公司
            价税合计（大写）壹仟贰佰叁拾肆元伍角（小写）¥1234.50
            """;

        InvoiceRecord record = parser.parse(file, raw, ExtractionMode.FULL);

        assertEquals(ExtractionStatus.SUCCESS, record.extractionStatus());
        assertEquals(new BigDecimal("1234.50"), record.amountTotal());
        assertEquals(LocalDate.of(2024, 3, 5), record.invoiceDate());
        assertEquals("上海某某科技有限公司", record.buyerName());
        assertEquals("北京某某餐饮有限公司", record.vendorName());
        assertEquals("12345678", record.invoiceNumber());
    }

    @Test
    void testKeywordFallback_English() {
        String raw = "Invoice No: INV-7\nDate: 2024-01-15\nSubtotal: 90.00\nTotal: 99.00\n";

        InvoiceRecord record = parser.parse(file, raw, ExtractionMode.SIMPLE);

        assertEquals(new BigDecimal("99.00"), record.amountTotal());
    }

    @Test
    void testUnparseableAnswerFails() {
        InvoiceRecord record = parser.parse(file, "I cannot read this image.", ExtractionMode.FULL);

        assertEquals(ExtractionStatus.FAILED, record.extractionStatus());
        assertEquals(ErrorTags.AMOUNT_NOT_FOUND, record.firstError());
    }

    @Test
    void testEmptyAnswerFails() {
        InvoiceRecord record = parser.parse(file, "  ", ExtractionMode.SIMPLE);

        assertFalse(record.isValid());
        assertTrue(record.hasErrorTag(ErrorTags.AMOUNT_NOT_FOUND));
    }

    @Test
    void testParseIsInvoice() {
        assertEquals(Optional.of(false), parser.parseIsInvoice("{\"is_invoice\": false}"));
        assertEquals(Optional.of(true), parser.parseIsInvoice("```json\n{\"is_invoice\": true}\n```"));
        assertEquals(Optional.of(false), parser.parseIsInvoice("{\"is_invoice\": \"false\"}"));
        assertEquals(Optional.empty(), parser.parseIsInvoice("vielleicht"));
    }

    @Test
    @DisplayName("JSON ohne Betrag: Betrag aus dem Text davor")
    void testJsonWithoutAmountFallsBackToKeywords() {
        InvoiceRecord record = parser.parse(file, "价税合计：¥1,234.50\n{\"note\": \"ok\"}", ExtractionMode.SIMPLE);

        assertEquals(ExtractionStatus.SUCCESS, record.extractionStatus());
        assertEquals(new BigDecimal("1234.50"), record.amountTotal());
    }

    @Test
    void testChineseTotalKeyInJson() {
        InvoiceRecord record = parser.parse(file, "{\"总金额\": \"1234.50\"}", ExtractionMode.SIMPLE);

        assertEquals(ExtractionStatus.SUCCESS, record.extractionStatus());
        assertEquals(new BigDecimal("1234.50"), record.amountTotal());
    }

    @Test
    @DisplayName("Einzelne Alltagsziffer im Fließtext ist kein Betrag")
    void testStrayChineseDigitIsNotAnAmount() {
        InvoiceRecord record = parser.parse(file, "合计：金额在下一页，无法识别", ExtractionMode.SIMPLE);

        assertEquals(ExtractionStatus.FAILED, record.extractionStatus());
        assertEquals(ErrorTags.AMOUNT_NOT_FOUND, record.firstError());
    }

    @Test
    @DisplayName("Negativer Betrag: FAILED mit Detail")
    void testNegativeAmountFails() {
        InvoiceRecord record = parser.parse(file, "{\"total\": -100}", ExtractionMode.SIMPLE);

        assertEquals(ExtractionStatus.FAILED, record.extractionStatus());
        assertEquals(InvoiceRecord.ZERO_AMOUNT, record.amountTotal());
        assertEquals("amount_not_found: negative", record.firstError());
    }

    @Test
    void testNegativeAmountInTextFails() {
        InvoiceRecord record = parser.parse(file, "Total: -¥58.00", ExtractionMode.SIMPLE);

        assertEquals("amount_not_found: negative", record.firstError());
    }

    @Test
    @DisplayName("FULL: Steuer, Zwischensumme und Positionen")
    void testFullModeReadsTaxSubtotalAndItems() {
        String raw = "{\"total\": 113, \"tax\": 13, \"subtotal\": \"100.00\", \"items\": [\"Beratung\", \"Reise\"],"
                + " \"invoice_no\": \"1\", \"issue_date\": \"2024-06-01\", \"seller\": \"S\", \"buyer\": \"B\"}";

        InvoiceRecord record = parser.parse(file, raw, ExtractionMode.FULL);

        assertEquals(ExtractionStatus.SUCCESS, record.extractionStatus());
        assertEquals(new BigDecimal("13.00"), record.tax());
        assertEquals(new BigDecimal("100.00"), record.subtotal());
        assertEquals("Beratung, Reise", record.items());
    }

    @Test
    void testSimpleModeLeavesFullFieldsEmpty() {
        InvoiceRecord record = parser.parse(file, "{\"total\": 113, \"tax\": 13}", ExtractionMode.SIMPLE);

        assertNull(record.tax());
        assertNull(record.items());
    }

    @Test
    void testParseVerification() {
        Verification verification = parser.parseVerification(
                "```json\n{\"risk_level\": \"medium\", \"has_stamp\": true, \"image_quality\": \"fair\"}\n```")
                .orElseThrow();

        assertEquals(RiskLevel.MEDIUM, verification.riskLevel());
        assertTrue(verification.hasStamp());
        assertEquals("fair", verification.imageQuality());
        assertEquals("", verification.riskNotes());

        // fehlende Schlüssel: unauffällige Standardwerte
        Verification defaults = parser.parseVerification("{}").orElseThrow();
        assertEquals(RiskLevel.LOW, defaults.riskLevel());
        assertTrue(defaults.hasStamp());

        assertTrue(parser.parseVerification("kann ich nicht beurteilen").isEmpty());
    }

    @Test
    void testParseClassification() {
        Classification classification = parser.parseClassification(
                "{\"invoice_type\": \"special_vat\", \"invoice_type_name\": \"增值税专用发票\", \"expense_category\": \"dining\"}")
                .orElseThrow();

        assertEquals("special_vat", classification.invoiceType());
        assertEquals("增值税专用发票", classification.invoiceTypeName());
        assertEquals("dining", classification.expenseCategory());
        // kein Name geliefert: Code als Anzeigename
        assertEquals("dining", classification.expenseCategoryName());

        assertTrue(parser.parseClassification("{\"foo\": 1}").isEmpty());
    }
}
