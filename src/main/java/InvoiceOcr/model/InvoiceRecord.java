package InvoiceOcr.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Modellklasse für das Extraktionsergebnis einer Rechnungsdatei.
 *
 * One extraction outcome for one source file. Instances are immutable; the amount is
 * always stored with two decimal places. A FAILED record carries a zero amount and at
 * least one error tag.
 *
 * Error entries are tagged strings of the form {@code tag} or {@code tag: detail}.
 * Tax, subtotal and items are only filled in FULL mode; verification and classification only
 * when the optional checks ran.
 */
public record InvoiceRecord(
        Path sourcePath,
        BigDecimal amountTotal,
        LocalDate invoiceDate,
        String vendorName,
        String buyerName,
        String invoiceNumber,
        String rawModelText,
        ExtractionStatus extractionStatus,
        List<String> errors,
        BigDecimal tax,
        BigDecimal subtotal,
        String items,
        Verification verification,
        Classification classification) {

    public static final BigDecimal ZERO_AMOUNT = BigDecimal.ZERO.setScale(2, RoundingMode.UNNECESSARY);

    public InvoiceRecord {
        Objects.requireNonNull(sourcePath, "sourcePath");
        Objects.requireNonNull(extractionStatus, "extractionStatus");
        amountTotal = amountTotal == null ? ZERO_AMOUNT : amountTotal.setScale(2, RoundingMode.HALF_UP);
        errors = errors == null ? List.of() : List.copyOf(errors);
        tax = tax == null ? null : tax.setScale(2, RoundingMode.HALF_UP);
        subtotal = subtotal == null ? null : subtotal.setScale(2, RoundingMode.HALF_UP);

        if (amountTotal.signum() < 0) {
            throw new IllegalArgumentException("amountTotal must not be negative: " + amountTotal);
        }
        if (extractionStatus == ExtractionStatus.FAILED) {
            if (amountTotal.signum() != 0) {
                throw new IllegalArgumentException("FAILED record must have a zero amount");
            }
            if (errors.isEmpty()) {
                throw new IllegalArgumentException("FAILED record must carry at least one error");
            }
        }
    }

    public InvoiceRecord(Path sourcePath, BigDecimal amountTotal, LocalDate invoiceDate, String vendorName,
                         String buyerName, String invoiceNumber, String rawModelText,
                         ExtractionStatus extractionStatus, List<String> errors) {
        this(sourcePath, amountTotal, invoiceDate, vendorName, buyerName, invoiceNumber, rawModelText,
                extractionStatus, errors, null, null, null, null, null);
    }

    /**
     * Record for a file that could not be extracted at all.
     */
    public static InvoiceRecord failed(Path sourcePath, String rawModelText, List<String> errors) {
        return new InvoiceRecord(sourcePath, ZERO_AMOUNT, null, null, null, null,
                rawModelText, ExtractionStatus.FAILED, errors);
    }

    public static InvoiceRecord failed(Path sourcePath, String errorTag) {
        return failed(sourcePath, null, List.of(errorTag));
    }

    /**
     * Gleicher Datensatz nach einer Umbenennung.
     */
    public InvoiceRecord withSourcePath(Path newPath) {
        return new InvoiceRecord(newPath, amountTotal, invoiceDate, vendorName, buyerName, invoiceNumber,
                rawModelText, extractionStatus, errors, tax, subtotal, items, verification, classification);
    }

    /**
     * Gleicher Datensatz mit den Ergebnissen der Zusatzprüfungen; {@code null} lässt ein Feld unverändert.
     */
    public InvoiceRecord withChecks(Verification newVerification, Classification newClassification) {
        return new InvoiceRecord(sourcePath, amountTotal, invoiceDate, vendorName, buyerName, invoiceNumber,
                rawModelText, extractionStatus, errors, tax, subtotal, items,
                newVerification == null ? verification : newVerification,
                newClassification == null ? classification : newClassification);
    }

    public boolean isValid() {
        return extractionStatus != ExtractionStatus.FAILED;
    }

    /**
     * Prüft, ob ein Fehler mit diesem Tag vorliegt (Details nach ':' werden ignoriert).
     */
    public boolean hasErrorTag(String tag) {
        for (String error : errors) {
            int colon = error.indexOf(':');
            String errorTag = colon >= 0 ? error.substring(0, colon) : error;
            if (errorTag.trim().equals(tag)) {
                return true;
            }
        }
        return false;
    }

    public String firstError() {
        return errors.isEmpty() ? null : errors.get(0);
    }

    public String fileName() {
        return sourcePath.getFileName().toString();
    }
}
