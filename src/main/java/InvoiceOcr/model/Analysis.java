package InvoiceOcr.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Auswertung einer abgeschlossenen Rechnungsmenge.
 *
 * Population statistics over a finalized record list. Month, vendor and bucket maps keep the
 * insertion order of the first occurrence of each key; type and category maps are sorted by count,
 * largest first. The type, category and risk maps are empty when the optional checks did not run.
 */
public record Analysis(
        int totalCount,
        int validCount,
        BigDecimal totalAmount,
        BigDecimal averageAmount,
        Map<String, BigDecimal> byMonth,
        Map<String, BigDecimal> byVendor,
        Map<AmountBucket, BucketStats> byBucket,
        List<String> duplicateInvoiceNumbers,
        List<String> warnings,
        Map<String, BucketStats> byInvoiceType,
        Map<String, BucketStats> byExpenseCategory,
        Map<RiskLevel, Integer> byRiskLevel) {

    public static final String UNKNOWN_KEY = "unknown";

    public Analysis {
        byMonth = Collections.unmodifiableMap(new LinkedHashMap<>(byMonth));
        byVendor = Collections.unmodifiableMap(new LinkedHashMap<>(byVendor));
        byBucket = Collections.unmodifiableMap(new LinkedHashMap<>(byBucket));
        duplicateInvoiceNumbers = List.copyOf(duplicateInvoiceNumbers);
        warnings = List.copyOf(warnings);
        byInvoiceType = Collections.unmodifiableMap(new LinkedHashMap<>(byInvoiceType));
        byExpenseCategory = Collections.unmodifiableMap(new LinkedHashMap<>(byExpenseCategory));
        byRiskLevel = Collections.unmodifiableMap(new LinkedHashMap<>(byRiskLevel));
    }

    public int failedCount() {
        return totalCount - validCount;
    }

    /**
     * Anzahl und Summe eines Betragsbereichs.
     */
    public record BucketStats(int count, BigDecimal subtotal) {

        public BucketStats add(BigDecimal amount) {
            return new BucketStats(count + 1, subtotal.add(amount));
        }
    }
}
