package InvoiceOcr.validation;

import InvoiceOcr.model.AmountBucket;
import InvoiceOcr.model.Analysis;
import InvoiceOcr.model.Analysis.BucketStats;
import InvoiceOcr.model.InvoiceRecord;
import InvoiceOcr.model.RiskLevel;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;


/**
 * Wertet eine abgeschlossene Menge von Rechnungen aus.
 *
 * Computes population statistics over a finalized record list. Pure: the same input always
 * yields an equal {@link Analysis}, and the records are never modified.
 *
 * Groupings only consider valid records (status other than FAILED).
 */
@Component
public class InvoiceAnalyzer {

    private static final DateTimeFormatter MONTH_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM");
    private static final BigDecimal OUTLIER_FACTOR = new BigDecimal("3");

    public Analysis analyze(List<InvoiceRecord> records) {
        int validCount = 0;
        BigDecimal totalAmount = InvoiceRecord.ZERO_AMOUNT;
        Map<String, BigDecimal> byMonth = new LinkedHashMap<>();
        Map<String, BigDecimal> byVendor = new LinkedHashMap<>();
        Map<AmountBucket, BucketStats> byBucket = new LinkedHashMap<>();
        Map<String, Integer> invoiceNumberCounts = new LinkedHashMap<>();
        Map<String, BucketStats> byInvoiceType = new LinkedHashMap<>();
        Map<String, BucketStats> byExpenseCategory = new LinkedHashMap<>();
        Map<RiskLevel, Integer> byRiskLevel = new EnumMap<>(RiskLevel.class);

        for (InvoiceRecord record : records) {
            if (!record.isValid()) {
                continue;
            }
            validCount++;
            BigDecimal amount = record.amountTotal();
            totalAmount = totalAmount.add(amount);

            byMonth.merge(monthKey(record), amount, BigDecimal::add);
            byVendor.merge(vendorKey(record), amount, BigDecimal::add);
            byBucket.merge(AmountBucket.of(amount), new BucketStats(1, amount),
                    (current, single) -> current.add(amount));

            if (!isEmpty(record.invoiceNumber())) {
                invoiceNumberCounts.merge(record.invoiceNumber().trim(), 1, Integer::sum);
            }
            if (record.classification() != null) {
                byInvoiceType.merge(record.classification().invoiceTypeName(), new BucketStats(1, amount),
                        (current, single) -> current.add(amount));
                byExpenseCategory.merge(record.classification().expenseCategoryName(), new BucketStats(1, amount),
                        (current, single) -> current.add(amount));
            }
            if (record.verification() != null) {
                byRiskLevel.merge(record.verification().riskLevel(), 1, Integer::sum);
            }
        }

        BigDecimal average = validCount == 0
                ? InvoiceRecord.ZERO_AMOUNT
                : totalAmount.divide(BigDecimal.valueOf(validCount), 2, RoundingMode.HALF_UP);

        List<String> duplicates = new ArrayList<>();
        invoiceNumberCounts.forEach((number, count) -> {
            if (count > 1) {
                duplicates.add(number);
            }
        });

        return new Analysis(records.size(), validCount, totalAmount, average, byMonth, byVendor, byBucket,
                duplicates, outlierWarnings(records, average, validCount),
                sortedByCount(byInvoiceType), sortedByCount(byExpenseCategory), byRiskLevel);
    }

    // größte Gruppe zuerst, bei Gleichstand in Reihenfolge des ersten Auftretens
    private static Map<String, BucketStats> sortedByCount(Map<String, BucketStats> stats) {
        List<Map.Entry<String, BucketStats>> entries = new ArrayList<>(stats.entrySet());
        entries.sort((a, b) -> Integer.compare(b.getValue().count(), a.getValue().count()));
        Map<String, BucketStats> sorted = new LinkedHashMap<>();
        for (Map.Entry<String, BucketStats> entry : entries) {
            sorted.put(entry.getKey(), entry.getValue());
        }
        return sorted;
    }

    /*
     * Beträge über dem Dreifachen des Durchschnitts. Erst ab zwei gültigen Rechnungen sinnvoll.
     */
    private List<String> outlierWarnings(List<InvoiceRecord> records, BigDecimal average, int validCount) {
        List<String> warnings = new ArrayList<>();
        if (validCount < 2) {
            return warnings;
        }
        BigDecimal threshold = average.multiply(OUTLIER_FACTOR);
        for (InvoiceRecord record : records) {
            if (record.isValid() && record.amountTotal().compareTo(threshold) > 0) {
                warnings.add(record.fileName() + ": amount " + record.amountTotal()
                        + " exceeds 3x the average (" + average + ")");
            }
        }
        return warnings;
    }

    private static String monthKey(InvoiceRecord record) {
        return record.invoiceDate() == null ? Analysis.UNKNOWN_KEY : record.invoiceDate().format(MONTH_FORMAT);
    }

    private static String vendorKey(InvoiceRecord record) {
        return isEmpty(record.vendorName()) ? Analysis.UNKNOWN_KEY : record.vendorName().trim();
    }

    private static boolean isEmpty(String value) {
        return value == null || value.trim().isEmpty();
    }
}
