package InvoiceOcr.model;

import java.math.BigDecimal;

/**
 * Feste Betragsbereiche für die Histogramm-Auswertung.
 *
 * Fixed amount ranges, lower bound inclusive, upper bound exclusive:
 * <ul>
 *   <li>{@link #UNDER_100}: [0, 100)</li>
 *   <li>{@link #FROM_100_TO_500}: [100, 500)</li>
 *   <li>{@link #FROM_500_TO_1000}: [500, 1000)</li>
 *   <li>{@link #FROM_1000_TO_5000}: [1000, 5000)</li>
 *   <li>{@link #FROM_5000}: [5000, ∞)</li>
 * </ul>
 */
public enum AmountBucket {
    UNDER_100("<100", null, new BigDecimal("100")),
    FROM_100_TO_500("100-500", new BigDecimal("100"), new BigDecimal("500")),
    FROM_500_TO_1000("500-1000", new BigDecimal("500"), new BigDecimal("1000")),
    FROM_1000_TO_5000("1000-5000", new BigDecimal("1000"), new BigDecimal("5000")),
    FROM_5000(">=5000", new BigDecimal("5000"), null);

    private final String label;
    private final BigDecimal lowerInclusive;
    private final BigDecimal upperExclusive;

    AmountBucket(String label, BigDecimal lowerInclusive, BigDecimal upperExclusive) {
        this.label = label;
        this.lowerInclusive = lowerInclusive;
        this.upperExclusive = upperExclusive;
    }

    public String getLabel() {
        return label;
    }

    public static AmountBucket of(BigDecimal amount) {
        for (AmountBucket bucket : values()) {
            boolean aboveLower = bucket.lowerInclusive == null || amount.compareTo(bucket.lowerInclusive) >= 0;
            boolean belowUpper = bucket.upperExclusive == null || amount.compareTo(bucket.upperExclusive) < 0;
            if (aboveLower && belowUpper) {
                return bucket;
            }
        }
        throw new IllegalArgumentException("No bucket for amount " + amount);
    }
}
