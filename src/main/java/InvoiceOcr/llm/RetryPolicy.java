package InvoiceOcr.llm;

import java.time.Duration;

/**
 * Backoff zwischen zwei Versuchen.
 *
 * Exponential backoff: {@code base * 2^(attempt-1)}, capped at {@code maxDelay}. Rate limits
 * start from a longer base and honour the server's Retry-After when that is larger.
 */
public class RetryPolicy {

    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(2);
    public static final Duration DEFAULT_RATE_LIMIT_BASE_DELAY = Duration.ofSeconds(10);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(60);

    private final Duration baseDelay;
    private final Duration rateLimitBaseDelay;
    private final Duration maxDelay;

    public RetryPolicy(Duration baseDelay, Duration rateLimitBaseDelay, Duration maxDelay) {
        if (baseDelay.isNegative() || rateLimitBaseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("Backoff delays must not be negative");
        }
        this.baseDelay = baseDelay;
        this.rateLimitBaseDelay = rateLimitBaseDelay;
        this.maxDelay = maxDelay;
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_BASE_DELAY, DEFAULT_RATE_LIMIT_BASE_DELAY, DEFAULT_MAX_DELAY);
    }

    /**
     * Wartezeit nach dem fehlgeschlagenen Versuch {@code attempt} (1-basiert).
     */
    public Duration delayAfter(int attempt, ProviderException failure) {
        if (failure.getKind() == ProviderErrorKind.RATE_LIMIT) {
            Duration computed = exponential(rateLimitBaseDelay, attempt);
            Duration retryAfter = failure.getRetryAfter().orElse(Duration.ZERO);
            return retryAfter.compareTo(computed) > 0 ? retryAfter : computed;
        }
        return exponential(baseDelay, attempt);
    }

    private Duration exponential(Duration base, int attempt) {
        int shift = Math.max(0, Math.min(attempt - 1, 20));
        Duration delay = base.multipliedBy(1L << shift);
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }
}
