package InvoiceOcr.llm;

import java.time.Duration;

/**
 * Callback after every failed attempt of {@link ExtractionClient}.
 */
@FunctionalInterface
public interface AttemptListener {

    AttemptListener NONE = (attempt, maxAttempts, failure, nextDelay) -> { };

    /**
     * @param attempt     1-based number of the attempt that failed
     * @param maxAttempts configured attempt budget
     * @param failure     what went wrong
     * @param nextDelay   backoff before the next attempt, or null if no further attempt follows
     */
    void onFailedAttempt(int attempt, int maxAttempts, ProviderException failure, Duration nextDelay);
}
