package InvoiceOcr.llm;

import InvoiceOcr.config.ProviderConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;

/* Ruft den Vision-Provider mit Wiederholungen und Backoff auf.
 * Wiederholt werden NETWORK, TIMEOUT, RATE_LIMIT und EMPTY_RESPONSE.
 * AUTH und CONFIG brechen sofort ab.

 * Calls the vision provider with retries and backoff.
 * At most config.maxRetries() attempts per call (always at least one).
*/
@Service
public class ExtractionClient {

    private static final Logger log = LoggerFactory.getLogger(ExtractionClient.class);

    private final ProviderAdapterFactory adapterFactory;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;

    public ExtractionClient(ProviderAdapterFactory adapterFactory, RetryPolicy retryPolicy, Sleeper sleeper) {
        this.adapterFactory = adapterFactory;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
    }

    /**
     * Prüft die Konfiguration des gewählten Providers ohne Netzwerkzugriff.
     */
    public void validate(ProviderConfig config) throws ProviderException {
        adapterFactory.forKind(config.kind()).validate(config);
    }

    public boolean isReachable(ProviderConfig config) {
        return adapterFactory.forKind(config.kind()).isReachable(config);
    }

    /**
     * Ein einzelner Versuch ohne Wiederholung (für die Rechnungs-Vorabprüfung).
     */
    public String extractOnce(byte[] imageBytes, String mimeType, String prompt, ProviderConfig config)
            throws ProviderException {
        return adapterFactory.forKind(config.kind()).extract(imageBytes, mimeType, prompt, config);
    }

    public String extract(byte[] imageBytes, String mimeType, String prompt, ProviderConfig config)
            throws ExtractionFailedException {
        return extract(imageBytes, mimeType, prompt, config, AttemptListener.NONE);
    }

    /**
     * Extrahiert mit Wiederholungen.
     *
     * @return the raw model text of the first successful attempt
     * @throws ExtractionFailedException after the last allowed attempt, after a non-retryable
     *                                   failure, or when the backoff sleep is interrupted
     */
    public String extract(byte[] imageBytes, String mimeType, String prompt, ProviderConfig config,
                          AttemptListener listener) throws ExtractionFailedException {
        ProviderAdapter adapter = adapterFactory.forKind(config.kind());
        int maxAttempts = Math.max(1, config.maxRetries());

        int attempt = 0;
        while (true) {
            attempt++;
            try {
                String text = adapter.extract(imageBytes, mimeType, prompt, config);
                if (attempt > 1) {
                    log.info("Provider call succeeded on attempt {}/{}", attempt, maxAttempts);
                }
                return text;
            } catch (ProviderException e) {
                boolean lastAttempt = !e.isRetryable() || attempt >= maxAttempts;
                Duration delay = lastAttempt ? null : retryPolicy.delayAfter(attempt, e);
                listener.onFailedAttempt(attempt, maxAttempts, e, delay);

                if (lastAttempt) {
                    log.warn("Provider call failed after {} attempt(s) ({}): {}", attempt, e.getKind(), e.getMessage());
                    throw new ExtractionFailedException(attempt, e);
                }

                log.info("Attempt {}/{} failed ({}), retrying in {}s", attempt, maxAttempts, e.getKind(),
                        delay.toSeconds());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw new ExtractionFailedException(attempt, e);
                }
            }
        }
    }
}
