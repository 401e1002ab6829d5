package InvoiceOcr.llm;

/**
 * Alle Versuche fehlgeschlagen (oder ein nicht wiederholbarer Fehler).
 *
 * Thrown by {@link ExtractionClient} once the attempt budget is spent or a non-retryable
 * failure occurred. Carries the number of attempts made and the last provider failure.
 */
public class ExtractionFailedException extends Exception {

    private final int attempts;
    private final ProviderException lastCause;

    public ExtractionFailedException(int attempts, ProviderException lastCause) {
        super("Extraction failed after " + attempts + " attempt(s): " + lastCause.getMessage(), lastCause);
        this.attempts = attempts;
        this.lastCause = lastCause;
    }

    public int getAttempts() {
        return attempts;
    }

    public ProviderException getLastCause() {
        return lastCause;
    }

    public ProviderErrorKind getKind() {
        return lastCause.getKind();
    }
}
