package InvoiceOcr.llm;

import java.time.Duration;
import java.util.Optional;

/**
 * Fehler eines Provider-Aufrufs, mit Originalmeldung des Providers.
 */
public class ProviderException extends Exception {

    public static final int NO_STATUS = -1;

    private final ProviderErrorKind kind;
    private final int statusCode;
    private final Duration retryAfter;

    public ProviderException(ProviderErrorKind kind, String message) {
        this(kind, message, NO_STATUS, null, null);
    }

    public ProviderException(ProviderErrorKind kind, String message, Throwable cause) {
        this(kind, message, NO_STATUS, null, cause);
    }

    public ProviderException(ProviderErrorKind kind, String message, int statusCode, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
        this.retryAfter = retryAfter;
    }

    public ProviderErrorKind getKind() {
        return kind;
    }

    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Vom Server verlangte Wartezeit (Retry-After), falls angegeben.
     */
    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
