package InvoiceOcr.llm;

/**
 * Einheitliche Fehlerklassen aller Vision-Provider.
 *
 * Unified failure taxonomy of the provider adapters. {@link #isRetryable()} drives the retry
 * policy of {@link ExtractionClient}.
 */
public enum ProviderErrorKind {
    NETWORK("network_error", true),
    TIMEOUT("timeout_error", true),
    AUTH("auth_error", false),
    RATE_LIMIT("rate_limit_error", true),
    EMPTY_RESPONSE("empty_response_error", true),
    CONFIG("config_error", false);

    private final String errorTag;
    private final boolean retryable;

    ProviderErrorKind(String errorTag, boolean retryable) {
        this.errorTag = errorTag;
        this.retryable = retryable;
    }

    public String errorTag() {
        return errorTag;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
