package InvoiceOcr.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Unveränderliche Provider-Konfiguration für einen Batch-Lauf.
 *
 * Immutable provider configuration, built once per batch run and passed into every call.
 *
 * Volcengine has two identifiers that are easy to mix up: {@code model} names the model
 * family for display, {@code endpointId} (the {@code ep-...} inference endpoint) is what the
 * API actually routes on. Fields that do not apply to {@code kind} are null.
 * {@code baseUrl} overrides the provider's default URL when set.
 */
public record ProviderConfig(
        ProviderKind kind,
        String host,
        int port,
        String model,
        String apiKey,
        String endpointId,
        int maxRetries,
        Duration timeout,
        String baseUrl) {

    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(300);

    public ProviderConfig {
        Objects.requireNonNull(kind, "kind");
        timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
        if (maxRetries < 1) {
            maxRetries = 1;
        }
    }

    public static ProviderConfig ollama(String host, int port, String model, int maxRetries, Duration timeout) {
        return new ProviderConfig(ProviderKind.OLLAMA, host, port, model, null, null, maxRetries, timeout, null);
    }

    public static ProviderConfig volcengine(String apiKey, String endpointId, String model,
                                            int maxRetries, Duration timeout) {
        return new ProviderConfig(ProviderKind.VOLCENGINE, null, 0, model, apiKey, endpointId,
                maxRetries, timeout, null);
    }

    public static ProviderConfig openRouter(String apiKey, String model, int maxRetries, Duration timeout) {
        return new ProviderConfig(ProviderKind.OPENROUTER, null, 0, model, apiKey, null, maxRetries, timeout, null);
    }

    public ProviderConfig withBaseUrl(String url) {
        return new ProviderConfig(kind, host, port, model, apiKey, endpointId, maxRetries, timeout, url);
    }

    /**
     * Kurzbeschreibung für Logs, ohne API-Key.
     */
    public String describe() {
        if (kind == ProviderKind.OLLAMA) {
            return "Ollama " + host + ":" + port + " model=" + model;
        }
        if (kind == ProviderKind.VOLCENGINE) {
            return "Volcengine endpoint=" + endpointId + " model=" + model;
        }
        return "OpenRouter model=" + model;
    }

    @Override
    public String toString() {
        return "ProviderConfig{" + describe() + ", maxRetries=" + maxRetries + ", timeout=" + timeout + '}';
    }
}
