package InvoiceOcr.llm;

import InvoiceOcr.config.ProviderConfig;
import InvoiceOcr.config.ProviderKind;

/**
 * Gemeinsamer Vertrag aller Vision-Provider (Ollama, Volcengine, OpenRouter).
 *
 * One implementation per provider, constructed once and selected through
 * {@link ProviderAdapterFactory}. Pipeline code only talks to this interface.
 */
public interface ProviderAdapter {

    ProviderKind kind();

    /**
     * Sends one image plus prompt to the provider and returns the model's raw text.
     *
     * @param imageBytes encoded image (PNG, JPEG, ...)
     * @param mimeType   MIME type of {@code imageBytes}
     * @param prompt     instruction for the model
     * @param config     provider configuration of the current run
     * @return the raw answer text, never blank
     * @throws ProviderException with a kind from the unified taxonomy
     */
    String extract(byte[] imageBytes, String mimeType, String prompt, ProviderConfig config) throws ProviderException;

    /**
     * Prüft die Konfiguration ohne Netzwerkzugriff.
     *
     * @throws ProviderException of kind {@link ProviderErrorKind#CONFIG}
     */
    void validate(ProviderConfig config) throws ProviderException;

    /**
     * Leichter Verbindungstest; wirft nie.
     */
    boolean isReachable(ProviderConfig config);
}
