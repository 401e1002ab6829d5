package InvoiceOcr.config;

import InvoiceOcr.model.ExtractionMode;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Modellklasse für die gespeicherten Einstellungen (~/.invoice_ocr_config.json).
 *
 * Persisted user settings. This is the editable document; a batch run reads it once through
 * {@link #toProviderConfig()} and never sees later changes.
 */
public class AppSettings {

    // =====================
    // Provider
    // =====================

    private String provider = "ollama";
    private String ollamaHost = "192.168.110.219";
    private int ollamaPort = 11434;
    private String ollamaModel = "qwen3-vl:8b";
    private String volcengineApiKey = "";
    private String volcengineEndpointId = "";
    private String volcengineModel = "";
    private String openrouterApiKey = "";
    private String openrouterModel = "google/gemini-2.0-flash-exp:free";

    // =====================
    // Verarbeitung
    // =====================

    private int maxRetries = ProviderConfig.DEFAULT_MAX_RETRIES;
    private int timeoutSeconds = (int) ProviderConfig.DEFAULT_TIMEOUT.getSeconds();
    private String scanDirectory = "";
    private String mode = "simple";
    private boolean enableExcel = true;
    private boolean enableMarkdown = true;
    private boolean enableRename = false;
    private boolean enableValidate = true;
    private boolean enableVerify = false;
    private boolean enableClassify = false;
    private List<String> skipKeywords = new ArrayList<>(List.of("itinerary", "行程单", "receipt"));
    private String rasterizer = "pdfbox";

    // =====================
    // Getters
    // =====================

    public String getProvider() { return provider; }
    public String getOllamaHost() { return ollamaHost; }
    public int getOllamaPort() { return ollamaPort; }
    public String getOllamaModel() { return ollamaModel; }
    public String getVolcengineApiKey() { return volcengineApiKey; }
    public String getVolcengineEndpointId() { return volcengineEndpointId; }
    public String getVolcengineModel() { return volcengineModel; }
    public String getOpenrouterApiKey() { return openrouterApiKey; }
    public String getOpenrouterModel() { return openrouterModel; }
    public int getMaxRetries() { return maxRetries; }
    public int getTimeoutSeconds() { return timeoutSeconds; }
    public String getScanDirectory() { return scanDirectory; }
    public String getMode() { return mode; }
    public boolean isEnableExcel() { return enableExcel; }
    public boolean isEnableMarkdown() { return enableMarkdown; }
    public boolean isEnableRename() { return enableRename; }
    public boolean isEnableValidate() { return enableValidate; }
    public boolean isEnableVerify() { return enableVerify; }
    public boolean isEnableClassify() { return enableClassify; }
    public List<String> getSkipKeywords() { return skipKeywords; }
    public String getRasterizer() { return rasterizer; }

    // =====================
    // Setters
    // =====================

    public void setProvider(String provider) { this.provider = provider; }
    public void setOllamaHost(String ollamaHost) { this.ollamaHost = ollamaHost; }
    public void setOllamaPort(int ollamaPort) { this.ollamaPort = ollamaPort; }
    public void setOllamaModel(String ollamaModel) { this.ollamaModel = ollamaModel; }
    public void setVolcengineApiKey(String volcengineApiKey) { this.volcengineApiKey = volcengineApiKey; }
    public void setVolcengineEndpointId(String volcengineEndpointId) { this.volcengineEndpointId = volcengineEndpointId; }
    public void setVolcengineModel(String volcengineModel) { this.volcengineModel = volcengineModel; }
    public void setOpenrouterApiKey(String openrouterApiKey) { this.openrouterApiKey = openrouterApiKey; }
    public void setOpenrouterModel(String openrouterModel) { this.openrouterModel = openrouterModel; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
    public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    public void setScanDirectory(String scanDirectory) { this.scanDirectory = scanDirectory; }
    public void setMode(String mode) { this.mode = mode; }
    public void setEnableExcel(boolean enableExcel) { this.enableExcel = enableExcel; }
    public void setEnableMarkdown(boolean enableMarkdown) { this.enableMarkdown = enableMarkdown; }
    public void setEnableRename(boolean enableRename) { this.enableRename = enableRename; }
    public void setEnableValidate(boolean enableValidate) { this.enableValidate = enableValidate; }
    public void setEnableVerify(boolean enableVerify) { this.enableVerify = enableVerify; }
    public void setEnableClassify(boolean enableClassify) { this.enableClassify = enableClassify; }
    public void setSkipKeywords(List<String> skipKeywords) { this.skipKeywords = new ArrayList<>(skipKeywords); }
    public void setRasterizer(String rasterizer) { this.rasterizer = rasterizer; }

    // =====================
    // Utility Methods
    // =====================

    public ExtractionMode extractionMode() {
        return ExtractionMode.fromSetting(mode);
    }

    /**
     * Erstellt die unveränderliche Provider-Konfiguration für einen Lauf.
     *
     * Snapshot of the provider part of these settings.
     */
    public ProviderConfig toProviderConfig() {
        Duration timeout = Duration.ofSeconds(Math.max(1, timeoutSeconds));
        ProviderKind kind = ProviderKind.fromSetting(provider);
        if (kind == ProviderKind.VOLCENGINE) {
            return ProviderConfig.volcengine(volcengineApiKey, volcengineEndpointId, volcengineModel,
                    maxRetries, timeout);
        }
        if (kind == ProviderKind.OPENROUTER) {
            return ProviderConfig.openRouter(openrouterApiKey, openrouterModel, maxRetries, timeout);
        }
        return ProviderConfig.ollama(ollamaHost, ollamaPort, ollamaModel, maxRetries, timeout);
    }

    @Override
    public String toString() {
        return "AppSettings{" +
                "provider='" + provider + '\'' +
                ", mode='" + mode + '\'' +
                ", scanDirectory='" + scanDirectory + '\'' +
                ", maxRetries=" + maxRetries +
                ", enableExcel=" + enableExcel +
                ", enableMarkdown=" + enableMarkdown +
                ", enableRename=" + enableRename +
                ", enableValidate=" + enableValidate +
                '}';
    }
}
