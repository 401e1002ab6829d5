package InvoiceOcr.config;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/*
Lädt und speichert die Einstellungen als flaches JSON-Dokument.
 * Unbekannte Schlüssel werden ignoriert, fehlende Schlüssel behalten ihren Standardwert.

Loads and saves the settings as a flat JSON document.
 * Unknown keys are ignored, missing keys keep their default value.
*/
@Component
public class SettingsStore {

    private static final Logger log = LoggerFactory.getLogger(SettingsStore.class);

    private final Path configFile;

    public SettingsStore(@Value("${invoice-ocr.config-file:${user.home}/.invoice_ocr_config.json}") String configFile) {
        this.configFile = Path.of(configFile);
    }

    /**
     * Lädt die Einstellungen; bei fehlender oder kaputter Datei gelten die Standardwerte.
     */
    public AppSettings load() {
        AppSettings settings = new AppSettings();
        if (!Files.isRegularFile(configFile)) {
            log.info("No settings file at {}, using defaults", configFile);
            return settings;
        }
        try {
            String json = Files.readString(configFile, StandardCharsets.UTF_8);
            apply(settings, new JSONObject(json));
            log.info("Loaded settings from {}", configFile);
        } catch (IOException | JSONException e) {
            log.warn("Could not read settings file {}: {} (using defaults)", configFile, e.getMessage());
            return new AppSettings();
        }
        return settings;
    }

    public void save(AppSettings settings) throws IOException {
        Path parent = configFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(configFile, toJson(settings).toString(2), StandardCharsets.UTF_8);
        log.info("Saved settings to {}", configFile);
    }

    static void apply(AppSettings target, JSONObject obj) {
        target.setProvider(obj.optString("provider", target.getProvider()));
        target.setOllamaHost(obj.optString("ollama_host", target.getOllamaHost()));
        target.setOllamaPort(obj.optInt("ollama_port", target.getOllamaPort()));
        target.setOllamaModel(obj.optString("ollama_model", target.getOllamaModel()));
        target.setVolcengineApiKey(obj.optString("volcengine_api_key", target.getVolcengineApiKey()));
        target.setVolcengineEndpointId(obj.optString("volcengine_endpoint_id", target.getVolcengineEndpointId()));
        target.setVolcengineModel(obj.optString("volcengine_model", target.getVolcengineModel()));
        target.setOpenrouterApiKey(obj.optString("openrouter_api_key", target.getOpenrouterApiKey()));
        target.setOpenrouterModel(obj.optString("openrouter_model", target.getOpenrouterModel()));
        target.setMaxRetries(obj.optInt("max_retries", target.getMaxRetries()));
        target.setTimeoutSeconds(obj.optInt("timeout_seconds", target.getTimeoutSeconds()));
        target.setScanDirectory(obj.optString("scan_directory", target.getScanDirectory()));
        target.setMode(obj.optString("mode", target.getMode()));
        target.setEnableExcel(obj.optBoolean("enable_excel", target.isEnableExcel()));
        target.setEnableMarkdown(obj.optBoolean("enable_markdown", target.isEnableMarkdown()));
        target.setEnableRename(obj.optBoolean("enable_rename", target.isEnableRename()));
        target.setEnableValidate(obj.optBoolean("enable_validate", target.isEnableValidate()));
        target.setEnableVerify(obj.optBoolean("enable_verify", target.isEnableVerify()));
        target.setEnableClassify(obj.optBoolean("enable_classify", target.isEnableClassify()));
        target.setRasterizer(obj.optString("rasterizer", target.getRasterizer()));

        JSONArray keywords = obj.optJSONArray("skip_keywords");
        if (keywords != null) {
            List<String> values = new ArrayList<>();
            for (int i = 0; i < keywords.length(); i++) {
                String keyword = keywords.optString(i, "").trim();
                if (!keyword.isEmpty()) {
                    values.add(keyword);
                }
            }
            target.setSkipKeywords(values);
        }

        // Ältere Dateien speicherten die Endpoint-ID (ep-...) im Feld volcengine_model
        if (!obj.has("volcengine_endpoint_id") && target.getVolcengineModel().startsWith("ep-")) {
            log.info("Migrating Volcengine endpoint id from volcengine_model");
            target.setVolcengineEndpointId(target.getVolcengineModel());
        }
    }

    static JSONObject toJson(AppSettings settings) {
        JSONObject obj = new JSONObject();
        obj.put("provider", settings.getProvider());
        obj.put("ollama_host", settings.getOllamaHost());
        obj.put("ollama_port", settings.getOllamaPort());
        obj.put("ollama_model", settings.getOllamaModel());
        obj.put("volcengine_api_key", settings.getVolcengineApiKey());
        obj.put("volcengine_endpoint_id", settings.getVolcengineEndpointId());
        obj.put("volcengine_model", settings.getVolcengineModel());
        obj.put("openrouter_api_key", settings.getOpenrouterApiKey());
        obj.put("openrouter_model", settings.getOpenrouterModel());
        obj.put("max_retries", settings.getMaxRetries());
        obj.put("timeout_seconds", settings.getTimeoutSeconds());
        obj.put("scan_directory", settings.getScanDirectory());
        obj.put("mode", settings.getMode());
        obj.put("enable_excel", settings.isEnableExcel());
        obj.put("enable_markdown", settings.isEnableMarkdown());
        obj.put("enable_rename", settings.isEnableRename());
        obj.put("enable_validate", settings.isEnableValidate());
        obj.put("enable_verify", settings.isEnableVerify());
        obj.put("enable_classify", settings.isEnableClassify());
        obj.put("skip_keywords", new JSONArray(settings.getSkipKeywords()));
        obj.put("rasterizer", settings.getRasterizer());
        return obj;
    }
}
