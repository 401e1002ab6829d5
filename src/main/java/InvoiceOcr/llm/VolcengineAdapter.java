package InvoiceOcr.llm;

import InvoiceOcr.config.ProviderConfig;
import InvoiceOcr.config.ProviderKind;
import okhttp3.OkHttpClient;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.util.Map;

/*
Adapter für Volcengine Ark (OpenAI-kompatible Chat-API).
 * WICHTIG: Das Feld "model" der Anfrage enthält die Endpoint-ID (ep-...), nicht den Modellnamen.

Adapter for Volcengine Ark (OpenAI compatible chat API).
 * IMPORTANT: the request "model" field carries the endpoint id (ep-...), not the model name.
*/
@Component
public class VolcengineAdapter extends AbstractHttpAdapter {

    public static final String DEFAULT_URL = "https://ark.cn-beijing.volces.com/api/v3";

    public VolcengineAdapter(OkHttpClient client) {
        super(client);
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.VOLCENGINE;
    }

    @Override
    protected String providerName() {
        return "Volcengine";
    }

    @Override
    public String extract(byte[] imageBytes, String mimeType, String prompt, ProviderConfig config)
            throws ProviderException {
        validate(config);

        JSONArray content = new JSONArray()
                .put(new JSONObject()
                        .put("type", "image_url")
                        .put("image_url", new JSONObject().put("url", dataUrl(mimeType, imageBytes))))
                .put(new JSONObject()
                        .put("type", "text")
                        .put("text", prompt));

        JSONObject requestBody = new JSONObject()
                .put("model", config.endpointId().trim())
                .put("messages", new JSONArray().put(new JSONObject()
                        .put("role", "user")
                        .put("content", content)));

        String responseBody = postJson(baseUrl(config) + "/chat/completions", requestBody,
                authHeaders(config), config);
        return readChatCompletionContent(responseBody);
    }

    @Override
    public void validate(ProviderConfig config) throws ProviderException {
        if (isBlank(config.apiKey())) {
            throw new ProviderException(ProviderErrorKind.CONFIG, "Volcengine API key is not configured");
        }
        if (isBlank(config.endpointId())) {
            throw new ProviderException(ProviderErrorKind.CONFIG,
                    "Volcengine endpoint id (ep-...) is not configured");
        }
    }

    /**
     * Volcengine bietet keinen günstigen Test-Endpunkt; geprüft wird nur die Konfiguration.
     */
    @Override
    public boolean isReachable(ProviderConfig config) {
        try {
            validate(config);
            return true;
        } catch (ProviderException e) {
            return false;
        }
    }

    private static Map<String, String> authHeaders(ProviderConfig config) {
        return Map.of("Authorization", "Bearer " + config.apiKey().trim());
    }

    private static String baseUrl(ProviderConfig config) {
        return isBlank(config.baseUrl()) ? DEFAULT_URL : stripTrailingSlash(config.baseUrl());
    }
}
