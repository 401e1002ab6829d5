package InvoiceOcr.llm;

import InvoiceOcr.config.ProviderConfig;
import InvoiceOcr.config.ProviderKind;
import okhttp3.OkHttpClient;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.util.Map;

/*
Adapter für einen Ollama-Server (lokal oder im LAN).
 * POST /api/chat mit dem Bild als Base64 im Feld "images", ohne Streaming.

Adapter for an Ollama server (local or on the LAN).
 * POST /api/chat with the image as base64 in "images", streaming disabled.
*/
@Component
public class OllamaAdapter extends AbstractHttpAdapter {

    public OllamaAdapter(OkHttpClient client) {
        super(client);
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.OLLAMA;
    }

    @Override
    protected String providerName() {
        return "Ollama";
    }

    @Override
    public String extract(byte[] imageBytes, String mimeType, String prompt, ProviderConfig config)
            throws ProviderException {
        validate(config);

        JSONObject message = new JSONObject()
                .put("role", "user")
                .put("content", prompt)
                .put("images", new JSONArray().put(base64(imageBytes)));

        JSONObject requestBody = new JSONObject()
                .put("model", config.model())
                .put("messages", new JSONArray().put(message))
                .put("stream", false);

        String responseBody = postJson(baseUrl(config) + "/api/chat", requestBody, Map.of(), config);

        try {
            JSONObject responseObj = new JSONObject(responseBody);
            JSONObject answer = responseObj.optJSONObject("message");
            String content = answer != null ? answer.optString("content", "") : "";
            if (content.isBlank()) {
                // ältere Server antworten im Feld "response"
                content = responseObj.optString("response", "");
            }
            return requireText(content, responseBody);
        } catch (JSONException e) {
            throw new ProviderException(ProviderErrorKind.EMPTY_RESPONSE,
                    "Ollama returned an unreadable body", e);
        }
    }

    @Override
    public void validate(ProviderConfig config) throws ProviderException {
        if (isBlank(config.baseUrl()) && isBlank(config.host())) {
            throw new ProviderException(ProviderErrorKind.CONFIG, "Ollama host is not configured");
        }
        if (isBlank(config.baseUrl()) && (config.port() <= 0 || config.port() > 65535)) {
            throw new ProviderException(ProviderErrorKind.CONFIG, "Ollama port is invalid: " + config.port());
        }
        if (isBlank(config.model())) {
            throw new ProviderException(ProviderErrorKind.CONFIG, "Ollama model is not configured");
        }
    }

    @Override
    public boolean isReachable(ProviderConfig config) {
        try {
            validate(config);
        } catch (ProviderException e) {
            return false;
        }
        return respondsTo(baseUrl(config) + "/api/tags", Map.of());
    }

    private static String baseUrl(ProviderConfig config) {
        if (!isBlank(config.baseUrl())) {
            return stripTrailingSlash(config.baseUrl());
        }
        String host = config.host().trim();
        if (host.startsWith("http://") || host.startsWith("https://")) {
            return stripTrailingSlash(host) + ":" + config.port();
        }
        return "http://" + host + ":" + config.port();
    }
}
