package InvoiceOcr.llm;

import InvoiceOcr.config.ProviderConfig;
import InvoiceOcr.config.ProviderKind;
import InvoiceOcr.image.MimeTypeDetector;
import okhttp3.OkHttpClient;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/*
Adapter für OpenRouter.
 * Der MIME-Typ der data-URL wird aus den Bytes bestimmt; der Wert des Aufrufers wird ignoriert,
 * weil OpenRouter bei falschem Typ (z.B. PNG als image/jpeg) das Bild ablehnt.

Adapter for OpenRouter.
 * The data URL MIME type is detected from the bytes; the caller's value is ignored.
*/
@Component
public class OpenRouterAdapter extends AbstractHttpAdapter {

    public static final String DEFAULT_URL = "https://openrouter.ai/api/v1";
    static final String REFERER = "https://localhost/invoice-ocr";
    static final String TITLE = "Invoice OCR";

    public OpenRouterAdapter(OkHttpClient client) {
        super(client);
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.OPENROUTER;
    }

    @Override
    protected String providerName() {
        return "OpenRouter";
    }

    @Override
    public String extract(byte[] imageBytes, String mimeType, String prompt, ProviderConfig config)
            throws ProviderException {
        validate(config);

        String detectedMime = MimeTypeDetector.detect(imageBytes);
        if (!detectedMime.equals(mimeType)) {
            log.debug("OpenRouter: caller said {}, bytes are {}", mimeType, detectedMime);
        }

        JSONArray content = new JSONArray()
                .put(new JSONObject()
                        .put("type", "text")
                        .put("text", prompt))
                .put(new JSONObject()
                        .put("type", "image_url")
                        .put("image_url", new JSONObject().put("url", dataUrl(detectedMime, imageBytes))));

        JSONObject requestBody = new JSONObject()
                .put("model", config.model().trim())
                .put("messages", new JSONArray().put(new JSONObject()
                        .put("role", "user")
                        .put("content", content)));

        String responseBody = postJson(baseUrl(config) + "/chat/completions", requestBody, headers(config), config);
        return readChatCompletionContent(responseBody);
    }

    @Override
    public void validate(ProviderConfig config) throws ProviderException {
        if (isBlank(config.apiKey())) {
            throw new ProviderException(ProviderErrorKind.CONFIG, "OpenRouter API key is not configured");
        }
        if (isBlank(config.model())) {
            throw new ProviderException(ProviderErrorKind.CONFIG, "OpenRouter model is not configured");
        }
    }

    @Override
    public boolean isReachable(ProviderConfig config) {
        try {
            validate(config);
        } catch (ProviderException e) {
            return false;
        }
        return respondsTo(baseUrl(config) + "/models", headers(config));
    }

    /**
     * Lädt die Modellliste von {@code GET /models}, sortiert nach Anzeigename.
     * Einträge ohne id oder ohne positives context_length werden übersprungen.
     */
    public List<ModelInfo> listModels(ProviderConfig config) throws ProviderException {
        if (isBlank(config.apiKey())) {
            throw new ProviderException(ProviderErrorKind.CONFIG, "OpenRouter API key is not configured");
        }
        String responseBody = getJson(baseUrl(config) + "/models", headers(config), config);

        List<ModelInfo> models = new ArrayList<>();
        try {
            JSONArray data = new JSONObject(responseBody).optJSONArray("data");
            if (data == null) {
                throw new ProviderException(ProviderErrorKind.EMPTY_RESPONSE, "OpenRouter returned no model list");
            }
            for (int i = 0; i < data.length(); i++) {
                JSONObject model = data.optJSONObject(i);
                if (model == null) {
                    continue;
                }
                String id = model.optString("id", "").trim();
                if (id.isEmpty() || model.optLong("context_length", 0) <= 0) {
                    continue;
                }
                String name = model.optString("name", "").trim();
                models.add(new ModelInfo(id, name.isEmpty() ? id : name));
            }
        } catch (JSONException e) {
            throw new ProviderException(ProviderErrorKind.EMPTY_RESPONSE,
                    "OpenRouter returned an unreadable model list", e);
        }
        models.sort(Comparator.comparing(ModelInfo::name, String.CASE_INSENSITIVE_ORDER));
        log.info("OpenRouter lists {} model(s)", models.size());
        return models;
    }

    private static Map<String, String> headers(ProviderConfig config) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Authorization", "Bearer " + config.apiKey().trim());
        headers.put("HTTP-Referer", REFERER);
        headers.put("X-Title", TITLE);
        return headers;
    }

    private static String baseUrl(ProviderConfig config) {
        return isBlank(config.baseUrl()) ? DEFAULT_URL : stripTrailingSlash(config.baseUrl());
    }
}
