package InvoiceOcr.llm;

import InvoiceOcr.config.ProviderConfig;
import okhttp3.*;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.Base64;
import java.util.Map;


/*
Gemeinsame HTTP-Logik der Vision-Provider.
 * Baut die Anfrage, setzt das Timeout pro Aufruf und übersetzt HTTP-/IO-Fehler
 * in die einheitlichen ProviderErrorKind-Klassen.

Shared HTTP plumbing for the vision providers.
 * Builds the request, applies the per-call timeout and maps HTTP/IO failures
 * to the unified ProviderErrorKind taxonomy.

FALLS EIN PROVIDER NICHT ANTWORTET / IF A PROVIDER DOES NOT ANSWER:
- Ollama: läuft der Server auf host:port (Standard 11434)? GET /api/tags im Browser testen
- Volcengine: ist die Endpoint-ID (ep-...) gesetzt, nicht nur der Modellname?
- OpenRouter: ist der API-Key gültig und unterstützt das Modell Bilder?
*/
public abstract class AbstractHttpAdapter implements ProviderAdapter {

    protected static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final int MAX_ERROR_BODY = 500;

    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final OkHttpClient client;

    protected AbstractHttpAdapter(OkHttpClient client) {
        this.client = client;
    }

    protected abstract String providerName();

    protected String postJson(String url, JSONObject payload, Map<String, String> headers, ProviderConfig config)
            throws ProviderException {
        Request request;
        try {
            Request.Builder builder = new Request.Builder()
                    .url(url)
                    .post(RequestBody.create(payload.toString(), JSON));
            headers.forEach(builder::addHeader);
            request = builder.build();
        } catch (IllegalArgumentException e) {
            throw new ProviderException(ProviderErrorKind.CONFIG,
                    providerName() + ": invalid endpoint URL '" + url + "'", e);
        }

        return execute(request, url, config);
    }

    protected String getJson(String url, Map<String, String> headers, ProviderConfig config)
            throws ProviderException {
        Request request;
        try {
            Request.Builder builder = new Request.Builder().url(url).get();
            headers.forEach(builder::addHeader);
            request = builder.build();
        } catch (IllegalArgumentException e) {
            throw new ProviderException(ProviderErrorKind.CONFIG,
                    providerName() + ": invalid endpoint URL '" + url + "'", e);
        }
        return execute(request, url, config);
    }

    private String execute(Request request, String url, ProviderConfig config) throws ProviderException {
        OkHttpClient callClient = client.newBuilder()
                .callTimeout(config.timeout())
                .readTimeout(config.timeout())
                .build();

        long startTime = System.currentTimeMillis();
        try (Response response = callClient.newCall(request).execute()) {
            long duration = System.currentTimeMillis() - startTime;
            ResponseBody body = response.body();
            String responseBody = body != null ? body.string() : "";
            log.debug("{} answered {} after {}ms ({} chars)", providerName(), response.code(), duration,
                    responseBody.length());

            if (!response.isSuccessful()) {
                throw mapHttpError(response.code(), responseBody, response.header("Retry-After"));
            }
            return responseBody;
        } catch (InterruptedIOException e) {
            throw new ProviderException(ProviderErrorKind.TIMEOUT,
                    providerName() + " timed out after " + config.timeout().toSeconds() + "s: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ProviderException(ProviderErrorKind.NETWORK,
                    providerName() + " network error on " + url + ": " + e.getMessage(), e);
        }
    }

    /**
     * Übersetzt einen HTTP-Fehlerstatus in die einheitliche Fehlerklasse.
     */
    protected ProviderException mapHttpError(int statusCode, String body, String retryAfterHeader) {
        String message = providerName() + " HTTP " + statusCode + ": " + truncate(body);
        ProviderErrorKind kind;
        if (statusCode == 401 || statusCode == 403) {
            kind = ProviderErrorKind.AUTH;
        } else if (statusCode == 429) {
            kind = ProviderErrorKind.RATE_LIMIT;
        } else if (statusCode == 408 || statusCode == 504) {
            kind = ProviderErrorKind.TIMEOUT;
        } else if (statusCode >= 500) {
            kind = ProviderErrorKind.NETWORK;
        } else {
            // Anfrage abgelehnt: falsches Modell, falscher Endpoint, ungültige Parameter
            kind = ProviderErrorKind.CONFIG;
        }
        return new ProviderException(kind, message, statusCode, parseRetryAfter(retryAfterHeader), null);
    }

    /**
     * Liest {@code choices[0].message.content} einer OpenAI-kompatiblen Antwort.
     */
    protected String readChatCompletionContent(String responseBody) throws ProviderException {
        try {
            JSONObject responseObj = new JSONObject(responseBody);
            JSONArray choices = responseObj.optJSONArray("choices");
            if (choices == null || choices.isEmpty()) {
                throw emptyResponse(responseBody);
            }
            JSONObject message = choices.getJSONObject(0).optJSONObject("message");
            if (message == null) {
                throw emptyResponse(responseBody);
            }
            Object content = message.opt("content");
            String text;
            if (content instanceof JSONArray) {
                JSONArray parts = (JSONArray) content;
                StringBuilder sb = new StringBuilder();
                for (int i = 0; i < parts.length(); i++) {
                    JSONObject part = parts.optJSONObject(i);
                    if (part != null) {
                        sb.append(part.optString("text", ""));
                    }
                }
                text = sb.toString();
            } else {
                text = message.optString("content", "");
            }
            return requireText(text, responseBody);
        } catch (JSONException e) {
            throw new ProviderException(ProviderErrorKind.EMPTY_RESPONSE,
                    providerName() + " returned an unreadable body: " + truncate(responseBody), e);
        }
    }

    protected String requireText(String text, String responseBody) throws ProviderException {
        if (text == null || text.isBlank()) {
            throw emptyResponse(responseBody);
        }
        return text.trim();
    }

    protected boolean respondsTo(String url, Map<String, String> headers) {
        try {
            Request.Builder builder = new Request.Builder().url(url).get();
            headers.forEach(builder::addHeader);
            OkHttpClient checkClient = client.newBuilder().callTimeout(Duration.ofSeconds(5)).build();
            try (Response response = checkClient.newCall(builder.build()).execute()) {
                return response.isSuccessful();
            }
        } catch (IOException | IllegalArgumentException e) {
            log.debug("{} reachability check on {} failed: {}", providerName(), url, e.getMessage());
            return false;
        }
    }

    protected static String base64(byte[] bytes) {
        return Base64.getEncoder().encodeToString(bytes);
    }

    protected static String dataUrl(String mimeType, byte[] bytes) {
        return "data:" + mimeType + ";base64," + base64(bytes);
    }

    protected static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    protected static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private ProviderException emptyResponse(String responseBody) {
        return new ProviderException(ProviderErrorKind.EMPTY_RESPONSE,
                providerName() + " returned empty content: " + truncate(responseBody));
    }

    private static Duration parseRetryAfter(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        try {
            long seconds = Long.parseLong(header.trim());
            return seconds >= 0 ? Duration.ofSeconds(seconds) : null;
        } catch (NumberFormatException e) {
            // HTTP-Datum wird nicht ausgewertet
            return null;
        }
    }

    private static String truncate(String body) {
        if (body == null || body.isEmpty()) {
            return "<empty body>";
        }
        return body.length() > MAX_ERROR_BODY ? body.substring(0, MAX_ERROR_BODY) + "..." : body;
    }
}
