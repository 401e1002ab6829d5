package InvoiceOcr;

import InvoiceOcr.config.ProviderConfig;
import InvoiceOcr.llm.ModelInfo;
import InvoiceOcr.llm.OllamaAdapter;
import InvoiceOcr.llm.OpenRouterAdapter;
import InvoiceOcr.llm.ProviderErrorKind;
import InvoiceOcr.llm.ProviderException;
import InvoiceOcr.llm.VolcengineAdapter;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ProviderAdapterTest {

    // PNG-Signatur plus ein paar Bytes
    private static final byte[] PNG_BYTES = {(byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A, 0, 0, 0, 13};
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private MockWebServer server;
    private final OkHttpClient client = new OkHttpClient();

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private static String chatCompletion(String content) {
        return new JSONObject()
                .put("choices", new JSONArray().put(new JSONObject()
                        .put("message", new JSONObject().put("role", "assistant").put("content", content))))
                .toString();
    }

    private ProviderConfig openRouterConfig() {
        return ProviderConfig.openRouter("sk-test", "google/gemini-2.0-flash-exp:free", 1, TIMEOUT)
                .withBaseUrl(server.url("/api/v1").toString());
    }

    // ==========================================
    // OpenRouter
    // ==========================================

    @Test
    @DisplayName("OpenRouter: PNG-Bytes werden als image/png gesendet, egal was der Aufrufer sagt")
    void testOpenRouter_DetectsMimeTypeFromBytes() throws Exception {
        server.enqueue(new MockResponse().setBody(chatCompletion("{\"total\": 12.5}")));

        String answer = new OpenRouterAdapter(client).extract(PNG_BYTES, "image/jpeg", "prompt", openRouterConfig());

        assertEquals("{\"total\": 12.5}", answer);
        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(request);
        assertEquals("/api/v1/chat/completions", request.getPath());
        assertEquals("Bearer sk-test", request.getHeader("Authorization"));
        assertNotNull(request.getHeader("HTTP-Referer"));
        assertEquals("Invoice OCR", request.getHeader("X-Title"));

        JSONObject body = new JSONObject(request.getBody().readUtf8());
        JSONArray content = body.getJSONArray("messages").getJSONObject(0).getJSONArray("content");
        String url = content.getJSONObject(1).getJSONObject("image_url").getString("url");
        assertEquals("data:image/png;base64," + Base64.getEncoder().encodeToString(PNG_BYTES), url);
        assertEquals("google/gemini-2.0-flash-exp:free", body.getString("model"));
    }

    @Test
    void testOpenRouter_MissingKeyIsConfigError() {
        ProviderConfig config = ProviderConfig.openRouter("", "some/model", 1, TIMEOUT)
                .withBaseUrl(server.url("/api/v1").toString());

        ProviderException e = assertThrows(ProviderException.class,
                () -> new OpenRouterAdapter(client).extract(PNG_BYTES, "image/png", "p", config));

        assertEquals(ProviderErrorKind.CONFIG, e.getKind());
        assertEquals(0, server.getRequestCount());
    }

    @Test
    @DisplayName("OpenRouter: Modellliste ohne Einträge ohne Kontext, sortiert nach Name")
    void testOpenRouter_ListModels() throws Exception {
        String body = new JSONObject().put("data", new JSONArray()
                .put(new JSONObject().put("id", "z/vision").put("name", "Zeta Vision").put("context_length", 32000))
                .put(new JSONObject().put("id", "a/text").put("context_length", 8000))
                .put(new JSONObject().put("id", "broken/model").put("name", "Broken").put("context_length", 0))
                .put(new JSONObject().put("name", "No Id").put("context_length", 4000)))
                .toString();
        server.enqueue(new MockResponse().setBody(body));

        List<ModelInfo> models = new OpenRouterAdapter(client).listModels(openRouterConfig());

        assertEquals(List.of(new ModelInfo("a/text", "a/text"), new ModelInfo("z/vision", "Zeta Vision")), models);
        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(request);
        assertEquals("GET", request.getMethod());
        assertEquals("/api/v1/models", request.getPath());
        assertEquals("Bearer sk-test", request.getHeader("Authorization"));
    }

    @Test
    void testOpenRouter_ListModelsMapsHttpErrors() {
        server.enqueue(new MockResponse().setResponseCode(401).setBody("{\"error\": \"invalid key\"}"));

        ProviderException e = assertThrows(ProviderException.class,
                () -> new OpenRouterAdapter(client).listModels(openRouterConfig()));

        assertEquals(ProviderErrorKind.AUTH, e.getKind());
    }

    // ==========================================
    // Volcengine
    // ==========================================

    @Test
    @DisplayName("Volcengine: leere Endpoint-ID ergibt CONFIG ohne Anfrage")
    void testVolcengine_EmptyEndpointId() {
        ProviderConfig config = ProviderConfig.volcengine("key", "  ", "doubao-vision", 3, TIMEOUT)
                .withBaseUrl(server.url("/api/v3").toString());

        ProviderException e = assertThrows(ProviderException.class,
                () -> new VolcengineAdapter(client).extract(PNG_BYTES, "image/png", "p", config));

        assertEquals(ProviderErrorKind.CONFIG, e.getKind());
        assertFalse(e.isRetryable());
        assertEquals(0, server.getRequestCount());
    }

    @Test
    @DisplayName("Volcengine: Feld 'model' enthält die Endpoint-ID")
    void testVolcengine_SendsEndpointIdAsModel() throws Exception {
        server.enqueue(new MockResponse().setBody(chatCompletion("{\"total\": 99}")));
        ProviderConfig config = ProviderConfig.volcengine("key", "ep-20240101-abc", "doubao-vision", 1, TIMEOUT)
                .withBaseUrl(server.url("/api/v3").toString());

        String answer = new VolcengineAdapter(client).extract(PNG_BYTES, "image/png", "prompt", config);

        assertEquals("{\"total\": 99}", answer);
        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertEquals("/api/v3/chat/completions", request.getPath());
        JSONObject body = new JSONObject(request.getBody().readUtf8());
        assertEquals("ep-20240101-abc", body.getString("model"));
    }

    // ==========================================
    // Ollama
    // ==========================================

    @Test
    void testOllama_SendsImagesAndReadsMessageContent() throws Exception {
        server.enqueue(new MockResponse().setBody(
                new JSONObject().put("message", new JSONObject().put("content", "{\"total\": 5}")).toString()));
        ProviderConfig config = ProviderConfig.ollama("ignored", 11434, "qwen3-vl:8b", 1, TIMEOUT)
                .withBaseUrl(server.url("/").toString());

        String answer = new OllamaAdapter(client).extract(PNG_BYTES, "image/png", "prompt", config);

        assertEquals("{\"total\": 5}", answer);
        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertEquals("/api/chat", request.getPath());
        JSONObject body = new JSONObject(request.getBody().readUtf8());
        assertFalse(body.getBoolean("stream"));
        assertEquals("qwen3-vl:8b", body.getString("model"));
        JSONObject message = body.getJSONArray("messages").getJSONObject(0);
        assertEquals("prompt", message.getString("content"));
        assertEquals(Base64.getEncoder().encodeToString(PNG_BYTES), message.getJSONArray("images").getString(0));
    }

    @Test
    void testOllama_IsReachable() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"models\": []}"));
        ProviderConfig config = ProviderConfig.ollama("ignored", 11434, "qwen3-vl:8b", 1, TIMEOUT)
                .withBaseUrl(server.url("/").toString());

        assertTrue(new OllamaAdapter(client).isReachable(config));
        assertEquals("/api/tags", server.takeRequest(1, TimeUnit.SECONDS).getPath());
    }

    // ==========================================
    // HTTP-Fehler -> Fehlerklassen
    // ==========================================

    @Test
    void testStatusMapping() {
        assertEquals(ProviderErrorKind.AUTH, failWith(new MockResponse().setResponseCode(401)).getKind());
        assertEquals(ProviderErrorKind.AUTH, failWith(new MockResponse().setResponseCode(403)).getKind());
        assertEquals(ProviderErrorKind.NETWORK, failWith(new MockResponse().setResponseCode(503)).getKind());
        assertEquals(ProviderErrorKind.TIMEOUT, failWith(new MockResponse().setResponseCode(504)).getKind());
        assertEquals(ProviderErrorKind.CONFIG, failWith(new MockResponse().setResponseCode(404)).getKind());
    }

    @Test
    void testRateLimitKeepsStatusAndRetryAfter() {
        ProviderException e = failWith(new MockResponse().setResponseCode(429)
                .setHeader("Retry-After", "7")
                .setBody("{\"error\": \"rate limited\"}"));

        assertEquals(ProviderErrorKind.RATE_LIMIT, e.getKind());
        assertEquals(429, e.getStatusCode());
        assertEquals(Duration.ofSeconds(7), e.getRetryAfter().orElseThrow());
        assertTrue(e.getMessage().contains("rate limited"));
    }

    @Test
    void testEmptyOrBrokenBodyIsEmptyResponse() {
        assertEquals(ProviderErrorKind.EMPTY_RESPONSE,
                failWith(new MockResponse().setBody(chatCompletion("   "))).getKind());
        assertEquals(ProviderErrorKind.EMPTY_RESPONSE,
                failWith(new MockResponse().setBody("<html>gateway</html>")).getKind());
        assertEquals(ProviderErrorKind.EMPTY_RESPONSE,
                failWith(new MockResponse().setBody("{\"choices\": []}")).getKind());
    }

    @Test
    void testSlowServerIsTimeout() {
        server.enqueue(new MockResponse().setBody(chatCompletion("late")).setHeadersDelay(3, TimeUnit.SECONDS));
        ProviderConfig config = ProviderConfig.openRouter("sk-test", "m", 1, Duration.ofSeconds(1))
                .withBaseUrl(server.url("/api/v1").toString());

        ProviderException e = assertThrows(ProviderException.class,
                () -> new OpenRouterAdapter(client).extract(PNG_BYTES, "image/png", "p", config));

        assertEquals(ProviderErrorKind.TIMEOUT, e.getKind());
    }

    private ProviderException failWith(MockResponse response) {
        server.enqueue(response);
        return assertThrows(ProviderException.class,
                () -> new OpenRouterAdapter(client).extract(PNG_BYTES, "image/png", "p", openRouterConfig()));
    }
}
