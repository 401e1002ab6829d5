package InvoiceOcr;

import InvoiceOcr.config.ProviderConfig;
import InvoiceOcr.config.ProviderKind;
import InvoiceOcr.llm.AttemptListener;
import InvoiceOcr.llm.ExtractionClient;
import InvoiceOcr.llm.ExtractionFailedException;
import InvoiceOcr.llm.ProviderAdapter;
import InvoiceOcr.llm.ProviderAdapterFactory;
import InvoiceOcr.llm.ProviderErrorKind;
import InvoiceOcr.llm.ProviderException;
import InvoiceOcr.llm.RetryPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ExtractionClientTest {

    @Mock ProviderAdapterFactory adapterFactory;
    @Mock ProviderAdapter adapter;

    private final List<Duration> sleeps = new ArrayList<>();
    private final byte[] image = {1, 2, 3};
    private ExtractionClient client;

    @BeforeEach
    void setUp() {
        when(adapterFactory.forKind(ProviderKind.OLLAMA)).thenReturn(adapter);
        client = new ExtractionClient(adapterFactory, RetryPolicy.defaults(), sleeps::add);
    }

    private static ProviderConfig config(int maxRetries) {
        return ProviderConfig.ollama("localhost", 11434, "qwen3-vl:8b", maxRetries, Duration.ofSeconds(30));
    }

    @Test
    @DisplayName("NETWORK bei den ersten Versuchen, Erfolg beim letzten: genau maxRetries Aufrufe")
    void testRetriesUntilSuccessOnLastAttempt() throws Exception {
        when(adapter.extract(any(), anyString(), anyString(), any()))
                .thenThrow(new ProviderException(ProviderErrorKind.NETWORK, "connection refused"))
                .thenThrow(new ProviderException(ProviderErrorKind.NETWORK, "connection refused"))
                .thenReturn("{\"total\": 100}");

        String result = client.extract(image, "image/png", "prompt", config(3));

        assertEquals("{\"total\": 100}", result);
        verify(adapter, times(3)).extract(any(), anyString(), anyString(), any());
        assertEquals(List.of(Duration.ofSeconds(2), Duration.ofSeconds(4)), sleeps);
    }

    @Test
    @DisplayName("AUTH: Abbruch nach genau einem Versuch")
    void testAuthFailsAfterOneAttempt() throws Exception {
        when(adapter.extract(any(), anyString(), anyString(), any()))
                .thenThrow(new ProviderException(ProviderErrorKind.AUTH, "invalid key", 401, null, null));

        ExtractionFailedException e = assertThrows(ExtractionFailedException.class,
                () -> client.extract(image, "image/png", "prompt", config(5)));

        assertEquals(1, e.getAttempts());
        assertEquals(ProviderErrorKind.AUTH, e.getKind());
        assertEquals(401, e.getLastCause().getStatusCode());
        verify(adapter, times(1)).extract(any(), anyString(), anyString(), any());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void testExhaustedRetriesCarryLastCause() throws Exception {
        when(adapter.extract(any(), anyString(), anyString(), any()))
                .thenThrow(new ProviderException(ProviderErrorKind.TIMEOUT, "first"))
                .thenThrow(new ProviderException(ProviderErrorKind.EMPTY_RESPONSE, "second"));

        ExtractionFailedException e = assertThrows(ExtractionFailedException.class,
                () -> client.extract(image, "image/png", "prompt", config(2)));

        assertEquals(2, e.getAttempts());
        assertEquals(ProviderErrorKind.EMPTY_RESPONSE, e.getKind());
        assertEquals("second", e.getLastCause().getMessage());
    }

    @Test
    @DisplayName("RATE_LIMIT wartet länger als NETWORK")
    void testRateLimitBacksOffLonger() throws Exception {
        when(adapter.extract(any(), anyString(), anyString(), any()))
                .thenThrow(new ProviderException(ProviderErrorKind.RATE_LIMIT, "slow down", 429, null, null))
                .thenReturn("ok");

        client.extract(image, "image/png", "prompt", config(3));

        assertEquals(1, sleeps.size());
        assertTrue(sleeps.get(0).compareTo(RetryPolicy.DEFAULT_BASE_DELAY) > 0);
        assertEquals(Duration.ofSeconds(10), sleeps.get(0));
    }

    @Test
    void testRetryAfterHeaderWinsWhenLarger() throws Exception {
        when(adapter.extract(any(), anyString(), anyString(), any()))
                .thenThrow(new ProviderException(ProviderErrorKind.RATE_LIMIT, "slow down", 429,
                        Duration.ofSeconds(42), null))
                .thenReturn("ok");

        client.extract(image, "image/png", "prompt", config(2));

        assertEquals(List.of(Duration.ofSeconds(42)), sleeps);
    }

    @Test
    @DisplayName("maxRetries < 1 bedeutet trotzdem ein Versuch")
    void testAtLeastOneAttempt() throws Exception {
        when(adapter.extract(any(), anyString(), anyString(), any())).thenReturn("ok");

        assertEquals("ok", client.extract(image, "image/png", "prompt", config(0)));
        verify(adapter, times(1)).extract(any(), anyString(), anyString(), any());
    }

    @Test
    void testAttemptListenerSeesEveryFailure() throws Exception {
        when(adapter.extract(any(), anyString(), anyString(), any()))
                .thenThrow(new ProviderException(ProviderErrorKind.NETWORK, "a"))
                .thenThrow(new ProviderException(ProviderErrorKind.NETWORK, "b"));
        List<String> seen = new ArrayList<>();
        AttemptListener listener = (attempt, max, failure, delay) ->
                seen.add(attempt + "/" + max + ":" + failure.getMessage() + ":" + (delay == null ? "-" : delay.toSeconds()));

        assertThrows(ExtractionFailedException.class,
                () -> client.extract(image, "image/png", "prompt", config(2), listener));

        assertEquals(List.of("1/2:a:2", "2/2:b:-"), seen);
    }
}
