package InvoiceOcr.config;

import InvoiceOcr.llm.RetryPolicy;
import InvoiceOcr.llm.Sleeper;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Gemeinsame Beans: HTTP-Client, Backoff-Politik, Sleeper.
 *
 * The read and call timeouts set here are only fallbacks; every provider call overrides them
 * with the timeout of its {@link ProviderConfig}.
 */
@Configuration
public class PipelineConfiguration {

    @Bean
    public OkHttpClient okHttpClient(@Value("${invoice-ocr.http.connect-timeout-seconds:10}") long connectTimeout,
                                     @Value("${invoice-ocr.http.write-timeout-seconds:60}") long writeTimeout,
                                     @Value("${invoice-ocr.http.read-timeout-seconds:300}") long readTimeout) {
        // OkHttp Client mit großzügigen Timeouts (Bilder sind groß, Vision-Modelle langsam)
        return new OkHttpClient.Builder()
                .connectTimeout(connectTimeout, TimeUnit.SECONDS)
                .writeTimeout(writeTimeout, TimeUnit.SECONDS)
                .readTimeout(readTimeout, TimeUnit.SECONDS)
                .build();
    }

    @Bean
    public RetryPolicy retryPolicy(@Value("${invoice-ocr.retry.base-delay-ms:2000}") long baseDelayMs,
                                   @Value("${invoice-ocr.retry.rate-limit-base-delay-ms:10000}") long rateLimitDelayMs,
                                   @Value("${invoice-ocr.retry.max-delay-ms:60000}") long maxDelayMs) {
        return new RetryPolicy(Duration.ofMillis(baseDelayMs), Duration.ofMillis(rateLimitDelayMs),
                Duration.ofMillis(maxDelayMs));
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.THREAD;
    }
}
