package InvoiceOcr.llm;

import java.time.Duration;

/**
 * Wartet zwischen zwei Versuchen. In Tests durch eine Attrappe ersetzt.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
