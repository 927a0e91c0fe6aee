package quest.gekko.seo.util;

import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import quest.gekko.seo.config.SeoProperties;
import quest.gekko.seo.exception.TransientUpstreamException;

import java.util.concurrent.Semaphore;
import java.util.function.Supplier;

/**
 * Caps concurrent calls to the measurement APIs and retries transient upstream failures.
 */
@Component
public class RateLimiter {
    private final Semaphore sem;
    private final RetryTemplate retryTemplate;

    public RateLimiter(SeoProperties.Api api) {
        this.sem = new Semaphore(Math.max(api.maxConcurrent(), 1));
        this.retryTemplate = RetryTemplate.builder()
                .maxAttempts(Math.max(api.maxAttempts(), 1))
                .fixedBackoff(Math.max(api.backoff().toMillis(), 1))
                .retryOn(TransientUpstreamException.class)
                .build();
    }

    public <T> T call(Supplier<T> call) {
        try {
            sem.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for an API permit", e);
        }
        try {
            return retryTemplate.execute(ctx -> call.get());
        } finally {
            sem.release();
        }
    }
}
