package org.nowstart.copytrade.service.venue;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.copytrade.data.exception.VenueCallException;
import org.nowstart.copytrade.data.property.CopyTradingProperties;

/**
 * The only path to the venue. Every attempt waits for the caller's rate limit slot, transient failures are
 * retried with exponential backoff, and the terminal failure is rethrown as {@link VenueCallException}
 * carrying a human-readable message.
 */
@Slf4j
public class VenueCallExecutor {

    private final FollowerRateLimiter rateLimiter;
    private final VenueErrorClassifier errorClassifier;
    private final RetryConfig retryConfig;

    public VenueCallExecutor(
            FollowerRateLimiter rateLimiter,
            VenueErrorClassifier errorClassifier,
            CopyTradingProperties properties
    ) {
        this.rateLimiter = rateLimiter;
        this.errorClassifier = errorClassifier;
        this.retryConfig = RetryConfig.custom()
                .maxAttempts(properties.maxRetries())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(properties.retryBaseDelay().toMillis(), 2.0))
                .retryOnException(errorClassifier::isRetryable)
                .build();
    }

    public <T> T execute(String callerKey, String operation, Supplier<T> call) {
        AtomicInteger attempts = new AtomicInteger();
        Retry retry = Retry.of(operation + ":" + callerKey, retryConfig);
        retry.getEventPublisher().onRetry(event -> log.warn(
                "event=venue_retry operation={} caller={} attempt={} wait_ms={} reason={}",
                operation,
                callerKey,
                event.getNumberOfRetryAttempts(),
                event.getWaitInterval().toMillis(),
                errorClassifier.classify(event.getLastThrowable()).message()
        ));

        Supplier<T> limited = () -> {
            rateLimiter.acquire(callerKey);
            attempts.incrementAndGet();
            return call.get();
        };

        try {
            return retry.executeSupplier(limited);
        } catch (VenueCallException e) {
            throw e;
        } catch (RuntimeException e) {
            VenueErrorClassification classification = errorClassifier.classify(e);
            int attemptCount = attempts.get();
            String message = classification.retryable() && attemptCount > 1
                    ? classification.message() + " (after " + attemptCount + " attempts)"
                    : classification.message();
            log.warn(
                    "event=venue_call_failed operation={} caller={} attempts={} retryable={} reason={}",
                    operation,
                    callerKey,
                    attemptCount,
                    classification.retryable(),
                    classification.message()
            );
            throw new VenueCallException(message, classification.retryable(), attemptCount, e);
        }
    }
}
