package com.adlanda.dailytoon.support;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Retries a call with exponential backoff: the n-th retry (0-based) waits
 * {@code baseDelay * 2^n}.
 *
 * Only failures accepted by the classifier are retried; anything else is
 * rethrown at once. After the last attempt the last failure is rethrown
 * unchanged. An interrupted thread stops the loop before the next attempt
 * or during a backoff wait with a {@link CancellationException}; the interrupt
 * flag is set again when it escapes.
 */
public final class BackoffRetry {

    private static final Logger log = LoggerFactory.getLogger(BackoffRetry.class);

    private static final double MULTIPLIER = 2.0;

    private final Retry retry;
    private final Predicate<Throwable> isTransient;

    public BackoffRetry(String name, int maxAttempts, Duration baseDelay, Predicate<Throwable> isTransient) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(baseDelay.toMillis(), MULTIPLIER))
                .retryOnException(isTransient)
                .build();
        this.retry = Retry.of(name, config);
        this.isTransient = isTransient;
        this.retry.getEventPublisher().onRetry(event -> log.info("{}: attempt {} failed ({}), retrying in {}ms",
                name, event.getNumberOfRetryAttempts(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown",
                event.getWaitInterval().toMillis()));
    }

    public <T> T call(Supplier<T> attempt) {
        AtomicInteger attempts = new AtomicInteger();
        try {
            return retry.executeSupplier(() -> {
                if (Thread.currentThread().isInterrupted()) {
                    throw new CancellationException("Retry loop '" + retry.getName() + "' interrupted");
                }
                attempts.incrementAndGet();
                return attempt.get();
            });
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            // resilience4j turns an interrupted backoff wait into the last failure and clears the flag
            if (attempts.get() < getMaxAttempts() && isTransient.test(e)) {
                Thread.currentThread().interrupt();
                CancellationException cancelled = new CancellationException(
                        "Retry loop '" + retry.getName() + "' interrupted after " + attempts.get() + " attempt(s)");
                cancelled.initCause(e);
                throw cancelled;
            }
            throw e;
        }
    }

    public int getMaxAttempts() {
        return retry.getRetryConfig().getMaxAttempts();
    }

    /**
     * Underlying resilience4j retry, for event subscriptions and metrics.
     */
    public Retry getRetry() {
        return retry;
    }
}
