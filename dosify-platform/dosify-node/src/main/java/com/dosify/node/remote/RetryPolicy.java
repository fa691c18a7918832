package com.dosify.node.remote;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Retry with exponential back-off for blocking calls such as secure-store access.
 *
 * @param maxAttempts  total attempts including the first one
 * @param initialDelay delay before the second attempt
 * @param multiplier   factor applied to the delay after every failed attempt
 */
public record RetryPolicy(int maxAttempts, Duration initialDelay, double multiplier) {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("Max attempts must be at least 1");
        }
        if (initialDelay == null || initialDelay.isNegative()) {
            throw new IllegalArgumentException("Initial delay cannot be null or negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("Multiplier must be >= 1.0");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(
                3,                          // Three attempts in total
                Duration.ofSeconds(1),      // First retry after one second
                2.0                         // Doubling back-off
        );
    }

    public static RetryPolicy none() {
        return new RetryPolicy(1, Duration.ZERO, 1.0);
    }

    /**
     * Delay before the given retry (1-based: the delay before attempt 2 is {@code delayBefore(1)}).
     */
    public Duration delayBefore(int retry) {
        double factor = Math.pow(multiplier, Math.max(0, retry - 1));
        return Duration.ofMillis((long) (initialDelay.toMillis() * factor));
    }

    /**
     * Runs a blocking operation, retrying every failure until attempts are exhausted.
     */
    public <T> T execute(Callable<T> operation) throws Exception {
        Exception last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return operation.call();
            } catch (Exception e) {
                last = e;
                if (attempt == maxAttempts) {
                    break;
                }
                Duration delay = delayBefore(attempt);
                log.debug("Attempt {} failed, retrying in {}ms", attempt, delay.toMillis());
                sleep(delay);
            }
        }
        throw last;
    }

    /**
     * Strips the CompletionException/ExecutionException wrappers added by future composition.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static void sleep(Duration delay) throws InterruptedException {
        if (!delay.isZero()) {
            Thread.sleep(delay.toMillis());
        }
    }
}
