package com.sprintsense.backend.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter, applied inside a {@link CircuitBreaker}.
 * <p>
 * The delay before retry number {@code n} (1-based) is
 * {@code min(initialDelay * 2^(n-1), maxDelay)}, shifted by up to
 * {@code jitterFraction * delay} in either direction.
 */
public final class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private static final RetryPolicy NONE = new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 0.0, Sleeper.THREAD);

    private final int maxAttempts;
    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double jitterFraction;
    private final Sleeper sleeper;

    private RetryPolicy(int maxAttempts, Duration initialDelay, Duration maxDelay,
            double jitterFraction, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        if (jitterFraction < 0.0 || jitterFraction > 1.0) {
            throw new IllegalArgumentException("jitterFraction must be within [0, 1], got " + jitterFraction);
        }
        this.maxAttempts = maxAttempts;
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.jitterFraction = jitterFraction;
        this.sleeper = sleeper;
    }

    /**
     * Single attempt, no retries.
     */
    public static RetryPolicy none() {
        return NONE;
    }

    public static RetryPolicy exponential(int maxAttempts, Duration initialDelay, Duration maxDelay,
            double jitterFraction) {
        return new RetryPolicy(maxAttempts, initialDelay, maxDelay, jitterFraction, Sleeper.THREAD);
    }

    /**
     * Copy of this policy that waits through the given sleeper.
     */
    public RetryPolicy withSleeper(Sleeper sleeper) {
        return new RetryPolicy(maxAttempts, initialDelay, maxDelay, jitterFraction, sleeper);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Backoff delay before the given retry, before jitter.
     */
    public Duration baseDelay(int attempt) {
        long initialMs = initialDelay.toMillis();
        long factor = 1L << Math.min(Math.max(attempt - 1, 0), 30);
        long delayMs = initialMs > Long.MAX_VALUE / factor ? Long.MAX_VALUE : initialMs * factor;
        return Duration.ofMillis(Math.min(delayMs, maxDelay.toMillis()));
    }

    /**
     * Backoff delay with jitter applied.
     *
     * @param attempt 1-based retry number
     * @param random  value in [-1, 1]
     */
    public Duration delay(int attempt, double random) {
        double base = baseDelay(attempt).toMillis();
        double jittered = base + jitterFraction * base * random;
        return Duration.ofMillis(Math.max(0L, Math.round(jittered)));
    }

    /**
     * Run the operation, retrying failures until {@code maxAttempts} is reached.
     * The last failure is rethrown unchanged.
     */
    public <T> T execute(Callable<T> operation) throws Exception {
        int attempt = 0;
        while (true) {
            try {
                return operation.call();
            } catch (Exception e) {
                attempt++;
                if (attempt >= maxAttempts) {
                    throw e;
                }
                Duration wait = delay(attempt, ThreadLocalRandom.current().nextDouble(-1.0, 1.0));
                log.debug("[RETRY] Attempt {}/{} failed ({}), retrying in {}ms",
                        attempt, maxAttempts, e.getMessage(), wait.toMillis());
                try {
                    sleeper.sleep(wait);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
            }
        }
    }

    @FunctionalInterface
    public interface Sleeper {

        Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

        void sleep(Duration duration) throws InterruptedException;
    }
}
