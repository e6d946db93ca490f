package com.sprintsense.backend.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Three-state circuit breaker guarding a single downstream dependency.
 * <p>
 * CLOSED passes calls through and counts consecutive failures. Reaching the
 * failure threshold opens the circuit, which rejects calls with
 * {@link CircuitBreakerOpenException} until the recovery timeout has elapsed
 * since the last failure. The next call then moves the circuit to HALF_OPEN
 * and runs as the single trial: success closes the circuit, failure opens it
 * again.
 * <p>
 * State transitions happen under a lock, so one instance can be shared by
 * concurrent callers. The protected operation itself runs outside the lock.
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final Duration DEFAULT_RECOVERY_TIMEOUT = Duration.ofSeconds(60);

    private final String name;
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final RetryPolicy retryPolicy;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private CircuitState state = CircuitState.CLOSED;
    private int failureCount = 0;
    private Instant lastFailureTime;
    private boolean trialInFlight = false;

    public CircuitBreaker(String name) {
        this(name, DEFAULT_FAILURE_THRESHOLD, DEFAULT_RECOVERY_TIMEOUT, RetryPolicy.none(), Clock.systemUTC());
    }

    public CircuitBreaker(String name, int failureThreshold, Duration recoveryTimeout,
            RetryPolicy retryPolicy, Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1, got " + failureThreshold);
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = recoveryTimeout;
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.none();
        this.clock = clock;
    }

    /**
     * Run the operation through the breaker. Failures of the operation are
     * recorded and rethrown unchanged.
     *
     * @throws CircuitBreakerOpenException if the circuit rejects the call
     */
    public <T> T call(Callable<T> operation) throws Exception {
        boolean trial = acquirePermission();
        try {
            T result = retryPolicy.execute(operation);
            onSuccess();
            return result;
        } catch (Exception e) {
            onFailure(e);
            throw e;
        } finally {
            if (trial) {
                releaseTrial();
            }
        }
    }

    /**
     * Same as {@link #call(Callable)} for operations that only throw unchecked
     * exceptions.
     */
    public <T> T execute(Supplier<T> operation) {
        try {
            return call(operation::get);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            // Supplier cannot throw checked exceptions
            throw new IllegalStateException("Unexpected checked exception from " + name, e);
        }
    }

    public String getName() {
        return name;
    }

    public CircuitState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public int getFailureCount() {
        lock.lock();
        try {
            return failureCount;
        } finally {
            lock.unlock();
        }
    }

    public Instant getLastFailureTime() {
        lock.lock();
        try {
            return lastFailureTime;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return true if this call is the half-open trial
     */
    private boolean acquirePermission() {
        lock.lock();
        try {
            if (state == CircuitState.OPEN) {
                Instant now = clock.instant();
                if (lastFailureTime != null && now.isBefore(lastFailureTime.plus(recoveryTimeout))) {
                    Duration retryAfter = Duration.between(now, lastFailureTime.plus(recoveryTimeout));
                    log.debug("[CIRCUIT] {} is open, rejecting call (recovery in {}s)", name, retryAfter.toSeconds());
                    throw new CircuitBreakerOpenException(name, retryAfter);
                }
                log.info("[CIRCUIT] {} entering half-open state", name);
                state = CircuitState.HALF_OPEN;
            }
            if (state == CircuitState.HALF_OPEN) {
                if (trialInFlight) {
                    throw new CircuitBreakerOpenException(name, Duration.ZERO);
                }
                trialInFlight = true;
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    private void releaseTrial() {
        lock.lock();
        try {
            trialInFlight = false;
        } finally {
            lock.unlock();
        }
    }

    private void onSuccess() {
        lock.lock();
        try {
            failureCount = 0;
            if (state == CircuitState.HALF_OPEN) {
                log.info("[CIRCUIT] {} closed after successful recovery", name);
                state = CircuitState.CLOSED;
            }
        } finally {
            lock.unlock();
        }
    }

    private void onFailure(Exception e) {
        lock.lock();
        try {
            failureCount++;
            lastFailureTime = clock.instant();
            if (state == CircuitState.HALF_OPEN) {
                log.warn("[CIRCUIT] {} reopened after failed recovery attempt: {}", name, e.getMessage());
                state = CircuitState.OPEN;
            } else if (failureCount >= failureThreshold && state != CircuitState.OPEN) {
                log.warn("[CIRCUIT] {} opened after {} failures: {}", name, failureCount, e.getMessage());
                state = CircuitState.OPEN;
            }
        } finally {
            lock.unlock();
        }
    }
}
