package com.sprintsense.backend.resilience;

import java.time.Duration;

/**
 * Thrown when a circuit breaker rejects a call without invoking the protected
 * operation.
 */
public class CircuitBreakerOpenException extends RuntimeException {

    private final String breakerName;
    private final Duration retryAfter;

    public CircuitBreakerOpenException(String breakerName, Duration retryAfter) {
        super("Circuit breaker '" + breakerName + "' is open, retry in " + retryAfter.toSeconds() + "s");
        this.breakerName = breakerName;
        this.retryAfter = retryAfter;
    }

    public String getBreakerName() {
        return breakerName;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
