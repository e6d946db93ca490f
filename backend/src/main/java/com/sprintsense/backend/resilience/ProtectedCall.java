package com.sprintsense.backend.resilience;

import java.util.function.Supplier;

/**
 * An operation bound to the circuit breaker that guards it.
 */
public final class ProtectedCall<T> implements Supplier<T> {

    private final CircuitBreaker breaker;
    private final Supplier<T> operation;

    private ProtectedCall(CircuitBreaker breaker, Supplier<T> operation) {
        this.breaker = breaker;
        this.operation = operation;
    }

    public static <T> ProtectedCall<T> of(CircuitBreaker breaker, Supplier<T> operation) {
        return new ProtectedCall<>(breaker, operation);
    }

    @Override
    public T get() {
        return breaker.execute(operation);
    }
}
