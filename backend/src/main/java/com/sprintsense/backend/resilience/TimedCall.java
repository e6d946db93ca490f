package com.sprintsense.backend.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Measures an operation and logs a warning when it exceeds its threshold.
 */
public final class TimedCall<T> implements Supplier<T> {

    private static final Logger log = LoggerFactory.getLogger(TimedCall.class);

    private final String operationName;
    private final long thresholdMs;
    private final Supplier<T> operation;

    private TimedCall(String operationName, long thresholdMs, Supplier<T> operation) {
        this.operationName = operationName;
        this.thresholdMs = thresholdMs;
        this.operation = operation;
    }

    public static <T> TimedCall<T> of(String operationName, long thresholdMs, Supplier<T> operation) {
        return new TimedCall<>(operationName, thresholdMs, operation);
    }

    @Override
    public T get() {
        long start = System.nanoTime();
        boolean success = false;
        try {
            T result = operation.get();
            success = true;
            return result;
        } finally {
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            if (elapsedMs > thresholdMs) {
                log.warn("[PERF] {} took {}ms (threshold: {}ms, success: {})",
                        operationName, elapsedMs, thresholdMs, success);
            } else {
                log.debug("[PERF] {} took {}ms (success: {})", operationName, elapsedMs, success);
            }
        }
    }
}
