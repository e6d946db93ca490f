package com.sprintsense.backend.exception;

/**
 * A downstream dependency is unavailable and its circuit breaker is open.
 */
public class ServiceDegradedException extends RuntimeException {

    private final String dependency;

    public ServiceDegradedException(String dependency, Throwable cause) {
        super("AI prioritization is degraded: " + dependency + " is unavailable", cause);
        this.dependency = dependency;
    }

    public String getDependency() {
        return dependency;
    }
}
