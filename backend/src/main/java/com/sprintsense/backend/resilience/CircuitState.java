package com.sprintsense.backend.resilience;

public enum CircuitState {
    CLOSED, // Normal operation
    OPEN, // Calls are rejected
    HALF_OPEN // One trial call is allowed
}
