package com.sprintsense.backend.exception;

public class InvalidPrioritizationRequestException extends IllegalArgumentException {

    public InvalidPrioritizationRequestException(String message) {
        super(message);
    }
}
