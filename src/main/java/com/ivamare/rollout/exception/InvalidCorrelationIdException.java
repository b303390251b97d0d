package com.ivamare.rollout.exception;

/**
 * Thrown when a correlation ID is missing, malformed or of the wrong type.
 * Raised before any store access.
 */
public class InvalidCorrelationIdException extends RolloutException {

    private final String value;

    public InvalidCorrelationIdException(String value, String reason) {
        super("Invalid correlation ID '" + value + "': " + reason);
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
