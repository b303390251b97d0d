package com.ivamare.rollout.exception;

/**
 * Thrown when a transient failure persists past the retry policy's attempt cap.
 */
public class RetryExhaustedException extends RolloutException {

    private final String operation;
    private final int attempts;

    public RetryExhaustedException(String operation, int attempts, Throwable lastFailure) {
        super("Retries exhausted for " + operation + " after " + attempts + " attempts: "
            + (lastFailure != null ? lastFailure.getMessage() : "unknown"), lastFailure);
        this.operation = operation;
        this.attempts = attempts;
    }

    public String getOperation() {
        return operation;
    }

    public int getAttempts() {
        return attempts;
    }
}
