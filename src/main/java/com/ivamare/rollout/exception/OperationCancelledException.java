package com.ivamare.rollout.exception;

/**
 * Thrown when a cancellation signal stops an operation before its next step.
 */
public class OperationCancelledException extends RolloutException {

    public OperationCancelledException(String operation) {
        super("Operation cancelled: " + operation);
    }
}
