package com.ivamare.rollout.exception;

/**
 * Thrown when an invalid state transition or operation is attempted.
 */
public class InvalidOperationException extends RolloutException {

    public InvalidOperationException(String message) {
        super(message);
    }
}
