package com.ivamare.rollout.exception;

/**
 * Base exception for all rollout control plane errors.
 */
public class RolloutException extends RuntimeException {

    public RolloutException(String message) {
        super(message);
    }

    public RolloutException(String message, Throwable cause) {
        super(message, cause);
    }
}
