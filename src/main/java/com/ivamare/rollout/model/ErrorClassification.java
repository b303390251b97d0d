package com.ivamare.rollout.model;

/**
 * Three-way failure taxonomy governing retry and escalation.
 */
public enum ErrorClassification {
    /**
     * May succeed on retry: rate limits, timeouts, temporary unavailability.
     * Retried with exponential backoff up to the attempt cap.
     */
    TRANSIENT,

    /**
     * Will not succeed on retry: malformed input, missing resource.
     * Returned to the caller without retry.
     */
    PERMANENT,

    /**
     * Governance rejection: missing approval, scope breach, compliance signal.
     * Never retried, routed to governance notification, deployment blocked.
     */
    POLICY_VIOLATION;

    public boolean isRetryable() {
        return this == TRANSIENT;
    }
}
