package com.ivamare.rollout.exception;

import java.util.List;

/**
 * Governance rejection: scope breach, missing or expired CAB approval,
 * invalid evidence. Never retried; the deployment is blocked.
 */
public class PolicyViolationException extends RolloutException {

    private final String correlationId;
    private final List<String> violations;

    public PolicyViolationException(String correlationId, List<String> violations) {
        super("Policy violation for " + correlationId + ": " + String.join("; ", violations));
        this.correlationId = correlationId;
        this.violations = List.copyOf(violations);
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public List<String> getViolations() {
        return violations;
    }
}
