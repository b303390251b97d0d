package com.ivamare.rollout.exception;

/**
 * Thrown when no submitted deployment exists for a correlation ID.
 */
public class DeploymentNotFoundException extends RolloutException {

    private final String correlationId;

    public DeploymentNotFoundException(String correlationId) {
        super("Deployment not found: " + correlationId);
        this.correlationId = correlationId;
    }

    public String getCorrelationId() {
        return correlationId;
    }
}
