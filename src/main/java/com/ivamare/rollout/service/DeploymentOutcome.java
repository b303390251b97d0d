package com.ivamare.rollout.service;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.ivamare.rollout.model.ConnectorOperationResult;
import com.ivamare.rollout.model.Ring;
import com.ivamare.rollout.risk.RiskAssessment;

import java.util.List;

/**
 * Result of submitting a deployment intent.
 *
 * @param correlationId Correlation ID of the deployment
 * @param status Overall status
 * @param ring Ring the intent targeted
 * @param risk Risk assessment (null while in progress)
 * @param violations Governance violations that blocked the deployment
 * @param results Connector results
 * @param replayed Whether this outcome was replayed for a duplicate submission
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DeploymentOutcome(
    String correlationId,
    Status status,
    Ring ring,
    RiskAssessment risk,
    List<String> violations,
    List<ConnectorOperationResult> results,
    boolean replayed
) {

    public DeploymentOutcome {
        violations = violations != null ? List.copyOf(violations) : List.of();
        results = results != null ? List.copyOf(results) : List.of();
    }

    public DeploymentOutcome asReplay() {
        return new DeploymentOutcome(correlationId, status, ring, risk, violations, results, true);
    }

    public enum Status {
        /** Published on every connector */
        DISPATCHED,
        /** Published on some connectors only */
        PARTIAL,
        /** No connector accepted the publish */
        FAILED,
        /** Rejected by scope, CAB, risk or evidence policy */
        BLOCKED,
        /** Stopped by a cancellation signal before dispatch */
        CANCELLED,
        /** A duplicate submission whose first attempt has not finished */
        IN_PROGRESS
    }
}
