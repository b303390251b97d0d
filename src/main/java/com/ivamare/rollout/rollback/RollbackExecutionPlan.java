package com.ivamare.rollout.rollback;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.ivamare.rollout.model.CorrelationId;
import com.ivamare.rollout.model.DeploymentAction;
import com.ivamare.rollout.model.DeploymentIntent;
import com.ivamare.rollout.model.Ring;

import java.util.List;

/**
 * A validated rollback, ready to dispatch.
 *
 * @param rollbackId Correlation ID of the rollback ({@code rollback-} prefix)
 * @param deploymentId Correlation ID of the deployment being rolled back
 * @param strategy Chosen strategy
 * @param ring Ring the deployment reached
 * @param rollbackVersion Version the backend should end up with
 * @param action Action dispatched to the backend
 * @param connectors Connectors to dispatch to
 * @param targetDevices Devices to roll back; empty means the whole ring
 * @param intent Intent the rollback dispatches
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RollbackExecutionPlan(
    CorrelationId rollbackId,
    CorrelationId deploymentId,
    RollbackStrategy strategy,
    Ring ring,
    String rollbackVersion,
    DeploymentAction action,
    List<String> connectors,
    List<String> targetDevices,
    DeploymentIntent intent
) {

    public RollbackExecutionPlan {
        connectors = List.copyOf(connectors);
        targetDevices = List.copyOf(targetDevices);
    }
}
