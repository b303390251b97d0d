package com.ivamare.rollout.rollback;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.ivamare.rollout.model.ConnectorOperationResult;

import java.util.List;

/**
 * Result of a rollback, including partial-failure detail.
 *
 * @param plan The executed plan
 * @param outcome Final outcome
 * @param totalDevices Devices observed across connectors
 * @param compliantDevices Devices in the desired state
 * @param nonCompliantDevices Devices still not in the desired state
 * @param redispatches Re-dispatch rounds performed
 * @param polls Status polls performed
 * @param escalated Whether the rollback was handed over to manual intervention
 * @param dispatchResults Results of every dispatch round, in order
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RollbackReport(
    RollbackExecutionPlan plan,
    RollbackOutcome outcome,
    int totalDevices,
    long compliantDevices,
    List<String> nonCompliantDevices,
    int redispatches,
    int polls,
    boolean escalated,
    List<ConnectorOperationResult> dispatchResults
) {

    public RollbackReport {
        nonCompliantDevices = List.copyOf(nonCompliantDevices);
        dispatchResults = List.copyOf(dispatchResults);
    }
}
