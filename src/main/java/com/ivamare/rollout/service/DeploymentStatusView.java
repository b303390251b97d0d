package com.ivamare.rollout.service;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.ivamare.rollout.connector.AggregatedStatus;
import com.ivamare.rollout.model.Ring;

/**
 * Current state of a deployment with live device status.
 *
 * @param correlationId Deployment correlation ID
 * @param currentRing Ring last dispatched to (null if never dispatched)
 * @param rolledBack Whether a rollback converged
 * @param totalDevices Devices reported across connectors
 * @param compliantDevices Devices in the desired state
 * @param status Per-connector detail
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DeploymentStatusView(
    String correlationId,
    Ring currentRing,
    boolean rolledBack,
    int totalDevices,
    long compliantDevices,
    AggregatedStatus status
) {}
