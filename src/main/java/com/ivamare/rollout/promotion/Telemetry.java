package com.ivamare.rollout.promotion;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Live deployment telemetry for the current ring.
 *
 * @param successRate Install success rate in [0, 1]
 * @param timeToComplianceHours Hours until devices reached compliance
 * @param incidentCount Incidents attributed to the deployment
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Telemetry(
    double successRate,
    double timeToComplianceHours,
    int incidentCount
) {}
