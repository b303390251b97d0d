package com.ivamare.rollout.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Telemetry observed at the current ring.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PromotionRequest(
    Double successRate,
    Double timeToComplianceHours,
    Integer incidentCount
) {}
