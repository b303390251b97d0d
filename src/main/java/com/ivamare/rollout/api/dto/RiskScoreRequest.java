package com.ivamare.rollout.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Map;

/**
 * Either raw factor values or a full intent to derive them from.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RiskScoreRequest(
    Map<String, Double> factors,
    SubmitDeploymentRequest intent
) {}
