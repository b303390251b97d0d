package com.ivamare.rollout.risk;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Map;

/**
 * Result of scoring one intent.
 *
 * @param score Risk score in [0, 100], two decimal places
 * @param modelVersion Version of the model that produced the score
 * @param factorValues Clamped factor values that went into the score
 * @param tier Approval tier for the score
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RiskAssessment(
    double score,
    String modelVersion,
    Map<String, Double> factorValues,
    ApprovalTier tier
) {

    public RiskAssessment {
        factorValues = Map.copyOf(factorValues);
    }
}
