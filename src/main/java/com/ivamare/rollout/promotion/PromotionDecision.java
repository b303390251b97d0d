package com.ivamare.rollout.promotion;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.ivamare.rollout.model.ConnectorOperationResult;
import com.ivamare.rollout.model.CorrelationId;
import com.ivamare.rollout.model.Ring;
import com.ivamare.rollout.risk.RiskAssessment;

import java.util.List;

/**
 * Result of a promotion attempt.
 *
 * @param deploymentId Deployment correlation ID
 * @param fromRing Ring being left
 * @param toRing Ring being entered
 * @param risk Risk assessment at the target ring
 * @param gates Gate evaluation
 * @param violations Governance violations that blocked the promotion (evidence)
 * @param advanced Whether the deployment moved to {@code toRing}
 * @param duplicate Whether another caller already performed this promotion
 * @param cancelled Whether a cancellation signal stopped the promotion
 * @param dispatchResults Connector results of the dispatch to {@code toRing}
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PromotionDecision(
    CorrelationId deploymentId,
    Ring fromRing,
    Ring toRing,
    RiskAssessment risk,
    PromotionGateResult gates,
    List<String> violations,
    boolean advanced,
    boolean duplicate,
    boolean cancelled,
    List<ConnectorOperationResult> dispatchResults
) {

    public PromotionDecision {
        violations = List.copyOf(violations);
        dispatchResults = List.copyOf(dispatchResults);
    }
}
