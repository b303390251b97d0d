package com.ivamare.rollout.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * A CAB decision.
 *
 * @param approvalId Approval ID referenced by intents
 * @param decision approved, denied or pending
 * @param validDays Days until expiry (1 to 90, default 30)
 * @param conditions Conditions attached to the decision
 * @param correlationId Optional {@code cab-} correlation ID
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CabDecisionRequest(
    String approvalId,
    String decision,
    Integer validDays,
    List<String> conditions,
    String correlationId
) {}
