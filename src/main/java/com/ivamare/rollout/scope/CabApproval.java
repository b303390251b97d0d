package com.ivamare.rollout.scope;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.ivamare.rollout.model.CorrelationId;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A governance approval record.
 *
 * @param approvalId Approval identifier
 * @param status Approval status
 * @param expiry End of validity
 * @param conditions Conditions attached to the approval
 * @param approver Who recorded the decision (nullable)
 * @param decidedAt When the decision was recorded
 * @param correlationId Correlation ID of the decision ({@code cab-} prefix, nullable for imported records)
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CabApproval(
    String approvalId,
    CabApprovalStatus status,
    Instant expiry,
    List<String> conditions,
    String approver,
    Instant decidedAt,
    CorrelationId correlationId
) {

    public CabApproval {
        Objects.requireNonNull(approvalId, "approvalId");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(expiry, "expiry");
        conditions = conditions != null ? List.copyOf(conditions) : List.of();
    }

    /**
     * @param now Reference time
     * @return true if approved and not yet expired
     */
    public boolean isUsableAt(Instant now) {
        return status == CabApprovalStatus.APPROVED && now.isBefore(expiry);
    }
}
