package com.ivamare.rollout.scope;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;

/**
 * Result of a CAB approval lookup.
 *
 * @param approvalId Approval ID that was checked
 * @param approved Whether the approval is usable right now
 * @param status Stored status, or MISSING
 * @param expiry Expiry of the record (null when missing)
 * @param conditions Conditions of the record (empty when missing)
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CabApprovalCheck(
    String approvalId,
    boolean approved,
    CabApprovalStatus status,
    Instant expiry,
    List<String> conditions
) {

    public CabApprovalCheck {
        conditions = conditions != null ? List.copyOf(conditions) : List.of();
    }

    public static CabApprovalCheck missing(String approvalId) {
        return new CabApprovalCheck(approvalId, false, CabApprovalStatus.MISSING, null, List.of());
    }
}
