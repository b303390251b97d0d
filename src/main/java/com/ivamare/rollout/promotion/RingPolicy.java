package com.ivamare.rollout.promotion;

import com.ivamare.rollout.model.Ring;

import java.util.Objects;

/**
 * Promotion thresholds for leaving one ring.
 *
 * @param ring The ring
 * @param successRateThreshold Minimum install success rate in [0, 1]
 * @param timeToComplianceHours Maximum hours for devices to reach compliance
 * @param maxIncidents Maximum incidents allowed
 * @param cabApprovalRequired Whether this ring can require CAB approval
 * @param cabApprovalRequiredIfRiskGt Risk score above which CAB approval is required (nullable: always)
 * @param rollbackValidationRequired Whether the rollback plan must be validated to leave this ring
 */
public record RingPolicy(
    Ring ring,
    double successRateThreshold,
    double timeToComplianceHours,
    int maxIncidents,
    boolean cabApprovalRequired,
    Double cabApprovalRequiredIfRiskGt,
    boolean rollbackValidationRequired
) {

    public RingPolicy {
        Objects.requireNonNull(ring, "ring");
        if (successRateThreshold < 0 || successRateThreshold > 1) {
            throw new IllegalArgumentException("successRateThreshold must be within [0, 1]");
        }
        if (timeToComplianceHours < 0 || maxIncidents < 0) {
            throw new IllegalArgumentException("thresholds must not be negative");
        }
    }

    /**
     * Whether CAB approval is needed for a given risk score.
     */
    public boolean requiresCab(double riskScore) {
        if (!cabApprovalRequired) {
            return false;
        }
        return cabApprovalRequiredIfRiskGt == null || riskScore > cabApprovalRequiredIfRiskGt;
    }
}
