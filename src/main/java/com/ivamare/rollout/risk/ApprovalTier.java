package com.ivamare.rollout.risk;

/**
 * Approval path implied by a risk score.
 */
public enum ApprovalTier {
    /** Low risk, no manual review */
    AUTO_APPROVED,
    /** Needs a CAB review */
    MANUAL_REVIEW,
    /** Above the review ceiling; needs a documented exception */
    EXCEPTION_REQUIRED;

    /**
     * @param score Risk score in [0, 100]
     * @param autoApproveMax Highest score that is auto-approved
     * @param manualReviewMax Highest score that can go through manual review
     */
    public static ApprovalTier forScore(double score, double autoApproveMax, double manualReviewMax) {
        if (score <= autoApproveMax) {
            return AUTO_APPROVED;
        }
        if (score <= manualReviewMax) {
            return MANUAL_REVIEW;
        }
        return EXCEPTION_REQUIRED;
    }
}
