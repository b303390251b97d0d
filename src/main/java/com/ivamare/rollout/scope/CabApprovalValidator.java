package com.ivamare.rollout.scope;

import com.ivamare.rollout.repository.CabApprovalRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Checks whether a CAB approval is currently usable:
 * {@code approved = status == approved && now < expiry}.
 */
public class CabApprovalValidator {

    private final CabApprovalRepository repository;
    private final Clock clock;

    public CabApprovalValidator(CabApprovalRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Look up and check an approval.
     *
     * @param approvalId Approval ID (nullable)
     * @return The check; status MISSING if there is no such record
     */
    public CabApprovalCheck check(String approvalId) {
        if (approvalId == null || approvalId.isBlank()) {
            return CabApprovalCheck.missing(approvalId);
        }
        Optional<CabApproval> found = repository.findById(approvalId);
        if (found.isEmpty()) {
            return CabApprovalCheck.missing(approvalId);
        }
        CabApproval approval = found.get();
        Instant now = clock.instant();
        return new CabApprovalCheck(
            approvalId,
            approval.isUsableAt(now),
            approval.status(),
            approval.expiry(),
            approval.conditions()
        );
    }

    public boolean isApproved(String approvalId) {
        return check(approvalId).approved();
    }
}
