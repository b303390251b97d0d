package com.ivamare.rollout.repository;

import com.ivamare.rollout.scope.CabApproval;

import java.util.Optional;

/**
 * Repository for CAB approval records.
 */
public interface CabApprovalRepository {

    /**
     * Find an approval by ID.
     *
     * @param approvalId The approval ID
     * @return The approval if present
     */
    Optional<CabApproval> findById(String approvalId);

    /**
     * Store an approval decision, replacing any earlier decision with the same ID.
     *
     * @param approval The approval
     */
    void save(CabApproval approval);
}
