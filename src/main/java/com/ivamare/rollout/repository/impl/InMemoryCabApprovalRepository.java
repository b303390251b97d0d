package com.ivamare.rollout.repository.impl;

import com.ivamare.rollout.repository.CabApprovalRepository;
import com.ivamare.rollout.scope.CabApproval;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory CabApprovalRepository.
 */
public class InMemoryCabApprovalRepository implements CabApprovalRepository {

    private final Map<String, CabApproval> approvals = new ConcurrentHashMap<>();

    @Override
    public Optional<CabApproval> findById(String approvalId) {
        return Optional.ofNullable(approvals.get(approvalId));
    }

    @Override
    public void save(CabApproval approval) {
        approvals.put(approval.approvalId(), approval);
    }
}
