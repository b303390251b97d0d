package com.ivamare.rollout.repository.impl;

import com.ivamare.rollout.scope.CabApproval;
import com.ivamare.rollout.scope.CabApprovalStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryCabApprovalRepositoryTest {

    @Test
    void shouldReplaceEarlierDecision() {
        InMemoryCabApprovalRepository repository = new InMemoryCabApprovalRepository();
        Instant now = Instant.now();
        repository.save(new CabApproval("CAB-1", CabApprovalStatus.PENDING, now.plusSeconds(60),
            List.of(), "a", now, null));
        repository.save(new CabApproval("CAB-1", CabApprovalStatus.APPROVED, now.plusSeconds(60),
            List.of(), "b", now, null));

        assertEquals(CabApprovalStatus.APPROVED, repository.findById("CAB-1").orElseThrow().status());
        assertTrue(repository.findById("CAB-2").isEmpty());
    }
}
