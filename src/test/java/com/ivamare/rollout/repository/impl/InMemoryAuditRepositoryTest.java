package com.ivamare.rollout.repository.impl;

import com.ivamare.rollout.model.AuditEvent;
import com.ivamare.rollout.model.AuditEventType;
import com.ivamare.rollout.model.CorrelationId;
import com.ivamare.rollout.model.CorrelationIdType;
import com.ivamare.rollout.model.OperationKey;
import com.ivamare.rollout.model.OperationType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryAuditRepository")
class InMemoryAuditRepositoryTest {

    private final CorrelationId id = CorrelationId.generate(CorrelationIdType.DEPLOYMENT);

    @Test
    @DisplayName("should register a key exactly once under concurrent submissions")
    void shouldRegisterOnceUnderConcurrency() throws Exception {
        InMemoryAuditRepository repository = new InMemoryAuditRepository();
        OperationKey key = OperationKey.of(OperationType.PUBLISH, "LAB", "intune");
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Callable<Boolean> task = () -> {
                    start.await();
                    return repository.register(id, key);
                };
                results.add(pool.submit(task));
            }
            start.countDown();

            int newCount = 0;
            for (Future<Boolean> result : results) {
                if (result.get()) {
                    newCount++;
                }
            }
            assertEquals(1, newCount);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("should keep distinct operations of one correlation ID apart")
    void shouldKeepDistinctOperationsApart() {
        InMemoryAuditRepository repository = new InMemoryAuditRepository();

        assertTrue(repository.register(id, OperationKey.of(OperationType.PUBLISH, "LAB", "intune")));
        assertTrue(repository.register(id, OperationKey.of(OperationType.PUBLISH, "CANARY", "intune")));
        assertFalse(repository.register(id, OperationKey.of(OperationType.PUBLISH, "LAB", "intune")));
    }

    @Test
    @DisplayName("should return events in append order with sequential IDs")
    void shouldReturnEventsInAppendOrder() {
        InMemoryAuditRepository repository = new InMemoryAuditRepository();
        CorrelationId other = CorrelationId.generate(CorrelationIdType.CAB);

        repository.append(id, AuditEventType.DEPLOYMENT_SUBMITTED, "alice", Map.of());
        repository.append(other, AuditEventType.CAB_DECISION_RECORDED, "bob", Map.of());
        repository.append(id, AuditEventType.RISK_ASSESSED, "alice", Map.of("score", 10.0));

        List<AuditEvent> events = repository.getEvents(id);
        assertEquals(2, events.size());
        assertEquals(AuditEventType.DEPLOYMENT_SUBMITTED, events.get(0).eventType());
        assertEquals(AuditEventType.RISK_ASSESSED, events.get(1).eventType());
        assertTrue(events.get(0).auditId() < events.get(1).auditId());
        assertEquals(3, repository.countEvents());
    }

    @Test
    @DisplayName("should not be affected by later payload mutation")
    void shouldCopyPayload() {
        InMemoryAuditRepository repository = new InMemoryAuditRepository();
        Map<String, Object> payload = new HashMap<>();
        payload.put("ring", "LAB");

        repository.append(id, AuditEventType.DEPLOYMENT_DISPATCHED, "alice", payload);
        payload.put("ring", "GLOBAL");

        assertEquals("LAB", repository.getEvents(id).get(0).payload().get("ring"));
        assertThrows(UnsupportedOperationException.class,
            () -> repository.getEvents(id).get(0).payload().put("x", 1));
    }

    @Test
    @DisplayName("should filter by half-open time range")
    void shouldFilterByTimeRange() {
        Instant at = Instant.parse("2026-03-01T10:00:00Z");
        InMemoryAuditRepository repository = new InMemoryAuditRepository(Clock.fixed(at, ZoneOffset.UTC));
        repository.append(id, AuditEventType.DEPLOYMENT_SUBMITTED, "alice", Map.of());

        assertEquals(1, repository.getEventsBetween(at, at.plusSeconds(1)).size());
        assertEquals(0, repository.getEventsBetween(at.minusSeconds(10), at).size());
    }
}
