package com.ivamare.rollout.repository.impl;

import com.ivamare.rollout.model.AuditEvent;
import com.ivamare.rollout.model.CorrelationId;
import com.ivamare.rollout.model.OperationKey;
import com.ivamare.rollout.repository.AuditRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory AuditRepository for single-process deployments and tests.
 *
 * <p>Registration uses {@link ConcurrentHashMap#putIfAbsent}, which gives the
 * same first-writer-wins guarantee as the database primary key.
 */
public class InMemoryAuditRepository implements AuditRepository {

    private final Map<String, Boolean> registeredKeys = new ConcurrentHashMap<>();
    private final List<AuditEvent> events = new ArrayList<>();
    private final Clock clock;
    private long nextId = 1;

    public InMemoryAuditRepository() {
        this(Clock.systemUTC());
    }

    public InMemoryAuditRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean register(CorrelationId correlationId, OperationKey operationKey) {
        String key = correlationId.value() + "|" + operationKey.value();
        return registeredKeys.putIfAbsent(key, Boolean.TRUE) == null;
    }

    @Override
    public synchronized AuditEvent append(CorrelationId correlationId, String eventType, String actor,
                                          Map<String, Object> payload) {
        Map<String, Object> copy = payload != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(payload))
            : Map.of();
        AuditEvent event = new AuditEvent(nextId++, correlationId.value(), eventType, actor, clock.instant(), copy);
        events.add(event);
        return event;
    }

    @Override
    public synchronized List<AuditEvent> getEvents(CorrelationId correlationId) {
        String id = correlationId.value();
        return events.stream()
            .filter(e -> e.correlationId().equals(id))
            .toList();
    }

    @Override
    public synchronized List<AuditEvent> getEventsBetween(Instant from, Instant to) {
        return events.stream()
            .filter(e -> !e.timestamp().isBefore(from) && e.timestamp().isBefore(to))
            .toList();
    }

    @Override
    public synchronized long countEvents() {
        return events.size();
    }
}
