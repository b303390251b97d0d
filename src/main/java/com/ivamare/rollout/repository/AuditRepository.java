package com.ivamare.rollout.repository;

import com.ivamare.rollout.model.AuditEvent;
import com.ivamare.rollout.model.CorrelationId;
import com.ivamare.rollout.model.OperationKey;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Idempotency and audit store. The single source of truth for whether an
 * operation has already happened; connectors keep no duplicate-suppression
 * state of their own.
 *
 * <p>Events are append-only: nothing updates or deletes them.
 */
public interface AuditRepository {

    /**
     * Atomically register an operation.
     *
     * <p>Of any number of concurrent callers using the same correlation ID and
     * operation key, exactly one observes {@code true}.
     *
     * @param correlationId The correlation ID
     * @param operationKey The operation within that correlation ID
     * @return true if this call registered the key, false if it was already registered
     */
    boolean register(CorrelationId correlationId, OperationKey operationKey);

    /**
     * Append an event.
     *
     * @param correlationId The correlation ID
     * @param eventType The event type
     * @param actor User or system causing the event
     * @param payload Event details (nullable)
     * @return The stored event with its assigned ID and timestamp
     */
    AuditEvent append(CorrelationId correlationId, String eventType, String actor, Map<String, Object> payload);

    /**
     * Get all events of a correlation ID.
     *
     * @param correlationId The correlation ID
     * @return Events in append order
     */
    List<AuditEvent> getEvents(CorrelationId correlationId);

    /**
     * Get all events in a time range.
     *
     * @param from Inclusive lower bound
     * @param to Exclusive upper bound
     * @return Events in append order
     */
    List<AuditEvent> getEventsBetween(Instant from, Instant to);

    /**
     * Find the most recent event of a type for a correlation ID.
     *
     * @param correlationId The correlation ID
     * @param eventType The event type
     * @return The latest such event, if any
     */
    default Optional<AuditEvent> findLatest(CorrelationId correlationId, String eventType) {
        List<AuditEvent> events = getEvents(correlationId);
        for (int i = events.size() - 1; i >= 0; i--) {
            if (events.get(i).eventType().equals(eventType)) {
                return Optional.of(events.get(i));
            }
        }
        return Optional.empty();
    }

    /**
     * Count stored events. Used by health checks.
     *
     * @return Number of events
     */
    long countEvents();
}
