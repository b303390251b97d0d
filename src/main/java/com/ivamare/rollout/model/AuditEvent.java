package com.ivamare.rollout.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.Map;

/**
 * One immutable line of the audit log.
 *
 * @param auditId Store-assigned sequence number
 * @param correlationId Correlation ID the event belongs to
 * @param eventType Type of event (see {@link AuditEventType})
 * @param actor User or system that caused the event
 * @param timestamp When the event occurred
 * @param payload Event details (never null, may be empty)
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AuditEvent(
    long auditId,
    String correlationId,
    String eventType,
    String actor,
    Instant timestamp,
    Map<String, Object> payload
) {

    public AuditEvent {
        payload = payload != null ? payload : Map.of();
    }
}
