package com.ivamare.rollout.repository.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.rollout.exception.RolloutException;
import com.ivamare.rollout.model.AuditEvent;
import com.ivamare.rollout.model.CorrelationId;
import com.ivamare.rollout.model.OperationKey;
import com.ivamare.rollout.repository.AuditRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * JDBC implementation of AuditRepository (PostgreSQL).
 *
 * <p>Registration relies on the primary key of {@code rollout.idempotency_key}:
 * {@code ON CONFLICT DO NOTHING} makes the insert an atomic check-and-set and
 * the affected row count tells the caller whether it won.
 */
public class JdbcAuditRepository implements AuditRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcAuditRepository.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private static final String SELECT_EVENTS =
        "SELECT audit_id, correlation_id, event_type, actor, ts, payload FROM rollout.audit_event";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<AuditEvent> eventMapper;

    public JdbcAuditRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.eventMapper = (rs, rowNum) -> new AuditEvent(
            rs.getLong("audit_id"),
            rs.getString("correlation_id"),
            rs.getString("event_type"),
            rs.getString("actor"),
            rs.getTimestamp("ts").toInstant(),
            deserializePayload(rs.getString("payload"))
        );
    }

    @Override
    public boolean register(CorrelationId correlationId, OperationKey operationKey) {
        int inserted = jdbcTemplate.update(
            "INSERT INTO rollout.idempotency_key (correlation_id, operation_key) VALUES (?, ?) "
                + "ON CONFLICT DO NOTHING",
            correlationId.value(), operationKey.value()
        );
        if (inserted == 0) {
            log.debug("Operation {} already registered for {}", operationKey, correlationId);
        }
        return inserted == 1;
    }

    @Override
    public AuditEvent append(CorrelationId correlationId, String eventType, String actor,
                             Map<String, Object> payload) {
        String payloadJson = serializePayload(payload);
        AuditEvent stored = jdbcTemplate.queryForObject(
            "INSERT INTO rollout.audit_event (correlation_id, event_type, actor, payload) "
                + "VALUES (?, ?, ?, ?::jsonb) "
                + "RETURNING audit_id, correlation_id, event_type, actor, ts, payload",
            eventMapper,
            correlationId.value(), eventType, actor, payloadJson
        );
        if (stored == null) {
            throw new RolloutException("Audit insert returned no row for " + correlationId);
        }
        return stored;
    }

    @Override
    public List<AuditEvent> getEvents(CorrelationId correlationId) {
        return jdbcTemplate.query(
            SELECT_EVENTS + " WHERE correlation_id = ? ORDER BY audit_id ASC",
            eventMapper,
            correlationId.value()
        );
    }

    @Override
    public List<AuditEvent> getEventsBetween(Instant from, Instant to) {
        return jdbcTemplate.query(
            SELECT_EVENTS + " WHERE ts >= ? AND ts < ? ORDER BY audit_id ASC",
            eventMapper,
            Timestamp.from(from), Timestamp.from(to)
        );
    }

    @Override
    public long countEvents() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM rollout.audit_event", Long.class);
        return count != null ? count : 0L;
    }

    private String serializePayload(Map<String, Object> payload) {
        if (payload == null || payload.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new RolloutException("Failed to serialize audit payload", e);
        }
    }

    private Map<String, Object> deserializePayload(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new RolloutException("Failed to parse audit payload", e);
        }
    }
}
