package com.ivamare.rollout.repository.impl;

import com.ivamare.rollout.exception.RolloutException;
import com.ivamare.rollout.model.AuditEvent;
import com.ivamare.rollout.model.AuditEventType;
import com.ivamare.rollout.model.CorrelationId;
import com.ivamare.rollout.model.CorrelationIdType;
import com.ivamare.rollout.model.OperationKey;
import com.ivamare.rollout.model.OperationType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JdbcAuditRepositoryTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    private JdbcAuditRepository repository;
    private final CorrelationId id = CorrelationId.generate(CorrelationIdType.DEPLOYMENT);

    @BeforeEach
    void setUp() {
        repository = new JdbcAuditRepository(jdbcTemplate, new ObjectMapper());
    }

    @Nested
    class RegisterTests {

        @Test
        void shouldReturnTrueWhenKeyInserted() {
            when(jdbcTemplate.update(contains("INSERT INTO rollout.idempotency_key"), eq(id.value()),
                eq("PUBLISH:LAB:intune"))).thenReturn(1);

            assertTrue(repository.register(id, OperationKey.of(OperationType.PUBLISH, "LAB", "intune")));
        }

        @Test
        void shouldReturnFalseOnConflict() {
            when(jdbcTemplate.update(contains("ON CONFLICT DO NOTHING"), eq(id.value()), eq("SUBMIT:LAB")))
                .thenReturn(0);

            assertFalse(repository.register(id, OperationKey.of(OperationType.SUBMIT, "LAB")));
        }
    }

    @Nested
    class AppendTests {

        @Test
        @SuppressWarnings("unchecked")
        void shouldInsertPayloadAsJson() {
            AuditEvent stored = new AuditEvent(7, id.value(), AuditEventType.RISK_ASSESSED, "alice",
                Instant.now(), Map.of("score", 42.0));
            when(jdbcTemplate.queryForObject(contains("INSERT INTO rollout.audit_event"), any(RowMapper.class),
                eq(id.value()), eq(AuditEventType.RISK_ASSESSED), eq("alice"), contains("\"score\":42.0")))
                .thenReturn(stored);

            AuditEvent result = repository.append(id, AuditEventType.RISK_ASSESSED, "alice", Map.of("score", 42.0));

            assertSame(stored, result);
        }

        @Test
        @SuppressWarnings("unchecked")
        void shouldStoreEmptyObjectForNullPayload() {
            AuditEvent stored = new AuditEvent(1, id.value(), AuditEventType.DEPLOYMENT_SUBMITTED, "bob",
                Instant.now(), Map.of());
            when(jdbcTemplate.queryForObject(anyString(), any(RowMapper.class),
                eq(id.value()), eq(AuditEventType.DEPLOYMENT_SUBMITTED), eq("bob"), eq("{}")))
                .thenReturn(stored);

            assertSame(stored, repository.append(id, AuditEventType.DEPLOYMENT_SUBMITTED, "bob", null));
        }

        @Test
        @SuppressWarnings("unchecked")
        void shouldFailWhenNoRowReturned() {
            when(jdbcTemplate.queryForObject(anyString(), any(RowMapper.class), any(), any(), any(), any()))
                .thenReturn(null);

            assertThrows(RolloutException.class,
                () -> repository.append(id, AuditEventType.DEPLOYMENT_SUBMITTED, "bob", Map.of()));
        }
    }

    @Nested
    class QueryTests {

        @Test
        @SuppressWarnings("unchecked")
        void shouldQueryEventsInAppendOrder() {
            when(jdbcTemplate.query(contains("ORDER BY audit_id ASC"), any(RowMapper.class), eq(id.value())))
                .thenReturn(List.of());

            assertTrue(repository.getEvents(id).isEmpty());
            verify(jdbcTemplate).query(contains("WHERE correlation_id = ?"), any(RowMapper.class), eq(id.value()));
        }

        @Test
        @SuppressWarnings("unchecked")
        void shouldQueryHalfOpenTimeRange() {
            Instant from = Instant.parse("2026-01-01T00:00:00Z");
            Instant to = Instant.parse("2026-02-01T00:00:00Z");
            when(jdbcTemplate.query(contains("ts >= ? AND ts < ?"), any(RowMapper.class),
                eq(Timestamp.from(from)), eq(Timestamp.from(to)))).thenReturn(List.of());

            assertTrue(repository.getEventsBetween(from, to).isEmpty());
        }

        @Test
        void shouldCountEvents() {
            when(jdbcTemplate.queryForObject(contains("COUNT(*)"), eq(Long.class))).thenReturn(12L);

            assertEquals(12L, repository.countEvents());
        }
    }
}
