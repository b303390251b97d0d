package com.ivamare.rollout.repository.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.rollout.exception.RolloutException;
import com.ivamare.rollout.model.CorrelationId;
import com.ivamare.rollout.repository.CabApprovalRepository;
import com.ivamare.rollout.scope.CabApproval;
import com.ivamare.rollout.scope.CabApprovalStatus;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of CabApprovalRepository.
 */
public class JdbcCabApprovalRepository implements CabApprovalRepository {

    private static final TypeReference<List<String>> LIST_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<CabApproval> approvalMapper;

    public JdbcCabApprovalRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.approvalMapper = (rs, rowNum) -> {
            String correlationId = rs.getString("correlation_id");
            return new CabApproval(
                rs.getString("approval_id"),
                CabApprovalStatus.fromValue(rs.getString("status")),
                rs.getTimestamp("expiry").toInstant(),
                deserializeConditions(rs.getString("conditions")),
                rs.getString("approver"),
                rs.getTimestamp("decided_at").toInstant(),
                correlationId != null ? CorrelationId.parse(correlationId) : null
            );
        };
    }

    @Override
    public Optional<CabApproval> findById(String approvalId) {
        List<CabApproval> results = jdbcTemplate.query(
            "SELECT approval_id, status, expiry, conditions, approver, decided_at, correlation_id "
                + "FROM rollout.cab_approval WHERE approval_id = ?",
            approvalMapper,
            approvalId
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public void save(CabApproval approval) {
        jdbcTemplate.update(
            "INSERT INTO rollout.cab_approval "
                + "(approval_id, status, expiry, conditions, approver, decided_at, correlation_id) "
                + "VALUES (?, ?, ?, ?::jsonb, ?, ?, ?) "
                + "ON CONFLICT (approval_id) DO UPDATE SET status = EXCLUDED.status, "
                + "expiry = EXCLUDED.expiry, conditions = EXCLUDED.conditions, "
                + "approver = EXCLUDED.approver, decided_at = EXCLUDED.decided_at, "
                + "correlation_id = EXCLUDED.correlation_id",
            approval.approvalId(),
            approval.status().value(),
            Timestamp.from(approval.expiry()),
            serializeConditions(approval.conditions()),
            approval.approver(),
            Timestamp.from(approval.decidedAt()),
            approval.correlationId() != null ? approval.correlationId().value() : null
        );
    }

    private String serializeConditions(List<String> conditions) {
        try {
            return objectMapper.writeValueAsString(conditions);
        } catch (JsonProcessingException e) {
            throw new RolloutException("Failed to serialize CAB conditions", e);
        }
    }

    private List<String> deserializeConditions(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, LIST_TYPE);
        } catch (JsonProcessingException e) {
            throw new RolloutException("Failed to parse CAB conditions", e);
        }
    }
}
