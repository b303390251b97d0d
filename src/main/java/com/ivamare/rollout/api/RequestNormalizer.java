package com.ivamare.rollout.api;

import com.ivamare.rollout.api.dto.CabDecisionRequest;
import com.ivamare.rollout.api.dto.PromotionRequest;
import com.ivamare.rollout.api.dto.RollbackRequest;
import com.ivamare.rollout.api.dto.SubmitDeploymentRequest;
import com.ivamare.rollout.model.CorrelationId;
import com.ivamare.rollout.model.CorrelationIdType;
import com.ivamare.rollout.model.DeploymentAction;
import com.ivamare.rollout.model.DeploymentIntent;
import com.ivamare.rollout.model.Ring;
import com.ivamare.rollout.model.RollbackPlan;
import com.ivamare.rollout.model.TargetScope;
import com.ivamare.rollout.promotion.Telemetry;
import com.ivamare.rollout.rollback.RollbackStrategy;
import com.ivamare.rollout.scope.CabApprovalStatus;

import java.util.List;
import java.util.Locale;

/**
 * Turns loosely typed wire requests into domain values. Enum names are
 * accepted in any case with {@code -} or {@code _} separators; correlation
 * IDs are validated or generated here so nothing downstream sees a raw string.
 */
public class RequestNormalizer {

    static final int DEFAULT_APPROVAL_DAYS = 30;

    public DeploymentIntent toIntent(SubmitDeploymentRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request body is required");
        }
        CorrelationId correlationId = request.correlationId() == null || request.correlationId().isBlank()
            ? CorrelationId.generate(CorrelationIdType.DEPLOYMENT)
            : CorrelationId.parse(request.correlationId(), CorrelationIdType.DEPLOYMENT);

        return new DeploymentIntent(
            correlationId,
            required(request.appId(), "app_id"),
            required(request.version(), "version"),
            ring(required(request.targetRing(), "target_ring")),
            scope(request.targetScope()),
            request.publisherId(),
            request.connectors(),
            request.targetDevices(),
            request.riskFactors(),
            rollbackPlan(request.rollbackPlan()),
            blankToNull(request.cabApprovalId()),
            request.evidencePack(),
            request.action() != null ? enumValue(DeploymentAction.class, request.action(), "action") : null,
            Boolean.TRUE.equals(request.requiresElevation()),
            request.complianceTags() != null
                ? request.complianceTags().stream().map(t -> t.trim().toLowerCase(Locale.ROOT)).toList()
                : List.of()
        );
    }

    public Telemetry toTelemetry(PromotionRequest request) {
        if (request == null || request.successRate() == null) {
            throw new IllegalArgumentException("success_rate is required");
        }
        double successRate = request.successRate();
        if (successRate < 0.0 || successRate > 1.0) {
            throw new IllegalArgumentException("success_rate must be in [0, 1], was " + successRate);
        }
        return new Telemetry(
            successRate,
            request.timeToComplianceHours() != null ? request.timeToComplianceHours() : 0.0,
            request.incidentCount() != null ? request.incidentCount() : 0
        );
    }

    public RollbackStrategy toStrategy(RollbackRequest request) {
        if (request == null || request.strategy() == null) {
            return RollbackStrategy.VERSION_PIN;
        }
        return enumValue(RollbackStrategy.class, request.strategy(), "strategy");
    }

    public CorrelationId rollbackId(RollbackRequest request) {
        if (request == null || request.rollbackId() == null || request.rollbackId().isBlank()) {
            return null;
        }
        return CorrelationId.parse(request.rollbackId(), CorrelationIdType.ROLLBACK);
    }

    public CabApprovalStatus toDecision(CabDecisionRequest request) {
        return enumValue(CabApprovalStatus.class, required(request.decision(), "decision"), "decision");
    }

    public int validDays(CabDecisionRequest request) {
        return request.validDays() != null ? request.validDays() : DEFAULT_APPROVAL_DAYS;
    }

    public CorrelationId cabCorrelationId(CabDecisionRequest request) {
        if (request.correlationId() == null || request.correlationId().isBlank()) {
            return null;
        }
        return CorrelationId.parse(request.correlationId(), CorrelationIdType.CAB);
    }

    /**
     * Correlation ID of a resource removal; generated when the caller supplies none.
     */
    public CorrelationId removalCorrelationId(String value) {
        if (value == null || value.isBlank()) {
            return CorrelationId.generate(CorrelationIdType.DEPLOYMENT);
        }
        return CorrelationId.parse(value.trim());
    }

    public CorrelationId deploymentId(String value) {
        return CorrelationId.parse(value, CorrelationIdType.DEPLOYMENT);
    }

    public Ring ring(String value) {
        return enumValue(Ring.class, value, "ring");
    }

    private static TargetScope scope(SubmitDeploymentRequest.ScopeDto dto) {
        if (dto == null) {
            return null;
        }
        return new TargetScope(dimension(dto.orgUnit()), dimension(dto.businessUnit()), dimension(dto.site()));
    }

    private static RollbackPlan rollbackPlan(SubmitDeploymentRequest.RollbackPlanDto dto) {
        if (dto == null) {
            return null;
        }
        return new RollbackPlan(Boolean.TRUE.equals(dto.validated()), blankToNull(dto.previousVersion()),
            blankToNull(dto.uninstallCommand()), blankToNull(dto.detectionRule()),
            blankToNull(dto.remediationScript()));
    }

    private static String dimension(String value) {
        return TargetScope.isAny(value) ? TargetScope.ANY : value.trim();
    }

    static <E extends Enum<E>> E enumValue(Class<E> type, String value, String field) {
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return Enum.valueOf(type, normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown " + field + ": " + value, e);
        }
    }

    private static String required(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value.trim();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
