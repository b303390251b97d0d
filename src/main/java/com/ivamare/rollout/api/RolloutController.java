package com.ivamare.rollout.api;

import com.ivamare.rollout.api.dto.CabDecisionRequest;
import com.ivamare.rollout.api.dto.EvidenceValidationRequest;
import com.ivamare.rollout.api.dto.PromotionRequest;
import com.ivamare.rollout.api.dto.RiskScoreRequest;
import com.ivamare.rollout.api.dto.RollbackRequest;
import com.ivamare.rollout.api.dto.SubmitDeploymentRequest;
import com.ivamare.rollout.audit.AuditExportFormat;
import com.ivamare.rollout.connector.ConnectorHealth;
import com.ivamare.rollout.exception.PolicyViolationException;
import com.ivamare.rollout.model.AuditEvent;
import com.ivamare.rollout.model.ConnectorOperationResult;
import com.ivamare.rollout.model.CorrelationId;
import com.ivamare.rollout.model.ValidationResult;
import com.ivamare.rollout.promotion.PromotionDecision;
import com.ivamare.rollout.risk.RiskAssessment;
import com.ivamare.rollout.rollback.RollbackReport;
import com.ivamare.rollout.scope.CabApproval;
import com.ivamare.rollout.scope.CabApprovalCheck;
import com.ivamare.rollout.service.DeploymentOutcome;
import com.ivamare.rollout.service.DeploymentStatusView;
import com.ivamare.rollout.service.RolloutService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * REST surface of the control plane. Requests are normalized by
 * {@link RequestNormalizer}; everything else is delegated to {@link RolloutService}.
 */
@RestController
@RequestMapping(RolloutController.BASE_PATH)
public class RolloutController {

    public static final String BASE_PATH = "/api/v1";

    private final RolloutService rolloutService;
    private final RequestNormalizer normalizer;

    public RolloutController(RolloutService rolloutService, RequestNormalizer normalizer) {
        this.rolloutService = rolloutService;
        this.normalizer = normalizer;
    }

    @PostMapping("/deployments")
    public ResponseEntity<DeploymentOutcome> submit(
            @RequestBody SubmitDeploymentRequest request,
            @RequestAttribute(BearerTokenInterceptor.ACTOR_ATTRIBUTE) String actor) {
        DeploymentOutcome outcome = rolloutService.submit(normalizer.toIntent(request), actor);
        return switch (outcome.status()) {
            case BLOCKED -> throw new PolicyViolationException(outcome.correlationId(), outcome.violations());
            case DISPATCHED, PARTIAL, IN_PROGRESS -> ResponseEntity.status(HttpStatus.ACCEPTED).body(outcome);
            case FAILED -> ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(outcome);
            case CANCELLED -> ResponseEntity.status(HttpStatus.CONFLICT).body(outcome);
        };
    }

    @GetMapping("/deployments/{deploymentId}/status")
    public DeploymentStatusView status(@PathVariable String deploymentId,
                                       @RequestParam(required = false) String connector) {
        return rolloutService.status(normalizer.deploymentId(deploymentId), connector);
    }

    @PostMapping("/deployments/{deploymentId}/promotions")
    public PromotionDecision promote(@PathVariable String deploymentId,
                                     @RequestBody PromotionRequest request,
                                     @RequestAttribute(BearerTokenInterceptor.ACTOR_ATTRIBUTE) String actor) {
        return rolloutService.promote(normalizer.deploymentId(deploymentId), normalizer.toTelemetry(request), actor);
    }

    @PostMapping("/deployments/{deploymentId}/rollbacks")
    public RollbackReport rollback(@PathVariable String deploymentId,
                                   @RequestBody(required = false) RollbackRequest request,
                                   @RequestAttribute(BearerTokenInterceptor.ACTOR_ATTRIBUTE) String actor) {
        return rolloutService.rollback(
            normalizer.deploymentId(deploymentId),
            normalizer.rollbackId(request),
            normalizer.toStrategy(request),
            request != null && request.targetDevices() != null ? request.targetDevices() : List.of(),
            actor);
    }

    @PostMapping("/deployments/{deploymentId}/cancel")
    public Map<String, Object> cancel(@PathVariable String deploymentId) {
        CorrelationId id = normalizer.deploymentId(deploymentId);
        return Map.of("correlation_id", id.value(), "cancelled", rolloutService.cancel(id));
    }

    @DeleteMapping("/connectors/{connector}/resources/{resourceId}")
    public ConnectorOperationResult remove(@PathVariable String connector,
                                           @PathVariable String resourceId,
                                           @RequestParam(name = "correlation_id", required = false) String correlationId,
                                           @RequestAttribute(BearerTokenInterceptor.ACTOR_ATTRIBUTE) String actor) {
        return rolloutService.remove(connector, resourceId, normalizer.removalCorrelationId(correlationId), actor);
    }

    @GetMapping("/connectors/health")
    public Map<String, ConnectorHealth> connectorHealth() {
        return rolloutService.connectorHealth();
    }

    @PostMapping("/cab-approvals")
    @ResponseStatus(HttpStatus.CREATED)
    public CabApproval recordCabDecision(@RequestBody CabDecisionRequest request,
                                         @RequestAttribute(BearerTokenInterceptor.ACTOR_ATTRIBUTE) String actor) {
        return rolloutService.approve(request.approvalId(), normalizer.toDecision(request),
            normalizer.validDays(request), request.conditions(), normalizer.cabCorrelationId(request), actor);
    }

    @GetMapping("/cab-approvals/{approvalId}")
    public CabApprovalCheck checkApproval(@PathVariable String approvalId) {
        return rolloutService.checkApproval(approvalId);
    }

    @PostMapping("/risk-score")
    public RiskAssessment riskScore(@RequestBody RiskScoreRequest request) {
        if (request.intent() != null) {
            return rolloutService.riskScore(normalizer.toIntent(request.intent()));
        }
        if (request.factors() == null) {
            throw new IllegalArgumentException("factors or intent is required");
        }
        return rolloutService.riskScore(request.factors());
    }

    @PostMapping("/evidence/validate")
    public ValidationResult validateEvidence(@RequestBody EvidenceValidationRequest request) {
        return rolloutService.validateEvidence(request.evidencePack(), request.requiredFields());
    }

    @GetMapping("/audit/{correlationId}")
    public List<AuditEvent> auditTrail(@PathVariable String correlationId) {
        return rolloutService.auditTrail(CorrelationId.parse(correlationId));
    }

    @GetMapping("/audit/export")
    public ResponseEntity<String> exportAudit(@RequestParam Instant from,
                                              @RequestParam Instant to,
                                              @RequestParam(required = false) String format) {
        AuditExportFormat exportFormat = AuditExportFormat.fromValue(format);
        return ResponseEntity.ok()
            .contentType(MediaType.parseMediaType(exportFormat.contentType()))
            .body(rolloutService.exportAudit(from, to, exportFormat));
    }
}
