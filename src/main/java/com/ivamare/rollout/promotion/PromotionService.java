package com.ivamare.rollout.promotion;

import com.ivamare.rollout.connector.ConnectorDispatcher;
import com.ivamare.rollout.evidence.EvidencePackValidator;
import com.ivamare.rollout.exception.InvalidOperationException;
import com.ivamare.rollout.governance.GovernanceNotifier;
import com.ivamare.rollout.governance.PolicyViolationEvent;
import com.ivamare.rollout.model.AuditEventType;
import com.ivamare.rollout.model.ConnectorOperationResult;
import com.ivamare.rollout.model.CorrelationId;
import com.ivamare.rollout.model.DeploymentIntent;
import com.ivamare.rollout.model.OperationKey;
import com.ivamare.rollout.model.OperationType;
import com.ivamare.rollout.model.Ring;
import com.ivamare.rollout.model.ValidationResult;
import com.ivamare.rollout.policy.CancellationToken;
import com.ivamare.rollout.repository.AuditRepository;
import com.ivamare.rollout.repository.DeploymentHistory;
import com.ivamare.rollout.risk.RiskAssessment;
import com.ivamare.rollout.risk.RiskFactorExtractor;
import com.ivamare.rollout.risk.RiskScoringEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Drives the ring state machine: evaluates the gates for the current ring
 * and, when they all pass, dispatches the deployment to the next ring.
 *
 * <p>Rings only move forward here. A failing gate leaves the deployment
 * where it is; rolling back is a separate, explicit decision. Leaving the
 * first ring additionally requires a valid evidence pack.
 *
 * <p>Each promotion attempt registers its own key: {@code PROMOTE:<from>:<to>}
 * for the first, {@code PROMOTE:<from>:<to>:attempt-n} after that. An attempt
 * whose dispatch failed is recorded as {@code PROMOTION_FAILED}, so the next
 * call retries instead of being reported as a duplicate.
 */
public class PromotionService {

    private static final Logger log = LoggerFactory.getLogger(PromotionService.class);

    private final DeploymentHistory history;
    private final AuditRepository auditRepository;
    private final PromotionGateEvaluator evaluator;
    private final RiskScoringEngine riskEngine;
    private final RiskFactorExtractor factorExtractor;
    private final EvidencePackValidator evidenceValidator;
    private final ConnectorDispatcher dispatcher;
    private final GovernanceNotifier governanceNotifier;

    public PromotionService(
            DeploymentHistory history,
            AuditRepository auditRepository,
            PromotionGateEvaluator evaluator,
            RiskScoringEngine riskEngine,
            RiskFactorExtractor factorExtractor,
            EvidencePackValidator evidenceValidator,
            ConnectorDispatcher dispatcher,
            GovernanceNotifier governanceNotifier) {
        this.history = history;
        this.auditRepository = auditRepository;
        this.evaluator = evaluator;
        this.riskEngine = riskEngine;
        this.factorExtractor = factorExtractor;
        this.evidenceValidator = evidenceValidator;
        this.dispatcher = dispatcher;
        this.governanceNotifier = governanceNotifier;
    }

    /**
     * Attempt to promote a deployment to its next ring.
     *
     * @param deploymentId Deployment correlation ID
     * @param telemetry Live telemetry of the current ring
     * @param actor Who requested the promotion
     * @param cancellation Prevents advancing when cancelled
     * @return The decision
     * @throws InvalidOperationException if the deployment was never dispatched,
     *         was rolled back, or is already at the last ring
     */
    public PromotionDecision promote(CorrelationId deploymentId, Telemetry telemetry, String actor,
                                     CancellationToken cancellation) {
        DeploymentHistory.DeploymentState state = history.load(deploymentId);
        if (state.rolledBack()) {
            throw new InvalidOperationException("Deployment " + deploymentId + " was rolled back");
        }
        Ring from = state.currentRing();
        if (from == null) {
            throw new InvalidOperationException("Deployment " + deploymentId + " was never dispatched");
        }
        Ring to = evaluator.getConfig().next(from)
            .orElseThrow(() -> new InvalidOperationException(
                "Deployment " + deploymentId + " is already at the last ring " + from));

        DeploymentIntent nextIntent = state.intent().withTargetRing(to);
        RiskAssessment risk = riskEngine.assess(factorExtractor.extract(nextIntent));
        PromotionGateResult gates = evaluator.evaluate(from, telemetry, risk.score(),
            nextIntent.rollbackPlan(), nextIntent.cabApprovalId());

        List<String> violations = List.of();
        if (from == evaluator.getConfig().firstRing()) {
            ValidationResult evidence = evidenceValidator.validate(nextIntent.evidencePack());
            auditRepository.append(deploymentId, AuditEventType.EVIDENCE_VALIDATED, actor, evidencePayload(evidence));
            violations = evidence.errors();
        }

        auditRepository.append(deploymentId, AuditEventType.PROMOTION_EVALUATED, actor,
            evaluationPayload(from, to, risk, gates));

        if (!violations.isEmpty()) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("source", "evidence");
            payload.put("violations", violations);
            auditRepository.append(deploymentId, AuditEventType.POLICY_VIOLATION, actor, payload);
            governanceNotifier.notify(new PolicyViolationEvent(
                deploymentId.value(), "evidence", violations, actor, Instant.now()));
            return new PromotionDecision(deploymentId, from, to, risk, gates, violations,
                false, false, false, List.of());
        }
        if (!gates.allowPromotion()) {
            log.info("Promotion of {} from {} blocked by gates {}", deploymentId, from, gates.gatesFailed());
            return new PromotionDecision(deploymentId, from, to, risk, gates, violations,
                false, false, false, List.of());
        }
        if (cancellation.isCancelled()) {
            log.info("Promotion of {} from {} cancelled before dispatch", deploymentId, from);
            return new PromotionDecision(deploymentId, from, to, risk, gates, violations,
                false, false, true, List.of());
        }

        int attempt = 1;
        OperationKey promoteKey = promoteKey(from, to, attempt);
        while (!auditRepository.register(deploymentId, promoteKey)) {
            if (!attemptFailed(deploymentId, promoteKey)) {
                log.debug("Promotion of {} from {} to {} already in progress", deploymentId, from, to);
                return new PromotionDecision(deploymentId, from, to, risk, gates, violations,
                    false, true, false, List.of());
            }
            promoteKey = promoteKey(from, to, ++attempt);
        }

        List<String> publishQualifiers = attempt == 1 ? List.of() : List.of(attemptQualifier(attempt));
        List<ConnectorOperationResult> results = dispatcher.publish(nextIntent, publishQualifiers, actor, cancellation);
        boolean dispatched = results.stream().allMatch(ConnectorOperationResult::isSuccess);
        if (!dispatched) {
            Map<String, Object> failed = new LinkedHashMap<>();
            failed.put("operation_key", promoteKey.value());
            failed.put("from_ring", from.name());
            failed.put(DeploymentHistory.TO_RING, to.name());
            failed.put("attempt", attempt);
            failed.put("failed_connectors", results.stream()
                .filter(result -> !result.isSuccess())
                .map(ConnectorOperationResult::connector)
                .toList());
            auditRepository.append(deploymentId, AuditEventType.PROMOTION_FAILED, actor, failed);
            log.warn("Promotion attempt {} of {} to {} failed to dispatch on every connector; staying at {}",
                attempt, deploymentId, to, from);
            return new PromotionDecision(deploymentId, from, to, risk, gates, violations,
                false, false, false, results);
        }

        Map<String, Object> advanced = new LinkedHashMap<>();
        advanced.put("from_ring", from.name());
        advanced.put(DeploymentHistory.TO_RING, to.name());
        advanced.put("risk_score", risk.score());
        auditRepository.append(deploymentId, AuditEventType.RING_ADVANCED, actor, advanced);
        log.info("Deployment {} advanced from {} to {}", deploymentId, from, to);
        return new PromotionDecision(deploymentId, from, to, risk, gates, violations,
            true, false, false, results);
    }

    private boolean attemptFailed(CorrelationId deploymentId, OperationKey promoteKey) {
        return auditRepository.getEvents(deploymentId).stream()
            .anyMatch(event -> AuditEventType.PROMOTION_FAILED.equals(event.eventType())
                && promoteKey.value().equals(event.payload().get("operation_key")));
    }

    static OperationKey promoteKey(Ring from, Ring to, int attempt) {
        return attempt == 1
            ? OperationKey.of(OperationType.PROMOTE, from.name(), to.name())
            : OperationKey.of(OperationType.PROMOTE, from.name(), to.name(), attemptQualifier(attempt));
    }

    private static String attemptQualifier(int attempt) {
        return "attempt-" + attempt;
    }

    private static Map<String, Object> evaluationPayload(Ring from, Ring to, RiskAssessment risk,
                                                         PromotionGateResult gates) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("from_ring", from.name());
        payload.put(DeploymentHistory.TO_RING, to.name());
        payload.put("risk_score", risk.score());
        payload.put("risk_model_version", risk.modelVersion());
        payload.put("allow_promotion", gates.allowPromotion());
        payload.put("gates_passed", gates.gatesPassed());
        payload.put("gates_failed", gates.gatesFailed());
        return payload;
    }

    static Map<String, Object> evidencePayload(ValidationResult evidence) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("valid", evidence.valid());
        payload.put("errors", evidence.errors());
        return payload;
    }
}
