package com.ivamare.rollout.service;

import com.ivamare.rollout.audit.AuditExportFormat;
import com.ivamare.rollout.audit.AuditExporter;
import com.ivamare.rollout.connector.AggregatedStatus;
import com.ivamare.rollout.connector.ConnectorDispatcher;
import com.ivamare.rollout.connector.ConnectorHealth;
import com.ivamare.rollout.evidence.EvidencePack;
import com.ivamare.rollout.evidence.EvidencePackValidator;
import com.ivamare.rollout.exception.InvalidOperationException;
import com.ivamare.rollout.governance.GovernanceNotifier;
import com.ivamare.rollout.governance.PolicyViolationEvent;
import com.ivamare.rollout.model.AuditEvent;
import com.ivamare.rollout.model.AuditEventType;
import com.ivamare.rollout.model.ConnectorOperationResult;
import com.ivamare.rollout.model.CorrelationId;
import com.ivamare.rollout.model.CorrelationIdType;
import com.ivamare.rollout.model.DeploymentIntent;
import com.ivamare.rollout.model.OperationKey;
import com.ivamare.rollout.model.OperationType;
import com.ivamare.rollout.model.ValidationResult;
import com.ivamare.rollout.policy.CancellationToken;
import com.ivamare.rollout.promotion.PromotionDecision;
import com.ivamare.rollout.promotion.PromotionGateConfig;
import com.ivamare.rollout.promotion.PromotionService;
import com.ivamare.rollout.promotion.RingPolicy;
import com.ivamare.rollout.promotion.Telemetry;
import com.ivamare.rollout.repository.AuditRepository;
import com.ivamare.rollout.repository.CabApprovalRepository;
import com.ivamare.rollout.repository.DeploymentHistory;
import com.ivamare.rollout.risk.ApprovalTier;
import com.ivamare.rollout.risk.RiskAssessment;
import com.ivamare.rollout.risk.RiskFactorExtractor;
import com.ivamare.rollout.risk.RiskScoringEngine;
import com.ivamare.rollout.rollback.RollbackOrchestrator;
import com.ivamare.rollout.rollback.RollbackReport;
import com.ivamare.rollout.rollback.RollbackStrategy;
import com.ivamare.rollout.scope.CabApproval;
import com.ivamare.rollout.scope.CabApprovalCheck;
import com.ivamare.rollout.scope.CabApprovalStatus;
import com.ivamare.rollout.scope.CabApprovalValidator;
import com.ivamare.rollout.scope.ScopeValidator;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Entry point of the control plane.
 *
 * <p>A submission runs: idempotency check, risk scoring, scope, CAB and
 * evidence validation, dispatch, outcome recording. Promotion and rollback
 * reuse the same dispatch cycle. Every operation logs with the correlation
 * ID in the {@value #MDC_KEY} MDC key.
 */
public class RolloutService {

    private static final Logger log = LoggerFactory.getLogger(RolloutService.class);

    public static final String MDC_KEY = "correlationId";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    static final int MIN_APPROVAL_DAYS = 1;
    static final int MAX_APPROVAL_DAYS = 90;

    private final AuditRepository auditRepository;
    private final DeploymentHistory history;
    private final RiskScoringEngine riskEngine;
    private final RiskFactorExtractor factorExtractor;
    private final ScopeValidator scopeValidator;
    private final CabApprovalValidator cabValidator;
    private final CabApprovalRepository cabRepository;
    private final EvidencePackValidator evidenceValidator;
    private final PromotionGateConfig gateConfig;
    private final PromotionService promotionService;
    private final RollbackOrchestrator rollbackOrchestrator;
    private final ConnectorDispatcher dispatcher;
    private final GovernanceNotifier governanceNotifier;
    private final AuditExporter auditExporter;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    // One token per running operation; a deployment can have a promotion and a rollback in flight
    private final Map<CorrelationId, Set<CancellationToken>> activeOperations = new ConcurrentHashMap<>();

    public RolloutService(
            AuditRepository auditRepository,
            DeploymentHistory history,
            RiskScoringEngine riskEngine,
            RiskFactorExtractor factorExtractor,
            ScopeValidator scopeValidator,
            CabApprovalValidator cabValidator,
            CabApprovalRepository cabRepository,
            EvidencePackValidator evidenceValidator,
            PromotionGateConfig gateConfig,
            PromotionService promotionService,
            RollbackOrchestrator rollbackOrchestrator,
            ConnectorDispatcher dispatcher,
            GovernanceNotifier governanceNotifier,
            AuditExporter auditExporter,
            ObjectMapper objectMapper,
            Clock clock) {
        this.auditRepository = auditRepository;
        this.history = history;
        this.riskEngine = riskEngine;
        this.factorExtractor = factorExtractor;
        this.scopeValidator = scopeValidator;
        this.cabValidator = cabValidator;
        this.cabRepository = cabRepository;
        this.evidenceValidator = evidenceValidator;
        this.gateConfig = gateConfig;
        this.promotionService = promotionService;
        this.rollbackOrchestrator = rollbackOrchestrator;
        this.dispatcher = dispatcher;
        this.governanceNotifier = governanceNotifier;
        this.auditExporter = auditExporter;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Submit a deployment intent.
     *
     * <p>Submitting the same intent again returns the recorded outcome; the
     * backends see the publish at most once.
     *
     * @param intent The intent ({@code deployment-} correlation ID)
     * @param actor Who submitted it
     * @return The outcome
     */
    public DeploymentOutcome submit(DeploymentIntent intent, String actor) {
        CorrelationId id = intent.correlationId().requireType(CorrelationIdType.DEPLOYMENT);
        return withCorrelation(id, () -> {
            if (!auditRepository.register(id, OperationKey.of(OperationType.SUBMIT, intent.targetRing().name()))) {
                return replaySubmission(intent);
            }
            CancellationToken cancellation = track(id);
            try {
                return doSubmit(intent, actor, cancellation);
            } finally {
                untrack(id, cancellation);
            }
        });
    }

    private DeploymentOutcome doSubmit(DeploymentIntent intent, String actor, CancellationToken cancellation) {
        CorrelationId id = intent.correlationId();
        auditRepository.append(id, AuditEventType.DEPLOYMENT_SUBMITTED, actor, history.submittedPayload(intent));
        log.info("Deployment {} {} submitted for ring {} by {}", intent.appId(), intent.version(),
            intent.targetRing(), actor);

        RiskAssessment risk = riskEngine.assess(factorExtractor.extract(intent));
        auditRepository.append(id, AuditEventType.RISK_ASSESSED, actor, objectMapper.convertValue(risk, MAP_TYPE));

        List<String> violations = new ArrayList<>(validate(intent, risk, actor));
        if (!violations.isEmpty()) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("source", "submission");
            payload.put("violations", violations);
            auditRepository.append(id, AuditEventType.POLICY_VIOLATION, actor, payload);
            governanceNotifier.notify(new PolicyViolationEvent(id.value(), "submission", violations, actor,
                clock.instant()));
            return recordOutcome(new DeploymentOutcome(id.value(), DeploymentOutcome.Status.BLOCKED,
                intent.targetRing(), risk, violations, List.of(), false), actor);
        }

        if (cancellation.isCancelled()) {
            return recordOutcome(new DeploymentOutcome(id.value(), DeploymentOutcome.Status.CANCELLED,
                intent.targetRing(), risk, List.of(), List.of(), false), actor);
        }

        List<ConnectorOperationResult> results = dispatcher.publish(intent, actor, cancellation);
        long succeeded = results.stream().filter(ConnectorOperationResult::isSuccess).count();
        DeploymentOutcome.Status status;
        if (succeeded == results.size()) {
            status = DeploymentOutcome.Status.DISPATCHED;
        } else if (succeeded > 0) {
            status = DeploymentOutcome.Status.PARTIAL;
        } else {
            status = DeploymentOutcome.Status.FAILED;
        }

        if (succeeded > 0) {
            Map<String, Object> dispatched = new LinkedHashMap<>();
            dispatched.put(DeploymentHistory.RING, intent.targetRing().name());
            dispatched.put("connectors", intent.connectors());
            auditRepository.append(id, AuditEventType.DEPLOYMENT_DISPATCHED, actor, dispatched);
        }
        return recordOutcome(new DeploymentOutcome(id.value(), status, intent.targetRing(), risk,
            List.of(), results, false), actor);
    }

    // Scope, CAB and evidence checks; every violation is collected
    private List<String> validate(DeploymentIntent intent, RiskAssessment risk, String actor) {
        List<String> violations = new ArrayList<>();
        if (!gateConfig.isConfigured(intent.targetRing())) {
            violations.add("RING_NOT_CONFIGURED:" + intent.targetRing());
            return violations;
        }

        violations.addAll(scopeValidator.validate(intent).errors());

        RingPolicy policy = gateConfig.policyFor(intent.targetRing());
        boolean cabNeeded = policy.requiresCab(risk.score());
        boolean exceptionNeeded = risk.tier() == ApprovalTier.EXCEPTION_REQUIRED;
        if (cabNeeded || exceptionNeeded) {
            CabApprovalCheck check = cabValidator.check(intent.cabApprovalId());
            if (!check.approved()) {
                if (cabNeeded) {
                    violations.add("CAB_APPROVAL_REQUIRED: risk " + risk.score() + " at ring "
                        + intent.targetRing() + ", approval " + intent.cabApprovalId() + " is "
                        + check.status().value());
                }
                if (exceptionNeeded) {
                    violations.add("RISK_THRESHOLD_EXCEEDED: risk " + risk.score()
                        + " requires an approved exception");
                }
            }
        }

        // Deploying past the first ring skips the gate that would have checked the evidence
        if (intent.targetRing() != gateConfig.firstRing()) {
            ValidationResult evidence = evidenceValidator.validate(intent.evidencePack());
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("valid", evidence.valid());
            payload.put("errors", evidence.errors());
            auditRepository.append(intent.correlationId(), AuditEventType.EVIDENCE_VALIDATED, actor, payload);
            violations.addAll(evidence.errors());
        }
        return violations;
    }

    private DeploymentOutcome recordOutcome(DeploymentOutcome outcome, String actor) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("outcome", objectMapper.convertValue(outcome, MAP_TYPE));
        auditRepository.append(CorrelationId.parse(outcome.correlationId()),
            AuditEventType.DEPLOYMENT_OUTCOME, actor, payload);
        if (outcome.status() == DeploymentOutcome.Status.BLOCKED) {
            log.warn("Deployment {} blocked: {}", outcome.correlationId(), outcome.violations());
        } else {
            log.info("Deployment {} finished with {}", outcome.correlationId(), outcome.status());
        }
        return outcome;
    }

    private DeploymentOutcome replaySubmission(DeploymentIntent intent) {
        Optional<AuditEvent> recorded = auditRepository.findLatest(intent.correlationId(),
            AuditEventType.DEPLOYMENT_OUTCOME);
        if (recorded.isPresent()) {
            log.debug("Duplicate submission of {}, replaying recorded outcome", intent.correlationId());
            return objectMapper.convertValue(recorded.get().payload().get("outcome"), DeploymentOutcome.class)
                .asReplay();
        }
        log.debug("Duplicate submission of {} while the first is still running", intent.correlationId());
        return new DeploymentOutcome(intent.correlationId().value(), DeploymentOutcome.Status.IN_PROGRESS,
            intent.targetRing(), null, List.of(), List.of(), true);
    }

    /**
     * Current ring and live device status of a deployment.
     *
     * @param deploymentId Deployment correlation ID
     * @param connectorName Restrict to one connector (nullable)
     */
    public DeploymentStatusView status(CorrelationId deploymentId, String connectorName) {
        return withCorrelation(deploymentId, () -> {
            DeploymentHistory.DeploymentState state = history.load(deploymentId);
            AggregatedStatus status = dispatcher.getStatus(deploymentId, connectorName, state.intent().connectors());
            return new DeploymentStatusView(deploymentId.value(), state.currentRing(), state.rolledBack(),
                status.totalDevices(), status.compliantDevices(), status);
        });
    }

    /**
     * Remove a backend resource.
     */
    public ConnectorOperationResult remove(String connectorName, String resourceId, CorrelationId correlationId,
                                           String actor) {
        return withCorrelation(correlationId, () ->
            dispatcher.remove(connectorName, resourceId, correlationId, actor, CancellationToken.none()));
    }

    /**
     * Evaluate the gates of the current ring and advance if they pass.
     */
    public PromotionDecision promote(CorrelationId deploymentId, Telemetry telemetry, String actor) {
        deploymentId.requireType(CorrelationIdType.DEPLOYMENT);
        return withCorrelation(deploymentId, () -> {
            CancellationToken cancellation = track(deploymentId);
            try {
                return promotionService.promote(deploymentId, telemetry, actor, cancellation);
            } finally {
                untrack(deploymentId, cancellation);
            }
        });
    }

    /**
     * Roll a deployment back.
     *
     * @param deploymentId Deployment correlation ID
     * @param rollbackId Rollback correlation ID; generated when null
     * @param strategy Strategy
     * @param targetDevices Devices to roll back; empty means the whole ring
     * @param actor Who requested the rollback
     */
    public RollbackReport rollback(CorrelationId deploymentId, CorrelationId rollbackId, RollbackStrategy strategy,
                                   List<String> targetDevices, String actor) {
        deploymentId.requireType(CorrelationIdType.DEPLOYMENT);
        CorrelationId id = rollbackId != null ? rollbackId : CorrelationId.generate(CorrelationIdType.ROLLBACK);
        return withCorrelation(id, () -> {
            CancellationToken cancellation = track(deploymentId);
            try {
                return rollbackOrchestrator.initiateRollback(deploymentId, id, strategy, targetDevices,
                    actor, cancellation);
            } finally {
                untrack(deploymentId, cancellation);
            }
        });
    }

    /**
     * Signal an in-flight submission, promotion or rollback of a deployment
     * to stop. Calls already in flight finish; no new retries, re-dispatches
     * or ring advances start.
     *
     * @return true if an operation was running
     */
    public boolean cancel(CorrelationId deploymentId) {
        AtomicInteger signalled = new AtomicInteger();
        activeOperations.computeIfPresent(deploymentId, (id, tokens) -> {
            tokens.forEach(token -> {
                token.cancel();
                signalled.incrementAndGet();
            });
            return tokens;
        });
        if (signalled.get() == 0) {
            return false;
        }
        log.info("Cancellation requested for {} ({} operation(s))", deploymentId, signalled.get());
        return true;
    }

    /**
     * Record a CAB decision. Approvals expire after 1 to 90 days.
     *
     * @param approvalId Approval ID
     * @param decision APPROVED, DENIED or PENDING
     * @param validDays Days until expiry
     * @param conditions Conditions attached to the decision
     * @param correlationId Correlation ID of the decision ({@code cab-}); generated when null
     * @param actor Who recorded the decision
     * @return The stored approval
     */
    public CabApproval approve(String approvalId, CabApprovalStatus decision, int validDays,
                               List<String> conditions, CorrelationId correlationId, String actor) {
        if (approvalId == null || approvalId.isBlank()) {
            throw new IllegalArgumentException("approvalId is required");
        }
        if (decision == null || decision == CabApprovalStatus.MISSING) {
            throw new IllegalArgumentException("decision must be approved, denied or pending");
        }
        if (validDays < MIN_APPROVAL_DAYS || validDays > MAX_APPROVAL_DAYS) {
            throw new IllegalArgumentException("validDays must be between " + MIN_APPROVAL_DAYS
                + " and " + MAX_APPROVAL_DAYS + ", was " + validDays);
        }
        CorrelationId id = correlationId != null
            ? correlationId.requireType(CorrelationIdType.CAB)
            : CorrelationId.generate(CorrelationIdType.CAB);

        return withCorrelation(id, () -> {
            if (!auditRepository.register(id, OperationKey.of(OperationType.CAB_DECISION,
                    ConnectorDispatcher.encodeQualifier(approvalId)))) {
                log.debug("CAB decision {} already recorded", id);
                return cabRepository.findById(approvalId)
                    .orElseThrow(() -> new InvalidOperationException("CAB decision " + id + " is in progress"));
            }
            Instant now = clock.instant();
            CabApproval approval = new CabApproval(approvalId, decision, now.plus(Duration.ofDays(validDays)),
                conditions, actor, now, id);
            cabRepository.save(approval);

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("approval_id", approvalId);
            payload.put("status", decision.value());
            payload.put("expiry", approval.expiry().toString());
            payload.put("conditions", approval.conditions());
            auditRepository.append(id, AuditEventType.CAB_DECISION_RECORDED, actor, payload);
            log.info("CAB decision {} recorded for {} by {}, expires {}", decision, approvalId, actor,
                approval.expiry());
            return approval;
        });
    }

    public CabApprovalCheck checkApproval(String approvalId) {
        return cabValidator.check(approvalId);
    }

    /**
     * Score raw factor values against the active model.
     */
    public RiskAssessment riskScore(Map<String, Double> factors) {
        return riskEngine.assess(factors);
    }

    /**
     * Score an intent, deriving the built-in factors from it.
     */
    public RiskAssessment riskScore(DeploymentIntent intent) {
        return riskEngine.assess(factorExtractor.extract(intent));
    }

    /**
     * Validate an evidence pack.
     *
     * @param requiredFields Required fields; the configured list when null or empty
     */
    public ValidationResult validateEvidence(EvidencePack pack, List<String> requiredFields) {
        if (requiredFields == null || requiredFields.isEmpty()) {
            return evidenceValidator.validate(pack);
        }
        return evidenceValidator.validate(pack, requiredFields);
    }

    public Map<String, ConnectorHealth> connectorHealth() {
        return dispatcher.healthCheck();
    }

    public List<AuditEvent> auditTrail(CorrelationId correlationId) {
        return auditRepository.getEvents(correlationId);
    }

    /**
     * Export the audit log for a time range.
     *
     * @param from Inclusive lower bound
     * @param to Exclusive upper bound
     * @param format Output format
     */
    public String exportAudit(Instant from, Instant to, AuditExportFormat format) {
        if (!from.isBefore(to)) {
            throw new IllegalArgumentException("from must be before to");
        }
        return auditExporter.export(auditRepository.getEventsBetween(from, to), format);
    }

    private CancellationToken track(CorrelationId id) {
        CancellationToken token = new CancellationToken();
        activeOperations.compute(id, (key, tokens) -> {
            Set<CancellationToken> updated = tokens != null ? tokens : ConcurrentHashMap.newKeySet();
            updated.add(token);
            return updated;
        });
        return token;
    }

    private void untrack(CorrelationId id, CancellationToken token) {
        activeOperations.computeIfPresent(id, (key, tokens) -> {
            tokens.remove(token);
            return tokens.isEmpty() ? null : tokens;
        });
    }

    private static <T> T withCorrelation(CorrelationId id, Supplier<T> work) {
        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_KEY, id.value())) {
            return work.get();
        }
    }
}
