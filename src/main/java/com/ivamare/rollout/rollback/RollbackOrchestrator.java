package com.ivamare.rollout.rollback;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.rollout.connector.AggregatedStatus;
import com.ivamare.rollout.connector.Connector;
import com.ivamare.rollout.connector.ConnectorDispatcher;
import com.ivamare.rollout.exception.InvalidOperationException;
import com.ivamare.rollout.model.AuditEvent;
import com.ivamare.rollout.model.AuditEventType;
import com.ivamare.rollout.model.ConnectorOperationResult;
import com.ivamare.rollout.model.CorrelationId;
import com.ivamare.rollout.model.CorrelationIdType;
import com.ivamare.rollout.model.DeploymentIntent;
import com.ivamare.rollout.model.OperationKey;
import com.ivamare.rollout.model.OperationType;
import com.ivamare.rollout.model.RollbackPlan;
import com.ivamare.rollout.model.ValidationResult;
import com.ivamare.rollout.policy.CancellationToken;
import com.ivamare.rollout.policy.Sleeper;
import com.ivamare.rollout.repository.AuditRepository;
import com.ivamare.rollout.repository.DeploymentHistory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Plans, dispatches and reconciles rollbacks.
 *
 * <p>After the first dispatch the orchestrator polls status until every
 * target device reports the desired state or the reconcile timeout passes.
 * Devices that have not converged are re-dispatched, and only those, up to
 * the configured number of rounds; after that the rollback is escalated for
 * manual intervention and reported as PARTIAL or FAILED with the
 * non-converged subset.
 *
 * <p>A cancellation signal stops further polling and re-dispatch. Calls
 * already in flight run to completion.
 */
public class RollbackOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RollbackOrchestrator.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    public static final String PRECONDITION_PREVIOUS_VERSION = "PREVIOUS_VERSION_NOT_RETAINED";
    public static final String PRECONDITION_UNINSTALL_COMMAND = "UNINSTALL_COMMAND_MISSING";
    public static final String PRECONDITION_REMEDIATION_SCRIPT = "REMEDIATION_SCRIPT_MISSING";
    public static final String PRECONDITION_DETECTION_RULE = "DETECTION_RULE_INVALID";
    public static final String PRECONDITION_CAPABILITY = "CONNECTOR_CAPABILITY_MISSING";

    private final DeploymentHistory history;
    private final AuditRepository auditRepository;
    private final ConnectorDispatcher dispatcher;
    private final Sleeper sleeper;
    private final ObjectMapper objectMapper;
    private final Duration pollInterval;
    private final Duration reconcileTimeout;
    private final int maxRedispatches;

    public RollbackOrchestrator(
            DeploymentHistory history,
            AuditRepository auditRepository,
            ConnectorDispatcher dispatcher,
            Sleeper sleeper,
            ObjectMapper objectMapper,
            Duration pollInterval,
            Duration reconcileTimeout,
            int maxRedispatches) {
        this.history = history;
        this.auditRepository = auditRepository;
        this.dispatcher = dispatcher;
        this.sleeper = sleeper;
        this.objectMapper = objectMapper;
        this.pollInterval = pollInterval;
        this.reconcileTimeout = reconcileTimeout;
        this.maxRedispatches = maxRedispatches;
    }

    /**
     * Check that a deployment can be rolled back with a strategy.
     *
     * @param intent The deployment intent
     * @param strategy The strategy
     * @return Every unmet precondition
     */
    public ValidationResult validatePreconditions(DeploymentIntent intent, RollbackStrategy strategy) {
        RollbackPlan plan = intent.rollbackPlan();
        List<String> errors = new ArrayList<>();
        if (!plan.hasValidDetectionRule()) {
            errors.add(PRECONDITION_DETECTION_RULE + ": " + plan.detectionRule());
        }
        switch (strategy) {
            case VERSION_PIN -> {
                if (!plan.hasPreviousVersion()) {
                    errors.add(PRECONDITION_PREVIOUS_VERSION);
                }
            }
            case TARGETED_UNINSTALL -> {
                if (!plan.hasUninstallCommand()) {
                    errors.add(PRECONDITION_UNINSTALL_COMMAND);
                }
            }
            case REMEDIATION_SCRIPT -> {
                if (!plan.hasRemediationScript()) {
                    errors.add(PRECONDITION_REMEDIATION_SCRIPT);
                }
            }
        }
        for (String name : intent.connectors()) {
            Connector connector = dispatcher.getRegistry().get(name);
            if (!connector.supports(strategy.requiredCapability())) {
                errors.add(PRECONDITION_CAPABILITY + ":" + name + " lacks " + strategy.requiredCapability());
            }
        }
        return ValidationResult.of(errors);
    }

    /**
     * Build a rollback plan for a deployment.
     *
     * @param deploymentId Deployment correlation ID
     * @param rollbackId Rollback correlation ID
     * @param strategy Strategy
     * @param targetDevices Devices to roll back; empty means the whole ring
     * @return The plan
     * @throws InvalidOperationException if the deployment was never dispatched,
     *         is already rolled back, or a precondition fails
     */
    public RollbackExecutionPlan plan(CorrelationId deploymentId, CorrelationId rollbackId,
                                      RollbackStrategy strategy, List<String> targetDevices) {
        rollbackId.requireType(CorrelationIdType.ROLLBACK);
        DeploymentHistory.DeploymentState state = history.load(deploymentId);
        if (state.currentRing() == null) {
            throw new InvalidOperationException("Deployment " + deploymentId + " was never dispatched");
        }
        if (state.rolledBack()) {
            throw new InvalidOperationException("Deployment " + deploymentId + " is already rolled back");
        }

        DeploymentIntent deployed = state.intent().withTargetRing(state.currentRing());
        ValidationResult preconditions = validatePreconditions(deployed, strategy);
        if (!preconditions.valid()) {
            throw new InvalidOperationException("Rollback preconditions not met for " + deploymentId
                + ": " + String.join("; ", preconditions.errors()));
        }

        String rollbackVersion = strategy == RollbackStrategy.VERSION_PIN
            ? deployed.rollbackPlan().previousVersion()
            : deployed.version();
        List<String> devices = targetDevices != null ? targetDevices : List.of();
        DeploymentIntent rollbackIntent = deployed.forRollback(rollbackId, rollbackVersion, strategy.action(), devices);
        return new RollbackExecutionPlan(rollbackId, deploymentId, strategy, state.currentRing(),
            rollbackVersion, strategy.action(), deployed.connectors(), devices, rollbackIntent);
    }

    /**
     * Plan and execute a rollback. Re-submitting the same rollback ID returns
     * the recorded report instead of rolling back again, whatever strategy
     * the repeat names; the strategy actually used is in the
     * {@code ROLLBACK_INITIATED} payload.
     *
     * @param deploymentId Deployment correlation ID
     * @param rollbackId Rollback correlation ID
     * @param strategy Strategy
     * @param targetDevices Devices to roll back; empty means the whole ring
     * @param actor Who requested the rollback
     * @param cancellation Stops polling and re-dispatch when cancelled
     * @return The report
     */
    public RollbackReport initiateRollback(CorrelationId deploymentId, CorrelationId rollbackId,
                                           RollbackStrategy strategy, List<String> targetDevices,
                                           String actor, CancellationToken cancellation) {
        Optional<AuditEvent> completed = auditRepository.findLatest(rollbackId, AuditEventType.ROLLBACK_COMPLETED);
        if (completed.isPresent()) {
            log.debug("Rollback {} already completed, replaying report", rollbackId);
            return toReport(completed.get());
        }
        RollbackExecutionPlan plan = plan(deploymentId, rollbackId, strategy, targetDevices);

        if (!auditRepository.register(rollbackId, OperationKey.of(OperationType.ROLLBACK))) {
            return replay(rollbackId);
        }

        Map<String, Object> initiated = new LinkedHashMap<>();
        initiated.put("rollback_id", rollbackId.value());
        initiated.put("deployment_id", deploymentId.value());
        initiated.put("strategy", strategy.name());
        initiated.put("ring", plan.ring().name());
        initiated.put("rollback_version", plan.rollbackVersion());
        initiated.put("target_devices", plan.targetDevices());
        auditRepository.append(deploymentId, AuditEventType.ROLLBACK_INITIATED, actor, initiated);
        auditRepository.append(rollbackId, AuditEventType.ROLLBACK_INITIATED, actor, initiated);
        log.info("Rollback {} of {} started with {} at ring {}", rollbackId, deploymentId, strategy, plan.ring());

        return execute(plan, actor, cancellation);
    }

    /**
     * Dispatch a plan and reconcile until convergence, escalation or cancellation.
     */
    public RollbackReport execute(RollbackExecutionPlan plan, String actor, CancellationToken cancellation) {
        List<ConnectorOperationResult> dispatchResults = new ArrayList<>(
            dispatcher.publish(plan.intent(), List.of(round(0)), actor, cancellation));
        if (dispatchResults.stream().noneMatch(ConnectorOperationResult::isSuccess)) {
            log.warn("Rollback {} could not be dispatched to any connector", plan.rollbackId());
            return finish(plan, RollbackOutcome.FAILED, null, plan.targetDevices(), 0, 0, dispatchResults, actor);
        }

        int redispatches = 0;
        int polls = 0;
        int maxPolls = maxPolls();
        while (true) {
            AggregatedStatus status = null;
            for (int i = 0; i < maxPolls; i++) {
                status = dispatcher.getStatus(plan.rollbackId(), null, plan.connectors());
                polls++;
                recordPoll(plan, status, polls, actor);
                if (status.convergedFor(plan.targetDevices())) {
                    return finish(plan, RollbackOutcome.CONVERGED, status, List.of(),
                        redispatches, polls, dispatchResults, actor);
                }
                if (cancellation.isCancelled()) {
                    return finish(plan, RollbackOutcome.CANCELLED, status, failingDevices(status, plan),
                        redispatches, polls, dispatchResults, actor);
                }
                if (i < maxPolls - 1 && !sleep()) {
                    return finish(plan, RollbackOutcome.CANCELLED, status, failingDevices(status, plan),
                        redispatches, polls, dispatchResults, actor);
                }
            }

            List<String> failing = failingDevices(status, plan);
            if (cancellation.isCancelled()) {
                return finish(plan, RollbackOutcome.CANCELLED, status, failing,
                    redispatches, polls, dispatchResults, actor);
            }
            if (redispatches >= maxRedispatches) {
                RollbackOutcome outcome = status.compliantDevices() > 0 ? RollbackOutcome.PARTIAL : RollbackOutcome.FAILED;
                return finish(plan, outcome, status, failing, redispatches, polls, dispatchResults, actor);
            }

            redispatches++;
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("round", redispatches);
            payload.put("devices", failing);
            auditRepository.append(plan.rollbackId(), AuditEventType.ROLLBACK_REDISPATCHED, actor, payload);
            log.info("Rollback {} re-dispatching to {} non-converged devices (round {}/{})",
                plan.rollbackId(), failing.size(), redispatches, maxRedispatches);

            DeploymentIntent subset = plan.intent().forRollback(plan.rollbackId(), plan.rollbackVersion(),
                plan.action(), failing);
            dispatchResults.addAll(dispatcher.publish(subset, List.of(round(redispatches)), actor, cancellation));
        }
    }

    private RollbackReport finish(RollbackExecutionPlan plan, RollbackOutcome outcome, AggregatedStatus status,
                                  List<String> nonCompliant, int redispatches, int polls,
                                  List<ConnectorOperationResult> dispatchResults, String actor) {
        boolean escalated = outcome == RollbackOutcome.PARTIAL || outcome == RollbackOutcome.FAILED;
        RollbackReport report = new RollbackReport(
            plan,
            outcome,
            status != null ? status.totalDevices() : 0,
            status != null ? status.compliantDevices() : 0,
            nonCompliant,
            redispatches,
            polls,
            escalated,
            dispatchResults
        );

        if (escalated) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("outcome", outcome.name());
            payload.put("non_compliant_devices", nonCompliant);
            payload.put("redispatches", redispatches);
            auditRepository.append(plan.rollbackId(), AuditEventType.ROLLBACK_ESCALATED, actor, payload);
            log.warn("Rollback {} escalated for manual intervention: {} with {} non-converged devices",
                plan.rollbackId(), outcome, nonCompliant.size());
        } else {
            log.info("Rollback {} finished: {}", plan.rollbackId(), outcome);
        }

        Map<String, Object> reportPayload = new LinkedHashMap<>();
        reportPayload.put(DeploymentHistory.OUTCOME, outcome.name());
        reportPayload.put("report", objectMapper.convertValue(report, MAP_TYPE));
        auditRepository.append(plan.rollbackId(), AuditEventType.ROLLBACK_COMPLETED, actor, reportPayload);

        Map<String, Object> deploymentPayload = new LinkedHashMap<>();
        deploymentPayload.put(DeploymentHistory.OUTCOME, outcome.name());
        deploymentPayload.put("rollback_id", plan.rollbackId().value());
        deploymentPayload.put("non_compliant_devices", nonCompliant);
        auditRepository.append(plan.deploymentId(), AuditEventType.ROLLBACK_COMPLETED, actor, deploymentPayload);
        return report;
    }

    private RollbackReport replay(CorrelationId rollbackId) {
        Optional<AuditEvent> completed = auditRepository.findLatest(rollbackId, AuditEventType.ROLLBACK_COMPLETED);
        if (completed.isEmpty()) {
            throw new InvalidOperationException("Rollback " + rollbackId + " is already in progress");
        }
        return toReport(completed.get());
    }

    private RollbackReport toReport(AuditEvent completed) {
        return objectMapper.convertValue(completed.payload().get("report"), RollbackReport.class);
    }

    private void recordPoll(RollbackExecutionPlan plan, AggregatedStatus status, int poll, String actor) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("poll", poll);
        payload.put("total_devices", status.totalDevices());
        payload.put("compliant_devices", status.compliantDevices());
        payload.put("non_compliant_devices", status.nonCompliantDevices());
        payload.put("connector_errors", status.errors());
        auditRepository.append(plan.rollbackId(), AuditEventType.ROLLBACK_RECONCILED, actor, payload);
    }

    // Devices to re-dispatch: explicit targets not yet compliant, or every non-compliant device in the ring
    private static List<String> failingDevices(AggregatedStatus status, RollbackExecutionPlan plan) {
        List<String> nonCompliant = status.nonCompliantDevices();
        if (plan.targetDevices().isEmpty()) {
            return nonCompliant;
        }
        List<String> failing = new ArrayList<>();
        for (String device : plan.targetDevices()) {
            boolean reported = status.reports().values().stream().anyMatch(r -> r.devices().containsKey(device));
            if (!reported || nonCompliant.contains(device)) {
                failing.add(device);
            }
        }
        return failing;
    }

    private int maxPolls() {
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            return 1;
        }
        return (int) Math.max(1, reconcileTimeout.toMillis() / pollInterval.toMillis());
    }

    private boolean sleep() {
        try {
            sleeper.sleep(pollInterval);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static String round(int n) {
        return "round-" + n;
    }
}
