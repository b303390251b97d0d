package com.ivamare.rollout.promotion;

import com.ivamare.rollout.model.Ring;
import com.ivamare.rollout.model.RollbackPlan;
import com.ivamare.rollout.scope.CabApprovalCheck;
import com.ivamare.rollout.scope.CabApprovalValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Evaluates the five promotion gates for leaving a ring.
 *
 * <p>Gates are evaluated independently and all of them always run, so the
 * result names every failing gate. A single failing gate blocks promotion.
 */
public class PromotionGateEvaluator {

    private static final Logger log = LoggerFactory.getLogger(PromotionGateEvaluator.class);

    public static final String SUCCESS_RATE = "success_rate";
    public static final String TIME_TO_COMPLIANCE = "time_to_compliance";
    public static final String INCIDENT_COUNT = "incident_count";
    public static final String CAB_APPROVAL = "cab_approval";
    public static final String ROLLBACK_VALIDATION = "rollback_validation";

    private final PromotionGateConfig config;
    private final CabApprovalValidator cabValidator;

    public PromotionGateEvaluator(PromotionGateConfig config, CabApprovalValidator cabValidator) {
        this.config = config;
        this.cabValidator = cabValidator;
    }

    public PromotionGateConfig getConfig() {
        return config;
    }

    /**
     * Evaluate the gates for leaving a ring.
     *
     * @param ring Ring being left
     * @param telemetry Live telemetry of the ring
     * @param riskScore Risk score of the intent
     * @param rollbackPlan Rollback plan of the intent
     * @param cabApprovalId CAB approval of the intent (nullable)
     * @return Passed and failed gates with detail
     */
    public PromotionGateResult evaluate(Ring ring, Telemetry telemetry, double riskScore,
                                        RollbackPlan rollbackPlan, String cabApprovalId) {
        Objects.requireNonNull(telemetry, "telemetry");
        RingPolicy policy = config.policyFor(ring);
        List<GateOutcome> gates = new ArrayList<>();

        gates.add(new GateOutcome(SUCCESS_RATE,
            telemetry.successRate() >= policy.successRateThreshold(), true,
            policy.successRateThreshold(), telemetry.successRate()));

        gates.add(new GateOutcome(TIME_TO_COMPLIANCE,
            telemetry.timeToComplianceHours() <= policy.timeToComplianceHours(), true,
            policy.timeToComplianceHours(), telemetry.timeToComplianceHours()));

        gates.add(new GateOutcome(INCIDENT_COUNT,
            telemetry.incidentCount() <= policy.maxIncidents(), true,
            policy.maxIncidents(), telemetry.incidentCount()));

        gates.add(cabGate(policy, riskScore, cabApprovalId));

        boolean rollbackRequired = ring == config.firstRing() || policy.rollbackValidationRequired();
        boolean rollbackValidated = rollbackPlan != null && rollbackPlan.validated();
        gates.add(new GateOutcome(ROLLBACK_VALIDATION,
            !rollbackRequired || rollbackValidated, rollbackRequired,
            rollbackRequired ? "validated" : null, rollbackValidated ? "validated" : "not_validated"));

        List<String> passed = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (GateOutcome gate : gates) {
            (gate.passed() ? passed : failed).add(gate.gate());
        }

        PromotionGateResult result = new PromotionGateResult(
            ring, config.next(ring).orElse(null), failed.isEmpty(), passed, failed, gates);
        log.debug("Promotion gates for {}: passed={} failed={}", ring, passed, failed);
        return result;
    }

    private GateOutcome cabGate(RingPolicy policy, double riskScore, String cabApprovalId) {
        if (!policy.requiresCab(riskScore)) {
            return new GateOutcome(CAB_APPROVAL, true, false, policy.cabApprovalRequiredIfRiskGt(), riskScore);
        }
        CabApprovalCheck check = cabValidator.check(cabApprovalId);
        return new GateOutcome(CAB_APPROVAL, check.approved(), true, "approved", check.status().value());
    }
}
