package com.ivamare.rollout.risk;

import com.ivamare.rollout.evidence.EvidencePack;
import com.ivamare.rollout.model.DeploymentIntent;
import com.ivamare.rollout.model.Ring;
import com.ivamare.rollout.model.RollbackPlan;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Derives normalized values for the built-in risk factors from an intent and
 * its evidence pack. Factors the caller supplied on the intent take
 * precedence over derived ones.
 */
public class RiskFactorExtractor {

    private static final Map<Ring, Double> BLAST_RADIUS = Map.of(
        Ring.LAB, 0.0,
        Ring.CANARY, 0.2,
        Ring.PILOT, 0.4,
        Ring.DEPARTMENT, 0.7,
        Ring.GLOBAL, 1.0
    );

    private static final Set<String> HIGH_IMPACT_TAGS = Set.of("sox", "hipaa");
    private static final Set<String> MEDIUM_IMPACT_TAGS = Set.of("pci");

    private static final List<String> COMPLETENESS_FIELDS = List.of(
        EvidencePack.ARTIFACT_HASH,
        EvidencePack.SBOM_REFERENCE,
        EvidencePack.VULNERABILITY_SCAN,
        EvidencePack.ROLLBACK
    );

    /** Used when no scan result is available */
    static final double UNKNOWN_VULNERABILITY_SEVERITY = 0.5;

    /**
     * @param intent The intent
     * @return Factor name to value in [0, 1]
     */
    public Map<String, Double> extract(DeploymentIntent intent) {
        Map<String, Double> factors = new HashMap<>();
        factors.put(RiskModel.PRIVILEGE_ELEVATION, intent.requiresElevation() ? 1.0 : 0.0);
        factors.put(RiskModel.BLAST_RADIUS, BLAST_RADIUS.get(intent.targetRing()));
        factors.put(RiskModel.ROLLBACK_COMPLEXITY, rollbackComplexity(intent.rollbackPlan()));
        factors.put(RiskModel.VULNERABILITY_SEVERITY, vulnerabilitySeverity(intent.evidencePack()));
        factors.put(RiskModel.EVIDENCE_COMPLETENESS, evidenceGap(intent.evidencePack()));
        factors.put(RiskModel.COMPLIANCE_IMPACT, complianceImpact(intent.complianceTags()));
        factors.putAll(intent.riskFactors());
        return factors;
    }

    private static double rollbackComplexity(RollbackPlan plan) {
        if (plan.validated()) {
            return 0.0;
        }
        if (plan.hasPreviousVersion() || plan.hasUninstallCommand() || plan.hasRemediationScript()) {
            return 0.5;
        }
        return 1.0;
    }

    private static double vulnerabilitySeverity(EvidencePack pack) {
        if (pack == null || pack.vulnerabilityScan() == null) {
            return UNKNOWN_VULNERABILITY_SEVERITY;
        }
        EvidencePack.VulnerabilityScan scan = pack.vulnerabilityScan();
        if (scan.critical() > 0) {
            return 1.0;
        }
        if (scan.high() > 0) {
            return 0.7;
        }
        if (scan.medium() > 0) {
            return 0.3;
        }
        return 0.0;
    }

    // Fraction of completeness fields that are missing; higher is riskier
    private static double evidenceGap(EvidencePack pack) {
        if (pack == null) {
            return 1.0;
        }
        long missing = COMPLETENESS_FIELDS.stream()
            .map(pack::fieldValue)
            .filter(v -> v == null || (v instanceof String s && s.isBlank()))
            .count();
        return (double) missing / COMPLETENESS_FIELDS.size();
    }

    private static double complianceImpact(List<String> tags) {
        if (tags.isEmpty()) {
            return 0.0;
        }
        boolean medium = false;
        for (String tag : tags) {
            String normalized = tag.toLowerCase(Locale.ROOT);
            if (HIGH_IMPACT_TAGS.contains(normalized)) {
                return 1.0;
            }
            if (MEDIUM_IMPACT_TAGS.contains(normalized)) {
                medium = true;
            }
        }
        return medium ? 0.7 : 0.3;
    }
}
