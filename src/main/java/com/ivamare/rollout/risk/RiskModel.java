package com.ivamare.rollout.risk;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Versioned weighted-factor risk model. Immutable; a new version replaces it
 * through {@link RiskModelProvider#reload(RiskModel)}.
 *
 * @param version Model version identifier
 * @param weights Factor name to weight (each &gt;= 0)
 */
public record RiskModel(
    String version,
    Map<String, Double> weights
) {

    public static final String PRIVILEGE_ELEVATION = "privilege_elevation";
    public static final String BLAST_RADIUS = "blast_radius";
    public static final String ROLLBACK_COMPLEXITY = "rollback_complexity";
    public static final String VULNERABILITY_SEVERITY = "vulnerability_severity";
    public static final String EVIDENCE_COMPLETENESS = "evidence_completeness";
    public static final String COMPLIANCE_IMPACT = "compliance_impact";

    public RiskModel {
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(weights, "weights");
        for (Map.Entry<String, Double> entry : weights.entrySet()) {
            Double weight = entry.getValue();
            if (weight == null || weight.isNaN() || weight < 0) {
                throw new IllegalArgumentException(
                    "Risk factor " + entry.getKey() + " has invalid weight " + weight);
            }
        }
        weights = Map.copyOf(weights);
    }

    /**
     * Built-in model covering the factors {@link RiskFactorExtractor} derives.
     */
    public static RiskModel defaultModel() {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put(PRIVILEGE_ELEVATION, 0.20);
        weights.put(BLAST_RADIUS, 0.20);
        weights.put(ROLLBACK_COMPLEXITY, 0.15);
        weights.put(VULNERABILITY_SEVERITY, 0.20);
        weights.put(EVIDENCE_COMPLETENESS, 0.10);
        weights.put(COMPLIANCE_IMPACT, 0.15);
        return new RiskModel("v1.0", weights);
    }

    public double totalWeight() {
        return weights.values().stream().mapToDouble(Double::doubleValue).sum();
    }
}
