package com.ivamare.rollout.risk;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Deterministic weighted-factor scorer.
 *
 * <p>{@code score = 100 * sum(weight * value) / sum(weight)} over the factors
 * of the model. Factors missing from the input count as 0, values outside
 * [0, 1] are clamped, and a model with total weight 0 scores 0. The result is
 * rounded half-up to two decimals.
 */
public class RiskScoringEngine {

    private final RiskModelProvider modelProvider;
    private final double autoApproveMax;
    private final double manualReviewMax;

    public RiskScoringEngine(RiskModelProvider modelProvider, double autoApproveMax, double manualReviewMax) {
        this.modelProvider = modelProvider;
        this.autoApproveMax = autoApproveMax;
        this.manualReviewMax = manualReviewMax;
    }

    /**
     * Score factors against the active model.
     *
     * @param factors Factor name to normalized value
     * @return The assessment
     */
    public RiskAssessment assess(Map<String, Double> factors) {
        RiskModel model = modelProvider.current();
        Map<String, Double> used = new LinkedHashMap<>();
        // Sorted iteration keeps floating point summation order stable across map implementations
        for (String name : new TreeMap<>(model.weights()).keySet()) {
            used.put(name, clamp(factors.get(name)));
        }
        double score = score(factors, model);
        return new RiskAssessment(score, model.version(), used,
            ApprovalTier.forScore(score, autoApproveMax, manualReviewMax));
    }

    /**
     * Pure scoring function.
     *
     * @param factors Factor name to value
     * @param model The model
     * @return Score in [0, 100] rounded to two decimals
     */
    public static double score(Map<String, Double> factors, RiskModel model) {
        double totalWeight = 0.0;
        double weighted = 0.0;
        for (Map.Entry<String, Double> entry : new TreeMap<>(model.weights()).entrySet()) {
            double weight = entry.getValue();
            totalWeight += weight;
            weighted += weight * clamp(factors.get(entry.getKey()));
        }
        if (totalWeight == 0.0) {
            return 0.0;
        }
        double raw = 100.0 * weighted / totalWeight;
        return BigDecimal.valueOf(raw).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    static double clamp(Double value) {
        if (value == null || value.isNaN()) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
