package com.ivamare.rollout.promotion;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.ivamare.rollout.model.Ring;

import java.util.List;

/**
 * Outcome of evaluating all gates for one ring transition.
 *
 * @param ring Ring being left
 * @param nextRing Ring being entered (null at the last ring)
 * @param allowPromotion Whether no gate failed
 * @param gatesPassed Names of passed gates
 * @param gatesFailed Names of failed gates
 * @param gates Per-gate detail
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PromotionGateResult(
    Ring ring,
    Ring nextRing,
    boolean allowPromotion,
    List<String> gatesPassed,
    List<String> gatesFailed,
    List<GateOutcome> gates
) {

    public PromotionGateResult {
        gatesPassed = List.copyOf(gatesPassed);
        gatesFailed = List.copyOf(gatesFailed);
        gates = List.copyOf(gates);
    }
}
