package com.ivamare.rollout.promotion;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Outcome of one promotion gate.
 *
 * @param gate Gate name
 * @param passed Whether the gate passed
 * @param required Whether the gate applied at this ring; gates that do not apply pass
 * @param threshold Threshold the actual value was compared with (nullable)
 * @param actual Observed value (nullable)
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GateOutcome(
    String gate,
    boolean passed,
    boolean required,
    Object threshold,
    Object actual
) {}
