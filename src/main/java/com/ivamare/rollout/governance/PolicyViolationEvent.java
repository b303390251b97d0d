package com.ivamare.rollout.governance;

import java.time.Instant;
import java.util.List;

/**
 * A governance rejection that blocked a deployment.
 *
 * @param correlationId Correlation ID of the blocked operation
 * @param source Component that detected the violation (scope, cab, evidence, connector name...)
 * @param violations Every violated constraint
 * @param actor Who requested the operation
 * @param occurredAt When it was detected
 */
public record PolicyViolationEvent(
    String correlationId,
    String source,
    List<String> violations,
    String actor,
    Instant occurredAt
) {

    public PolicyViolationEvent {
        violations = List.copyOf(violations);
    }
}
