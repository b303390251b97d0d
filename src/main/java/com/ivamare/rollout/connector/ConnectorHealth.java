package com.ivamare.rollout.connector;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * Result of a connector health check.
 *
 * @param connector Connector name
 * @param state Health state
 * @param detail Human-readable detail (nullable)
 * @param checkedAt When the check ran
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ConnectorHealth(
    String connector,
    HealthState state,
    String detail,
    Instant checkedAt
) {

    public static ConnectorHealth ready(String connector) {
        return new ConnectorHealth(connector, HealthState.READY, null, Instant.now());
    }

    public static ConnectorHealth down(String connector, String detail) {
        return new ConnectorHealth(connector, HealthState.DOWN, detail, Instant.now());
    }
}
