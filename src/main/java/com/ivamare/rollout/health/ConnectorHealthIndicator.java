package com.ivamare.rollout.health;

import com.ivamare.rollout.connector.ConnectorDispatcher;
import com.ivamare.rollout.connector.ConnectorHealth;
import com.ivamare.rollout.connector.HealthState;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health of the registered execution-plane connectors.
 *
 * <p>DOWN when any connector is down, UP otherwise; degraded connectors are
 * listed in the details but do not fail the check.
 */
public class ConnectorHealthIndicator implements HealthIndicator {

    private final ConnectorDispatcher dispatcher;

    public ConnectorHealthIndicator(ConnectorDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public Health health() {
        Map<String, ConnectorHealth> results = dispatcher.healthCheck();
        if (results.isEmpty()) {
            return Health.unknown()
                .withDetail("message", "No connectors registered")
                .build();
        }

        Map<String, ConnectorStatus> statuses = new LinkedHashMap<>();
        boolean anyDown = false;
        for (Map.Entry<String, ConnectorHealth> entry : results.entrySet()) {
            ConnectorHealth health = entry.getValue();
            statuses.put(entry.getKey(), new ConnectorStatus(health.state(), health.detail()));
            anyDown |= health.state() == HealthState.DOWN;
        }

        Health.Builder builder = anyDown ? Health.down() : Health.up();
        return builder
            .withDetail("connectors", statuses)
            .build();
    }

    record ConnectorStatus(HealthState state, String detail) {}
}
