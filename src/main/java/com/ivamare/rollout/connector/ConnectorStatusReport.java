package com.ivamare.rollout.connector;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Device states one connector reports for a correlation ID.
 *
 * @param connector Connector name
 * @param correlationId Correlation ID queried
 * @param devices Device ID to state
 * @param observedAt When the backend was queried
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ConnectorStatusReport(
    String connector,
    String correlationId,
    Map<String, DeviceState> devices,
    Instant observedAt
) {

    public ConnectorStatusReport {
        devices = devices != null ? Map.copyOf(devices) : Map.of();
    }

    public long compliantCount() {
        return devices.values().stream().filter(s -> s == DeviceState.COMPLIANT).count();
    }

    public List<String> nonCompliantDevices() {
        return devices.entrySet().stream()
            .filter(e -> e.getValue() != DeviceState.COMPLIANT)
            .map(Map.Entry::getKey)
            .sorted()
            .toList();
    }
}
