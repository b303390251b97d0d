package com.ivamare.rollout.connector;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Status of a correlation ID across connectors.
 *
 * @param correlationId Correlation ID queried
 * @param reports Connector name to its report
 * @param errors Connector name to failure message, for connectors that could not be queried
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AggregatedStatus(
    String correlationId,
    Map<String, ConnectorStatusReport> reports,
    Map<String, String> errors
) {

    public AggregatedStatus {
        reports = Map.copyOf(reports);
        errors = Map.copyOf(errors);
    }

    public int totalDevices() {
        return reports.values().stream().mapToInt(r -> r.devices().size()).sum();
    }

    public long compliantDevices() {
        return reports.values().stream().mapToLong(ConnectorStatusReport::compliantCount).sum();
    }

    /**
     * Devices not yet in the desired state on any connector.
     */
    public List<String> nonCompliantDevices() {
        Set<String> devices = new TreeSet<>();
        reports.values().forEach(r -> devices.addAll(r.nonCompliantDevices()));
        return List.copyOf(devices);
    }

    /**
     * Whether every reported device on every reachable connector is compliant
     * and no connector failed to report.
     */
    public boolean converged() {
        return errors.isEmpty() && totalDevices() > 0 && nonCompliantDevices().isEmpty();
    }

    /**
     * Whether every listed device is compliant on every connector that reports it
     * and every connector could be queried.
     */
    public boolean convergedFor(List<String> devices) {
        if (!errors.isEmpty()) {
            return false;
        }
        if (devices.isEmpty()) {
            return converged();
        }
        List<String> failing = nonCompliantDevices();
        for (String device : devices) {
            if (failing.contains(device) || reports.values().stream().noneMatch(r -> r.devices().containsKey(device))) {
                return false;
            }
        }
        return true;
    }
}
