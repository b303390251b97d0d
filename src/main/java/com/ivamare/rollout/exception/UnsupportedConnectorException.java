package com.ivamare.rollout.exception;

import java.util.Set;

/**
 * Thrown when a connector name is not in the registry.
 */
public class UnsupportedConnectorException extends RolloutException {

    private final String connectorName;

    public UnsupportedConnectorException(String connectorName, Set<String> available) {
        super("Unsupported connector '" + connectorName + "'. Available: " + available);
        this.connectorName = connectorName;
    }

    public String getConnectorName() {
        return connectorName;
    }
}
