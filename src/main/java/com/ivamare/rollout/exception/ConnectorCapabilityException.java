package com.ivamare.rollout.exception;

import com.ivamare.rollout.connector.ConnectorCapability;

/**
 * Thrown when an operation is requested from a connector that does not declare the capability.
 */
public class ConnectorCapabilityException extends RolloutException {

    private final String connectorName;
    private final ConnectorCapability capability;

    public ConnectorCapabilityException(String connectorName, ConnectorCapability capability) {
        super("Connector '" + connectorName + "' does not support " + capability);
        this.connectorName = connectorName;
        this.capability = capability;
    }

    public String getConnectorName() {
        return connectorName;
    }

    public ConnectorCapability getCapability() {
        return capability;
    }
}
