package com.ivamare.rollout.connector;

import com.ivamare.rollout.exception.ConnectorCapabilityException;
import com.ivamare.rollout.exception.UnsupportedConnectorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Static registry of connectors, populated once at startup.
 */
public class ConnectorRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConnectorRegistry.class);

    private final Map<String, Connector> connectors;

    public ConnectorRegistry(Collection<? extends Connector> connectors) {
        Map<String, Connector> byName = new LinkedHashMap<>();
        for (Connector connector : connectors) {
            Connector existing = byName.putIfAbsent(connector.name(), connector);
            if (existing != null) {
                throw new IllegalStateException("Duplicate connector name: " + connector.name());
            }
        }
        this.connectors = Map.copyOf(byName);
        log.info("Registered connectors: {}", byName.keySet());
    }

    /**
     * Get a connector by name.
     *
     * @throws UnsupportedConnectorException if no connector has this name
     */
    public Connector get(String name) {
        Connector connector = name != null ? connectors.get(name) : null;
        if (connector == null) {
            throw new UnsupportedConnectorException(name, connectors.keySet());
        }
        return connector;
    }

    /**
     * Get a connector and require a capability.
     *
     * @throws UnsupportedConnectorException if no connector has this name
     * @throws ConnectorCapabilityException if the connector lacks the capability
     */
    public Connector require(String name, ConnectorCapability capability) {
        Connector connector = get(name);
        if (!connector.supports(capability)) {
            throw new ConnectorCapabilityException(name, capability);
        }
        return connector;
    }

    public Set<String> names() {
        return connectors.keySet();
    }

    public Collection<Connector> all() {
        return connectors.values();
    }
}
