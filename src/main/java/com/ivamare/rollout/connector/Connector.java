package com.ivamare.rollout.connector;

import com.ivamare.rollout.model.ConnectorOperationResult;
import com.ivamare.rollout.model.CorrelationId;
import com.ivamare.rollout.model.DeploymentIntent;

import java.util.Set;

/**
 * Abstraction over one execution-plane backend.
 *
 * <p>Implementations are stateless between calls apart from cached
 * credentials, and keep no duplicate-suppression state: idempotency is the
 * dispatcher's job. Failures are signalled by throwing; the dispatcher
 * classifies and retries them.
 */
public interface Connector {

    /**
     * @return Unique connector name, e.g. {@code intune}
     */
    String name();

    Set<ConnectorCapability> capabilities();

    default boolean supports(ConnectorCapability capability) {
        return capabilities().contains(capability);
    }

    /**
     * Publish an intent to the backend.
     *
     * @param intent The intent
     * @param correlationId Correlation ID the backend should record
     * @return Result with status PUBLISHED and backend IDs
     */
    ConnectorOperationResult publish(DeploymentIntent intent, CorrelationId correlationId);

    /**
     * Remove a backend resource.
     *
     * @param resourceId Backend resource ID
     * @param correlationId Correlation ID the backend should record
     * @return Result with status REMOVED
     */
    ConnectorOperationResult remove(String resourceId, CorrelationId correlationId);

    /**
     * Query device states for a correlation ID.
     */
    ConnectorStatusReport getStatus(CorrelationId correlationId);

    ConnectorHealth healthCheck();
}
