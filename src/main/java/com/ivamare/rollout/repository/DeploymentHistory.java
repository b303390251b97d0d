package com.ivamare.rollout.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.rollout.exception.DeploymentNotFoundException;
import com.ivamare.rollout.model.AuditEvent;
import com.ivamare.rollout.model.AuditEventType;
import com.ivamare.rollout.model.CorrelationId;
import com.ivamare.rollout.model.DeploymentIntent;
import com.ivamare.rollout.model.Ring;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Projects deployment state from the audit log. The log is the only place
 * deployment state lives: the submitted intent is stored in the
 * {@code DEPLOYMENT_SUBMITTED} payload and the current ring follows from the
 * dispatch, advance and rollback events.
 */
public class DeploymentHistory {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    public static final String INTENT = "intent";
    public static final String RING = "ring";
    public static final String TO_RING = "to_ring";
    public static final String OUTCOME = "outcome";

    /** Value of {@link #OUTCOME} in ROLLBACK_COMPLETED when the rollback converged */
    public static final String CONVERGED = "CONVERGED";

    private final AuditRepository auditRepository;
    private final ObjectMapper objectMapper;

    public DeploymentHistory(AuditRepository auditRepository, ObjectMapper objectMapper) {
        this.auditRepository = auditRepository;
        this.objectMapper = objectMapper;
    }

    /**
     * Projected state of one deployment.
     *
     * @param intent The submitted intent
     * @param currentRing Last ring the deployment was dispatched to, or null if never dispatched
     * @param rolledBack Whether a rollback of the deployment converged
     */
    public record DeploymentState(DeploymentIntent intent, Ring currentRing, boolean rolledBack) {}

    /**
     * Build the payload stored with {@code DEPLOYMENT_SUBMITTED}.
     */
    public Map<String, Object> submittedPayload(DeploymentIntent intent) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(INTENT, objectMapper.convertValue(intent, MAP_TYPE));
        return payload;
    }

    /**
     * Load the projected state of a deployment.
     *
     * @param deploymentId The deployment's correlation ID
     * @return The state
     * @throws DeploymentNotFoundException if no intent was submitted under this ID
     */
    public DeploymentState load(CorrelationId deploymentId) {
        List<AuditEvent> events = auditRepository.getEvents(deploymentId);
        DeploymentIntent intent = null;
        Ring ring = null;
        boolean rolledBack = false;
        for (AuditEvent event : events) {
            switch (event.eventType()) {
                case AuditEventType.DEPLOYMENT_SUBMITTED -> {
                    if (intent == null) {
                        intent = objectMapper.convertValue(event.payload().get(INTENT), DeploymentIntent.class);
                    }
                }
                case AuditEventType.DEPLOYMENT_DISPATCHED -> ring = Ring.valueOf((String) event.payload().get(RING));
                case AuditEventType.RING_ADVANCED -> ring = Ring.valueOf((String) event.payload().get(TO_RING));
                case AuditEventType.ROLLBACK_COMPLETED -> {
                    if (CONVERGED.equals(event.payload().get(OUTCOME))) {
                        rolledBack = true;
                    }
                }
                default -> {
                }
            }
        }
        if (intent == null) {
            throw new DeploymentNotFoundException(deploymentId.value());
        }
        return new DeploymentState(intent, ring, rolledBack);
    }

    public DeploymentIntent loadIntent(CorrelationId deploymentId) {
        return load(deploymentId).intent();
    }
}
