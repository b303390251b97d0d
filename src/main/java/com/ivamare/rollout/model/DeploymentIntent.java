package com.ivamare.rollout.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.ivamare.rollout.evidence.EvidencePack;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Request to publish or remove an app version to a ring.
 *
 * <p>Never mutated after dispatch; retries of a failed deployment are new
 * intents with new correlation IDs. The {@code with*} methods derive the
 * intents the promotion and rollback flows dispatch.
 *
 * @param correlationId Idempotency and audit key ({@code deployment-} prefix)
 * @param appId Application identifier
 * @param version Version to deploy
 * @param targetRing Ring the intent is dispatched to
 * @param targetScope Tenant boundary of the target devices
 * @param publisherId Publisher submitting the intent
 * @param connectors Execution planes to dispatch to
 * @param targetDevices Explicit device IDs; empty means the whole ring
 * @param riskFactors Normalized risk factor values in [0, 1]
 * @param rollbackPlan Rollback plan
 * @param cabApprovalId CAB approval reference (nullable)
 * @param evidencePack Evidence bundle for the artifact (nullable at the first ring)
 * @param action What the backend should do
 * @param requiresElevation Whether the installer needs admin rights
 * @param complianceTags Regulatory tags of the app (sox, hipaa, pci...)
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DeploymentIntent(
    CorrelationId correlationId,
    String appId,
    String version,
    Ring targetRing,
    TargetScope targetScope,
    String publisherId,
    List<String> connectors,
    List<String> targetDevices,
    Map<String, Double> riskFactors,
    RollbackPlan rollbackPlan,
    String cabApprovalId,
    EvidencePack evidencePack,
    DeploymentAction action,
    boolean requiresElevation,
    List<String> complianceTags
) {

    public DeploymentIntent {
        Objects.requireNonNull(correlationId, "correlationId");
        Objects.requireNonNull(appId, "appId");
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(targetRing, "targetRing");
        connectors = connectors != null ? List.copyOf(connectors) : List.of();
        targetDevices = targetDevices != null ? List.copyOf(targetDevices) : List.of();
        riskFactors = riskFactors != null ? Map.copyOf(riskFactors) : Map.of();
        complianceTags = complianceTags != null ? List.copyOf(complianceTags) : List.of();
        targetScope = targetScope != null ? targetScope : TargetScope.unrestricted();
        rollbackPlan = rollbackPlan != null ? rollbackPlan : RollbackPlan.none();
        action = action != null ? action : DeploymentAction.INSTALL;
    }

    public DeploymentIntent withTargetRing(Ring ring) {
        return new DeploymentIntent(correlationId, appId, version, ring, targetScope, publisherId,
            connectors, targetDevices, riskFactors, rollbackPlan, cabApprovalId, evidencePack,
            action, requiresElevation, complianceTags);
    }

    /**
     * Derive the intent a rollback dispatches: same app and ring, another
     * version and action, restricted to the given devices and keyed by the
     * rollback's correlation ID.
     */
    public DeploymentIntent forRollback(CorrelationId rollbackId, String rollbackVersion,
                                        DeploymentAction rollbackAction, List<String> devices) {
        return new DeploymentIntent(rollbackId, appId, rollbackVersion, targetRing, targetScope, publisherId,
            connectors, devices, riskFactors, rollbackPlan, cabApprovalId, evidencePack,
            rollbackAction, requiresElevation, complianceTags);
    }
}
