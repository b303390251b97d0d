package com.ivamare.rollout.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.ivamare.rollout.evidence.EvidencePack;

import java.util.List;
import java.util.Map;

/**
 * Wire form of a deployment intent. Strings are normalized by
 * {@link com.ivamare.rollout.api.RequestNormalizer}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SubmitDeploymentRequest(
    String correlationId,
    String appId,
    String version,
    String targetRing,
    ScopeDto targetScope,
    String publisherId,
    List<String> connectors,
    List<String> targetDevices,
    Map<String, Double> riskFactors,
    RollbackPlanDto rollbackPlan,
    String cabApprovalId,
    EvidencePack evidencePack,
    String action,
    Boolean requiresElevation,
    List<String> complianceTags
) {

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record ScopeDto(String orgUnit, String businessUnit, String site) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record RollbackPlanDto(
        Boolean validated,
        String previousVersion,
        String uninstallCommand,
        String detectionRule,
        String remediationScript
    ) {}
}
