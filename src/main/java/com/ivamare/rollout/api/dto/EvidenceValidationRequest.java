package com.ivamare.rollout.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.ivamare.rollout.evidence.EvidencePack;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EvidenceValidationRequest(
    EvidencePack evidencePack,
    List<String> requiredFields
) {}
