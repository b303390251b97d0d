package com.ivamare.rollout.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RollbackRequest(
    String rollbackId,
    String strategy,
    List<String> targetDevices
) {}
