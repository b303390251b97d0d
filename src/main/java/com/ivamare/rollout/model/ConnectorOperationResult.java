package com.ivamare.rollout.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Outcome of one connector dispatch call. Appended to the audit store and
 * replayed verbatim for duplicate submissions.
 *
 * @param status Call status
 * @param correlationId Correlation ID of the call
 * @param connector Connector name
 * @param operationKey Idempotency operation key of the call
 * @param backendIds Backend-assigned object IDs
 * @param errorClassification Failure class if status is ERROR (nullable)
 * @param errorMessage Failure detail if status is ERROR (nullable)
 * @param attempts Number of attempts made
 * @param duplicate Whether the backend reported the call as a duplicate of an earlier one
 * @param replayed Whether this result was replayed from the store instead of executed
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConnectorOperationResult(
    OperationStatus status,
    String correlationId,
    String connector,
    String operationKey,
    List<String> backendIds,
    ErrorClassification errorClassification,
    String errorMessage,
    int attempts,
    boolean duplicate,
    boolean replayed
) {

    public ConnectorOperationResult {
        backendIds = backendIds != null ? List.copyOf(backendIds) : List.of();
    }

    public static ConnectorOperationResult success(OperationStatus status, CorrelationId correlationId,
                                                   String connector, List<String> backendIds) {
        return new ConnectorOperationResult(status, correlationId.value(), connector, null,
            backendIds, null, null, 1, false, false);
    }

    public static ConnectorOperationResult error(CorrelationId correlationId, String connector,
                                                 OperationKey key, ErrorClassification classification,
                                                 String message, int attempts) {
        return new ConnectorOperationResult(OperationStatus.ERROR, correlationId.value(), connector,
            key.value(), List.of(), classification, message, attempts, false, false);
    }

    public static ConnectorOperationResult inProgress(CorrelationId correlationId, String connector, OperationKey key) {
        return new ConnectorOperationResult(OperationStatus.IN_PROGRESS, correlationId.value(), connector,
            key.value(), List.of(), null, null, 0, false, true);
    }

    public ConnectorOperationResult withExecution(OperationKey key, int attemptCount) {
        return new ConnectorOperationResult(status, correlationId, connector, key.value(), backendIds,
            errorClassification, errorMessage, attemptCount, duplicate, replayed);
    }

    public ConnectorOperationResult asDuplicate() {
        return new ConnectorOperationResult(status, correlationId, connector, operationKey, backendIds,
            errorClassification, errorMessage, attempts, true, replayed);
    }

    public ConnectorOperationResult asReplay() {
        return new ConnectorOperationResult(status, correlationId, connector, operationKey, backendIds,
            errorClassification, errorMessage, attempts, duplicate, true);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status.isSuccess();
    }
}
