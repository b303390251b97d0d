package com.ivamare.rollout.connector.http;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.ivamare.rollout.connector.Connector;
import com.ivamare.rollout.connector.ConnectorCapability;
import com.ivamare.rollout.connector.ConnectorHealth;
import com.ivamare.rollout.connector.ConnectorStatusReport;
import com.ivamare.rollout.connector.DeviceState;
import com.ivamare.rollout.connector.HealthState;
import com.ivamare.rollout.model.ConnectorOperationResult;
import com.ivamare.rollout.model.CorrelationId;
import com.ivamare.rollout.model.DeploymentIntent;
import com.ivamare.rollout.model.OperationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Connector for device-management backends that expose the generic
 * deployment REST contract:
 *
 * <pre>
 * POST   /deployments                       publish, answers {"backend_ids": [...]}
 * DELETE /deployments/{resourceId}          remove
 * GET    /deployments/{correlationId}/status device states, {"devices": {"id": "compliant"}}
 * GET    /health                            {"status": "ok" | "degraded" | ...}
 * </pre>
 *
 * <p>Every call carries the bearer token and the correlation ID in
 * {@value #CORRELATION_HEADER}, which the backend uses to reject duplicates
 * with 409. HTTP errors propagate as Spring {@code RestClientResponseException}s
 * for the dispatcher to classify.
 */
public class HttpConnector implements Connector {

    private static final Logger log = LoggerFactory.getLogger(HttpConnector.class);

    public static final String CORRELATION_HEADER = "X-Correlation-ID";

    private final String name;
    private final Set<ConnectorCapability> capabilities;
    private final RestClient restClient;
    private final TokenProvider tokenProvider;

    public HttpConnector(String name, Set<ConnectorCapability> capabilities, RestClient restClient,
                         TokenProvider tokenProvider) {
        this.name = name;
        this.capabilities = Set.copyOf(capabilities);
        this.restClient = restClient;
        this.tokenProvider = tokenProvider;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Set<ConnectorCapability> capabilities() {
        return capabilities;
    }

    @Override
    public ConnectorOperationResult publish(DeploymentIntent intent, CorrelationId correlationId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("correlation_id", correlationId.value());
        body.put("app_id", intent.appId());
        body.put("version", intent.version());
        body.put("ring", intent.targetRing().name().toLowerCase(Locale.ROOT));
        body.put("action", intent.action().name().toLowerCase(Locale.ROOT));
        body.put("target_devices", intent.targetDevices());
        body.put("target_scope", intent.targetScope().dimensions());
        switch (intent.action()) {
            case SUPERSEDE -> body.put("detection_rule", intent.rollbackPlan().detectionRule());
            case UNINSTALL -> {
                body.put("uninstall_command", intent.rollbackPlan().uninstallCommand());
                body.put("detection_rule", intent.rollbackPlan().detectionRule());
            }
            case REMEDIATE -> body.put("remediation_script", intent.rollbackPlan().remediationScript());
            default -> {
            }
        }

        PublishResponse response = authorized(() -> restClient.post()
            .uri("/deployments")
            .header(HttpHeaders.AUTHORIZATION, bearer())
            .header(CORRELATION_HEADER, correlationId.value())
            .contentType(MediaType.APPLICATION_JSON)
            .body(body)
            .retrieve()
            .body(PublishResponse.class));

        List<String> backendIds = response != null && response.backendIds() != null
            ? response.backendIds()
            : List.of();
        log.debug("Connector {} published {} {} as {}", name, intent.appId(), intent.version(), backendIds);
        return ConnectorOperationResult.success(OperationStatus.PUBLISHED, correlationId, name, backendIds);
    }

    @Override
    public ConnectorOperationResult remove(String resourceId, CorrelationId correlationId) {
        authorized(() -> restClient.delete()
            .uri("/deployments/{resourceId}", resourceId)
            .header(HttpHeaders.AUTHORIZATION, bearer())
            .header(CORRELATION_HEADER, correlationId.value())
            .retrieve()
            .toBodilessEntity());
        return ConnectorOperationResult.success(OperationStatus.REMOVED, correlationId, name, List.of(resourceId));
    }

    @Override
    public ConnectorStatusReport getStatus(CorrelationId correlationId) {
        StatusResponse response = authorized(() -> restClient.get()
            .uri("/deployments/{correlationId}/status", correlationId.value())
            .header(HttpHeaders.AUTHORIZATION, bearer())
            .header(CORRELATION_HEADER, correlationId.value())
            .retrieve()
            .body(StatusResponse.class));
        Map<String, DeviceState> devices = response != null && response.devices() != null
            ? response.devices()
            : Map.of();
        return new ConnectorStatusReport(name, correlationId.value(), devices, Instant.now());
    }

    @Override
    public ConnectorHealth healthCheck() {
        HealthResponse response = authorized(() -> restClient.get()
            .uri("/health")
            .header(HttpHeaders.AUTHORIZATION, bearer())
            .retrieve()
            .body(HealthResponse.class));
        String status = response != null && response.status() != null
            ? response.status().toLowerCase(Locale.ROOT)
            : "ok";
        HealthState state = switch (status) {
            case "ok", "up", "ready", "healthy" -> HealthState.READY;
            case "degraded", "warning" -> HealthState.DEGRADED;
            default -> HealthState.DOWN;
        };
        return new ConnectorHealth(name, state, response != null ? response.detail() : null, Instant.now());
    }

    private String bearer() {
        return "Bearer " + tokenProvider.getToken();
    }

    private <T> T authorized(Supplier<T> call) {
        try {
            return call.get();
        } catch (HttpClientErrorException.Unauthorized e) {
            log.debug("Connector {} rejected token, invalidating", name);
            tokenProvider.invalidate();
            throw e;
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    record PublishResponse(List<String> backendIds) {}

    record StatusResponse(Map<String, DeviceState> devices) {}

    record HealthResponse(String status, String detail) {}
}
