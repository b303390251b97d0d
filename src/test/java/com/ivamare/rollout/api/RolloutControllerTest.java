package com.ivamare.rollout.api;

import com.ivamare.rollout.audit.AuditExportFormat;
import com.ivamare.rollout.exception.DeploymentNotFoundException;
import com.ivamare.rollout.model.CorrelationId;
import com.ivamare.rollout.model.CorrelationIdType;
import com.ivamare.rollout.model.DeploymentIntent;
import com.ivamare.rollout.model.Ring;
import com.ivamare.rollout.promotion.Telemetry;
import com.ivamare.rollout.rollback.RollbackStrategy;
import com.ivamare.rollout.scope.CabApproval;
import com.ivamare.rollout.scope.CabApprovalStatus;
import com.ivamare.rollout.service.DeploymentOutcome;
import com.ivamare.rollout.service.RolloutService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@DisplayName("RolloutController")
class RolloutControllerTest {

    private static final String SUBMIT_BODY = """
        {
          "app_id": "contoso-agent",
          "version": "2.1.0",
          "target_ring": "canary",
          "publisher_id": "packaging-team",
          "connectors": ["intune"],
          "target_scope": {"org_unit": "corp", "business_unit": "*"},
          "compliance_tags": [" SOX "]
        }
        """;

    @Mock
    private RolloutService rolloutService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders
            .standaloneSetup(new RolloutController(rolloutService, new RequestNormalizer()))
            .setControllerAdvice(new ApiExceptionHandler())
            .addInterceptors(new BearerTokenInterceptor(Map.of(), true))
            .build();
    }

    private static DeploymentOutcome outcome(DeploymentOutcome.Status status, List<String> violations) {
        return new DeploymentOutcome(CorrelationId.generate(CorrelationIdType.DEPLOYMENT).value(), status,
            Ring.CANARY, null, violations, List.of(), false);
    }

    @Nested
    class SubmitTests {

        @Test
        @DisplayName("should accept a dispatched deployment with 202")
        void shouldAcceptDispatched() throws Exception {
            when(rolloutService.submit(any(), eq("alice")))
                .thenReturn(outcome(DeploymentOutcome.Status.DISPATCHED, List.of()));

            mockMvc.perform(post("/api/v1/deployments")
                    .header(BearerTokenInterceptor.ACTOR_HEADER, "alice")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(SUBMIT_BODY))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("DISPATCHED"));

            ArgumentCaptor<DeploymentIntent> captor = ArgumentCaptor.forClass(DeploymentIntent.class);
            verify(rolloutService).submit(captor.capture(), eq("alice"));
            DeploymentIntent intent = captor.getValue();
            assertEquals(Ring.CANARY, intent.targetRing());
            assertEquals(CorrelationIdType.DEPLOYMENT, intent.correlationId().type());
            assertEquals("corp", intent.targetScope().orgUnit());
            assertEquals(List.of("sox"), intent.complianceTags());
        }

        @Test
        @DisplayName("should answer 403 with the violations when blocked")
        void shouldRejectBlocked() throws Exception {
            when(rolloutService.submit(any(), any()))
                .thenReturn(outcome(DeploymentOutcome.Status.BLOCKED, List.of("UNKNOWN_PUBLISHER:packaging-team")));

            mockMvc.perform(post("/api/v1/deployments")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(SUBMIT_BODY))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error_code").value("POLICY_VIOLATION"))
                .andExpect(jsonPath("$.errors[0]").value("UNKNOWN_PUBLISHER:packaging-team"));
        }

        @Test
        @DisplayName("should answer 502 when no connector accepted the publish")
        void shouldReportFailedDispatch() throws Exception {
            when(rolloutService.submit(any(), any()))
                .thenReturn(outcome(DeploymentOutcome.Status.FAILED, List.of()));

            mockMvc.perform(post("/api/v1/deployments")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(SUBMIT_BODY))
                .andExpect(status().isBadGateway());
        }

        @Test
        @DisplayName("should reject a request without app_id")
        void shouldRejectMissingAppId() throws Exception {
            mockMvc.perform(post("/api/v1/deployments")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"version\": \"1.0\", \"target_ring\": \"LAB\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("INVALID_ARGUMENT"));

            verifyNoInteractions(rolloutService);
        }

        @Test
        @DisplayName("should reject a correlation ID of another operation type")
        void shouldRejectWrongCorrelationType() throws Exception {
            String body = "{\"correlation_id\": \"" + CorrelationId.generate(CorrelationIdType.CAB).value()
                + "\", \"app_id\": \"a\", \"version\": \"1\", \"target_ring\": \"LAB\"}";

            mockMvc.perform(post("/api/v1/deployments")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("INVALID_CORRELATION_ID"));
        }
    }

    @Test
    @DisplayName("should answer 404 for an unknown deployment")
    void shouldAnswerNotFound() throws Exception {
        CorrelationId id = CorrelationId.generate(CorrelationIdType.DEPLOYMENT);
        when(rolloutService.status(id, null)).thenThrow(new DeploymentNotFoundException(id.value()));

        mockMvc.perform(get("/api/v1/deployments/{id}/status", id.value()))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error_code").value("DEPLOYMENT_NOT_FOUND"));
    }

    @Test
    @DisplayName("should require success_rate for a promotion")
    void shouldRequireSuccessRate() throws Exception {
        CorrelationId id = CorrelationId.generate(CorrelationIdType.DEPLOYMENT);

        mockMvc.perform(post("/api/v1/deployments/{id}/promotions", id.value())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"incident_count\": 0}"))
            .andExpect(status().isBadRequest());

        verify(rolloutService, never()).promote(any(), any(Telemetry.class), any());
    }

    @Test
    @DisplayName("should default the rollback strategy to version pin")
    void shouldDefaultRollbackStrategy() throws Exception {
        CorrelationId id = CorrelationId.generate(CorrelationIdType.DEPLOYMENT);

        mockMvc.perform(post("/api/v1/deployments/{id}/rollbacks", id.value())
                .header(BearerTokenInterceptor.ACTOR_HEADER, "ops"))
            .andExpect(status().isOk());

        verify(rolloutService).rollback(eq(id), isNull(), eq(RollbackStrategy.VERSION_PIN), eq(List.of()), eq("ops"));
    }

    @Test
    @DisplayName("should generate a correlation ID for a removal without one")
    void shouldGenerateRemovalCorrelationId() throws Exception {
        mockMvc.perform(delete("/api/v1/connectors/{connector}/resources/{resourceId}", "intune", "app-42")
                .header(BearerTokenInterceptor.ACTOR_HEADER, "ops"))
            .andExpect(status().isOk());

        ArgumentCaptor<CorrelationId> captor = ArgumentCaptor.forClass(CorrelationId.class);
        verify(rolloutService).remove(eq("intune"), eq("app-42"), captor.capture(), eq("ops"));
        assertEquals(CorrelationIdType.DEPLOYMENT, captor.getValue().type());
        assertNotNull(captor.getValue().issuedAt());
    }

    @Test
    @DisplayName("should keep a supplied removal correlation ID")
    void shouldKeepRemovalCorrelationId() throws Exception {
        CorrelationId id = CorrelationId.generate(CorrelationIdType.ROLLBACK);

        mockMvc.perform(delete("/api/v1/connectors/{connector}/resources/{resourceId}", "intune", "app-42")
                .param("correlation_id", "rollback-" + id.id().toString().toUpperCase())
                .header(BearerTokenInterceptor.ACTOR_HEADER, "ops"))
            .andExpect(status().isOk());

        verify(rolloutService).remove(eq("intune"), eq("app-42"), eq(id), eq("ops"));
    }

    @Test
    @DisplayName("should report whether anything was cancelled")
    void shouldCancel() throws Exception {
        CorrelationId id = CorrelationId.generate(CorrelationIdType.DEPLOYMENT);
        when(rolloutService.cancel(id)).thenReturn(true);

        mockMvc.perform(post("/api/v1/deployments/{id}/cancel", id.value()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.cancelled").value(true));
    }

    @Test
    @DisplayName("should record a CAB decision with the default validity")
    void shouldRecordCabDecision() throws Exception {
        Instant now = Instant.parse("2026-06-01T00:00:00Z");
        when(rolloutService.approve(eq("CAB-1"), eq(CabApprovalStatus.APPROVED), eq(30), any(), isNull(), eq("cab")))
            .thenReturn(new CabApproval("CAB-1", CabApprovalStatus.APPROVED, now.plusSeconds(86400 * 30L),
                List.of(), "cab", now, CorrelationId.generate(CorrelationIdType.CAB)));

        mockMvc.perform(post("/api/v1/cab-approvals")
                .header(BearerTokenInterceptor.ACTOR_HEADER, "cab")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"approval_id\": \"CAB-1\", \"decision\": \"approved\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.approval_id").value("CAB-1"));
    }

    @Test
    @DisplayName("should export audit events as CSV")
    void shouldExportCsv() throws Exception {
        when(rolloutService.exportAudit(any(), any(), eq(AuditExportFormat.CSV))).thenReturn("audit_id\n");

        mockMvc.perform(get("/api/v1/audit/export")
                .param("from", "2026-06-01T00:00:00Z")
                .param("to", "2026-06-02T00:00:00Z")
                .param("format", "csv"))
            .andExpect(status().isOk())
            .andExpect(content().contentTypeCompatibleWith("text/csv"))
            .andExpect(content().string("audit_id\n"));
    }

    @Test
    @DisplayName("should reject a risk request without factors or intent")
    void shouldRejectEmptyRiskRequest() throws Exception {
        mockMvc.perform(post("/api/v1/risk-score")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("factors or intent is required"));
    }
}
