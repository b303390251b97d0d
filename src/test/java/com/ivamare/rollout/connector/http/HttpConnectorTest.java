package com.ivamare.rollout.connector.http;

import com.ivamare.rollout.connector.ConnectorCapability;
import com.ivamare.rollout.connector.ConnectorHealth;
import com.ivamare.rollout.connector.ConnectorStatusReport;
import com.ivamare.rollout.connector.DeviceState;
import com.ivamare.rollout.connector.HealthState;
import com.ivamare.rollout.model.ConnectorOperationResult;
import com.ivamare.rollout.model.CorrelationId;
import com.ivamare.rollout.model.CorrelationIdType;
import com.ivamare.rollout.model.DeploymentAction;
import com.ivamare.rollout.model.DeploymentIntent;
import com.ivamare.rollout.model.OperationStatus;
import com.ivamare.rollout.model.Ring;
import com.ivamare.rollout.support.TestIntents;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;

import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class HttpConnectorTest {

    private static final String BASE_URL = "http://intune.test";

    private MockRestServiceServer server;
    private CountingTokenProvider tokens;
    private HttpConnector connector;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
        server = MockRestServiceServer.bindTo(builder).build();
        tokens = new CountingTokenProvider();
        connector = new HttpConnector("intune", EnumSet.allOf(ConnectorCapability.class), builder.build(), tokens);
    }

    @Test
    void shouldPublishWithCorrelationHeader() {
        DeploymentIntent intent = TestIntents.intent(Ring.CANARY, "intune");
        String id = intent.correlationId().value();
        server.expect(requestTo(BASE_URL + "/deployments"))
            .andExpect(method(HttpMethod.POST))
            .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer token-1"))
            .andExpect(header(HttpConnector.CORRELATION_HEADER, id))
            .andExpect(jsonPath("$.app_id").value(TestIntents.APP_ID))
            .andExpect(jsonPath("$.ring").value("canary"))
            .andExpect(jsonPath("$.action").value("install"))
            .andRespond(withSuccess("{\"backend_ids\":[\"intune-app-7\"]}", MediaType.APPLICATION_JSON));

        ConnectorOperationResult result = connector.publish(intent, intent.correlationId());

        server.verify();
        assertEquals(OperationStatus.PUBLISHED, result.status());
        assertEquals(List.of("intune-app-7"), result.backendIds());
    }

    @Test
    void shouldSendUninstallCommandForUninstallAction() {
        DeploymentIntent base = TestIntents.intent(Ring.PILOT, "intune");
        CorrelationId rollbackId = CorrelationId.generate(CorrelationIdType.ROLLBACK);
        DeploymentIntent intent = base.forRollback(rollbackId, base.version(), DeploymentAction.UNINSTALL,
            List.of("dev-1"));
        server.expect(requestTo(BASE_URL + "/deployments"))
            .andExpect(jsonPath("$.action").value("uninstall"))
            .andExpect(jsonPath("$.uninstall_command").value("msiexec /x {APP}"))
            .andExpect(jsonPath("$.target_devices[0]").value("dev-1"))
            .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

        ConnectorOperationResult result = connector.publish(intent, rollbackId);

        server.verify();
        assertTrue(result.backendIds().isEmpty());
    }

    @Test
    void shouldRemoveResource() {
        CorrelationId id = CorrelationId.generate(CorrelationIdType.DEPLOYMENT);
        server.expect(requestTo(BASE_URL + "/deployments/res-1"))
            .andExpect(method(HttpMethod.DELETE))
            .andRespond(withNoContent());

        ConnectorOperationResult result = connector.remove("res-1", id);

        server.verify();
        assertEquals(OperationStatus.REMOVED, result.status());
    }

    @Test
    void shouldParseDeviceStates() {
        CorrelationId id = CorrelationId.generate(CorrelationIdType.DEPLOYMENT);
        server.expect(requestTo(BASE_URL + "/deployments/" + id.value() + "/status"))
            .andExpect(method(HttpMethod.GET))
            .andRespond(withSuccess("{\"devices\":{\"dev-1\":\"compliant\",\"dev-2\":\"pending\"}}",
                MediaType.APPLICATION_JSON));

        ConnectorStatusReport report = connector.getStatus(id);

        assertEquals(DeviceState.COMPLIANT, report.devices().get("dev-1"));
        assertEquals(DeviceState.PENDING, report.devices().get("dev-2"));
        assertEquals(List.of("dev-2"), report.nonCompliantDevices());
    }

    @Test
    void shouldMapHealthStatus() {
        server.expect(requestTo(BASE_URL + "/health"))
            .andRespond(withSuccess("{\"status\":\"degraded\",\"detail\":\"sync lag\"}", MediaType.APPLICATION_JSON));

        ConnectorHealth health = connector.healthCheck();

        assertEquals(HealthState.DEGRADED, health.state());
        assertEquals("sync lag", health.detail());
    }

    @Test
    void shouldInvalidateTokenOnUnauthorized() {
        CorrelationId id = CorrelationId.generate(CorrelationIdType.DEPLOYMENT);
        server.expect(requestTo(BASE_URL + "/deployments/res-2"))
            .andRespond(withUnauthorizedRequest());

        assertThrows(HttpClientErrorException.Unauthorized.class, () -> connector.remove("res-2", id));
        assertEquals(1, tokens.invalidations);
    }

    private static class CountingTokenProvider implements TokenProvider {

        private int invalidations;

        @Override
        public String getToken() {
            return "token-1";
        }

        @Override
        public void invalidate() {
            invalidations++;
        }
    }
}
