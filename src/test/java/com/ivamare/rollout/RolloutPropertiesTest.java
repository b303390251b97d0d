package com.ivamare.rollout;

import com.ivamare.rollout.connector.ConnectorCapability;
import com.ivamare.rollout.model.Ring;
import com.ivamare.rollout.model.TargetScope;
import com.ivamare.rollout.promotion.PromotionGateConfig;
import com.ivamare.rollout.promotion.RingPolicy;
import com.ivamare.rollout.risk.RiskModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RolloutProperties")
class RolloutPropertiesTest {

    @Test
    @DisplayName("should have default values")
    void shouldHaveDefaultValues() {
        RolloutProperties properties = new RolloutProperties();

        assertTrue(properties.isEnabled());
        assertEquals(5, properties.getRetry().getMaxAttempts());
        assertEquals(Duration.ofMillis(500), properties.getRetry().getBaseDelay());
        assertEquals(Duration.ofSeconds(30), properties.getRetry().getMaxDelay());
        assertEquals(50.0, properties.getApprovalTiers().getAutoApproveMax());
        assertEquals(75.0, properties.getApprovalTiers().getManualReviewMax());
        assertEquals(2, properties.getRollback().getMaxRedispatches());
        assertEquals(6, properties.getEvidence().getRequiredFields().size());
        assertTrue(properties.getApi().getTokens().isEmpty());
        assertFalse(properties.getApi().isAllowAnonymous());
    }

    @Test
    @DisplayName("should fall back to the built-in model without weights")
    void shouldUseDefaultRiskModel() {
        RolloutProperties properties = new RolloutProperties();

        assertEquals(RiskModel.defaultModel(), properties.getRiskModel().toModel());

        properties.getRiskModel().setVersion("v2.0");
        properties.getRiskModel().setWeights(Map.of(RiskModel.BLAST_RADIUS, 1.0));
        RiskModel model = properties.getRiskModel().toModel();
        assertEquals("v2.0", model.version());
        assertEquals(Map.of(RiskModel.BLAST_RADIUS, 1.0), model.weights());
    }

    @Test
    @DisplayName("should fall back to the default ring table")
    void shouldUseDefaultRings() {
        PromotionGateConfig config = new RolloutProperties().toGateConfig();

        assertEquals(PromotionGateConfig.defaults().getPolicies(), config.getPolicies());
        assertEquals(Ring.LAB, config.firstRing());
    }

    @Test
    @DisplayName("should build ring policies from properties")
    void shouldBuildRingPolicies() {
        RolloutProperties.RingProperties lab = new RolloutProperties.RingProperties();
        lab.setRing(Ring.LAB);
        lab.setRollbackValidationRequired(true);
        RolloutProperties.RingProperties global = new RolloutProperties.RingProperties();
        global.setRing(Ring.GLOBAL);
        global.setSuccessRateThreshold(0.9);
        global.getTimeToCompliance().setOnlineHours(168);
        global.setMaxIncidents(10);
        global.setCabApprovalRequired(true);
        global.setCabApprovalRequiredIfRiskGt(60.0);
        RolloutProperties properties = new RolloutProperties();
        properties.setRings(List.of(lab, global));

        PromotionGateConfig config = properties.toGateConfig();

        assertFalse(config.isConfigured(Ring.CANARY));
        assertEquals(new RingPolicy(Ring.GLOBAL, 0.9, 168, 10, true, 60.0, false), config.policyFor(Ring.GLOBAL));
        assertEquals(24, config.policyFor(Ring.LAB).timeToComplianceHours());
    }

    @Test
    @DisplayName("should return connector defaults for unknown connectors")
    void shouldReturnConnectorDefaults() {
        RolloutProperties properties = new RolloutProperties();

        RolloutProperties.ConnectorProperties config = properties.getConnectorConfig("unknown");

        assertEquals(4, config.getMaxConcurrency());
        assertEquals(10, config.getRequestsPerSecond());
        assertEquals(Duration.ofSeconds(30), config.getCallTimeout());
        assertTrue(config.getCapabilities().contains(ConnectorCapability.PUBLISH));
        assertFalse(config.getCapabilities().contains(ConnectorCapability.VERSION_PIN));
        assertFalse(config.getOauth().isConfigured());
    }

    @Test
    @DisplayName("ScopeEntry should default every dimension to any")
    void scopeEntryShouldDefaultToAny() {
        RolloutProperties.ScopeEntry entry = new RolloutProperties.ScopeEntry();
        entry.setOrgUnit("corp");

        assertEquals(new TargetScope("corp", TargetScope.ANY, TargetScope.ANY), entry.toScope());
    }
}
