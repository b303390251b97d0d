package com.ivamare.rollout.risk;

import com.ivamare.rollout.evidence.EvidencePack;
import com.ivamare.rollout.model.CorrelationId;
import com.ivamare.rollout.model.CorrelationIdType;
import com.ivamare.rollout.model.DeploymentIntent;
import com.ivamare.rollout.model.Ring;
import com.ivamare.rollout.model.RollbackPlan;
import com.ivamare.rollout.support.TestIntents;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RiskFactorExtractor")
class RiskFactorExtractorTest {

    private final RiskFactorExtractor extractor = new RiskFactorExtractor();

    @Test
    @DisplayName("should derive factors for a well-evidenced lab deployment")
    void shouldDeriveFactors() {
        Map<String, Double> factors = extractor.extract(TestIntents.intent(Ring.LAB, "intune"));

        assertEquals(0.0, factors.get(RiskModel.PRIVILEGE_ELEVATION));
        assertEquals(0.0, factors.get(RiskModel.BLAST_RADIUS));
        assertEquals(0.0, factors.get(RiskModel.ROLLBACK_COMPLEXITY));
        assertEquals(0.7, factors.get(RiskModel.VULNERABILITY_SEVERITY));
        assertEquals(0.0, factors.get(RiskModel.EVIDENCE_COMPLETENESS));
        assertEquals(0.0, factors.get(RiskModel.COMPLIANCE_IMPACT));
    }

    @Test
    @DisplayName("should treat missing evidence as unknown severity and full gap")
    void shouldHandleMissingEvidence() {
        DeploymentIntent base = TestIntents.intent(Ring.GLOBAL, "intune");
        DeploymentIntent intent = new DeploymentIntent(base.correlationId(), base.appId(), base.version(),
            Ring.GLOBAL, base.targetScope(), base.publisherId(), base.connectors(), List.of(), Map.of(),
            RollbackPlan.none(), null, null, base.action(), true, List.of("HIPAA"));

        Map<String, Double> factors = extractor.extract(intent);

        assertEquals(1.0, factors.get(RiskModel.PRIVILEGE_ELEVATION));
        assertEquals(1.0, factors.get(RiskModel.BLAST_RADIUS));
        assertEquals(1.0, factors.get(RiskModel.ROLLBACK_COMPLEXITY));
        assertEquals(RiskFactorExtractor.UNKNOWN_VULNERABILITY_SEVERITY, factors.get(RiskModel.VULNERABILITY_SEVERITY));
        assertEquals(1.0, factors.get(RiskModel.EVIDENCE_COMPLETENESS));
        assertEquals(1.0, factors.get(RiskModel.COMPLIANCE_IMPACT));
    }

    @Test
    @DisplayName("should let caller-supplied factors override derived ones")
    void shouldPreferSuppliedFactors() {
        DeploymentIntent intent = TestIntents.intent(CorrelationId.generate(CorrelationIdType.DEPLOYMENT),
            Ring.CANARY, Map.of(RiskModel.BLAST_RADIUS, 0.9, "custom_factor", 0.4), null, "intune");

        Map<String, Double> factors = extractor.extract(intent);

        assertEquals(0.9, factors.get(RiskModel.BLAST_RADIUS));
        assertEquals(0.4, factors.get("custom_factor"));
    }

    @Test
    @DisplayName("should count missing completeness fields as a fraction")
    void shouldComputeEvidenceGap() {
        EvidencePack base = TestIntents.completeEvidence();
        EvidencePack partial = new EvidencePack(base.artifactHash(), base.signature(), true, null,
            null, base.rollback(), base.installTests());
        DeploymentIntent template = TestIntents.intent(Ring.PILOT, "intune");
        DeploymentIntent intent = new DeploymentIntent(template.correlationId(), template.appId(),
            template.version(), Ring.PILOT, template.targetScope(), template.publisherId(), template.connectors(),
            List.of(), Map.of(), template.rollbackPlan(), null, partial, template.action(), false, List.of("pci"));

        Map<String, Double> factors = extractor.extract(intent);

        assertEquals(0.5, factors.get(RiskModel.EVIDENCE_COMPLETENESS));
        assertEquals(0.4, factors.get(RiskModel.BLAST_RADIUS));
        assertEquals(0.7, factors.get(RiskModel.COMPLIANCE_IMPACT));
    }
}
