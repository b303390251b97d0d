package com.ivamare.rollout.support;

import com.ivamare.rollout.evidence.EvidencePack;
import com.ivamare.rollout.model.CorrelationId;
import com.ivamare.rollout.model.CorrelationIdType;
import com.ivamare.rollout.model.DeploymentAction;
import com.ivamare.rollout.model.DeploymentIntent;
import com.ivamare.rollout.model.Ring;
import com.ivamare.rollout.model.RollbackPlan;
import com.ivamare.rollout.model.TargetScope;

import java.util.List;
import java.util.Map;

/**
 * Intents and evidence packs shared by the tests.
 */
public final class TestIntents {

    public static final String APP_ID = "contoso-agent";
    public static final String PUBLISHER = "packaging-team";

    private TestIntents() {}

    public static EvidencePack completeEvidence() {
        return new EvidencePack(
            "sha256:0f1e2d",
            "sig-001",
            true,
            "sbom://contoso-agent/2.1.0",
            new EvidencePack.VulnerabilityScan(0, 1, 3, "pass"),
            new EvidencePack.RollbackEvidence(true, "2.0.0"),
            new EvidencePack.InstallTestResults(12, 0)
        );
    }

    public static RollbackPlan validatedRollbackPlan() {
        return new RollbackPlan(true, "2.0.0", "msiexec /x {APP}", "registry:HKLM\\Software\\Contoso", "fix.ps1");
    }

    public static DeploymentIntent intent(Ring ring, String... connectors) {
        return intent(CorrelationId.generate(CorrelationIdType.DEPLOYMENT), ring, Map.of(), null, connectors);
    }

    public static DeploymentIntent intent(CorrelationId id, Ring ring, Map<String, Double> riskFactors,
                                          String cabApprovalId, String... connectors) {
        return new DeploymentIntent(
            id,
            APP_ID,
            "2.1.0",
            ring,
            new TargetScope("corp", "finance", "*"),
            PUBLISHER,
            List.of(connectors),
            List.of(),
            riskFactors,
            validatedRollbackPlan(),
            cabApprovalId,
            completeEvidence(),
            DeploymentAction.INSTALL,
            false,
            List.of()
        );
    }
}
