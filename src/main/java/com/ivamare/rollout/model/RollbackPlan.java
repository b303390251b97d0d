package com.ivamare.rollout.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Rollback plan attached to a deployment intent.
 *
 * @param validated Whether the plan was exercised and signed off
 * @param previousVersion Version retained for version-pin/supersede (nullable)
 * @param uninstallCommand Command used for targeted uninstall (nullable)
 * @param detectionRule Rule the backend uses to detect the installed state (nullable)
 * @param remediationScript Script deployed by the remediation strategy (nullable)
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RollbackPlan(
    boolean validated,
    String previousVersion,
    String uninstallCommand,
    String detectionRule,
    String remediationScript
) {

    public static RollbackPlan none() {
        return new RollbackPlan(false, null, null, null, null);
    }

    public boolean hasPreviousVersion() {
        return previousVersion != null && !previousVersion.isBlank();
    }

    public boolean hasUninstallCommand() {
        return uninstallCommand != null && !uninstallCommand.isBlank();
    }

    public boolean hasRemediationScript() {
        return remediationScript != null && !remediationScript.isBlank();
    }

    /**
     * A detection rule is valid when present and of the form {@code kind:expression},
     * e.g. {@code registry:HKLM\Software\App} or {@code file:/opt/app/version}.
     */
    public boolean hasValidDetectionRule() {
        if (detectionRule == null) {
            return false;
        }
        int sep = detectionRule.indexOf(':');
        return sep > 0 && sep < detectionRule.length() - 1;
    }
}
