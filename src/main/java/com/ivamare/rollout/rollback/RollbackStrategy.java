package com.ivamare.rollout.rollback;

import com.ivamare.rollout.connector.ConnectorCapability;
import com.ivamare.rollout.model.DeploymentAction;

/**
 * How a deployment is rolled back. Each strategy needs a matching connector
 * capability.
 */
public enum RollbackStrategy {
    /** Supersede with the retained previous version */
    VERSION_PIN(ConnectorCapability.VERSION_PIN, DeploymentAction.SUPERSEDE),
    /** Run the uninstall command on the affected devices */
    TARGETED_UNINSTALL(ConnectorCapability.TARGETED_UNINSTALL, DeploymentAction.UNINSTALL),
    /** Deploy a remediation script */
    REMEDIATION_SCRIPT(ConnectorCapability.REMEDIATION_SCRIPT, DeploymentAction.REMEDIATE);

    private final ConnectorCapability requiredCapability;
    private final DeploymentAction action;

    RollbackStrategy(ConnectorCapability requiredCapability, DeploymentAction action) {
        this.requiredCapability = requiredCapability;
        this.action = action;
    }

    public ConnectorCapability requiredCapability() {
        return requiredCapability;
    }

    public DeploymentAction action() {
        return action;
    }
}
