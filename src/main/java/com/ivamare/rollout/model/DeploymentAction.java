package com.ivamare.rollout.model;

/**
 * What a publish call asks the backend to do with the app version.
 */
public enum DeploymentAction {
    /** Regular install of the intent's version */
    INSTALL,

    /** Pin devices to an earlier version, superseding the current one */
    SUPERSEDE,

    /** Run the rollback plan's uninstall command */
    UNINSTALL,

    /** Deploy the rollback plan's remediation script */
    REMEDIATE
}
