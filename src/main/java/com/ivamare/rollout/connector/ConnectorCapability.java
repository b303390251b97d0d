package com.ivamare.rollout.connector;

/**
 * Operations and rollback strategies a connector supports.
 */
public enum ConnectorCapability {
    PUBLISH,
    REMOVE,
    STATUS,
    HEALTH,
    /** Can supersede an install with a pinned earlier version */
    VERSION_PIN,
    /** Can run a targeted uninstall command */
    TARGETED_UNINSTALL,
    /** Can deploy a remediation script */
    REMEDIATION_SCRIPT
}
