package com.ivamare.rollout.connector;

/**
 * Connector health.
 */
public enum HealthState {
    READY,
    DEGRADED,
    DOWN
}
