package com.ivamare.rollout.model;

/**
 * Successively larger device cohorts. Declaration order is the default
 * promotion order; the configured ring sequence may be a subset.
 */
public enum Ring {
    LAB,
    CANARY,
    PILOT,
    DEPARTMENT,
    GLOBAL
}
