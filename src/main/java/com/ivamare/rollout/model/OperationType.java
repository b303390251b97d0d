package com.ivamare.rollout.model;

/**
 * Mutating operations tracked by the idempotency store.
 */
public enum OperationType {
    /** Deployment intent submission */
    SUBMIT,

    /** Connector publish call */
    PUBLISH,

    /** Connector remove call */
    REMOVE,

    /** Ring promotion */
    PROMOTE,

    /** Rollback initiation */
    ROLLBACK,

    /** CAB decision recording */
    CAB_DECISION
}
