package com.ivamare.rollout.model;

/**
 * Status of one connector dispatch call.
 */
public enum OperationStatus {
    PUBLISHED,
    REMOVED,
    QUERIED,
    /** A concurrent caller registered the same operation first and has not recorded a result yet */
    IN_PROGRESS,
    ERROR;

    public boolean isSuccess() {
        return this == PUBLISHED || this == REMOVED || this == QUERIED;
    }
}
