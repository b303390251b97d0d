package com.ivamare.rollout.rollback;

/**
 * Final state of a rollback.
 */
public enum RollbackOutcome {
    /** Desired state observed on every target device */
    CONVERGED,
    /** Some devices converged, the rest did not within the re-dispatch limit */
    PARTIAL,
    /** No device converged, or the rollback could not be dispatched at all */
    FAILED,
    /** Stopped by a cancellation signal before convergence */
    CANCELLED
}
