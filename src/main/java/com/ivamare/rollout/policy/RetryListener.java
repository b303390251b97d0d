package com.ivamare.rollout.policy;

import java.time.Duration;

/**
 * Callback invoked each time the retry executor schedules another attempt.
 */
@FunctionalInterface
public interface RetryListener {

    RetryListener NOOP = (operation, attempt, delay, failure) -> { };

    /**
     * @param operation Name of the operation being retried
     * @param attempt The attempt that failed (1-based)
     * @param delay Backoff before the next attempt
     * @param failure The transient failure
     */
    void onRetry(String operation, int attempt, Duration delay, Throwable failure);
}
