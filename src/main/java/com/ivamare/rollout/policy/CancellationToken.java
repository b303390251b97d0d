package com.ivamare.rollout.policy;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal for an in-flight promotion or rollback.
 *
 * <p>Once cancelled, no new retries are scheduled and no further ring is
 * entered. Calls already running against a backend are left to complete so
 * the audit log matches what backends executed.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
