package com.ivamare.rollout.policy;

import java.time.Duration;

/**
 * Blocks the awaiting call for a backoff delay. Holds no locks.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper threadSleep() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
