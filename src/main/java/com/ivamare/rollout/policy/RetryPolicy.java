package com.ivamare.rollout.policy;

import java.time.Duration;
import java.util.Objects;

/**
 * Policy for retrying transient connector failures.
 *
 * <p>The delay before retry {@code n} (1-based, counted after the n-th failed
 * attempt) is {@code min(maxDelay, baseDelay * 2^(n-1))}, so delays never
 * decrease.
 *
 * @param maxAttempts Maximum number of attempts, including the first
 * @param baseDelay Delay before the first retry
 * @param maxDelay Upper bound for any single delay
 */
public record RetryPolicy(
    int maxAttempts,
    Duration baseDelay,
    Duration maxDelay
) {

    private static final int MAX_EXPONENT = 30;

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, was " + maxAttempts);
        }
        Objects.requireNonNull(baseDelay, "baseDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("delays must not be negative");
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay");
        }
    }

    /**
     * Default retry policy: 5 attempts, 500ms base delay, 30s cap.
     *
     * @return Default retry policy
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(5, Duration.ofMillis(500), Duration.ofSeconds(30));
    }

    /**
     * Create a policy with no retries.
     *
     * @return No retry policy
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO);
    }

    /**
     * Get the backoff delay after a failed attempt.
     *
     * @param attempt The attempt that just failed (1-based)
     * @return Delay before the next attempt, or zero if no more attempts are allowed
     */
    public Duration getBackoff(int attempt) {
        if (attempt < 1 || !shouldRetry(attempt)) {
            return Duration.ZERO;
        }
        int exponent = Math.min(attempt - 1, MAX_EXPONENT);
        long multiplier = 1L << exponent;
        long baseMillis = baseDelay.toMillis();
        if (baseMillis > 0 && multiplier > maxDelay.toMillis() / baseMillis) {
            return maxDelay;
        }
        Duration delay = Duration.ofMillis(baseMillis * multiplier);
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }

    /**
     * Check if another attempt is allowed.
     *
     * @param attempt The attempt that just failed (1-based)
     * @return true if more attempts are allowed
     */
    public boolean shouldRetry(int attempt) {
        return attempt < maxAttempts;
    }
}
