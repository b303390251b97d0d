package com.ivamare.rollout.policy;

import com.ivamare.rollout.exception.RetryExhaustedException;
import com.ivamare.rollout.model.ErrorClassification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Executes a call under a {@link RetryPolicy}, retrying only failures the
 * {@link ErrorClassifier} marks transient.
 *
 * <p>Backoff sleeps happen on the calling thread and hold no locks. A
 * cancelled token stops the next retry from being scheduled; it never
 * interrupts an attempt already running.
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final RetryPolicy policy;
    private final ErrorClassifier classifier;
    private final Sleeper sleeper;

    public RetryExecutor(RetryPolicy policy, ErrorClassifier classifier, Sleeper sleeper) {
        this.policy = policy;
        this.classifier = classifier;
        this.sleeper = sleeper;
    }

    public RetryExecutor(RetryPolicy policy, ErrorClassifier classifier) {
        this(policy, classifier, Sleeper.threadSleep());
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    public ErrorClassifier getClassifier() {
        return classifier;
    }

    /**
     * Run the call, retrying transient failures.
     *
     * @param operation Operation name for logging
     * @param call The call to run
     * @param cancellation Cooperative cancellation signal
     * @param listener Notified before every backoff
     * @param <T> Result type
     * @return The outcome, never throws for call failures
     */
    public <T> Outcome<T> execute(String operation, Callable<T> call,
                                  CancellationToken cancellation, RetryListener listener) {
        int attempt = 0;
        while (true) {
            attempt++;
            Throwable failure;
            try {
                T value = call.call();
                if (attempt > 1) {
                    log.debug("{} succeeded on attempt {}/{}", operation, attempt, policy.maxAttempts());
                }
                return Outcome.success(value, attempt);
            } catch (Exception e) {
                failure = e;
            }

            ErrorClassification classification = classifier.classify(failure);
            if (!classification.isRetryable()) {
                log.debug("{} failed with {} error on attempt {}: {}",
                    operation, classification, attempt, failure.getMessage());
                return Outcome.failure(failure, classification, attempt, false, false);
            }

            if (!policy.shouldRetry(attempt)) {
                log.warn("{} exhausted {} attempts: {}", operation, attempt, classifier.getReason(failure));
                return Outcome.failure(new RetryExhaustedException(operation, attempt, failure),
                    classification, attempt, true, false);
            }

            if (cancellation.isCancelled()) {
                log.info("{} cancelled after attempt {}, not retrying", operation, attempt);
                return Outcome.failure(failure, classification, attempt, false, true);
            }

            Duration delay = policy.getBackoff(attempt);
            listener.onRetry(operation, attempt, delay, failure);
            log.debug("{} transient failure on attempt {}/{} ({}), retrying in {}ms",
                operation, attempt, policy.maxAttempts(), classifier.getReason(failure), delay.toMillis());
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("{} interrupted during backoff", operation);
                return Outcome.failure(failure, classification, attempt, false, true);
            }
        }
    }

    /**
     * Result of a retried call.
     *
     * @param value Call result on success (nullable)
     * @param failure Last failure, or null on success
     * @param classification Classification of the failure, or null on success
     * @param attempts Number of attempts made
     * @param exhausted Whether transient failures used up every attempt
     * @param cancelled Whether cancellation or interruption stopped the retries
     * @param <T> Result type
     */
    public record Outcome<T>(
        T value,
        Throwable failure,
        ErrorClassification classification,
        int attempts,
        boolean exhausted,
        boolean cancelled
    ) {

        static <T> Outcome<T> success(T value, int attempts) {
            return new Outcome<>(value, null, null, attempts, false, false);
        }

        static <T> Outcome<T> failure(Throwable failure, ErrorClassification classification,
                                      int attempts, boolean exhausted, boolean cancelled) {
            return new Outcome<>(null, failure, classification, attempts, exhausted, cancelled);
        }

        public boolean isSuccess() {
            return failure == null;
        }
    }
}
