package com.ivamare.rollout.connector;

import com.ivamare.rollout.exception.ConnectorCallException;
import com.ivamare.rollout.model.ErrorClassification;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Per-connector admission control: a semaphore bounds concurrent calls and a
 * Bucket4j token bucket bounds the request rate.
 *
 * <p>Failing to get a permit within the maximum wait is reported as a
 * transient {@link ConnectorCallException}, so the call is retried like any
 * other rate-limit rejection.
 */
public class ConnectorRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(ConnectorRateLimiter.class);

    /**
     * Limits for one connector.
     *
     * @param maxConcurrency Maximum concurrent calls
     * @param requestsPerSecond Sustained request rate (also the burst capacity)
     */
    public record Limits(int maxConcurrency, int requestsPerSecond) {

        public Limits {
            if (maxConcurrency < 1 || requestsPerSecond < 1) {
                throw new IllegalArgumentException("Connector limits must be positive");
            }
        }
    }

    private final Function<String, Limits> limitsLookup;
    private final Duration maxWait;
    private final Map<String, Semaphore> semaphores = new ConcurrentHashMap<>();
    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();

    /**
     * @param limitsLookup Limits per connector name
     * @param maxWait Longest a caller waits for a permit or a token
     */
    public ConnectorRateLimiter(Function<String, Limits> limitsLookup, Duration maxWait) {
        this.limitsLookup = limitsLookup;
        this.maxWait = maxWait;
    }

    /**
     * Acquire a permit for one call. Close the permit when the call returns.
     *
     * @param connector Connector name
     * @return Permit that releases the concurrency slot on close
     * @throws ConnectorCallException (transient) if no permit is available in time
     * @throws InterruptedException if interrupted while waiting
     */
    public Permit acquire(String connector) throws InterruptedException {
        Semaphore semaphore = semaphores.computeIfAbsent(connector,
            name -> new Semaphore(limitsLookup.apply(name).maxConcurrency(), true));
        if (!semaphore.tryAcquire(maxWait.toMillis(), TimeUnit.MILLISECONDS)) {
            log.debug("Concurrency limit reached for connector {}", connector);
            throw new ConnectorCallException(connector, ErrorClassification.TRANSIENT, null,
                "concurrency limit reached");
        }
        boolean consumed = false;
        try {
            consumed = bucketFor(connector).asBlocking().tryConsume(1, maxWait);
        } finally {
            if (!consumed) {
                semaphore.release();
            }
        }
        if (!consumed) {
            log.debug("Rate limit reached for connector {}", connector);
            throw new ConnectorCallException(connector, ErrorClassification.TRANSIENT, null,
                "rate limit reached");
        }
        return new Permit(semaphore);
    }

    /**
     * Tokens currently available for a connector.
     */
    public long getAvailableTokens(String connector) {
        return bucketFor(connector).getAvailableTokens();
    }

    private Bucket bucketFor(String connector) {
        return buckets.computeIfAbsent(connector, this::createBucket);
    }

    private Bucket createBucket(String connector) {
        int rate = limitsLookup.apply(connector).requestsPerSecond();
        return Bucket.builder()
            .addLimit(Bandwidth.builder()
                .capacity(rate)
                .refillGreedy(rate, Duration.ofSeconds(1))
                .build())
            .build();
    }

    /**
     * A held concurrency slot.
     */
    public static final class Permit implements AutoCloseable {

        private final Semaphore semaphore;
        private boolean released;

        private Permit(Semaphore semaphore) {
            this.semaphore = semaphore;
        }

        @Override
        public synchronized void close() {
            if (!released) {
                released = true;
                semaphore.release();
            }
        }
    }
}
