package com.ivamare.rollout.connector;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.rollout.exception.ConnectorCallException;
import com.ivamare.rollout.exception.InvalidOperationException;
import com.ivamare.rollout.exception.OperationCancelledException;
import com.ivamare.rollout.exception.RolloutException;
import com.ivamare.rollout.governance.GovernanceNotifier;
import com.ivamare.rollout.governance.PolicyViolationEvent;
import com.ivamare.rollout.model.AuditEvent;
import com.ivamare.rollout.model.AuditEventType;
import com.ivamare.rollout.model.ConnectorOperationResult;
import com.ivamare.rollout.model.CorrelationId;
import com.ivamare.rollout.model.DeploymentIntent;
import com.ivamare.rollout.model.ErrorClassification;
import com.ivamare.rollout.model.OperationKey;
import com.ivamare.rollout.model.OperationStatus;
import com.ivamare.rollout.model.OperationType;
import com.ivamare.rollout.policy.CancellationToken;
import com.ivamare.rollout.policy.RetryExecutor;
import com.ivamare.rollout.policy.RetryListener;
import com.ivamare.rollout.repository.AuditRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Executes connector operations exactly once per correlation ID and
 * operation key.
 *
 * <p>Every publish and remove first registers its key in the
 * {@link AuditRepository}. Only the caller that wins the registration calls
 * the backend; everyone else gets the recorded result replayed, or
 * {@code IN_PROGRESS} while the first call is still running. Backend calls
 * run under the retry executor, the per-connector rate limiter and a call
 * timeout. The timeout itself counts as a transient failure. A call that
 * times out before it started is cancelled and never reaches the backend;
 * one that was already running is left to finish, and its late result is
 * recorded as {@code CONNECTOR_LATE_RESULT} under the same operation key.
 *
 * <p>Calls to several connectors for one intent are issued concurrently
 * and joined before returning.
 */
public class ConnectorDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ConnectorDispatcher.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ConnectorRegistry registry;
    private final AuditRepository auditRepository;
    private final RetryExecutor retryExecutor;
    private final ConnectorRateLimiter rateLimiter;
    private final GovernanceNotifier governanceNotifier;
    private final ExecutorService executor;
    private final Function<String, Duration> callTimeouts;
    private final ObjectMapper objectMapper;

    public ConnectorDispatcher(
            ConnectorRegistry registry,
            AuditRepository auditRepository,
            RetryExecutor retryExecutor,
            ConnectorRateLimiter rateLimiter,
            GovernanceNotifier governanceNotifier,
            ExecutorService executor,
            Function<String, Duration> callTimeouts,
            ObjectMapper objectMapper) {
        this.registry = registry;
        this.auditRepository = auditRepository;
        this.retryExecutor = retryExecutor;
        this.rateLimiter = rateLimiter;
        this.governanceNotifier = governanceNotifier;
        this.executor = executor;
        this.callTimeouts = callTimeouts;
        this.objectMapper = objectMapper;
    }

    public ConnectorRegistry getRegistry() {
        return registry;
    }

    /**
     * Publish an intent to every connector it names.
     *
     * @param intent The intent
     * @param actor Who requested the publish
     * @param cancellation Stops further retries when cancelled
     * @return One result per connector, in the intent's connector order
     */
    public List<ConnectorOperationResult> publish(DeploymentIntent intent, String actor,
                                                  CancellationToken cancellation) {
        return publish(intent, List.of(), actor, cancellation);
    }

    /**
     * Publish an intent to every connector it names, with extra operation key
     * qualifiers so repeated dispatches under one correlation ID (rollback
     * re-dispatch rounds) stay distinct.
     *
     * @param intent The intent
     * @param keyQualifiers Appended to {@code PUBLISH:<ring>:<connector>}
     * @param actor Who requested the publish
     * @param cancellation Stops further retries when cancelled
     * @return One result per connector, in the intent's connector order
     */
    public List<ConnectorOperationResult> publish(DeploymentIntent intent, List<String> keyQualifiers,
                                                  String actor, CancellationToken cancellation) {
        if (intent.connectors().isEmpty()) {
            throw new InvalidOperationException("Intent " + intent.correlationId() + " names no connectors");
        }
        for (String name : intent.connectors()) {
            registry.require(name, ConnectorCapability.PUBLISH);
        }

        List<Future<ConnectorOperationResult>> futures = new ArrayList<>();
        for (String name : intent.connectors()) {
            futures.add(executor.submit(withMdc(() -> publish(name, intent, keyQualifiers, actor, cancellation))));
        }
        List<ConnectorOperationResult> results = new ArrayList<>();
        for (Future<ConnectorOperationResult> future : futures) {
            results.add(join(future, "publish " + intent.correlationId()));
        }
        return results;
    }

    /**
     * Publish an intent to one connector.
     */
    public ConnectorOperationResult publish(String connectorName, DeploymentIntent intent,
                                            List<String> keyQualifiers, String actor,
                                            CancellationToken cancellation) {
        Connector connector = registry.require(connectorName, ConnectorCapability.PUBLISH);
        OperationKey key = publishKey(intent, connectorName, keyQualifiers);
        return dispatchOnce(intent.correlationId(), key, connectorName, OperationStatus.PUBLISHED,
            actor, cancellation, () -> connector.publish(intent, intent.correlationId()));
    }

    /**
     * Remove a backend resource through one connector.
     *
     * @param connectorName Connector name
     * @param resourceId Backend resource ID
     * @param correlationId Correlation ID of the removal
     * @param actor Who requested the removal
     * @param cancellation Stops further retries when cancelled
     * @return The result
     */
    public ConnectorOperationResult remove(String connectorName, String resourceId, CorrelationId correlationId,
                                           String actor, CancellationToken cancellation) {
        Connector connector = registry.require(connectorName, ConnectorCapability.REMOVE);
        OperationKey key = OperationKey.of(OperationType.REMOVE, connectorName, encodeQualifier(resourceId));
        return dispatchOnce(correlationId, key, connectorName, OperationStatus.REMOVED,
            actor, cancellation, () -> connector.remove(resourceId, correlationId));
    }

    /**
     * Query device states for a correlation ID.
     *
     * @param correlationId The correlation ID
     * @param connectorName Single connector to query (nullable)
     * @param connectors Connectors to query when no single one is named; empty means all registered
     * @return Per-connector reports plus the connectors that could not be queried
     */
    public AggregatedStatus getStatus(CorrelationId correlationId, String connectorName,
                                      Collection<String> connectors) {
        List<String> names;
        if (connectorName != null) {
            names = List.of(connectorName);
        } else if (connectors == null || connectors.isEmpty()) {
            names = List.copyOf(registry.names());
        } else {
            names = List.copyOf(connectors);
        }

        Map<String, Future<RetryExecutor.Outcome<ConnectorStatusReport>>> futures = new LinkedHashMap<>();
        for (String name : names) {
            Connector connector = registry.require(name, ConnectorCapability.STATUS);
            futures.put(name, executor.submit(withMdc(() -> retryExecutor.execute(
                "status " + name,
                () -> timed(name, () -> connector.getStatus(correlationId), true, null),
                CancellationToken.none(),
                RetryListener.NOOP))));
        }

        Map<String, ConnectorStatusReport> reports = new LinkedHashMap<>();
        Map<String, String> errors = new LinkedHashMap<>();
        for (Map.Entry<String, Future<RetryExecutor.Outcome<ConnectorStatusReport>>> entry : futures.entrySet()) {
            RetryExecutor.Outcome<ConnectorStatusReport> outcome = join(entry.getValue(), "status " + correlationId);
            if (outcome.isSuccess()) {
                reports.put(entry.getKey(), outcome.value());
            } else {
                log.warn("Status query for {} failed on {}: {}",
                    correlationId, entry.getKey(), outcome.failure().getMessage());
                errors.put(entry.getKey(), outcome.classification() + ": " + outcome.failure().getMessage());
            }
        }
        return new AggregatedStatus(correlationId.value(), reports, errors);
    }

    /**
     * Check the health of every registered connector. A connector that throws
     * or does not answer within its call timeout is DOWN.
     *
     * @return Connector name to health, in registration order
     */
    public Map<String, ConnectorHealth> healthCheck() {
        Map<String, ConnectorHealth> health = new LinkedHashMap<>();
        for (Connector connector : registry.all()) {
            if (!connector.supports(ConnectorCapability.HEALTH)) {
                continue;
            }
            try {
                health.put(connector.name(), timed(connector.name(), connector::healthCheck, false, null));
            } catch (Exception e) {
                if (e instanceof OperationCancelledException) {
                    throw (OperationCancelledException) e;
                }
                log.warn("Health check failed for connector {}: {}", connector.name(), e.getMessage());
                health.put(connector.name(), ConnectorHealth.down(connector.name(), e.getMessage()));
            }
        }
        return health;
    }

    /**
     * Operation key for a publish: {@code PUBLISH:<ring>:<connector>[:qualifier...]}.
     */
    public static OperationKey publishKey(DeploymentIntent intent, String connectorName, List<String> qualifiers) {
        List<String> parts = new ArrayList<>();
        parts.add(intent.targetRing().name());
        parts.add(connectorName);
        parts.addAll(qualifiers);
        return new OperationKey(OperationType.PUBLISH, parts);
    }

    private ConnectorOperationResult dispatchOnce(CorrelationId correlationId, OperationKey key,
                                                  String connectorName, OperationStatus successStatus,
                                                  String actor, CancellationToken cancellation,
                                                  Callable<ConnectorOperationResult> call) {
        if (!auditRepository.register(correlationId, key)) {
            log.debug("Duplicate {} for {}, replaying recorded result", key, correlationId);
            return replay(correlationId, key, connectorName);
        }

        RetryExecutor.Outcome<ConnectorOperationResult> outcome = retryExecutor.execute(
            connectorName + " " + key.value(),
            () -> timed(connectorName, call, true,
                (value, failure) -> recordLateResult(correlationId, key, connectorName, actor, value, failure)),
            cancellation,
            (operation, attempt, delay, failure) -> auditRepository.append(correlationId,
                AuditEventType.RETRY_SCHEDULED, actor, retryPayload(connectorName, key, attempt, delay, failure))
        );

        ConnectorOperationResult result = toResult(correlationId, key, connectorName, successStatus, outcome);
        auditRepository.append(correlationId, AuditEventType.CONNECTOR_RESULT, actor, toPayload(result));

        if (result.errorClassification() == ErrorClassification.POLICY_VIOLATION) {
            List<String> violations = List.of("BACKEND_POLICY_REJECTION: " + result.errorMessage());
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("source", connectorName);
            payload.put("operation_key", key.value());
            payload.put("violations", violations);
            auditRepository.append(correlationId, AuditEventType.POLICY_VIOLATION, actor, payload);
            governanceNotifier.notify(new PolicyViolationEvent(
                correlationId.value(), connectorName, violations, actor, Instant.now()));
        }

        if (result.isSuccess()) {
            log.info("{} on {} succeeded for {} after {} attempt(s){}", key.type(), connectorName,
                correlationId, result.attempts(), result.duplicate() ? " (backend duplicate)" : "");
        } else {
            log.warn("{} on {} failed for {} with {}: {}", key.type(), connectorName,
                correlationId, result.errorClassification(), result.errorMessage());
        }
        return result;
    }

    private ConnectorOperationResult toResult(CorrelationId correlationId, OperationKey key, String connectorName,
                                              OperationStatus successStatus,
                                              RetryExecutor.Outcome<ConnectorOperationResult> outcome) {
        if (outcome.isSuccess()) {
            return outcome.value().withExecution(key, outcome.attempts());
        }
        Throwable failure = outcome.failure();
        if (retryExecutor.getClassifier().isDuplicate(failure)) {
            return ConnectorOperationResult.success(successStatus, correlationId, connectorName, List.of())
                .withExecution(key, outcome.attempts())
                .asDuplicate();
        }
        String message = outcome.cancelled()
            ? "cancelled before retry: " + failure.getMessage()
            : failure.getMessage();
        return ConnectorOperationResult.error(correlationId, connectorName, key,
            outcome.classification(), message, outcome.attempts());
    }

    private ConnectorOperationResult replay(CorrelationId correlationId, OperationKey key, String connectorName) {
        List<AuditEvent> events = auditRepository.getEvents(correlationId);
        for (int i = events.size() - 1; i >= 0; i--) {
            AuditEvent event = events.get(i);
            if (AuditEventType.CONNECTOR_RESULT.equals(event.eventType())
                    && key.value().equals(event.payload().get("operation_key"))) {
                return objectMapper.convertValue(event.payload(), ConnectorOperationResult.class).asReplay();
            }
        }
        return ConnectorOperationResult.inProgress(correlationId, connectorName, key);
    }

    private void recordLateResult(CorrelationId correlationId, OperationKey key, String connectorName,
                                  String actor, ConnectorOperationResult value, Throwable failure) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("connector", connectorName);
        payload.put("operation_key", key.value());
        if (failure == null && value != null) {
            payload.put("status", value.status().name());
            payload.put("backend_ids", value.backendIds());
            log.warn("{} on {} for {} completed after its timeout with {}",
                key.type(), connectorName, correlationId, value.status());
        } else {
            payload.put("status", OperationStatus.ERROR.name());
            payload.put("error_classification", retryExecutor.getClassifier().classify(failure).name());
            payload.put("error_message", failure != null ? failure.getMessage() : null);
            log.warn("{} on {} for {} failed after its timeout: {}",
                key.type(), connectorName, correlationId, failure != null ? failure.getMessage() : "no result");
        }
        auditRepository.append(correlationId, AuditEventType.CONNECTOR_LATE_RESULT, actor, payload);
    }

    /**
     * Run one backend call under the connector's call timeout.
     *
     * <p>The rate-limit permit is taken on the calling thread before the call
     * is handed to the executor, so the call only ever runs holding a permit.
     *
     * @param lateResult Receives the outcome of a call that finished after its
     *        timeout was reported (nullable for read-only calls)
     */
    private <T> T timed(String connectorName, Callable<T> call, boolean rateLimited,
                        BiConsumer<T, Throwable> lateResult) throws Exception {
        Duration timeout = callTimeouts.apply(connectorName);
        ConnectorRateLimiter.Permit permit = rateLimited ? rateLimiter.acquire(connectorName) : null;
        TimedCall<T> timedCall = new TimedCall<>(connectorName, call, permit, lateResult);
        Future<T> future = submit(timedCall, permit);
        try {
            return unwrap(() -> future.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            switch (timedCall.abandon()) {
                case NOT_STARTED -> {
                    future.cancel(false);
                    releaseQuietly(permit);
                    log.warn("Call to connector {} timed out after {}ms before it started",
                        connectorName, timeout.toMillis());
                }
                case RUNNING -> log.warn("Call to connector {} timed out after {}ms and is left to finish",
                    connectorName, timeout.toMillis());
                case FINISHED -> {
                    return unwrap(future::get);
                }
            }
            throw new ConnectorCallException(connectorName, ErrorClassification.TRANSIENT, null,
                "call timed out after " + timeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            if (timedCall.abandon() == TimedCall.State.NOT_STARTED) {
                future.cancel(false);
                releaseQuietly(permit);
            }
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("call to connector " + connectorName);
        }
    }

    private <T> Future<T> submit(TimedCall<T> timedCall, ConnectorRateLimiter.Permit permit) {
        try {
            return executor.submit(withMdc(timedCall));
        } catch (RuntimeException e) {
            releaseQuietly(permit);
            throw e;
        }
    }

    private static <T> T unwrap(FutureGet<T> get) throws Exception {
        try {
            return get.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) {
                throw ex;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new RolloutException("Connector call failed", cause);
        }
    }

    private static void releaseQuietly(ConnectorRateLimiter.Permit permit) {
        if (permit != null) {
            permit.close();
        }
    }

    @FunctionalInterface
    private interface FutureGet<T> {
        T get() throws ExecutionException, InterruptedException, TimeoutException;
    }

    /**
     * A backend call that can be abandoned by its caller. Exactly one of the
     * caller and the call decides what happens to the result: the caller
     * when the call finished in time, the late-result handler otherwise.
     */
    private static final class TimedCall<T> implements Callable<T> {

        enum State { NOT_STARTED, RUNNING, FINISHED, ABANDONED_BEFORE_START, ABANDONED_WHILE_RUNNING }

        private final String connectorName;
        private final Callable<T> call;
        private final ConnectorRateLimiter.Permit permit;
        private final BiConsumer<T, Throwable> lateResult;
        private final AtomicReference<State> state = new AtomicReference<>(State.NOT_STARTED);

        TimedCall(String connectorName, Callable<T> call, ConnectorRateLimiter.Permit permit,
                  BiConsumer<T, Throwable> lateResult) {
            this.connectorName = connectorName;
            this.call = call;
            this.permit = permit;
            this.lateResult = lateResult;
        }

        @Override
        public T call() throws Exception {
            if (!state.compareAndSet(State.NOT_STARTED, State.RUNNING)) {
                return null;
            }
            try {
                T value = call.call();
                finish(value, null);
                return value;
            } catch (Exception e) {
                finish(null, e);
                throw e;
            } finally {
                releaseQuietly(permit);
            }
        }

        /**
         * Give up waiting for the call.
         *
         * @return NOT_STARTED if the call will never run, RUNNING if it is
         *         still running and will report late, FINISHED if it already
         *         completed and its result can be collected normally
         */
        State abandon() {
            if (state.compareAndSet(State.NOT_STARTED, State.ABANDONED_BEFORE_START)) {
                return State.NOT_STARTED;
            }
            if (state.compareAndSet(State.RUNNING, State.ABANDONED_WHILE_RUNNING)) {
                return State.RUNNING;
            }
            return state.get() == State.FINISHED ? State.FINISHED : State.RUNNING;
        }

        private void finish(T value, Throwable failure) {
            if (state.compareAndSet(State.RUNNING, State.FINISHED)) {
                return;
            }
            if (lateResult == null) {
                log.debug("Late result from connector {} discarded", connectorName);
                return;
            }
            try {
                lateResult.accept(value, failure);
            } catch (RuntimeException e) {
                log.error("Failed to record late result from connector {}", connectorName, e);
            }
        }
    }

    private <T> T join(Future<T> future, String operation) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new RolloutException("Failed to " + operation, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException(operation);
        }
    }

    private Map<String, Object> toPayload(ConnectorOperationResult result) {
        return objectMapper.convertValue(result, MAP_TYPE);
    }

    private Map<String, Object> retryPayload(String connectorName, OperationKey key, int attempt,
                                             Duration delay, Throwable failure) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("connector", connectorName);
        payload.put("operation_key", key.value());
        payload.put("attempt", attempt);
        payload.put("delay_ms", delay.toMillis());
        payload.put("reason", retryExecutor.getClassifier().getReason(failure));
        return payload;
    }

    public static String encodeQualifier(String value) {
        return value.replace("%", "%25").replace(":", "%3A");
    }

    private static <T> Callable<T> withMdc(Callable<T> task) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (context != null) {
                MDC.setContextMap(context);
            } else {
                MDC.clear();
            }
            try {
                return task.call();
            } finally {
                if (previous != null) {
                    MDC.setContextMap(previous);
                } else {
                    MDC.clear();
                }
            }
        };
    }
}
