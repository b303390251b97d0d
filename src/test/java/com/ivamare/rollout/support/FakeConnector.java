package com.ivamare.rollout.support;

import com.ivamare.rollout.connector.Connector;
import com.ivamare.rollout.connector.ConnectorCapability;
import com.ivamare.rollout.connector.ConnectorHealth;
import com.ivamare.rollout.connector.ConnectorStatusReport;
import com.ivamare.rollout.connector.DeviceState;
import com.ivamare.rollout.model.ConnectorOperationResult;
import com.ivamare.rollout.model.CorrelationId;
import com.ivamare.rollout.model.DeploymentIntent;
import com.ivamare.rollout.model.OperationStatus;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Scriptable in-process connector. Records every backend call it receives.
 */
public class FakeConnector implements Connector {

    private final String name;
    private final Set<ConnectorCapability> capabilities;
    private final AtomicInteger publishCalls = new AtomicInteger();
    private final AtomicInteger removeCalls = new AtomicInteger();
    private final List<DeploymentIntent> published = new CopyOnWriteArrayList<>();
    private final Queue<RuntimeException> failures = new ArrayDeque<>();
    private final Map<String, Map<String, DeviceState>> devicesByCorrelation = new ConcurrentHashMap<>();
    private volatile ConnectorHealth health;
    private volatile Consumer<DeploymentIntent> publishHook = intent -> { };

    public FakeConnector(String name) {
        this(name, EnumSet.allOf(ConnectorCapability.class));
    }

    public FakeConnector(String name, Set<ConnectorCapability> capabilities) {
        this.name = name;
        this.capabilities = Set.copyOf(capabilities);
        this.health = ConnectorHealth.ready(name);
    }

    /**
     * Fail the next backend call with the given exception. Failures queue up.
     */
    public synchronized FakeConnector failNext(RuntimeException failure) {
        failures.add(failure);
        return this;
    }

    public FakeConnector reportDevices(CorrelationId correlationId, Map<String, DeviceState> devices) {
        devicesByCorrelation.put(correlationId.value(), Map.copyOf(devices));
        return this;
    }

    /**
     * Run after every successful publish, e.g. to change reported device states.
     */
    public FakeConnector onPublish(Consumer<DeploymentIntent> hook) {
        this.publishHook = hook;
        return this;
    }

    public void setHealth(ConnectorHealth health) {
        this.health = health;
    }

    public int publishCalls() {
        return publishCalls.get();
    }

    public int removeCalls() {
        return removeCalls.get();
    }

    public List<DeploymentIntent> published() {
        return published;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Set<ConnectorCapability> capabilities() {
        return capabilities;
    }

    @Override
    public ConnectorOperationResult publish(DeploymentIntent intent, CorrelationId correlationId) {
        publishCalls.incrementAndGet();
        throwScriptedFailure();
        published.add(intent);
        publishHook.accept(intent);
        return ConnectorOperationResult.success(OperationStatus.PUBLISHED, correlationId, name,
            List.of(name + "-" + intent.appId() + "-" + intent.version()));
    }

    @Override
    public ConnectorOperationResult remove(String resourceId, CorrelationId correlationId) {
        removeCalls.incrementAndGet();
        throwScriptedFailure();
        return ConnectorOperationResult.success(OperationStatus.REMOVED, correlationId, name, List.of(resourceId));
    }

    @Override
    public ConnectorStatusReport getStatus(CorrelationId correlationId) {
        throwScriptedFailure();
        return new ConnectorStatusReport(name, correlationId.value(),
            devicesByCorrelation.getOrDefault(correlationId.value(), Map.of()), Instant.now());
    }

    @Override
    public ConnectorHealth healthCheck() {
        return health;
    }

    private synchronized void throwScriptedFailure() {
        RuntimeException failure = failures.poll();
        if (failure != null) {
            throw failure;
        }
    }
}
