/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package org.fireflyframework.flow.engine;

import org.fireflyframework.flow.bridge.BridgeCodec;
import org.fireflyframework.flow.bridge.CrossDomainBridge;
import org.fireflyframework.flow.bridge.RemoteStepEndpoint;
import org.fireflyframework.flow.core.WorkflowInstance;
import org.fireflyframework.flow.core.WorkflowOptions;
import org.fireflyframework.flow.events.FlowEvent;
import org.fireflyframework.flow.events.FlowEventBus;
import org.fireflyframework.flow.observability.FlowEvents;
import org.fireflyframework.flow.persistence.serialization.SerializationException;
import org.fireflyframework.flow.persistence.serialization.SerializationUnsupportedException;
import org.fireflyframework.flow.persistence.serialization.WorkflowSnapshot;
import org.fireflyframework.flow.persistence.serialization.WorkflowSnapshotSerializer;
import org.fireflyframework.flow.registry.RetrySpec;
import org.fireflyframework.flow.registry.WorkflowRegistry;
import org.fireflyframework.flow.store.InMemoryReactiveStore;
import org.fireflyframework.flow.store.ReactiveStore;
import org.fireflyframework.flow.store.StoreNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Entry point of the flow engine: opens workflow instances and owns everything they share, namely
 * the reactive store, the event bus, the optional cross-domain bridge, retry timers and snapshot
 * serialization.
 * <p>
 * Usage:
 * <pre>{@code
 * FlowEngine engine = FlowEngine.builder().build();
 * WorkflowHandle flow = engine.open("orders");
 * flow.step("A").effect(ctx -> IntNode.valueOf(ctx.input().asInt() * 2)).next("B").add()
 *     .step("B").effect(ctx -> IntNode.valueOf(ctx.input().asInt() + 1)).add();
 * flow.start("A", 3);
 * }</pre>
 */
public class FlowEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(FlowEngine.class);

    private final ReactiveStore store;
    private final FlowEventBus bus;
    private final FlowEvents events;
    private final WorkflowRegistry workflows = new WorkflowRegistry();
    private final Map<String, WorkflowHandle> handles = new ConcurrentHashMap<>();
    private final CrossDomainBridge bridge;
    private final boolean remoteDomain;
    private final WorkflowOptions defaultOptions;
    private final RetrySpec defaultRetry;
    private final WorkflowSnapshotSerializer serializer;
    private final BridgeCodec codec;
    private final Scheduler timerScheduler;
    private final Scheduler parallelScheduler;
    private final boolean ownsTimerScheduler;
    private final boolean ownsParallelScheduler;
    private final StepExecutor executor;
    private final FlowScheduler scheduler;
    private volatile RemoteStepEndpoint remoteEndpoint;
    private volatile boolean closed;

    private FlowEngine(Builder b) {
        this.store = b.store != null ? b.store : new InMemoryReactiveStore();
        this.bus = b.bus != null ? b.bus : new FlowEventBus();
        this.events = b.events != null ? b.events : new FlowEvents() {};
        this.bridge = b.bridge;
        this.remoteDomain = b.remoteDomain;
        this.defaultOptions = b.defaultOptions != null ? b.defaultOptions : WorkflowOptions.defaults();
        this.defaultRetry = b.defaultRetry != null ? b.defaultRetry : RetrySpec.defaults();
        this.serializer = b.serializer;
        this.codec = b.codec != null ? b.codec : new BridgeCodec();
        this.ownsTimerScheduler = b.timerScheduler == null;
        this.timerScheduler = ownsTimerScheduler ? Schedulers.newBoundedElastic(4, 10_000, "flow-timer") : b.timerScheduler;
        this.ownsParallelScheduler = b.parallelScheduler == null;
        this.parallelScheduler = ownsParallelScheduler ? Schedulers.newBoundedElastic(4, 10_000, "flow-parallel") : b.parallelScheduler;
        this.executor = new StepExecutor(this);
        this.scheduler = new FlowScheduler(this, executor);
        log.debug("Flow engine created (bridge={}, remoteDomain={}, serializer={})",
                bridge != null, remoteDomain, serializer != null ? serializer.getContentType() : "none");
    }

    public static Builder builder() {
        return new Builder();
    }

    public WorkflowHandle open(String id) {
        return open(id, defaultOptions);
    }

    /** Opens the instance {@code id}, or returns the already open one (whose options are kept). */
    public WorkflowHandle open(String id, WorkflowOptions options) {
        ensureOpen();
        WorkflowInstance instance = workflows.getOrCreate(id, key -> new WorkflowInstance(key, options != null ? options : defaultOptions));
        return handles.computeIfAbsent(instance.id(), key -> new WorkflowHandle(this, instance));
    }

    public Optional<WorkflowHandle> instance(String id) {
        return Optional.ofNullable(handles.get(id));
    }

    /** Forgets instance {@code id} and detaches its store watchers. */
    public boolean remove(String id) {
        handles.remove(id);
        return workflows.remove(id).map(instance -> {
            instance.disposeStoreSubscriptions();
            return true;
        }).orElse(false);
    }

    public Disposable on(String eventName, Consumer<FlowEvent> handler) {
        return bus.on(eventName, handler);
    }

    public void off(String eventName, Consumer<FlowEvent> handler) {
        bus.off(eventName, handler);
    }

    public byte[] serialize(String id) throws SerializationException {
        WorkflowSnapshotSerializer s = requireSerializer();
        return s.serialize(WorkflowSnapshot.capture(workflows.get(id)));
    }

    /**
     * Restores a snapshot into instance {@code targetId} (opened when needed), or into the snapshot's
     * own id when {@code targetId} is null. Step effects must be defined on the target separately.
     */
    public WorkflowHandle deserialize(byte[] data, String targetId) throws SerializationException {
        WorkflowSnapshotSerializer s = requireSerializer();
        WorkflowSnapshot snapshot = s.deserialize(data);
        WorkflowHandle handle = open(targetId != null ? targetId : snapshot.getId());
        snapshot.restoreInto(handle.instance());
        log.debug("Restored snapshot of {} into {} ({} queued items)", snapshot.getId(), handle.id(), handle.queued());
        return handle;
    }

    /** Endpoint serving bridge requests against this engine's instances, in the remote domain. */
    public RemoteStepEndpoint remoteEndpoint() {
        RemoteStepEndpoint e = remoteEndpoint;
        if (e == null) {
            synchronized (this) {
                if (remoteEndpoint == null) {
                    remoteEndpoint = new RemoteStepEndpoint(workflows, executor::runAsRemote, codec);
                }
                e = remoteEndpoint;
            }
        }
        return e;
    }

    public ReactiveStore store() { return store; }
    public FlowEventBus bus() { return bus; }
    public WorkflowRegistry workflows() { return workflows; }
    public CrossDomainBridge bridge() { return bridge; }
    public boolean isRemoteDomain() { return remoteDomain; }
    public FlowScheduler scheduler() { return scheduler; }

    FlowEvents events() { return events; }
    RetrySpec defaultRetry() { return defaultRetry; }
    Scheduler timerScheduler() { return timerScheduler; }
    Scheduler parallelScheduler() { return parallelScheduler; }

    /** Store node backing step {@code stepName} of instance {@code instanceId}. */
    public StoreNode backingNode(String instanceId, String stepName) {
        return store.node("flows." + instanceId + ".nodes." + stepName);
    }

    private WorkflowSnapshotSerializer requireSerializer() {
        if (serializer == null) {
            throw new SerializationUnsupportedException("No WorkflowSnapshotSerializer configured for this engine");
        }
        return serializer;
    }

    private void ensureOpen() {
        if (closed) throw new IllegalStateException("Flow engine is closed");
    }

    /** Cancels retry timers, disposes the bridge and owned schedulers and detaches every instance. */
    @Override
    public void close() {
        if (closed) return;
        closed = true;
        scheduler.dispose();
        if (bridge != null) bridge.dispose();
        handles.clear();
        for (String id : workflows.ids()) {
            workflows.find(id).ifPresent(WorkflowInstance::disposeStoreSubscriptions);
        }
        workflows.clear();
        bus.clear();
        if (ownsTimerScheduler) timerScheduler.dispose();
        if (ownsParallelScheduler) parallelScheduler.dispose();
        log.debug("Flow engine closed");
    }

    public static class Builder {
        private ReactiveStore store;
        private FlowEventBus bus;
        private FlowEvents events;
        private CrossDomainBridge bridge;
        private boolean remoteDomain;
        private WorkflowOptions defaultOptions;
        private RetrySpec defaultRetry;
        private WorkflowSnapshotSerializer serializer;
        private BridgeCodec codec;
        private Scheduler timerScheduler;
        private Scheduler parallelScheduler;

        private Builder() {}

        public Builder store(ReactiveStore store) { this.store = store; return this; }
        public Builder bus(FlowEventBus bus) { this.bus = bus; return this; }
        public Builder events(FlowEvents events) { this.events = events; return this; }
        public Builder bridge(CrossDomainBridge bridge) { this.bridge = bridge; return this; }
        /** Marks this engine as the remote domain: {@code REMOTE} steps then run in-process. */
        public Builder remoteDomain(boolean remoteDomain) { this.remoteDomain = remoteDomain; return this; }
        public Builder defaultOptions(WorkflowOptions options) { this.defaultOptions = options; return this; }
        /** Retry policy given to steps defined through {@link WorkflowHandle#step(String)}. */
        public Builder defaultRetry(RetrySpec retry) { this.defaultRetry = retry; return this; }
        public Builder serializer(WorkflowSnapshotSerializer serializer) { this.serializer = serializer; return this; }
        public Builder codec(BridgeCodec codec) { this.codec = codec; return this; }
        /** Scheduler for retry timers; tests pass a virtual-time scheduler. */
        public Builder timerScheduler(Scheduler scheduler) { this.timerScheduler = scheduler; return this; }
        /** Scheduler running the remote half of parallel {@code BOTH} steps. */
        public Builder parallelScheduler(Scheduler scheduler) { this.parallelScheduler = scheduler; return this; }

        public FlowEngine build() {
            return new FlowEngine(this);
        }
    }
}
