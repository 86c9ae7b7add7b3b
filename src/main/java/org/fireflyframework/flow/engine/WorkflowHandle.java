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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.fireflyframework.flow.core.ExecutionDomain;
import org.fireflyframework.flow.core.FlowValues;
import org.fireflyframework.flow.core.QueueItem;
import org.fireflyframework.flow.core.StepLog;
import org.fireflyframework.flow.core.WorkflowInstance;
import org.fireflyframework.flow.core.WorkflowStats;
import org.fireflyframework.flow.events.FlowEvent;
import org.fireflyframework.flow.persistence.serialization.SerializationException;
import org.fireflyframework.flow.registry.BothModeOrder;
import org.fireflyframework.flow.registry.BranchSpec;
import org.fireflyframework.flow.registry.MergeStrategy;
import org.fireflyframework.flow.registry.RetrySpec;
import org.fireflyframework.flow.registry.StepDefinition;
import org.fireflyframework.flow.registry.StepEffect;
import org.fireflyframework.flow.registry.StepGuard;
import org.fireflyframework.flow.store.StoreNode;
import reactor.core.Disposable;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Programmatic surface of one workflow instance: define steps and edges, trigger steps and pump.
 * <p>
 * Every defined step is bound to a node of the engine's reactive store
 * ({@code flows.<id>.nodes.<step>}); setting that node to a different value enqueues the step with
 * the new value as payload and pumps the instance.
 */
public class WorkflowHandle {
    private final FlowEngine engine;
    private final WorkflowInstance instance;
    private final Map<HandlerKey, Consumer<FlowEvent>> handlers = new ConcurrentHashMap<>();

    WorkflowHandle(FlowEngine engine, WorkflowInstance instance) {
        this.engine = engine;
        this.instance = instance;
    }

    public String id() {
        return instance.id();
    }

    public WorkflowInstance instance() {
        return instance;
    }

    public WorkflowHandle defineStep(StepDefinition def) {
        Objects.requireNonNull(def, "def");
        instance.steps().define(def);
        StoreNode node = engine.backingNode(instance.id(), def.name);
        Disposable subscription = engine.store().watch(node, (newValue, oldValue) -> {
            engine.scheduler().enqueue(instance, def.name, newValue);
            engine.scheduler().pump(instance);
        });
        instance.bindStoreSubscription(def.name, subscription);
        return this;
    }

    /** Defines {@code def} under {@code name}, which wins over the name the definition was built with. */
    public WorkflowHandle defineStep(String name, StepDefinition def) {
        Objects.requireNonNull(def, "def");
        return defineStep(name.equals(def.name) ? def : def.renamed(name));
    }

    /** Starts a fluent step definition; {@link Step#add()} registers it and returns this handle. */
    public Step step(String name) {
        return new Step(name);
    }

    public WorkflowHandle connect(String from, String... to) {
        instance.steps().connect(from, to);
        return this;
    }

    /** Enqueues {@code stepName} and pumps. */
    public PumpResult start(String stepName, Object payload) {
        enqueue(stepName, payload);
        return pump();
    }

    /**
     * Writes {@code value} to the step's store node. Triggers the step when the value differs from
     * the current one.
     *
     * @return whether the value changed
     */
    public boolean set(String stepName, Object value) {
        return engine.store().set(engine.backingNode(instance.id(), stepName), FlowValues.of(value));
    }

    /** Current value of the step's store node. */
    public JsonNode get(String stepName) {
        return engine.store().get(engine.backingNode(instance.id(), stepName));
    }

    public QueueItem enqueue(String stepName, Object payload) {
        return engine.scheduler().enqueue(instance, stepName, FlowValues.of(payload));
    }

    public QueueItem enqueue(String stepName, Object payload, String traceId) {
        return engine.scheduler().enqueue(instance, stepName, FlowValues.of(payload), traceId);
    }

    public PumpResult pump() {
        return engine.scheduler().pump(instance);
    }

    /** Resets the executed-steps counter and pumps. */
    public PumpResult runSync() {
        instance.stats().resetSteps();
        return pump();
    }

    /** Subscribes to events of this instance only. */
    public Disposable on(String eventName, Consumer<FlowEvent> handler) {
        Objects.requireNonNull(handler, "handler");
        Consumer<FlowEvent> filtered = e -> {
            if (instance.id().equals(e.instanceId())) handler.accept(e);
        };
        HandlerKey key = new HandlerKey(eventName, handler);
        Consumer<FlowEvent> previous = handlers.put(key, filtered);
        if (previous != null) {
            engine.bus().off(eventName, previous);
        }
        engine.bus().on(eventName, filtered);
        return () -> off(eventName, handler);
    }

    public void off(String eventName, Consumer<FlowEvent> handler) {
        Consumer<FlowEvent> filtered = handlers.remove(new HandlerKey(eventName, handler));
        if (filtered != null) {
            engine.bus().off(eventName, filtered);
        }
    }

    public JsonNode output(String stepName) {
        return instance.output(stepName);
    }

    public StepLog log(String stepName) {
        return instance.log(stepName);
    }

    public WorkflowStats stats() {
        return instance.stats();
    }

    public ObjectNode shared() {
        return instance.shared();
    }

    public int queued() {
        return instance.queue().size();
    }

    public byte[] serialize() throws SerializationException {
        return engine.serialize(instance.id());
    }

    /** Restores a snapshot into this instance. */
    public WorkflowHandle deserialize(byte[] snapshot) throws SerializationException {
        engine.deserialize(snapshot, instance.id());
        return this;
    }

    private record HandlerKey(String eventName, Consumer<FlowEvent> handler) {}

    /**
     * Fluent step definition bound to this handle.
     */
    public class Step {
        private final StepDefinition.Builder builder;

        private Step(String name) {
            this.builder = StepDefinition.builder(name).retry(engine.defaultRetry());
        }

        public Step domain(ExecutionDomain domain) { builder.domain(domain); return this; }
        public Step local() { builder.local(); return this; }
        public Step remote() { builder.remote(); return this; }
        public Step both(BothModeOrder order) { builder.both(order); return this; }
        public Step effect(StepEffect effect) { builder.effect(effect); return this; }
        public Step guard(StepGuard guard) { builder.guard(guard); return this; }
        public Step branch(BranchSpec branch) { builder.branch(branch); return this; }
        public Step retry(RetrySpec retry) { builder.retry(retry); return this; }
        public Step noRetry() { builder.noRetry(); return this; }
        public Step merge(MergeStrategy merge) { builder.merge(merge); return this; }
        public Step next(String... names) { builder.next(names); return this; }

        public WorkflowHandle add() {
            return defineStep(builder.build());
        }
    }
}
