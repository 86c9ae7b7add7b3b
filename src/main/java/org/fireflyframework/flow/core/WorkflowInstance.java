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


package org.fireflyframework.flow.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.fireflyframework.flow.registry.StepRegistry;
import reactor.core.Disposable;

import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runtime state of one workflow: step registry, pending queue, counters, shared map, last committed
 * outputs and per-step logs.
 * <p>
 * The queue accepts enqueues from any thread. Step execution is serialized by the {@code running}
 * flag, which only the scheduler flips.
 */
public class WorkflowInstance {
    private final String id;
    private final WorkflowOptions options;
    private final StepRegistry steps = new StepRegistry();
    private final Deque<QueueItem> queue = new ConcurrentLinkedDeque<>();
    private final WorkflowStats stats = new WorkflowStats();
    private final ObjectNode shared = FlowValues.object();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Map<String, JsonNode> outputs = new ConcurrentHashMap<>();
    private final Map<String, StepLog> logs = new ConcurrentHashMap<>();
    private final Map<String, Disposable> storeSubscriptions = new ConcurrentHashMap<>();
    private final AtomicInteger scheduledRetries = new AtomicInteger();
    private final AtomicInteger pendingSuspensions = new AtomicInteger();
    private final Map<String, JsonNode> parkedOutputs = new ConcurrentHashMap<>();

    public WorkflowInstance(String id, WorkflowOptions options) {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) throw new IllegalArgumentException("Workflow id must not be blank");
        this.id = id;
        this.options = options != null ? options : WorkflowOptions.defaults();
    }

    public String id() { return id; }
    public WorkflowOptions options() { return options; }
    public StepRegistry steps() { return steps; }
    public Deque<QueueItem> queue() { return queue; }
    public WorkflowStats stats() { return stats; }
    public ObjectNode shared() { return shared; }

    /** Claims the instance for a pump. Returns {@code false} when a pump is already in progress. */
    public boolean tryEnter() {
        return running.compareAndSet(false, true);
    }

    public void exit() {
        running.set(false);
    }

    public boolean isRunning() {
        return running.get();
    }

    public JsonNode output(String stepName) {
        return outputs.get(stepName);
    }

    public void recordOutput(String stepName, JsonNode value) {
        outputs.put(stepName, FlowValues.orNull(value));
    }

    public Map<String, JsonNode> outputs() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
    }

    public StepLog log(String stepName) {
        return logs.computeIfAbsent(stepName, n -> new StepLog(n, options.logSize()));
    }

    public Map<String, StepLog> logs() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(logs));
    }

    /** Registers the store subscription that triggers {@code stepName}; a previous one is disposed. */
    public void bindStoreSubscription(String stepName, Disposable subscription) {
        Disposable previous = storeSubscriptions.put(stepName, subscription);
        if (previous != null) previous.dispose();
    }

    public void disposeStoreSubscriptions() {
        storeSubscriptions.values().forEach(Disposable::dispose);
        storeSubscriptions.clear();
    }

    public int scheduledRetries() { return scheduledRetries.get(); }
    public void retryScheduled() { scheduledRetries.incrementAndGet(); }
    public void retryFired() { scheduledRetries.decrementAndGet(); }

    public int pendingSuspensions() { return pendingSuspensions.get(); }
    public void suspended() { pendingSuspensions.incrementAndGet(); }
    public void resumed() { pendingSuspensions.decrementAndGet(); }

    /**
     * Keeps the local half output of a {@code BOTH} step whose remote half suspended, so the replay
     * does not run the local effect again.
     */
    public void park(String key, JsonNode output) {
        parkedOutputs.put(key, FlowValues.orNull(output));
    }

    public JsonNode unpark(String key) {
        return parkedOutputs.remove(key);
    }

    /** No queued work, no retry timer and no bridge call in flight. */
    public boolean isSettled() {
        return queue.isEmpty() && scheduledRetries.get() == 0 && pendingSuspensions.get() == 0;
    }

    @Override
    public String toString() {
        return "WorkflowInstance{id='" + id + "', queued=" + queue.size() + ", running=" + running.get() + '}';
    }
}
