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
import org.fireflyframework.flow.core.LogLevel;
import org.fireflyframework.flow.core.QueueItem;
import org.fireflyframework.flow.core.StepContext;
import org.fireflyframework.flow.core.StepLogEntry;
import org.fireflyframework.flow.core.StepMeta;
import org.fireflyframework.flow.core.WorkflowInstance;
import org.fireflyframework.flow.registry.StepDefinition;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * {@link StepContext} of one attempt. Log lines go to {@code logSink}: the step log for local
 * execution, a reply buffer when running on behalf of a remote caller.
 */
final class DefaultStepContext implements StepContext {
    private final FlowEngine engine;
    private final WorkflowInstance instance;
    private final StepDefinition definition;
    private final QueueItem item;
    private final Consumer<StepLogEntry> logSink;
    private final List<QueueItem> pendingEnqueues = new ArrayList<>();
    private volatile ExecutionDomain domain;
    private volatile JsonNode lastWritten;
    private volatile JsonNode output;

    DefaultStepContext(FlowEngine engine, WorkflowInstance instance, StepDefinition definition, QueueItem item,
                       Consumer<StepLogEntry> logSink) {
        this.engine = engine;
        this.instance = instance;
        this.definition = definition;
        this.item = item;
        this.logSink = logSink;
        this.domain = definition.executionDomain == ExecutionDomain.BOTH ? ExecutionDomain.LOCAL : definition.executionDomain;
    }

    void runningIn(ExecutionDomain domain) {
        this.domain = domain;
    }

    void complete(JsonNode output) {
        this.output = output;
    }

    JsonNode lastWritten() {
        return lastWritten;
    }

    List<QueueItem> pendingEnqueues() {
        synchronized (pendingEnqueues) {
            return List.copyOf(pendingEnqueues);
        }
    }

    void append(StepLogEntry entry) {
        logSink.accept(entry);
    }

    @Override
    public String instanceId() {
        return instance.id();
    }

    @Override
    public String stepName() {
        return definition.name;
    }

    @Override
    public JsonNode input() {
        return item.payload();
    }

    @Override
    public void writeSelf(JsonNode value) {
        JsonNode v = FlowValues.orNull(value);
        this.lastWritten = v;
        engine.store().set(engine.backingNode(instance.id(), definition.name), v);
    }

    @Override
    public void enqueueNext(String stepName, JsonNode payload) {
        Objects.requireNonNull(stepName, "stepName");
        synchronized (pendingEnqueues) {
            pendingEnqueues.add(QueueItem.of(stepName, payload, TraceIds.next()));
        }
    }

    @Override
    public WorkflowHandle spawnSubWorkflow(String name, Consumer<WorkflowHandle> builder, boolean autoStart) {
        WorkflowHandle child = engine.open(instance.id() + ".subflows." + name, instance.options());
        if (builder != null) {
            builder.accept(child);
        }
        if (autoStart) {
            child.pump();
        }
        return child;
    }

    @Override
    public void log(Object... args) {
        append(LogLevel.INFO, args);
    }

    @Override
    public void warn(Object... args) {
        append(LogLevel.WARN, args);
    }

    @Override
    public void error(Object... args) {
        append(LogLevel.ERROR, args);
    }

    private void append(LogLevel level, Object... args) {
        List<Object> values = args == null ? List.of() : Arrays.asList(args);
        logSink.accept(new StepLogEntry(System.currentTimeMillis(), level, values));
    }

    @Override
    public String traceId() {
        return item.traceId();
    }

    @Override
    public ObjectNode shared() {
        return instance.shared();
    }

    @Override
    public ExecutionDomain executionDomain() {
        return domain;
    }

    @Override
    public int attempt() {
        return item.attempt();
    }

    @Override
    public StepMeta meta() {
        return new StepMeta(definition.name, definition.executionDomain, definition.hasEffect(), definition.hasBranch(), definition.hasGuard());
    }

    @Override
    public JsonNode output() {
        return output;
    }
}
