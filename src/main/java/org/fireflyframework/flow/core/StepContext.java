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
import org.fireflyframework.flow.engine.WorkflowHandle;

import java.util.function.Consumer;

/**
 * Per-execution view handed to step effects, guards and branches.
 * <p>
 * A context is created fresh for every attempt and is never persisted. Enqueues requested through
 * {@link #enqueueNext(String, JsonNode)} are buffered and only committed when the attempt succeeds.
 */
public interface StepContext {

    String instanceId();

    String stepName();

    /** Payload of the queue item being executed. */
    JsonNode input();

    /**
     * Writes {@code value} to the step's own backing node in the reactive store. Writing a value equal
     * to the current one does not re-trigger the step.
     */
    void writeSelf(JsonNode value);

    default void writeSelf(Object value) {
        writeSelf(FlowValues.of(value));
    }

    /** Requests {@code stepName} to run with {@code payload} once this attempt succeeds. */
    void enqueueNext(String stepName, JsonNode payload);

    /**
     * Opens a child workflow named {@code <instanceId>.subflows.<name>}, lets {@code builder} define its
     * steps and, when {@code autoStart} is set, pumps it right away.
     */
    WorkflowHandle spawnSubWorkflow(String name, Consumer<WorkflowHandle> builder, boolean autoStart);

    /** Same as {@link #spawnSubWorkflow(String, Consumer, boolean)} without starting it. */
    default WorkflowHandle planSubWorkflow(String name, Consumer<WorkflowHandle> builder) {
        return spawnSubWorkflow(name, builder, false);
    }

    void log(Object... args);

    void warn(Object... args);

    void error(Object... args);

    String traceId();

    /** Instance-wide shared map. Not synchronized. */
    ObjectNode shared();

    /** Domain this particular execution runs in; for {@code BOTH} steps it is the half being run. */
    ExecutionDomain executionDomain();

    /** 1-based attempt number. */
    int attempt();

    StepMeta meta();

    /** Committed output of the attempt; {@code null} until the effect completed. Branches read it. */
    JsonNode output();
}
