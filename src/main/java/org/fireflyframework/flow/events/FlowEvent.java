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


package org.fireflyframework.flow.events;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Payload of a bus event.
 *
 * @param name       event name, see {@link FlowEventNames}
 * @param instanceId workflow instance the event belongs to
 * @param stepName   step for {@code step:*} events, {@code null} for workflow events
 * @param traceId    trace id of the queue item, {@code null} for workflow events
 * @param value      step input for {@code before}, step output for {@code after}; may be {@code null}
 * @param error      failure for {@code error} events, otherwise {@code null}
 * @param timestamp  epoch millis
 */
public record FlowEvent(String name, String instanceId, String stepName, String traceId,
                        JsonNode value, Throwable error, long timestamp) {

    public static FlowEvent workflow(String name, String instanceId) {
        return new FlowEvent(name, instanceId, null, null, null, null, System.currentTimeMillis());
    }

    public static FlowEvent workflowError(String instanceId, String stepName, String traceId, Throwable error) {
        return new FlowEvent(FlowEventNames.WORKFLOW_ERROR, instanceId, stepName, traceId, null, error, System.currentTimeMillis());
    }

    public static FlowEvent step(String name, String instanceId, String stepName, String traceId, JsonNode value) {
        return new FlowEvent(name, instanceId, stepName, traceId, value, null, System.currentTimeMillis());
    }

    public static FlowEvent stepError(String instanceId, String stepName, String traceId, Throwable error) {
        return new FlowEvent(FlowEventNames.stepError(stepName), instanceId, stepName, traceId, null, error, System.currentTimeMillis());
    }
}
