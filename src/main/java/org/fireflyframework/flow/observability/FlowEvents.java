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


package org.fireflyframework.flow.observability;

import org.fireflyframework.flow.core.ExecutionDomain;

/**
 * Observability hook for workflow lifecycle events.
 * Provide your own Spring bean of this type to export metrics/traces/logs.
 * A default logger-based implementation is provided: {@link FlowLoggerEvents}.
 *
 * Notes:
 * - unlike the event bus, these hooks also see retries, suspensions and bridge fallbacks.
 */
public interface FlowEvents {
    /** Invoked when a pump starts draining an instance. */
    default void onWorkflowStarted(String instanceId) {}

    /** Invoked when a pump leaves an empty queue. */
    default void onWorkflowIdle(String instanceId, int executed) {}

    default void onWorkflowFinished(String instanceId, long totalSteps) {}

    default void onWorkflowError(String instanceId, String stepName, Throwable error) {}

    /** Invoked when a pump stops because a step or time budget ran out. */
    default void onBudgetExhausted(String instanceId, int executed, int remaining) {}

    default void onStepStarted(String instanceId, String stepName, String traceId, int attempt, ExecutionDomain domain) {}
    default void onStepSuccess(String instanceId, String stepName, int attempt, long latencyMs) {}
    default void onStepFailed(String instanceId, String stepName, Throwable error, int attempt, long latencyMs) {}
    default void onStepRetryScheduled(String instanceId, String stepName, int nextAttempt, long delayMs) {}
    default void onStepVetoed(String instanceId, String stepName) {}
    default void onStepSuspended(String instanceId, String stepName, String traceId) {}

    // Bridge
    default void onBridgeFallback(String instanceId, String stepName, String reason) {}
}
