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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Fan-out implementation of FlowEvents that delegates to multiple sinks
 * (e.g., logs + metrics). Used by default configuration to avoid bean conflicts
 * while enabling multiple observability channels.
 */
public class CompositeFlowEvents implements FlowEvents {
    private final List<FlowEvents> delegates;

    public CompositeFlowEvents(Collection<FlowEvents> delegates) {
        this.delegates = new ArrayList<>(Objects.requireNonNull(delegates, "delegates"));
    }

    @Override
    public void onWorkflowStarted(String instanceId) {
        for (FlowEvents d : delegates) d.onWorkflowStarted(instanceId);
    }

    @Override
    public void onWorkflowIdle(String instanceId, int executed) {
        for (FlowEvents d : delegates) d.onWorkflowIdle(instanceId, executed);
    }

    @Override
    public void onWorkflowFinished(String instanceId, long totalSteps) {
        for (FlowEvents d : delegates) d.onWorkflowFinished(instanceId, totalSteps);
    }

    @Override
    public void onWorkflowError(String instanceId, String stepName, Throwable error) {
        for (FlowEvents d : delegates) d.onWorkflowError(instanceId, stepName, error);
    }

    @Override
    public void onBudgetExhausted(String instanceId, int executed, int remaining) {
        for (FlowEvents d : delegates) d.onBudgetExhausted(instanceId, executed, remaining);
    }

    @Override
    public void onStepStarted(String instanceId, String stepName, String traceId, int attempt, ExecutionDomain domain) {
        for (FlowEvents d : delegates) d.onStepStarted(instanceId, stepName, traceId, attempt, domain);
    }

    @Override
    public void onStepSuccess(String instanceId, String stepName, int attempt, long latencyMs) {
        for (FlowEvents d : delegates) d.onStepSuccess(instanceId, stepName, attempt, latencyMs);
    }

    @Override
    public void onStepFailed(String instanceId, String stepName, Throwable error, int attempt, long latencyMs) {
        for (FlowEvents d : delegates) d.onStepFailed(instanceId, stepName, error, attempt, latencyMs);
    }

    @Override
    public void onStepRetryScheduled(String instanceId, String stepName, int nextAttempt, long delayMs) {
        for (FlowEvents d : delegates) d.onStepRetryScheduled(instanceId, stepName, nextAttempt, delayMs);
    }

    @Override
    public void onStepVetoed(String instanceId, String stepName) {
        for (FlowEvents d : delegates) d.onStepVetoed(instanceId, stepName);
    }

    @Override
    public void onStepSuspended(String instanceId, String stepName, String traceId) {
        for (FlowEvents d : delegates) d.onStepSuspended(instanceId, stepName, traceId);
    }

    @Override
    public void onBridgeFallback(String instanceId, String stepName, String reason) {
        for (FlowEvents d : delegates) d.onBridgeFallback(instanceId, stepName, reason);
    }
}
