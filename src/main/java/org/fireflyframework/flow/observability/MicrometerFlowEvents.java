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

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;

import java.time.Duration;

/**
 * Micrometer-based implementation of FlowEvents.
 * <p>
 * Meters are tagged by step name and outcome only; instance ids are left out to keep cardinality bounded.
 */
public class MicrometerFlowEvents implements FlowEvents {

    private final MeterRegistry registry;

    public MicrometerFlowEvents(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onWorkflowStarted(String instanceId) {
        registry.counter("flow.workflow.pumps").increment();
    }

    @Override
    public void onWorkflowError(String instanceId, String stepName, Throwable error) {
        registry.counter("flow.workflow.errors", Tags.of(Tag.of("step.name", String.valueOf(stepName)))).increment();
    }

    @Override
    public void onBudgetExhausted(String instanceId, int executed, int remaining) {
        registry.counter("flow.workflow.budget.exhausted").increment();
    }

    @Override
    public void onStepSuccess(String instanceId, String stepName, int attempt, long latencyMs) {
        Tags tags = Tags.of(
            Tag.of("step.name", stepName),
            Tag.of("outcome", "success")
        );
        registry.counter("flow.step.completed", tags).increment();
        if (latencyMs > 0) {
            registry.timer("flow.step.duration", tags).record(Duration.ofMillis(latencyMs));
        }
    }

    @Override
    public void onStepFailed(String instanceId, String stepName, Throwable error, int attempt, long latencyMs) {
        Tags tags = Tags.of(
            Tag.of("step.name", stepName),
            Tag.of("outcome", "failure"),
            Tag.of("error.type", error != null ? error.getClass().getSimpleName() : "unknown")
        );
        registry.counter("flow.step.completed", tags).increment();
        if (latencyMs > 0) {
            registry.timer("flow.step.duration", tags).record(Duration.ofMillis(latencyMs));
        }
    }

    @Override
    public void onStepRetryScheduled(String instanceId, String stepName, int nextAttempt, long delayMs) {
        registry.counter("flow.step.retries", Tags.of(Tag.of("step.name", stepName))).increment();
    }

    @Override
    public void onStepSuspended(String instanceId, String stepName, String traceId) {
        registry.counter("flow.step.suspensions", Tags.of(Tag.of("step.name", stepName))).increment();
    }

    @Override
    public void onBridgeFallback(String instanceId, String stepName, String reason) {
        registry.counter("flow.bridge.fallbacks", Tags.of(Tag.of("step.name", stepName))).increment();
    }
}
