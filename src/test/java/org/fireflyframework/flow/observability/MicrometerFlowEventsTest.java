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

import com.fasterxml.jackson.databind.node.IntNode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.fireflyframework.flow.engine.FlowEngine;
import org.fireflyframework.flow.engine.WorkflowHandle;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MicrometerFlowEventsTest {

    @Test
    void stepOutcomesAreCountedPerStep() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        MicrometerFlowEvents events = new MicrometerFlowEvents(registry);

        events.onStepSuccess("wf", "A", 1, 12L);
        events.onStepSuccess("wf", "A", 1, 0L);
        events.onStepFailed("wf", "A", new IllegalStateException("x"), 1, 3L);
        events.onStepRetryScheduled("wf", "A", 2, 150L);
        events.onBridgeFallback("wf", "R", "no bridge configured");

        assertThat(registry.get("flow.step.completed").tag("step.name", "A").tag("outcome", "success").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get("flow.step.completed").tag("outcome", "failure")
                .tag("error.type", "IllegalStateException").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("flow.step.duration").tag("outcome", "success").timer().count()).isEqualTo(1L);
        assertThat(registry.get("flow.step.retries").tag("step.name", "A").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("flow.bridge.fallbacks").tag("step.name", "R").counter().count()).isEqualTo(1.0);
    }

    @Test
    void engineReportsThroughTheMeterRegistry() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        try (FlowEngine engine = FlowEngine.builder().events(new MicrometerFlowEvents(registry)).build()) {
            WorkflowHandle flow = engine.open("metered");
            flow.step("A").effect(ctx -> IntNode.valueOf(1)).next("B").add().step("B").add();

            flow.start("A", 0);
        }

        assertThat(registry.get("flow.step.completed").tag("outcome", "success").counters())
                .hasSize(2);
        assertThat(registry.get("flow.workflow.pumps").counter().count()).isEqualTo(1.0);
    }
}
