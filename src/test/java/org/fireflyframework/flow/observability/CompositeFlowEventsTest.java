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
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CompositeFlowEventsTest {

    static class CapturingEvents implements FlowEvents {
        final List<String> calls = new ArrayList<>();
        @Override public void onWorkflowStarted(String instanceId) { calls.add("start:" + instanceId); }
        @Override public void onStepStarted(String instanceId, String stepName, String traceId, int attempt, ExecutionDomain domain) { calls.add("step:" + stepName + ":" + domain); }
        @Override public void onStepRetryScheduled(String instanceId, String stepName, int nextAttempt, long delayMs) { calls.add("retry:" + stepName + ":" + nextAttempt); }
        @Override public void onBridgeFallback(String instanceId, String stepName, String reason) { calls.add("fallback:" + stepName); }
    }

    @Test
    void compositeFansOutCalls() {
        CapturingEvents a = new CapturingEvents();
        CapturingEvents b = new CapturingEvents();
        CompositeFlowEvents composite = new CompositeFlowEvents(List.of(a, b));

        composite.onWorkflowStarted("wf");
        composite.onStepStarted("wf", "x", "t1", 1, ExecutionDomain.REMOTE);
        composite.onStepRetryScheduled("wf", "x", 2, 150L);
        composite.onBridgeFallback("wf", "x", "no bridge configured");
        composite.onWorkflowFinished("wf", 3L);

        List<String> expected = List.of("start:wf", "step:x:REMOTE", "retry:x:2", "fallback:x");
        assertEquals(expected, a.calls);
        assertEquals(expected, b.calls);
    }

    @Test
    void loggerEventsAcceptEveryHook() {
        FlowLoggerEvents logger = new FlowLoggerEvents();
        CompositeFlowEvents composite = new CompositeFlowEvents(List.of(logger));

        composite.onWorkflowStarted("wf");
        composite.onStepStarted("wf", "x", "t1", 1, ExecutionDomain.LOCAL);
        composite.onStepSuccess("wf", "x", 1, 5L);
        composite.onStepFailed("wf", "x", new IllegalStateException("boom"), 1, 5L);
        composite.onStepFailed("wf", "x", null, 2, 0L);
        composite.onStepRetryScheduled("wf", "x", 2, 150L);
        composite.onStepVetoed("wf", "x");
        composite.onStepSuspended("wf", "x", "t1");
        composite.onBudgetExhausted("wf", 10, 4);
        composite.onBridgeFallback("wf", "x", "timeout");
        composite.onWorkflowError("wf", "x", new IllegalStateException("boom"));
        composite.onWorkflowIdle("wf", 10);
        composite.onWorkflowFinished("wf", 10L);

        assertTrue(true, "logging sink never throws");
    }
}
