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

import org.junit.jupiter.api.Test;
import reactor.core.Disposable;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

class FlowEventBusTest {

    @Test
    void handlersRunSynchronouslyInSubscriptionOrder() {
        FlowEventBus bus = new FlowEventBus();
        List<String> calls = new CopyOnWriteArrayList<>();
        bus.on(FlowEventNames.WORKFLOW_IDLE, e -> calls.add("first:" + e.instanceId()));
        bus.on(FlowEventNames.WORKFLOW_IDLE, e -> calls.add("second:" + e.instanceId()));

        bus.emit(FlowEvent.workflow(FlowEventNames.WORKFLOW_IDLE, "wf"));

        assertEquals(List.of("first:wf", "second:wf"), calls);
    }

    @Test
    void throwingHandlerDoesNotStopTheOthers() {
        FlowEventBus bus = new FlowEventBus();
        List<String> calls = new CopyOnWriteArrayList<>();
        bus.on("step:after:A", e -> { throw new IllegalStateException("handler failure"); });
        bus.on("step:after:A", e -> calls.add(e.stepName()));

        assertDoesNotThrow(() -> bus.emit(FlowEvent.step(FlowEventNames.stepAfter("A"), "wf", "A", "t1", null)));

        assertEquals(List.of("A"), calls);
    }

    @Test
    void offAndDisposeUnsubscribe() {
        FlowEventBus bus = new FlowEventBus();
        List<String> calls = new CopyOnWriteArrayList<>();
        Consumer<FlowEvent> handler = e -> calls.add("h");
        bus.on(FlowEventNames.WORKFLOW_START, handler);
        Disposable other = bus.on(FlowEventNames.WORKFLOW_START, e -> calls.add("other"));
        assertEquals(2, bus.subscriberCount(FlowEventNames.WORKFLOW_START));

        bus.off(FlowEventNames.WORKFLOW_START, handler);
        other.dispose();
        bus.emit(FlowEvent.workflow(FlowEventNames.WORKFLOW_START, "wf"));

        assertTrue(calls.isEmpty());
        assertEquals(0, bus.subscriberCount(FlowEventNames.WORKFLOW_START));
    }

    @Test
    void stepEventNamesCarryTheStepName() {
        assertEquals("step:before:A", FlowEventNames.stepBefore("A"));
        assertEquals("step:after:A", FlowEventNames.stepAfter("A"));
        FlowEvent error = FlowEvent.stepError("wf", "A", "t1", new RuntimeException("x"));
        assertEquals("step:error:A", error.name());
        assertEquals("x", error.error().getMessage());
    }
}
