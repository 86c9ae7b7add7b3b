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
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.fireflyframework.flow.core.ExecutionDomain;
import org.fireflyframework.flow.core.LogLevel;
import org.fireflyframework.flow.core.StepLogEntry;
import org.fireflyframework.flow.events.FlowEvent;
import org.fireflyframework.flow.events.FlowEventNames;
import org.fireflyframework.flow.registry.BranchSpec;
import org.fireflyframework.flow.registry.StepDefinition;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class FlowEngineTest {

    private final FlowEngine engine = FlowEngine.builder().build();

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    void doublesThenIncrementsAlongAStaticEdge() {
        WorkflowHandle flow = engine.open("wf");
        flow.step("A").effect(ctx -> IntNode.valueOf(ctx.input().asInt() * 2)).next("B").add()
            .step("B").effect(ctx -> IntNode.valueOf(ctx.input().asInt() + 1)).add();
        List<String> afterOrder = new CopyOnWriteArrayList<>();
        flow.on(FlowEventNames.stepAfter("A"), e -> afterOrder.add("A=" + e.value()));
        flow.on(FlowEventNames.stepAfter("B"), e -> afterOrder.add("B=" + e.value()));

        PumpResult result = flow.start("A", 3);

        assertEquals(2, result.executed());
        assertFalse(result.stoppedByBudget());
        assertEquals(0, result.remaining());
        assertEquals(IntNode.valueOf(6), flow.output("A"));
        assertEquals(IntNode.valueOf(7), flow.output("B"));
        assertEquals(List.of("A=6", "B=7"), afterOrder);
    }

    @Test
    void selfWriteOfAnUnchangedValueDoesNotRetrigger() {
        WorkflowHandle flow = engine.open("self");
        AtomicInteger runs = new AtomicInteger();
        flow.step("S").effect(ctx -> {
            runs.incrementAndGet();
            ctx.writeSelf("done");
            return null;
        }).add();

        flow.start("S", 1);

        // first run changes the node and is re-enqueued once, the second write is a no-op
        assertEquals(2, runs.get());
        assertEquals(TextNode.valueOf("done"), flow.get("S"));
        assertEquals(TextNode.valueOf("done"), flow.output("S"));
        assertEquals(0, flow.queued());
    }

    @Test
    void settingTheBackingNodeTriggersTheStepOnlyOnChange() {
        WorkflowHandle flow = engine.open("watch");
        List<JsonNode> inputs = new CopyOnWriteArrayList<>();
        flow.step("W").effect(ctx -> { inputs.add(ctx.input()); return ctx.input(); }).add();

        assertTrue(flow.set("W", 5));
        assertFalse(flow.set("W", 5));
        assertTrue(flow.set("W", 6));

        assertEquals(List.of(IntNode.valueOf(5), IntNode.valueOf(6)), inputs);
    }

    @Test
    void branchEnqueuesOnlyTheSelectedTarget() {
        WorkflowHandle flow = engine.open("branch");
        flow.step("check")
                .effect(ctx -> ctx.input())
                .branch(BranchSpec.when(ctx -> ctx.output().asInt() > 10, "big", "small"))
                .next("ignored")
                .add()
            .step("big").add()
            .step("small").add()
            .step("ignored").add();

        flow.start("check", 42);

        assertEquals(IntNode.valueOf(42), flow.output("big"));
        assertNull(flow.output("small"));
        assertNull(flow.output("ignored"));
    }

    @Test
    void explicitEnqueueNextReplacesStaticSuccessors() {
        WorkflowHandle flow = engine.open("explicit");
        flow.step("A").effect(ctx -> {
            ctx.enqueueNext("C", IntNode.valueOf(9));
            return IntNode.valueOf(1);
        }).next("B").add()
            .step("B").add()
            .step("C").add();

        flow.start("A", 0);

        assertNull(flow.output("B"));
        assertEquals(IntNode.valueOf(9), flow.output("C"));
    }

    @Test
    void edgesAndStaticNextAreBothFollowed() {
        WorkflowHandle flow = engine.open("edges");
        flow.step("A").next("B").add().step("B").add().step("C").add();
        flow.connect("A", "C", "B");

        PumpResult result = flow.start("A", "x");

        assertEquals(3, result.executed());
        assertEquals(TextNode.valueOf("x"), flow.output("C"));
    }

    @Test
    void guardVetoSkipsTheStepWithoutEvents() {
        WorkflowHandle flow = engine.open("guard");
        flow.step("G").guard(ctx -> ctx.input().asBoolean()).next("H").add().step("H").add();
        List<String> events = new CopyOnWriteArrayList<>();
        flow.on(FlowEventNames.stepBefore("G"), e -> events.add("before"));
        flow.on(FlowEventNames.stepAfter("G"), e -> events.add("after"));

        flow.start("G", false);

        assertTrue(events.isEmpty());
        assertNull(flow.output("G"));
        assertNull(flow.output("H"));
        StepLogEntry last = flow.log("G").last();
        assertEquals(LogLevel.INFO, last.level());
        assertEquals("guard vetoed execution", last.args().get(0));
    }

    @Test
    void effectReturningNullFallsBackToInput() {
        WorkflowHandle flow = engine.open("passthrough");
        flow.step("N").effect(ctx -> null).add();

        flow.start("N", "in");

        assertEquals(TextNode.valueOf("in"), flow.output("N"));
    }

    @Test
    void unknownStepEmitsStepError() {
        WorkflowHandle flow = engine.open("unknown");
        AtomicReference<FlowEvent> error = new AtomicReference<>();
        flow.on(FlowEventNames.stepError("ghost"), error::set);

        PumpResult result = flow.start("ghost", null);

        assertEquals(1, result.executed());
        assertNotNull(error.get());
        assertInstanceOf(IllegalStateException.class, error.get().error());
    }

    @Test
    void nonRetriedFailureEmitsStepErrorThenWorkflowError() {
        WorkflowHandle flow = engine.open("failing");
        flow.step("F").noRetry().effect(ctx -> { throw new IllegalArgumentException("bad input"); }).next("G").add()
            .step("G").add();
        List<String> events = new CopyOnWriteArrayList<>();
        flow.on(FlowEventNames.stepError("F"), e -> events.add("step:error:" + e.error().getMessage()));
        flow.on(FlowEventNames.WORKFLOW_ERROR, e -> events.add("workflow:error:" + e.stepName()));

        flow.start("F", 1);

        assertEquals(List.of("step:error:bad input", "workflow:error:F"), events);
        assertNull(flow.output("G"));
    }

    @Test
    void errorThrownByEffectIsReportedAsStepFailure() {
        WorkflowHandle flow = engine.open("asserting");
        flow.step("F").noRetry().effect(ctx -> { throw new AssertionError("invariant broken"); }).next("G").add()
            .step("G").add();
        List<Throwable> errors = new CopyOnWriteArrayList<>();
        flow.on(FlowEventNames.stepError("F"), e -> errors.add(e.error()));

        PumpResult result = assertDoesNotThrow(() -> flow.start("F", 1));

        assertEquals(1, result.executed());
        assertEquals(1, errors.size());
        assertTrue(errors.get(0) instanceof AssertionError);
        assertNull(flow.output("G"));
    }

    @Test
    void failedAttemptDiscardsBufferedEnqueues() {
        WorkflowHandle flow = engine.open("partial");
        flow.step("A").noRetry().effect(ctx -> {
            ctx.enqueueNext("B", IntNode.valueOf(1));
            throw new IllegalStateException("after enqueue");
        }).add().step("B").add();

        flow.start("A", 0);

        assertNull(flow.output("B"));
        assertEquals(0, flow.queued());
    }

    @Test
    void remoteStepWithoutBridgeFallsBackInProcess() {
        WorkflowHandle flow = engine.open("fallback");
        AtomicReference<ExecutionDomain> domain = new AtomicReference<>();
        flow.step("R").remote().effect(ctx -> {
            domain.set(ctx.executionDomain());
            return IntNode.valueOf(ctx.input().asInt() + 100);
        }).add();

        flow.start("R", 1);

        assertEquals(IntNode.valueOf(101), flow.output("R"));
        assertEquals(ExecutionDomain.LOCAL, domain.get());
        assertTrue(flow.log("R").archive().stream().anyMatch(e -> e.level() == LogLevel.WARN));
    }

    @Test
    void stepContextExposesMetaTraceAndShared() {
        WorkflowHandle flow = engine.open("ctx");
        AtomicReference<String> seen = new AtomicReference<>();
        flow.step("M").guard(ctx -> true).effect(ctx -> {
            ctx.shared().put("visited", true);
            ctx.log("hello", 1);
            seen.set(ctx.meta().stepName() + ":" + ctx.meta().hasGuard() + ":" + ctx.attempt() + ":" + ctx.traceId());
            return null;
        }).add();

        flow.enqueue("M", null, "trace-1");
        flow.pump();

        assertEquals("M:true:1:trace-1", seen.get());
        assertTrue(flow.shared().get("visited").asBoolean());
        assertEquals(List.of("hello", 1), flow.log("M").last().args());
    }

    @Test
    void subWorkflowIsOpenedUnderTheParentAndAutoStarted() {
        WorkflowHandle flow = engine.open("parent");
        flow.step("spawn").effect(ctx -> {
            WorkflowHandle child = ctx.spawnSubWorkflow("child", c -> {
                c.step("c1").effect(cc -> IntNode.valueOf(cc.input().asInt() * 10)).add();
                c.enqueue("c1", 4);
            }, true);
            return child.output("c1");
        }).add();

        flow.start("spawn", null);

        assertEquals(IntNode.valueOf(40), flow.output("spawn"));
        assertTrue(engine.instance("parent.subflows.child").isPresent());
    }

    @Test
    void plannedSubWorkflowIsNotStarted() {
        WorkflowHandle flow = engine.open("planner");
        flow.step("plan").effect(ctx -> {
            WorkflowHandle child = ctx.planSubWorkflow("later", c -> {
                c.defineStep(StepDefinition.passThrough("x"));
                c.enqueue("x", 1);
            });
            return IntNode.valueOf(child.queued());
        }).add();

        flow.start("plan", null);

        assertEquals(IntNode.valueOf(1), flow.output("plan"));
        assertEquals(1, engine.instance("planner.subflows.later").orElseThrow().queued());
    }

    @Test
    void handleEventsAreScopedToTheirInstance() {
        WorkflowHandle one = engine.open("one");
        WorkflowHandle two = engine.open("two");
        one.step("A").add();
        two.step("A").add();
        List<String> seen = new CopyOnWriteArrayList<>();
        one.on(FlowEventNames.stepAfter("A"), e -> seen.add(e.instanceId()));
        List<String> global = new CopyOnWriteArrayList<>();
        engine.on(FlowEventNames.stepAfter("A"), e -> global.add(e.instanceId()));

        one.start("A", 1);
        two.start("A", 1);

        assertEquals(List.of("one"), seen);
        assertEquals(List.of("one", "two"), global);
    }

    @Test
    void openIsIdempotentAndRemoveDetachesTheInstance() {
        WorkflowHandle first = engine.open("same");
        assertSame(first, engine.open("same"));
        first.step("A").add();

        assertTrue(engine.remove("same"));
        assertFalse(engine.remove("same"));
        assertTrue(engine.instance("same").isEmpty());
    }

    @Test
    void closedEngineRefusesToOpenInstances() {
        FlowEngine other = FlowEngine.builder().build();
        other.close();

        assertThrows(IllegalStateException.class, () -> other.open("late"));
    }
}
