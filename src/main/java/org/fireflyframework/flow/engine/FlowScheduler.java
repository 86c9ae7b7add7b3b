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
import org.fireflyframework.flow.core.QueueItem;
import org.fireflyframework.flow.core.QueueOrder;
import org.fireflyframework.flow.core.WorkflowInstance;
import org.fireflyframework.flow.core.WorkflowOptions;
import org.fireflyframework.flow.events.FlowEvent;
import org.fireflyframework.flow.events.FlowEventNames;
import org.fireflyframework.flow.shared.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Drains workflow queues.
 * <p>
 * A pump executes queued items one at a time until the queue is empty or a budget runs out. It is
 * guarded per instance: pumping an instance that is already being pumped returns immediately, so
 * watchers and events fired by a step may enqueue and pump freely. Retries are re-enqueued by
 * timers and suspended items by bridge continuations; both pump the instance again themselves.
 * A continuation finishes the execution it belongs to, so it is not counted as a new step.
 */
public class FlowScheduler {
    private static final Logger log = LoggerFactory.getLogger(FlowScheduler.class);

    private final FlowEngine engine;
    private final StepExecutor executor;
    private final Disposable.Composite timers = Disposables.composite();

    FlowScheduler(FlowEngine engine, StepExecutor executor) {
        this.engine = engine;
        this.executor = executor;
    }

    public QueueItem enqueue(WorkflowInstance instance, String stepName, JsonNode payload) {
        return enqueue(instance, stepName, payload, null);
    }

    /** Appends a queue item; a fresh trace id is generated when {@code traceId} is null. */
    public QueueItem enqueue(WorkflowInstance instance, String stepName, JsonNode payload, String traceId) {
        QueueItem item = QueueItem.of(stepName, payload, traceId != null ? traceId : TraceIds.next());
        instance.queue().addLast(item);
        return item;
    }

    public PumpResult pump(WorkflowInstance instance) {
        WorkflowOptions options = instance.options();
        long startedAt = System.currentTimeMillis();
        int executed = 0;
        while (true) {
            if (!instance.tryEnter()) {
                return executed == 0
                        ? PumpResult.skipped(instance.queue().size())
                        : new PumpResult(executed, false, instance.queue().size(), false);
            }
            boolean stoppedByBudget = false;
            try {
                engine.bus().emit(FlowEvent.workflow(FlowEventNames.WORKFLOW_START, instance.id()));
                engine.events().onWorkflowStarted(instance.id());
                while (true) {
                    if (options.maxSteps() > 0 && executed >= options.maxSteps()) {
                        stoppedByBudget = !instance.queue().isEmpty();
                        break;
                    }
                    if (options.maxMillis() > 0 && System.currentTimeMillis() - startedAt >= options.maxMillis()) {
                        stoppedByBudget = !instance.queue().isEmpty();
                        break;
                    }
                    QueueItem item = options.order() == QueueOrder.LIFO
                            ? instance.queue().pollLast()
                            : instance.queue().pollFirst();
                    if (item == null) {
                        break;
                    }
                    if (!item.resumed()) {
                        executed++;
                        instance.stats().incrementSteps();
                    }
                    handle(instance, item, executor.execute(instance, item));
                }
            } finally {
                instance.exit();
            }

            int remaining = instance.queue().size();
            if (stoppedByBudget) {
                log.debug(JsonUtils.json("flow_event", "pump_budget", "instance_id", instance.id(),
                        "executed", String.valueOf(executed), "remaining", String.valueOf(remaining)));
                engine.events().onBudgetExhausted(instance.id(), executed, remaining);
                return new PumpResult(executed, true, remaining, false);
            }
            if (remaining == 0) {
                engine.bus().emit(FlowEvent.workflow(FlowEventNames.WORKFLOW_IDLE, instance.id()));
                engine.events().onWorkflowIdle(instance.id(), executed);
                if (instance.isSettled()) {
                    engine.bus().emit(FlowEvent.workflow(FlowEventNames.WORKFLOW_FINISH, instance.id()));
                    engine.events().onWorkflowFinished(instance.id(), instance.stats().steps());
                }
            }
            if (instance.queue().isEmpty()) {
                return new PumpResult(executed, false, 0, false);
            }
            // items arrived from another thread after the drain ended
            if (options.maxSteps() > 0 && executed >= options.maxSteps()) {
                return new PumpResult(executed, true, instance.queue().size(), false);
            }
        }
    }

    private void handle(WorkflowInstance instance, QueueItem item, StepOutcome outcome) {
        switch (outcome.status) {
            case RETRY:
                scheduleRetry(instance, item, outcome.retryDelayMs);
                break;
            case SUSPENDED:
                awaitContinuation(instance, item, outcome);
                break;
            default:
                break;
        }
    }

    private void scheduleRetry(WorkflowInstance instance, QueueItem item, long delayMs) {
        QueueItem next = item.nextAttempt();
        instance.retryScheduled();
        instance.stats().incrementRetries();
        engine.events().onStepRetryScheduled(instance.id(), item.stepName(), next.attempt(), delayMs);
        Disposable[] timer = new Disposable[1];
        timer[0] = Mono.delay(Duration.ofMillis(Math.max(0L, delayMs)), engine.timerScheduler())
                .doFinally(signal -> {
                    if (timer[0] != null) timers.remove(timer[0]);
                })
                .subscribe(tick -> {
                    instance.queue().addLast(next);
                    instance.retryFired();
                    pump(instance);
                });
        timers.add(timer[0]);
    }

    private void awaitContinuation(WorkflowInstance instance, QueueItem item, StepOutcome outcome) {
        instance.suspended();
        instance.stats().incrementSuspensions();
        outcome.pending.whenSettled().subscribe(null,
                error -> log.warn("Bridge continuation for step {} failed", item.stepName(), error),
                () -> {
                    instance.queue().addLast(item.asContinuation());
                    instance.resumed();
                    pump(instance);
                });
    }

    /** Cancels pending retry timers. */
    void dispose() {
        timers.dispose();
    }
}
