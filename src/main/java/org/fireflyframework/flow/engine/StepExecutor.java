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
import org.fireflyframework.flow.bridge.BridgeOutcome;
import org.fireflyframework.flow.bridge.BridgeProtocolException;
import org.fireflyframework.flow.bridge.BridgeRequest;
import org.fireflyframework.flow.bridge.BridgeResponse;
import org.fireflyframework.flow.bridge.CrossDomainBridge;
import org.fireflyframework.flow.bridge.PendingBridgeCall;
import org.fireflyframework.flow.bridge.RemoteStepException;
import org.fireflyframework.flow.core.ExecutionDomain;
import org.fireflyframework.flow.core.FlowValues;
import org.fireflyframework.flow.core.LogLevel;
import org.fireflyframework.flow.core.QueueItem;
import org.fireflyframework.flow.core.StepLog;
import org.fireflyframework.flow.core.StepLogEntry;
import org.fireflyframework.flow.core.WorkflowInstance;
import org.fireflyframework.flow.engine.step.StepBackoff;
import org.fireflyframework.flow.events.FlowEvent;
import org.fireflyframework.flow.events.FlowEventNames;
import org.fireflyframework.flow.registry.StepDefinition;
import org.fireflyframework.flow.shared.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Runs one queue item: guard, domain dispatch (in-process, through the bridge or both), branch
 * selection, downstream enqueues and lifecycle events. Failures never escape; they are turned into
 * a retry request or into {@code step:error} and {@code workflow:error} events.
 */
public class StepExecutor {
    private static final Logger log = LoggerFactory.getLogger(StepExecutor.class);

    private final FlowEngine engine;

    StepExecutor(FlowEngine engine) {
        this.engine = engine;
    }

    StepOutcome execute(WorkflowInstance instance, QueueItem item) {
        String name = item.stepName();
        StepDefinition def = instance.steps().get(name).orElse(null);
        if (def == null) {
            IllegalStateException err = new IllegalStateException("Unknown step '" + name + "' in workflow '" + instance.id() + "'");
            log.warn(JsonUtils.json("flow_event", "unknown_step", "instance_id", instance.id(), "step_name", name, "trace_id", item.traceId()));
            instance.log(name).append(LogLevel.ERROR, "unknown step", name);
            engine.events().onStepFailed(instance.id(), name, err, item.attempt(), 0L);
            engine.bus().emit(FlowEvent.stepError(instance.id(), name, item.traceId(), err));
            return StepOutcome.unknownStep(err);
        }

        StepLog stepLog = instance.log(name);
        DefaultStepContext ctx = new DefaultStepContext(engine, instance, def, item, stepLog::append);
        long start = System.currentTimeMillis();
        try {
            if (item.resumed()) {
                stepLog.append(LogLevel.INFO, "resumed after bridge call", item.traceId());
            } else {
                if (def.guard != null && !def.guard.test(ctx)) {
                    stepLog.append(LogLevel.INFO, "guard vetoed execution", item.traceId());
                    engine.events().onStepVetoed(instance.id(), name);
                    return StepOutcome.vetoed();
                }
                engine.bus().emit(FlowEvent.step(FlowEventNames.stepBefore(name), instance.id(), name, item.traceId(), item.payload()));
                engine.events().onStepStarted(instance.id(), name, item.traceId(), item.attempt(), def.executionDomain);
            }

            Dispatch result = dispatch(instance, def, ctx, item);
            if (result.pending != null) {
                stepLog.append(LogLevel.INFO, "suspended on bridge call", item.traceId());
                engine.events().onStepSuspended(instance.id(), name, item.traceId());
                return StepOutcome.suspended(result.pending);
            }

            JsonNode output = FlowValues.orNull(result.output);
            ctx.complete(output);
            List<QueueItem> downstream = selectDownstream(instance, def, ctx, output);
            instance.recordOutput(name, output);
            downstream.forEach(instance.queue()::addLast);

            engine.bus().emit(FlowEvent.step(FlowEventNames.stepAfter(name), instance.id(), name, item.traceId(), output));
            engine.events().onStepSuccess(instance.id(), name, item.attempt(), System.currentTimeMillis() - start);
            return StepOutcome.completed(output);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Exception | Error e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            return onFailure(instance, def, item, stepLog, e, System.currentTimeMillis() - start);
        }
    }

    private StepOutcome onFailure(WorkflowInstance instance, StepDefinition def, QueueItem item, StepLog stepLog,
                                  Throwable error, long latencyMs) {
        String name = def.name;
        stepLog.append(LogLevel.ERROR, "attempt " + item.attempt() + " failed", String.valueOf(error.getMessage()));
        engine.events().onStepFailed(instance.id(), name, error, item.attempt(), latencyMs);
        if (def.retry.allowsRetryAfter(item.attempt())) {
            long delay = StepBackoff.computeDelay(def.retry, item.attempt());
            stepLog.append(LogLevel.WARN, "retry scheduled", item.attempt() + 1, delay);
            return StepOutcome.retry(error, delay);
        }
        log.debug(JsonUtils.json("flow_event", "step_exhausted", "instance_id", instance.id(), "step_name", name,
                "attempts", String.valueOf(item.attempt())));
        engine.bus().emit(FlowEvent.stepError(instance.id(), name, item.traceId(), error));
        engine.bus().emit(FlowEvent.workflowError(instance.id(), name, item.traceId(), error));
        engine.events().onWorkflowError(instance.id(), name, error);
        return StepOutcome.failed(error);
    }

    private List<QueueItem> selectDownstream(WorkflowInstance instance, StepDefinition def, DefaultStepContext ctx, JsonNode output) {
        List<QueueItem> out = new ArrayList<>();
        if (def.branch != null) {
            def.branch.select(ctx).ifPresent(target -> out.add(QueueItem.of(target, output, TraceIds.next())));
            return out;
        }
        List<QueueItem> explicit = ctx.pendingEnqueues();
        if (!explicit.isEmpty()) {
            return explicit;
        }
        Set<String> targets = new LinkedHashSet<>(def.staticNext);
        targets.addAll(instance.steps().downstream(def.name));
        for (String t : targets) {
            out.add(QueueItem.of(t, output, TraceIds.next()));
        }
        return out;
    }

    private Dispatch dispatch(WorkflowInstance instance, StepDefinition def, DefaultStepContext ctx, QueueItem item) throws Exception {
        switch (def.executionDomain) {
            case LOCAL:
                ctx.runningIn(ExecutionDomain.LOCAL);
                return Dispatch.done(runInProcess(def, ctx));
            case REMOTE:
                return runRemote(instance, def, ctx, item, true);
            default:
                return runBoth(instance, def, ctx, item);
        }
    }

    /** Effect output, or the last self-write, or the input. */
    JsonNode runInProcess(StepDefinition def, DefaultStepContext ctx) throws Exception {
        if (def.effect == null) {
            return ctx.input();
        }
        JsonNode result = def.effect.apply(ctx);
        if (result != null) {
            return result;
        }
        return ctx.lastWritten() != null ? ctx.lastWritten() : ctx.input();
    }

    private Dispatch runRemote(WorkflowInstance instance, StepDefinition def, DefaultStepContext ctx, QueueItem item,
                               boolean ownsContext) throws Exception {
        if (engine.isRemoteDomain()) {
            if (ownsContext) ctx.runningIn(ExecutionDomain.REMOTE);
            return Dispatch.done(runInProcess(def, ctx));
        }
        CrossDomainBridge bridge = engine.bridge();
        if (bridge == null) {
            fallback(instance, def, ctx, "no bridge configured");
            if (ownsContext) ctx.runningIn(ExecutionDomain.LOCAL);
            return Dispatch.done(runInProcess(def, ctx));
        }
        if (ownsContext) ctx.runningIn(ExecutionDomain.REMOTE);
        BridgeOutcome outcome;
        try {
            outcome = bridge.call(BridgeRequest.step(instance.id(), def.name, item.payload(), item.traceId()));
        } catch (BridgeProtocolException e) {
            fallback(instance, def, ctx, e.getMessage());
            if (ownsContext) ctx.runningIn(ExecutionDomain.LOCAL);
            return Dispatch.done(runInProcess(def, ctx));
        }
        if (!outcome.isCompleted()) {
            return Dispatch.suspended(outcome.pending());
        }
        BridgeResponse response = outcome.response();
        if (!response.isOk()) {
            throw new RemoteStepException(response.error() != null ? response.error() : "Remote step failed");
        }
        for (StepLogEntry entry : response.logsOrEmpty()) {
            ctx.append(entry);
        }
        return Dispatch.done(response.value());
    }

    private void fallback(WorkflowInstance instance, StepDefinition def, DefaultStepContext ctx, String reason) {
        ctx.warn("remote execution unavailable, running in-process", reason);
        engine.events().onBridgeFallback(instance.id(), def.name, reason);
    }

    private Dispatch runBoth(WorkflowInstance instance, StepDefinition def, DefaultStepContext ctx, QueueItem item) throws Exception {
        String parkKey = item.traceId() + "/" + def.name + "/" + item.attempt();
        switch (def.bothModeOrder) {
            case LOCAL_FIRST: {
                JsonNode local = runLocalHalf(instance, def, ctx, parkKey);
                Dispatch remote = runRemote(instance, def, ctx, item, false);
                if (remote.pending != null) {
                    instance.park(parkKey, local);
                    return remote;
                }
                return Dispatch.done(def.merge.merge(List.of(local, FlowValues.orNull(remote.output))));
            }
            case PARALLEL:
                return runParallel(instance, def, ctx, item, parkKey);
            default: {
                Dispatch remote = runRemote(instance, def, ctx, item, false);
                if (remote.pending != null) {
                    return remote;
                }
                JsonNode local = runLocalHalf(instance, def, ctx, parkKey);
                return Dispatch.done(def.merge.merge(List.of(FlowValues.orNull(remote.output), local)));
            }
        }
    }

    private JsonNode runLocalHalf(WorkflowInstance instance, StepDefinition def, DefaultStepContext ctx, String parkKey) throws Exception {
        JsonNode parked = instance.unpark(parkKey);
        if (parked != null) {
            return parked;
        }
        ctx.runningIn(ExecutionDomain.LOCAL);
        return runInProcess(def, ctx);
    }

    /**
     * Remote half on a worker thread (or inline when the bridge never blocks), local half on this
     * thread. The attempt fails only when both halves fail. Outputs reach the merge strategy in the
     * fixed order {@code [local, remote]}, whichever half finished first.
     */
    private Dispatch runParallel(WorkflowInstance instance, StepDefinition def, DefaultStepContext ctx, QueueItem item,
                                 String parkKey) throws Exception {
        CrossDomainBridge bridge = engine.bridge();
        boolean offload = bridge != null && bridge.isBlockingAllowed() && !engine.isRemoteDomain();
        CompletableFuture<Dispatch> remoteFuture;
        if (offload) {
            remoteFuture = Mono.fromCallable(() -> runRemote(instance, def, ctx, item, false))
                    .subscribeOn(engine.parallelScheduler())
                    .toFuture();
        } else {
            remoteFuture = new CompletableFuture<>();
            try {
                remoteFuture.complete(runRemote(instance, def, ctx, item, false));
            } catch (Exception e) {
                remoteFuture.completeExceptionally(e);
            }
        }

        JsonNode local = null;
        boolean localDone = false;
        Exception localError = null;
        try {
            local = runLocalHalf(instance, def, ctx, parkKey);
            localDone = true;
        } catch (Exception e) {
            localError = e;
        }

        Dispatch remote = null;
        Exception remoteError = null;
        try {
            remote = remoteFuture.get();
        } catch (ExecutionException e) {
            remoteError = e.getCause() instanceof Exception ex ? ex : new RemoteStepException(String.valueOf(e.getCause()));
        }

        if (remote != null && remote.pending != null) {
            if (localDone) {
                instance.park(parkKey, local);
            }
            return remote;
        }
        if (localError != null && remoteError != null) {
            remoteError.addSuppressed(localError);
            throw remoteError;
        }
        if (localError != null) {
            ctx.warn("local half failed, keeping remote result", String.valueOf(localError.getMessage()));
        }
        if (remoteError != null) {
            ctx.warn("remote half failed, keeping local result", String.valueOf(remoteError.getMessage()));
        }
        List<JsonNode> outputs = new ArrayList<>(2);
        if (localDone) outputs.add(FlowValues.orNull(local));
        if (remote != null) outputs.add(FlowValues.orNull(remote.output));
        return Dispatch.done(def.merge.merge(outputs));
    }

    /**
     * Serves a bridge request on the remote side: runs the step effect in-process in the
     * {@code REMOTE} domain and returns its output together with the lines it logged.
     */
    BridgeResponse runAsRemote(WorkflowInstance instance, BridgeRequest request) {
        StepDefinition def = instance.steps().get(request.stepName()).orElse(null);
        if (def == null) {
            return BridgeResponse.err("Step not found: " + request.stepName());
        }
        List<StepLogEntry> entries = new ArrayList<>();
        String traceId = request.traceId() != null ? request.traceId() : TraceIds.next();
        QueueItem item = new QueueItem(def.name, request.payload(), System.currentTimeMillis(), traceId, 1);
        DefaultStepContext ctx = new DefaultStepContext(engine, instance, def, item, entries::add);
        ctx.runningIn(ExecutionDomain.REMOTE);
        try {
            JsonNode out = runInProcess(def, ctx);
            return BridgeResponse.ok(FlowValues.orNull(out), entries);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Exception | Error e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            log.debug("Remote execution of step {} in workflow {} failed", def.name, instance.id(), e);
            return BridgeResponse.err(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private static final class Dispatch {
        final JsonNode output;
        final PendingBridgeCall pending;

        private Dispatch(JsonNode output, PendingBridgeCall pending) {
            this.output = output;
            this.pending = pending;
        }

        static Dispatch done(JsonNode output) {
            return new Dispatch(output, null);
        }

        static Dispatch suspended(PendingBridgeCall pending) {
            return new Dispatch(null, pending);
        }
    }
}
