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


package org.fireflyframework.flow.persistence.serialization;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.fireflyframework.flow.core.ExecutionDomain;
import org.fireflyframework.flow.core.QueueItem;
import org.fireflyframework.flow.core.StepLog;
import org.fireflyframework.flow.core.StepLogEntry;
import org.fireflyframework.flow.core.WorkflowInstance;
import org.fireflyframework.flow.registry.StepDefinition;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serializable image of a workflow instance.
 * <p>
 * Step definitions are captured as metadata only: effects, guards and branches are code and must
 * be defined again on the instance a snapshot is restored into.
 */
public class WorkflowSnapshot {
    private String id;
    private Instant capturedAt;
    private Map<String, StepMetadata> steps = new LinkedHashMap<>();
    private Map<String, List<String>> edges = new LinkedHashMap<>();
    private List<QueueItem> queue = new ArrayList<>();
    private Stats stats = new Stats();
    private JsonNode shared;
    private Map<String, JsonNode> outputs = new LinkedHashMap<>();
    private Map<String, LogState> logs = new LinkedHashMap<>();

    // Default constructor for Jackson
    public WorkflowSnapshot() {}

    public static WorkflowSnapshot capture(WorkflowInstance instance) {
        WorkflowSnapshot s = new WorkflowSnapshot();
        s.id = instance.id();
        s.capturedAt = Instant.now();
        instance.steps().definitions().forEach((name, def) -> s.steps.put(name, StepMetadata.of(def)));
        s.edges = instance.steps().edges();
        s.queue = new ArrayList<>(instance.queue());
        s.stats.steps = instance.stats().steps();
        s.stats.retries = instance.stats().retries();
        s.stats.suspensions = instance.stats().suspensions();
        s.shared = instance.shared().deepCopy();
        s.outputs = new LinkedHashMap<>(instance.outputs());
        instance.logs().forEach((name, log) -> s.logs.put(name, new LogState(log.ring(), log.archive())));
        return s;
    }

    /**
     * Replaces the runtime state of {@code target} with this snapshot. Step definitions already present
     * on the target are kept; edges are added to the existing ones.
     */
    public void restoreInto(WorkflowInstance target) {
        edges.forEach((from, to) -> target.steps().connect(from, to.toArray(new String[0])));
        target.queue().clear();
        target.queue().addAll(queue);
        target.stats().restore(stats.steps, stats.retries, stats.suspensions);
        ObjectNode sharedNode = target.shared();
        sharedNode.removeAll();
        if (shared != null && shared.isObject()) {
            sharedNode.setAll((ObjectNode) shared);
        }
        outputs.forEach(target::recordOutput);
        logs.forEach((name, state) -> {
            StepLog log = target.log(name);
            log.restore(state.getRing(), state.getArchive());
        });
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public Instant getCapturedAt() { return capturedAt; }
    public void setCapturedAt(Instant capturedAt) { this.capturedAt = capturedAt; }

    public Map<String, StepMetadata> getSteps() { return steps; }
    public void setSteps(Map<String, StepMetadata> steps) { this.steps = steps; }

    public Map<String, List<String>> getEdges() { return edges; }
    public void setEdges(Map<String, List<String>> edges) { this.edges = edges; }

    public List<QueueItem> getQueue() { return queue; }
    public void setQueue(List<QueueItem> queue) { this.queue = queue; }

    public Stats getStats() { return stats; }
    public void setStats(Stats stats) { this.stats = stats; }

    public JsonNode getShared() { return shared; }
    public void setShared(JsonNode shared) { this.shared = shared; }

    public Map<String, JsonNode> getOutputs() { return outputs; }
    public void setOutputs(Map<String, JsonNode> outputs) { this.outputs = outputs; }

    public Map<String, LogState> getLogs() { return logs; }
    public void setLogs(Map<String, LogState> logs) { this.logs = logs; }

    public static class StepMetadata {
        private ExecutionDomain executionDomain;
        private boolean hasEffect;
        private boolean hasGuard;
        private String branch;
        private List<String> branchTargets = new ArrayList<>();
        private boolean retryEnabled;
        private int maxAttempts;
        private long backoffMs;
        private double multiplier;
        private boolean jitter;
        private String bothModeOrder;
        private String merge;
        private List<String> staticNext = new ArrayList<>();

        public StepMetadata() {}

        static StepMetadata of(StepDefinition def) {
            StepMetadata m = new StepMetadata();
            m.executionDomain = def.executionDomain;
            m.hasEffect = def.hasEffect();
            m.hasGuard = def.hasGuard();
            if (def.branch != null) {
                m.branch = def.branch.kind();
                m.branchTargets = new ArrayList<>(def.branch.targets());
            }
            m.retryEnabled = def.retry.enabled;
            m.maxAttempts = def.retry.maxAttempts;
            m.backoffMs = def.retry.backoffMs;
            m.multiplier = def.retry.multiplier;
            m.jitter = def.retry.jitter;
            m.bothModeOrder = def.bothModeOrder.name();
            m.merge = def.merge.kind().name();
            m.staticNext = new ArrayList<>(def.staticNext);
            return m;
        }

        public ExecutionDomain getExecutionDomain() { return executionDomain; }
        public void setExecutionDomain(ExecutionDomain executionDomain) { this.executionDomain = executionDomain; }
        public boolean isHasEffect() { return hasEffect; }
        public void setHasEffect(boolean hasEffect) { this.hasEffect = hasEffect; }
        public boolean isHasGuard() { return hasGuard; }
        public void setHasGuard(boolean hasGuard) { this.hasGuard = hasGuard; }
        public String getBranch() { return branch; }
        public void setBranch(String branch) { this.branch = branch; }
        public List<String> getBranchTargets() { return branchTargets; }
        public void setBranchTargets(List<String> branchTargets) { this.branchTargets = branchTargets; }
        public boolean isRetryEnabled() { return retryEnabled; }
        public void setRetryEnabled(boolean retryEnabled) { this.retryEnabled = retryEnabled; }
        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public long getBackoffMs() { return backoffMs; }
        public void setBackoffMs(long backoffMs) { this.backoffMs = backoffMs; }
        public double getMultiplier() { return multiplier; }
        public void setMultiplier(double multiplier) { this.multiplier = multiplier; }
        public boolean isJitter() { return jitter; }
        public void setJitter(boolean jitter) { this.jitter = jitter; }
        public String getBothModeOrder() { return bothModeOrder; }
        public void setBothModeOrder(String bothModeOrder) { this.bothModeOrder = bothModeOrder; }
        public String getMerge() { return merge; }
        public void setMerge(String merge) { this.merge = merge; }
        public List<String> getStaticNext() { return staticNext; }
        public void setStaticNext(List<String> staticNext) { this.staticNext = staticNext; }
    }

    public static class Stats {
        private long steps;
        private long retries;
        private long suspensions;

        public long getSteps() { return steps; }
        public void setSteps(long steps) { this.steps = steps; }
        public long getRetries() { return retries; }
        public void setRetries(long retries) { this.retries = retries; }
        public long getSuspensions() { return suspensions; }
        public void setSuspensions(long suspensions) { this.suspensions = suspensions; }
    }

    public static class LogState {
        private List<StepLogEntry> ring = new ArrayList<>();
        private List<StepLogEntry> archive = new ArrayList<>();

        public LogState() {}

        public LogState(List<StepLogEntry> ring, List<StepLogEntry> archive) {
            this.ring = new ArrayList<>(ring);
            this.archive = new ArrayList<>(archive);
        }

        public List<StepLogEntry> getRing() { return ring; }
        public void setRing(List<StepLogEntry> ring) { this.ring = ring; }
        public List<StepLogEntry> getArchive() { return archive; }
        public void setArchive(List<StepLogEntry> archive) { this.archive = archive; }
    }
}
