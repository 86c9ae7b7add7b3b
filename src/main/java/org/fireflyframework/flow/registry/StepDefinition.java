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


package org.fireflyframework.flow.registry;

import org.fireflyframework.flow.core.ExecutionDomain;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable definition of a workflow step: execution domain, optional effect, branch and guard,
 * retry policy, {@code BOTH}-mode ordering and merge, and statically declared successors.
 * Definitions are looked up by name at dequeue time, so redefining a step affects queued items.
 */
public class StepDefinition {
    public final String name;
    public final ExecutionDomain executionDomain;
    public final StepEffect effect;
    public final BranchSpec branch;
    public final StepGuard guard;
    public final RetrySpec retry;
    public final BothModeOrder bothModeOrder;
    public final MergeStrategy merge;
    public final List<String> staticNext;

    private StepDefinition(Builder b) {
        this.name = b.name;
        this.executionDomain = b.executionDomain;
        this.effect = b.effect;
        this.branch = b.branch;
        this.guard = b.guard;
        this.retry = b.retry;
        this.bothModeOrder = b.bothModeOrder;
        this.merge = b.merge;
        this.staticNext = List.copyOf(b.staticNext);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /** A step with no effect: passes its input to its successors. */
    public static StepDefinition passThrough(String name) {
        return builder(name).build();
    }

    public boolean hasEffect() { return effect != null; }
    public boolean hasBranch() { return branch != null; }
    public boolean hasGuard() { return guard != null; }

    public Builder toBuilder() {
        return copyInto(new Builder(name));
    }

    /** Same definition registered under another name. */
    public StepDefinition renamed(String newName) {
        return copyInto(new Builder(newName)).build();
    }

    private Builder copyInto(Builder target) {
        Builder b = target
                .domain(executionDomain)
                .effect(effect)
                .branch(branch)
                .guard(guard)
                .retry(retry)
                .bothModeOrder(bothModeOrder)
                .merge(merge);
        b.staticNext.addAll(staticNext);
        return b;
    }

    @Override
    public String toString() {
        return "StepDefinition{name='" + name + "', domain=" + executionDomain + ", effect=" + hasEffect()
                + ", branch=" + hasBranch() + ", guard=" + hasGuard() + ", retry=" + retry + ", next=" + staticNext + '}';
    }

    public static class Builder {
        private final String name;
        private ExecutionDomain executionDomain = ExecutionDomain.LOCAL;
        private StepEffect effect;
        private BranchSpec branch;
        private StepGuard guard;
        private RetrySpec retry = RetrySpec.defaults();
        private BothModeOrder bothModeOrder = BothModeOrder.REMOTE_FIRST;
        private MergeStrategy merge = MergeStrategy.last();
        private final List<String> staticNext = new ArrayList<>();

        protected Builder(String name) {
            Objects.requireNonNull(name, "name");
            if (name.isBlank()) throw new IllegalArgumentException("Step name must not be blank");
            this.name = name;
        }

        public Builder domain(ExecutionDomain domain) { this.executionDomain = domain != null ? domain : ExecutionDomain.LOCAL; return this; }
        public Builder local() { return domain(ExecutionDomain.LOCAL); }
        public Builder remote() { return domain(ExecutionDomain.REMOTE); }
        public Builder both(BothModeOrder order) { this.bothModeOrder = Objects.requireNonNull(order, "order"); return domain(ExecutionDomain.BOTH); }
        public Builder effect(StepEffect effect) { this.effect = effect; return this; }
        public Builder branch(BranchSpec branch) { this.branch = branch; return this; }
        public Builder guard(StepGuard guard) { this.guard = guard; return this; }
        public Builder retry(RetrySpec retry) { this.retry = retry != null ? retry : RetrySpec.disabled(); return this; }
        public Builder noRetry() { this.retry = RetrySpec.disabled(); return this; }
        public Builder bothModeOrder(BothModeOrder order) { this.bothModeOrder = order != null ? order : BothModeOrder.REMOTE_FIRST; return this; }
        public Builder merge(MergeStrategy merge) { this.merge = merge != null ? merge : MergeStrategy.last(); return this; }

        public Builder next(String... names) {
            if (names != null) {
                for (String n : Arrays.asList(names)) {
                    if (n != null && !staticNext.contains(n)) staticNext.add(n);
                }
            }
            return this;
        }

        public StepDefinition build() {
            return new StepDefinition(this);
        }
    }
}
