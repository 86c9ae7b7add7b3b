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

import org.fireflyframework.flow.core.StepContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Conditional selection of the downstream step, evaluated after a successful effect. The selected
 * step receives the step output as payload.
 */
public abstract class BranchSpec {

    private BranchSpec() {}

    /** Predicate branch: {@code then} when the condition holds, otherwise {@code otherwise} (may be null). */
    public static BranchSpec when(Predicate<StepContext> condition, String then, String otherwise) {
        return new Conditional(condition, then, otherwise);
    }

    public static BranchSpec when(Predicate<StepContext> condition, String then) {
        return new Conditional(condition, then, null);
    }

    public static Multiway multiway(Function<StepContext, String> selector) {
        return new Multiway(selector);
    }

    /** Target step, or empty when nothing should be enqueued. */
    public abstract Optional<String> select(StepContext ctx);

    /** Every step name this branch can select. */
    public abstract List<String> targets();

    public abstract String kind();

    public static final class Conditional extends BranchSpec {
        private final Predicate<StepContext> condition;
        private final String then;
        private final String otherwise;

        private Conditional(Predicate<StepContext> condition, String then, String otherwise) {
            this.condition = Objects.requireNonNull(condition, "condition");
            this.then = Objects.requireNonNull(then, "then");
            this.otherwise = otherwise;
        }

        @Override
        public Optional<String> select(StepContext ctx) {
            return condition.test(ctx) ? Optional.of(then) : Optional.ofNullable(otherwise);
        }

        @Override
        public List<String> targets() {
            return otherwise == null ? List.of(then) : List.of(then, otherwise);
        }

        @Override
        public String kind() {
            return "predicate";
        }
    }

    /**
     * Keyed branch. An unmatched key falls back to the default case; without one nothing is enqueued.
     */
    public static final class Multiway extends BranchSpec {
        private final Function<StepContext, String> selector;
        private final Map<String, String> cases = new LinkedHashMap<>();
        private String defaultStep;

        private Multiway(Function<StepContext, String> selector) {
            this.selector = Objects.requireNonNull(selector, "selector");
        }

        public Multiway on(String key, String stepName) {
            cases.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(stepName, "stepName"));
            return this;
        }

        public Multiway otherwise(String stepName) {
            this.defaultStep = stepName;
            return this;
        }

        public Map<String, String> cases() {
            return Collections.unmodifiableMap(cases);
        }

        @Override
        public Optional<String> select(StepContext ctx) {
            String key = selector.apply(ctx);
            String target = key != null ? cases.get(key) : null;
            return Optional.ofNullable(target != null ? target : defaultStep);
        }

        @Override
        public List<String> targets() {
            List<String> all = new ArrayList<>(cases.values());
            if (defaultStep != null) all.add(defaultStep);
            return all;
        }

        @Override
        public String kind() {
            return "multiway";
        }
    }
}
