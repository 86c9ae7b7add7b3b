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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Per-instance step definitions plus the adjacency map (step name to downstream step names).
 * Redefining a step replaces the previous definition; edges are kept.
 */
public class StepRegistry {
    private final Map<String, StepDefinition> steps = new ConcurrentHashMap<>();
    private final Map<String, CopyOnWriteArrayList<String>> edges = new ConcurrentHashMap<>();

    /** Registers {@code def} and returns the definition it replaced, if any. */
    public Optional<StepDefinition> define(StepDefinition def) {
        return Optional.ofNullable(steps.put(def.name, def));
    }

    public Optional<StepDefinition> get(String name) {
        return Optional.ofNullable(steps.get(name));
    }

    public boolean contains(String name) {
        return steps.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(steps.keySet()));
    }

    public Map<String, StepDefinition> definitions() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(steps));
    }

    /** Adds edges {@code from -> to}; duplicates are ignored. Steps need not be defined yet. */
    public void connect(String from, String... to) {
        if (from == null) throw new IllegalArgumentException("from");
        CopyOnWriteArrayList<String> out = edges.computeIfAbsent(from, k -> new CopyOnWriteArrayList<>());
        if (to == null) return;
        for (String t : to) {
            if (t != null) out.addIfAbsent(t);
        }
    }

    public List<String> downstream(String from) {
        List<String> out = edges.get(from);
        return out == null ? List.of() : List.copyOf(out);
    }

    public Map<String, List<String>> edges() {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        edges.forEach((k, v) -> copy.put(k, new ArrayList<>(v)));
        return copy;
    }
}
