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

import org.fireflyframework.flow.core.WorkflowInstance;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Engine-wide index of open workflow instances by id.
 */
public class WorkflowRegistry {
    private final Map<String, WorkflowInstance> instances = new ConcurrentHashMap<>();

    /** Returns the instance registered under {@code id}, creating it with {@code factory} when absent. */
    public WorkflowInstance getOrCreate(String id, Function<String, WorkflowInstance> factory) {
        return instances.computeIfAbsent(id, factory);
    }

    public void put(WorkflowInstance instance) {
        instances.put(instance.id(), instance);
    }

    public Optional<WorkflowInstance> find(String id) {
        return Optional.ofNullable(instances.get(id));
    }

    public WorkflowInstance get(String id) {
        WorkflowInstance instance = instances.get(id);
        if (instance == null) {
            throw new IllegalArgumentException("Workflow not found: " + id);
        }
        return instance;
    }

    public boolean contains(String id) {
        return instances.containsKey(id);
    }

    public Optional<WorkflowInstance> remove(String id) {
        return Optional.ofNullable(instances.remove(id));
    }

    public Set<String> ids() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(instances.keySet()));
    }

    public void clear() {
        instances.clear();
    }
}
