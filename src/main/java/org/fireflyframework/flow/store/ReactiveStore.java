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


package org.fireflyframework.flow.store;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.Disposable;

import java.util.Optional;

/**
 * Path-addressed reactive value store consumed by the flow engine.
 * <p>
 * The engine only relies on this contract:
 * <ul>
 *   <li>{@link #node(String)} creates (or resolves) a node by dotted path;</li>
 *   <li>{@link #get(StoreNode)} reads the current value, {@code null} when unset;</li>
 *   <li>{@link #set(StoreNode, JsonNode)} replaces the value and notifies watchers only when the new
 *       value differs from the current one by value equality;</li>
 *   <li>{@link #watch(StoreNode, StoreWatcher)} registers a change listener.</li>
 * </ul>
 * The skip-on-equal rule of {@code set} is what stops a step that rewrites its own unchanged
 * output from triggering itself again.
 */
public interface ReactiveStore {

    StoreNode node(String path);

    Optional<StoreNode> resolve(String path);

    JsonNode get(StoreNode node);

    /**
     * Sets the node value.
     *
     * @return {@code true} when the value changed and watchers were notified
     */
    boolean set(StoreNode node, JsonNode value);

    Disposable watch(StoreNode node, StoreWatcher watcher);

    /**
     * Listener invoked synchronously after a node value changed.
     */
    @FunctionalInterface
    interface StoreWatcher {
        void onChange(JsonNode newValue, JsonNode oldValue);
    }
}
