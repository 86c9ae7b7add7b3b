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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Default in-memory {@link ReactiveStore}.
 * <p>
 * Nodes are kept in a flat map keyed by path; creating {@code a.b.c} also creates {@code a} and
 * {@code a.b}. Values are compared with {@link JsonNode#equals(Object)}, which is a deep value
 * comparison. Watcher exceptions are logged and never reach the caller of {@code set}.
 */
public class InMemoryReactiveStore implements ReactiveStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryReactiveStore.class);

    private final Map<String, Node> nodes = new ConcurrentHashMap<>();

    @Override
    public StoreNode node(String path) {
        Objects.requireNonNull(path, "path");
        if (path.isBlank()) {
            throw new IllegalArgumentException("Store path must not be blank");
        }
        Node existing = nodes.get(path);
        if (existing != null) {
            return existing;
        }
        int dot = path.lastIndexOf('.');
        if (dot > 0) {
            node(path.substring(0, dot));
        }
        return nodes.computeIfAbsent(path, Node::new);
    }

    @Override
    public Optional<StoreNode> resolve(String path) {
        return Optional.ofNullable(nodes.get(path));
    }

    @Override
    public JsonNode get(StoreNode node) {
        return own(node).value;
    }

    @Override
    public boolean set(StoreNode node, JsonNode value) {
        Node n = own(node);
        JsonNode old;
        synchronized (n) {
            old = n.value;
            if (Objects.equals(old, value)) {
                return false;
            }
            n.value = value;
        }
        for (ReactiveStore.StoreWatcher watcher : n.watchers) {
            try {
                watcher.onChange(value, old);
            } catch (RuntimeException e) {
                log.error("Store watcher failed for path {}", n.path, e);
            }
        }
        return true;
    }

    @Override
    public Disposable watch(StoreNode node, StoreWatcher watcher) {
        Node n = own(node);
        n.watchers.add(watcher);
        return () -> n.watchers.remove(watcher);
    }

    private Node own(StoreNode node) {
        Objects.requireNonNull(node, "node");
        Node n = nodes.get(node.path());
        if (n == null) {
            throw new IllegalArgumentException("Node does not belong to this store: " + node.path());
        }
        return n;
    }

    private static final class Node implements StoreNode {
        private final String path;
        private final List<StoreWatcher> watchers = new CopyOnWriteArrayList<>();
        private volatile JsonNode value;

        private Node(String path) {
            this.path = path;
        }

        @Override
        public String path() {
            return path;
        }

        @Override
        public String key() {
            int dot = path.lastIndexOf('.');
            return dot < 0 ? path : path.substring(dot + 1);
        }

        @Override
        public String toString() {
            return "StoreNode[" + path + "]";
        }
    }
}
