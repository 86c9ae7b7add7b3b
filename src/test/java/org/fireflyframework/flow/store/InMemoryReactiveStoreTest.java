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
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.fireflyframework.flow.core.FlowValues;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryReactiveStoreTest {

    @Test
    void nodesAreAddressedByPathAndCreateTheirParents() {
        InMemoryReactiveStore store = new InMemoryReactiveStore();

        StoreNode node = store.node("flows.wf.nodes.A");

        assertEquals("flows.wf.nodes.A", node.path());
        assertEquals("A", node.key());
        assertSame(node, store.node("flows.wf.nodes.A"));
        assertTrue(store.resolve("flows.wf.nodes").isPresent());
        assertTrue(store.resolve("flows").isPresent());
        assertTrue(store.resolve("flows.other").isEmpty());
    }

    @Test
    void setNotifiesWatchersOnlyWhenTheValueChanges() {
        InMemoryReactiveStore store = new InMemoryReactiveStore();
        StoreNode node = store.node("a.b");
        List<JsonNode> seen = new CopyOnWriteArrayList<>();
        store.watch(node, (newValue, oldValue) -> seen.add(newValue));

        assertTrue(store.set(node, IntNode.valueOf(1)));
        assertFalse(store.set(node, IntNode.valueOf(1)));
        assertTrue(store.set(node, IntNode.valueOf(2)));

        assertEquals(List.of(IntNode.valueOf(1), IntNode.valueOf(2)), seen);
        assertEquals(IntNode.valueOf(2), store.get(node));
    }

    @Test
    void structurallyEqualObjectsDoNotCountAsAChange() {
        InMemoryReactiveStore store = new InMemoryReactiveStore();
        StoreNode node = store.node("doc");
        List<JsonNode> seen = new CopyOnWriteArrayList<>();
        store.watch(node, (newValue, oldValue) -> seen.add(newValue));

        store.set(node, FlowValues.of(Map.of("k", "v")));
        boolean changed = store.set(node, FlowValues.of(Map.of("k", "v")));

        assertFalse(changed);
        assertEquals(1, seen.size());
    }

    @Test
    void disposedWatcherIsNoLongerCalledAndFailingWatchersAreIsolated() {
        InMemoryReactiveStore store = new InMemoryReactiveStore();
        StoreNode node = store.node("x");
        List<String> calls = new CopyOnWriteArrayList<>();
        store.watch(node, (n, o) -> { throw new IllegalStateException("boom"); });
        Disposable d = store.watch(node, (n, o) -> calls.add(n.asText()));

        store.set(node, TextNode.valueOf("one"));
        d.dispose();
        store.set(node, TextNode.valueOf("two"));

        assertEquals(List.of("one"), calls);
    }

    @Test
    void nodesOfAnotherStoreAreRejected() {
        InMemoryReactiveStore a = new InMemoryReactiveStore();
        InMemoryReactiveStore b = new InMemoryReactiveStore();
        StoreNode foreign = b.node("only.in.b");

        assertThrows(IllegalArgumentException.class, () -> a.get(foreign));
        assertThrows(IllegalArgumentException.class, () -> a.node(" "));
    }
}
