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


package org.fireflyframework.flow.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process publish/subscribe for workflow and step lifecycle events.
 * <p>
 * Handlers run synchronously on the emitting thread, in subscription order. A throwing handler is
 * logged and does not prevent the remaining handlers from running. One bus belongs to one engine.
 */
public class FlowEventBus {
    private static final Logger log = LoggerFactory.getLogger(FlowEventBus.class);

    private final Map<String, List<Consumer<FlowEvent>>> handlers = new ConcurrentHashMap<>();

    /** Subscribes {@code handler}; disposing the returned handle unsubscribes it. */
    public Disposable on(String eventName, Consumer<FlowEvent> handler) {
        if (eventName == null) throw new IllegalArgumentException("eventName");
        if (handler == null) throw new IllegalArgumentException("handler");
        handlers.computeIfAbsent(eventName, k -> new CopyOnWriteArrayList<>()).add(handler);
        return () -> off(eventName, handler);
    }

    public void off(String eventName, Consumer<FlowEvent> handler) {
        List<Consumer<FlowEvent>> list = handlers.get(eventName);
        if (list != null) {
            list.remove(handler);
        }
    }

    public void emit(String eventName, FlowEvent event) {
        List<Consumer<FlowEvent>> list = handlers.get(eventName);
        if (list == null || list.isEmpty()) {
            return;
        }
        for (Consumer<FlowEvent> h : list) {
            try {
                h.accept(event);
            } catch (RuntimeException e) {
                log.warn("Flow event handler for '{}' failed", eventName, e);
            }
        }
    }

    public void emit(FlowEvent event) {
        emit(event.name(), event);
    }

    public int subscriberCount(String eventName) {
        List<Consumer<FlowEvent>> list = handlers.get(eventName);
        return list == null ? 0 : list.size();
    }

    public void clear() {
        handlers.clear();
    }
}
