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


package org.fireflyframework.flow.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Helpers around the dynamic value type used for payloads, outputs and shared state.
 * <p>
 * Every dynamic value is a Jackson {@link JsonNode}: a tagged variant over null, boolean,
 * number, string, binary, array and ordered object that has a well-defined wire form.
 */
public final class FlowValues {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private FlowValues() {
        // Utility class - prevent instantiation
    }

    /**
     * Converts a plain Java value (boxed primitive, String, byte[], Map, List, POJO) to a tree.
     * {@code null} becomes {@link NullNode}; a {@link JsonNode} is returned unchanged.
     */
    public static JsonNode of(Object value) {
        if (value == null) return NullNode.getInstance();
        if (value instanceof JsonNode node) return node;
        return MAPPER.valueToTree(value);
    }

    public static ObjectNode object() {
        return JsonNodeFactory.instance.objectNode();
    }

    /** Treats Java {@code null} and JSON {@code null} alike. */
    public static boolean isNull(JsonNode value) {
        return value == null || value.isNull() || value.isMissingNode();
    }

    /** Returns the value or {@link NullNode} when absent. */
    public static JsonNode orNull(JsonNode value) {
        return value != null ? value : NullNode.getInstance();
    }

    public static <T> T as(JsonNode value, Class<T> type) {
        if (isNull(value)) return null;
        return MAPPER.convertValue(value, type);
    }
}
