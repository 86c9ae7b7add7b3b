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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.List;
import java.util.Objects;
import java.util.function.BinaryOperator;

/**
 * Combines the outputs of the two halves of a {@code BOTH} step, in completion order.
 */
public final class MergeStrategy {

    public enum Kind { LAST, ALL, REDUCE }

    private static final MergeStrategy LAST = new MergeStrategy(Kind.LAST, null);
    private static final MergeStrategy ALL = new MergeStrategy(Kind.ALL, null);

    private final Kind kind;
    private final BinaryOperator<JsonNode> reducer;

    private MergeStrategy(Kind kind, BinaryOperator<JsonNode> reducer) {
        this.kind = kind;
        this.reducer = reducer;
    }

    /** Last completed half wins. */
    public static MergeStrategy last() {
        return LAST;
    }

    /** Output is an array of every successful half's output. */
    public static MergeStrategy all() {
        return ALL;
    }

    public static MergeStrategy reduce(BinaryOperator<JsonNode> reducer) {
        return new MergeStrategy(Kind.REDUCE, Objects.requireNonNull(reducer, "reducer"));
    }

    public Kind kind() {
        return kind;
    }

    public JsonNode merge(List<JsonNode> outputs) {
        if (outputs == null || outputs.isEmpty()) {
            return kind == Kind.ALL ? JsonNodeFactory.instance.arrayNode() : NullNode.getInstance();
        }
        switch (kind) {
            case ALL: {
                ArrayNode arr = JsonNodeFactory.instance.arrayNode();
                outputs.forEach(arr::add);
                return arr;
            }
            case REDUCE: {
                JsonNode acc = outputs.get(0);
                for (int i = 1; i < outputs.size(); i++) {
                    acc = reducer.apply(acc, outputs.get(i));
                }
                return acc;
            }
            default:
                return outputs.get(outputs.size() - 1);
        }
    }
}
