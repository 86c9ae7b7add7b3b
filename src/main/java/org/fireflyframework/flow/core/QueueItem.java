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

import java.util.Objects;

/**
 * A unit of pending work in a workflow instance queue.
 *
 * @param stepName     step to execute; resolved against the current definition at dequeue time
 * @param payload      step input
 * @param enqueuedAtMs epoch millis of the enqueue
 * @param traceId      per-enqueue correlation token, reused by retries and suspension replays
 * @param attempt      1-based attempt number; retries re-enqueue with {@code attempt + 1}
 * @param resumed      true when the item replays a step whose bridge call was suspended; the guard,
 *                     {@code step:before} and the step counters already ran for it
 */
public record QueueItem(String stepName, JsonNode payload, long enqueuedAtMs, String traceId, int attempt,
                        boolean resumed) {

    public QueueItem {
        Objects.requireNonNull(stepName, "stepName");
        Objects.requireNonNull(traceId, "traceId");
        payload = FlowValues.orNull(payload);
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1, got " + attempt);
        }
    }

    public QueueItem(String stepName, JsonNode payload, long enqueuedAtMs, String traceId, int attempt) {
        this(stepName, payload, enqueuedAtMs, traceId, attempt, false);
    }

    public static QueueItem of(String stepName, JsonNode payload, String traceId) {
        return new QueueItem(stepName, payload, System.currentTimeMillis(), traceId, 1);
    }

    public QueueItem nextAttempt() {
        return new QueueItem(stepName, payload, System.currentTimeMillis(), traceId, attempt + 1, false);
    }

    /** The same attempt, marked as the continuation of a suspended execution. */
    public QueueItem asContinuation() {
        return new QueueItem(stepName, payload, enqueuedAtMs, traceId, attempt, true);
    }
}
