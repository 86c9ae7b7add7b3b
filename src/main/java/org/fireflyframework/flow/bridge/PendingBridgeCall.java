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


package org.fireflyframework.flow.bridge;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * A bridge call that is still in flight. Completes (empty) once its result has been recorded, after
 * which the same request can be replayed to collect it.
 */
public class PendingBridgeCall {
    private final String key;
    private final String traceId;
    private final Sinks.Empty<Void> settled = Sinks.empty();

    PendingBridgeCall(String key, String traceId) {
        this.key = key;
        this.traceId = traceId;
    }

    public String key() {
        return key;
    }

    public String traceId() {
        return traceId;
    }

    /** Completes when the call has settled, successfully or not. */
    public Mono<Void> whenSettled() {
        return settled.asMono();
    }

    void markSettled() {
        settled.tryEmitEmpty();
    }
}
