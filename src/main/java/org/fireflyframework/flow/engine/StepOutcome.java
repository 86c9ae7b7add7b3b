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


package org.fireflyframework.flow.engine;

import com.fasterxml.jackson.databind.JsonNode;
import org.fireflyframework.flow.bridge.PendingBridgeCall;

/**
 * What happened to one executed queue item; the scheduler acts on it.
 */
final class StepOutcome {

    enum Status { COMPLETED, VETOED, RETRY, FAILED, SUSPENDED, UNKNOWN_STEP }

    final Status status;
    final JsonNode output;
    final Throwable error;
    final long retryDelayMs;
    final PendingBridgeCall pending;

    private StepOutcome(Status status, JsonNode output, Throwable error, long retryDelayMs, PendingBridgeCall pending) {
        this.status = status;
        this.output = output;
        this.error = error;
        this.retryDelayMs = retryDelayMs;
        this.pending = pending;
    }

    static StepOutcome completed(JsonNode output) { return new StepOutcome(Status.COMPLETED, output, null, 0L, null); }
    static StepOutcome vetoed() { return new StepOutcome(Status.VETOED, null, null, 0L, null); }
    static StepOutcome retry(Throwable error, long delayMs) { return new StepOutcome(Status.RETRY, null, error, delayMs, null); }
    static StepOutcome failed(Throwable error) { return new StepOutcome(Status.FAILED, null, error, 0L, null); }
    static StepOutcome suspended(PendingBridgeCall pending) { return new StepOutcome(Status.SUSPENDED, null, null, 0L, pending); }
    static StepOutcome unknownStep(Throwable error) { return new StepOutcome(Status.UNKNOWN_STEP, null, error, 0L, null); }
}
