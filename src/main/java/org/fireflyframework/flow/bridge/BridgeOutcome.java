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

import java.util.Objects;

/**
 * Result of {@link CrossDomainBridge#call(BridgeRequest)}: either a completed response or a pending
 * call the caller must wait for before replaying the request.
 */
public final class BridgeOutcome {
    private final BridgeResponse response;
    private final PendingBridgeCall pending;

    private BridgeOutcome(BridgeResponse response, PendingBridgeCall pending) {
        this.response = response;
        this.pending = pending;
    }

    public static BridgeOutcome completed(BridgeResponse response) {
        return new BridgeOutcome(Objects.requireNonNull(response, "response"), null);
    }

    public static BridgeOutcome suspended(PendingBridgeCall pending) {
        return new BridgeOutcome(null, Objects.requireNonNull(pending, "pending"));
    }

    public boolean isCompleted() {
        return response != null;
    }

    public BridgeResponse response() {
        if (response == null) throw new IllegalStateException("Bridge call is still pending");
        return response;
    }

    public PendingBridgeCall pending() {
        if (pending == null) throw new IllegalStateException("Bridge call already completed");
        return pending;
    }
}
