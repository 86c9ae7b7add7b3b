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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import org.fireflyframework.flow.core.FlowValues;

/**
 * Request sent to the remote domain: {@code {"kind":"step","instanceId","stepName","payload","traceId"}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BridgeRequest(String kind, String instanceId, String stepName, JsonNode payload, String traceId) {
    public static final String KIND_STEP = "step";

    public BridgeRequest {
        if (kind == null) kind = KIND_STEP;
        payload = FlowValues.orNull(payload);
    }

    public static BridgeRequest step(String instanceId, String stepName, JsonNode payload, String traceId) {
        return new BridgeRequest(KIND_STEP, instanceId, stepName, payload, traceId);
    }
}
