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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import org.fireflyframework.flow.core.StepLogEntry;

import java.util.List;

/**
 * Reply from the remote domain: {@code {"kind":"ok","value","logs"}} or {@code {"kind":"err","error"}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BridgeResponse(String kind, JsonNode value, List<StepLogEntry> logs, String error) {
    public static final String KIND_OK = "ok";
    public static final String KIND_ERR = "err";

    public BridgeResponse {
        logs = logs != null ? List.copyOf(logs) : null;
    }

    public static BridgeResponse ok(JsonNode value, List<StepLogEntry> logs) {
        return new BridgeResponse(KIND_OK, value, logs != null ? logs : List.of(), null);
    }

    public static BridgeResponse err(String error) {
        return new BridgeResponse(KIND_ERR, null, null, error);
    }

    @JsonIgnore
    public boolean isOk() {
        return KIND_OK.equals(kind);
    }

    @JsonIgnore
    public List<StepLogEntry> logsOrEmpty() {
        return logs != null ? logs : List.of();
    }
}
