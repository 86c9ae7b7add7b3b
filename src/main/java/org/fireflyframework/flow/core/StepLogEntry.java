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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One step log line: epoch millis, level and the raw arguments passed to the logger.
 */
public record StepLogEntry(long ts, LogLevel level, List<Object> args) {

    @JsonCreator
    public StepLogEntry(@JsonProperty("ts") long ts,
                        @JsonProperty("level") LogLevel level,
                        @JsonProperty("args") List<Object> args) {
        this.ts = ts;
        this.level = level;
        this.args = args != null ? Collections.unmodifiableList(new ArrayList<>(args)) : List.of();
    }
}
