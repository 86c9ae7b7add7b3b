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
import org.fireflyframework.flow.core.StepContext;

/**
 * The work performed by a step. The returned value becomes the step output; returning {@code null}
 * keeps the last value written through {@link StepContext#writeSelf(JsonNode)}, or the input when
 * nothing was written. Any exception fails the attempt.
 */
@FunctionalInterface
public interface StepEffect {
    JsonNode apply(StepContext ctx) throws Exception;
}
