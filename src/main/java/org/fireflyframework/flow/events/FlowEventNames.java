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


package org.fireflyframework.flow.events;

/**
 * Event names published on the {@link FlowEventBus}.
 */
public final class FlowEventNames {
    public static final String WORKFLOW_START = "workflow:start";
    public static final String WORKFLOW_IDLE = "workflow:idle";
    public static final String WORKFLOW_ERROR = "workflow:error";
    public static final String WORKFLOW_FINISH = "workflow:finish";

    public static final String STEP_BEFORE_PREFIX = "step:before:";
    public static final String STEP_AFTER_PREFIX = "step:after:";
    public static final String STEP_ERROR_PREFIX = "step:error:";

    private FlowEventNames() {
        // Utility class - prevent instantiation
    }

    public static String stepBefore(String stepName) { return STEP_BEFORE_PREFIX + stepName; }
    public static String stepAfter(String stepName) { return STEP_AFTER_PREFIX + stepName; }
    public static String stepError(String stepName) { return STEP_ERROR_PREFIX + stepName; }
}
