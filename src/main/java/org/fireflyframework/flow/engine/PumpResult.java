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

/**
 * Summary of one {@link FlowScheduler#pump} call.
 *
 * @param executed        queue items dequeued and executed by this call
 * @param stoppedByBudget the step or time budget ran out while work was still queued
 * @param remaining       items left in the queue when the call returned
 * @param reentrant       the instance was already being pumped, so this call did nothing
 */
public record PumpResult(int executed, boolean stoppedByBudget, int remaining, boolean reentrant) {

    static PumpResult skipped(int remaining) {
        return new PumpResult(0, false, remaining, true);
    }
}
