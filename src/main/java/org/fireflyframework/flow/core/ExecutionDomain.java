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

/**
 * Where a step effect runs.
 * <p>
 * {@link #BOTH} is only valid on a step definition; an individual execution always happens in
 * {@link #LOCAL} or {@link #REMOTE}, which is what {@link StepContext#executionDomain()} reports.
 */
public enum ExecutionDomain {
    LOCAL,
    REMOTE,
    BOTH
}
