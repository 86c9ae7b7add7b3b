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

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters of a workflow instance.
 */
public class WorkflowStats {
    private final AtomicLong steps = new AtomicLong();
    private final AtomicLong retries = new AtomicLong();
    private final AtomicLong suspensions = new AtomicLong();

    /** Step executions so far (every dequeued item counts, retries included). */
    public long steps() {
        return steps.get();
    }

    public long retries() {
        return retries.get();
    }

    public long suspensions() {
        return suspensions.get();
    }

    public long incrementSteps() {
        return steps.incrementAndGet();
    }

    public long incrementRetries() {
        return retries.incrementAndGet();
    }

    public long incrementSuspensions() {
        return suspensions.incrementAndGet();
    }

    public void resetSteps() {
        steps.set(0);
    }

    public void restore(long steps, long retries, long suspensions) {
        this.steps.set(steps);
        this.retries.set(retries);
        this.suspensions.set(suspensions);
    }
}
