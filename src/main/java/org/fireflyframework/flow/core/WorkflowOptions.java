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

import java.util.Objects;

/**
 * Per-instance scheduling options: dequeue order, pump budgets and step log ring size.
 * A budget of {@code 0} means unlimited.
 */
public final class WorkflowOptions {

    private final QueueOrder order;
    private final int maxSteps;
    private final long maxMillis;
    private final int logSize;

    private WorkflowOptions(Builder b) {
        this.order = b.order;
        this.maxSteps = b.maxSteps;
        this.maxMillis = b.maxMillis;
        this.logSize = b.logSize;
    }

    public static WorkflowOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public QueueOrder order() { return order; }
    public int maxSteps() { return maxSteps; }
    public long maxMillis() { return maxMillis; }
    public int logSize() { return logSize; }

    public Builder toBuilder() {
        return new Builder().order(order).maxSteps(maxSteps).maxMillis(maxMillis).logSize(logSize);
    }

    @Override
    public String toString() {
        return "WorkflowOptions{order=" + order + ", maxSteps=" + maxSteps
                + ", maxMillis=" + maxMillis + ", logSize=" + logSize + '}';
    }

    public static final class Builder {
        private QueueOrder order = QueueOrder.FIFO;
        private int maxSteps = 0;
        private long maxMillis = 0L;
        private int logSize = StepLog.DEFAULT_RING_SIZE;

        private Builder() {}

        public Builder order(QueueOrder order) { this.order = Objects.requireNonNull(order, "order"); return this; }

        public Builder maxSteps(int maxSteps) {
            if (maxSteps < 0) throw new IllegalArgumentException("maxSteps must be >= 0");
            this.maxSteps = maxSteps;
            return this;
        }

        public Builder maxMillis(long maxMillis) {
            if (maxMillis < 0) throw new IllegalArgumentException("maxMillis must be >= 0");
            this.maxMillis = maxMillis;
            return this;
        }

        public Builder logSize(int logSize) {
            if (logSize < 1) throw new IllegalArgumentException("logSize must be >= 1");
            this.logSize = logSize;
            return this;
        }

        public WorkflowOptions build() {
            return new WorkflowOptions(this);
        }
    }
}
