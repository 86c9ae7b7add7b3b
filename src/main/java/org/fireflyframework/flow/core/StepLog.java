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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Per-step log: a bounded ring holding the most recent entries plus an unbounded archive.
 * <p>
 * Used for post-hoc debugging and for recording bridge fallbacks and retries without
 * publishing them on the event bus. Thread-safe.
 */
public class StepLog {
    public static final int DEFAULT_RING_SIZE = 128;

    private final String stepName;
    private final int ringSize;
    private final ArrayDeque<StepLogEntry> ring;
    private final List<StepLogEntry> archive = new ArrayList<>();

    public StepLog(String stepName) {
        this(stepName, DEFAULT_RING_SIZE);
    }

    public StepLog(String stepName, int ringSize) {
        if (ringSize < 1) {
            throw new IllegalArgumentException("ringSize must be >= 1, got " + ringSize);
        }
        this.stepName = stepName;
        this.ringSize = ringSize;
        this.ring = new ArrayDeque<>(Math.min(ringSize, 256));
    }

    public String stepName() {
        return stepName;
    }

    public int ringSize() {
        return ringSize;
    }

    public StepLogEntry append(LogLevel level, Object... args) {
        List<Object> values = args == null ? List.of() : Arrays.asList(args);
        StepLogEntry entry = new StepLogEntry(System.currentTimeMillis(), level, values);
        append(entry);
        return entry;
    }

    public synchronized void append(StepLogEntry entry) {
        if (ring.size() >= ringSize) {
            ring.pollFirst();
        }
        ring.addLast(entry);
        archive.add(entry);
    }

    /** Restores log contents from a snapshot, replacing whatever was recorded. */
    public synchronized void restore(Collection<StepLogEntry> ringEntries, Collection<StepLogEntry> archiveEntries) {
        ring.clear();
        archive.clear();
        if (archiveEntries != null) archive.addAll(archiveEntries);
        if (ringEntries != null) {
            for (StepLogEntry e : ringEntries) {
                if (ring.size() >= ringSize) ring.pollFirst();
                ring.addLast(e);
            }
        }
    }

    public synchronized List<StepLogEntry> ring() {
        return List.copyOf(ring);
    }

    public synchronized List<StepLogEntry> archive() {
        return List.copyOf(archive);
    }

    public synchronized StepLogEntry last() {
        return ring.peekLast();
    }
}
