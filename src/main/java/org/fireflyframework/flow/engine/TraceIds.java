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

import java.util.concurrent.atomic.AtomicLong;

/**
 * Generates queue item trace ids of the form {@code t_<epoch millis base36>_<sequence base36>}.
 */
final class TraceIds {
    private static final AtomicLong SEQ = new AtomicLong();

    private TraceIds() {}

    static String next() {
        return "t_" + Long.toString(System.currentTimeMillis(), 36) + "_" + Long.toString(SEQ.incrementAndGet(), 36);
    }
}
