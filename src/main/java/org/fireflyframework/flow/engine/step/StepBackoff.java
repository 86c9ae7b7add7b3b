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


package org.fireflyframework.flow.engine.step;

import org.fireflyframework.flow.registry.RetrySpec;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Retry delay computation: exponential growth from the base backoff with optional jitter.
 */
public final class StepBackoff {

    /** Lower bound of the jitter factor; the upper bound is 1.0. */
    public static final double JITTER_MIN = 0.5d;

    private StepBackoff() {}

    /** Delay before the attempt that follows failed attempt {@code failedAttempt} (1-based). */
    public static long computeDelay(RetrySpec retry, int failedAttempt) {
        return computeDelay(retry, failedAttempt, () -> ThreadLocalRandom.current().nextDouble(JITTER_MIN, 1.0d));
    }

    /**
     * @param jitterFactor supplies a factor in {@code [0.5, 1.0]}; only consulted when jitter is enabled
     */
    public static long computeDelay(RetrySpec retry, int failedAttempt, DoubleSupplier jitterFactor) {
        if (retry.backoffMs <= 0) return 0L;
        double base = retry.backoffMs * Math.pow(retry.multiplier, Math.max(0, failedAttempt - 1));
        if (!retry.jitter) return Math.round(base);
        double f = Math.max(JITTER_MIN, Math.min(jitterFactor.getAsDouble(), 1.0d));
        return Math.max(0L, Math.round(base * f));
    }
}
