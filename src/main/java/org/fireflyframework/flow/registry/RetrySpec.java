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

/**
 * Retry policy of a step. Attempt {@code n+1} is scheduled {@code backoffMs * multiplier^(n-1)}
 * milliseconds after attempt {@code n} failed, scaled by a random factor in {@code [0.5, 1.0]} when
 * jitter is enabled.
 */
public final class RetrySpec {
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_BACKOFF_MS = 150L;
    public static final double DEFAULT_MULTIPLIER = 2.0d;

    private static final RetrySpec DISABLED = new RetrySpec(false, 1, 0L, 1.0d, false);
    private static final RetrySpec DEFAULTS = new RetrySpec(true, DEFAULT_MAX_ATTEMPTS, DEFAULT_BACKOFF_MS, DEFAULT_MULTIPLIER, true);

    public final boolean enabled;
    public final int maxAttempts;
    public final long backoffMs;
    public final double multiplier;
    public final boolean jitter;

    private RetrySpec(boolean enabled, int maxAttempts, long backoffMs, double multiplier, boolean jitter) {
        this.enabled = enabled;
        this.maxAttempts = maxAttempts;
        this.backoffMs = backoffMs;
        this.multiplier = multiplier;
        this.jitter = jitter;
    }

    public static RetrySpec disabled() {
        return DISABLED;
    }

    public static RetrySpec defaults() {
        return DEFAULTS;
    }

    public static RetrySpec of(int maxAttempts, long backoffMs, double multiplier, boolean jitter) {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        if (backoffMs < 0) throw new IllegalArgumentException("backoffMs must be >= 0, got " + backoffMs);
        if (multiplier < 1.0d) throw new IllegalArgumentException("multiplier must be >= 1, got " + multiplier);
        return new RetrySpec(true, maxAttempts, backoffMs, multiplier, jitter);
    }

    /** Whether a failure of {@code attempt} (1-based) may be followed by another attempt. */
    public boolean allowsRetryAfter(int attempt) {
        return enabled && attempt < maxAttempts;
    }

    @Override
    public String toString() {
        if (!enabled) return "RetrySpec{disabled}";
        return "RetrySpec{maxAttempts=" + maxAttempts + ", backoffMs=" + backoffMs
                + ", multiplier=" + multiplier + ", jitter=" + jitter + '}';
    }
}
