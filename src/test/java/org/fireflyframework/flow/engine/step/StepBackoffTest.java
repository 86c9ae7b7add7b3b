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
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StepBackoffTest {

    @Test
    void delayGrowsGeometricallyWithoutJitter() {
        RetrySpec retry = RetrySpec.of(5, 100, 2.0, false);

        assertEquals(100L, StepBackoff.computeDelay(retry, 1));
        assertEquals(200L, StepBackoff.computeDelay(retry, 2));
        assertEquals(400L, StepBackoff.computeDelay(retry, 3));
        assertEquals(800L, StepBackoff.computeDelay(retry, 4));
    }

    @Test
    void jitterScalesIntoTheHalfToFullRange() {
        RetrySpec retry = RetrySpec.of(5, 100, 2.0, true);

        assertEquals(100L, StepBackoff.computeDelay(retry, 2, () -> 0.5d));
        assertEquals(200L, StepBackoff.computeDelay(retry, 2, () -> 1.0d));
        // out-of-range factors are clamped
        assertEquals(100L, StepBackoff.computeDelay(retry, 2, () -> 0.1d));
        assertEquals(200L, StepBackoff.computeDelay(retry, 2, () -> 7.0d));
    }

    @Test
    void randomJitterStaysWithinBounds() {
        RetrySpec retry = RetrySpec.of(5, 1000, 1.0, true);

        for (int i = 0; i < 200; i++) {
            long delay = StepBackoff.computeDelay(retry, 1);
            assertTrue(delay >= 500L && delay <= 1000L, "delay out of range: " + delay);
        }
    }

    @Test
    void zeroBackoffMeansImmediateRetry() {
        assertEquals(0L, StepBackoff.computeDelay(RetrySpec.of(3, 0, 2.0, true), 2));
    }
}
