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


package org.fireflyframework.flow.bridge;

/**
 * A message did not fit in the shared channel. Never truncated; carries the size that would have been needed.
 */
public class BridgeBufferOverflowException extends BridgeProtocolException {
    private final int requiredBytes;
    private final int capacityBytes;

    public BridgeBufferOverflowException(int requiredBytes, int capacityBytes) {
        super("Bridge buffer too small: required " + requiredBytes + " bytes, capacity " + capacityBytes);
        this.requiredBytes = requiredBytes;
        this.capacityBytes = capacityBytes;
    }

    public int getRequiredBytes() {
        return requiredBytes;
    }

    public int getCapacityBytes() {
        return capacityBytes;
    }
}
