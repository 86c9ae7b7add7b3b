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
 * How a bridge call waits for its reply. Chosen by whether the calling thread may block.
 */
public interface BridgeCallStrategy {

    /**
     * @param key     idempotency key of the request
     * @param request encoded request
     * @param traceId trace id propagated to the transport
     */
    BridgeOutcome call(String key, byte[] request, String traceId);

    default void dispose() {}
}
