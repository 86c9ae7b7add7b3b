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
 * Blocks the calling thread on the shared channel until the reply arrives or the timeout elapses.
 * Only for threads that are allowed to block.
 */
public class BlockingBridgeStrategy implements BridgeCallStrategy {
    private final SharedChannelExchange exchange;

    public BlockingBridgeStrategy(SharedChannelExchange exchange) {
        this.exchange = exchange;
    }

    @Override
    public BridgeOutcome call(String key, byte[] request, String traceId) {
        return BridgeOutcome.completed(exchange.exchange(request, traceId));
    }
}
