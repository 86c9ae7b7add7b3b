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

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Hands bridge requests straight to a {@link RemoteStepEndpoint} in the same JVM.
 */
public class InProcessBridgeTransport implements BridgeTransport {
    private final RemoteStepEndpoint endpoint;

    public InProcessBridgeTransport(RemoteStepEndpoint endpoint) {
        this.endpoint = endpoint;
    }

    @Override
    public Mono<byte[]> exchange(String targetUrl, byte[] request, Map<String, String> headers) {
        return Mono.fromCallable(() -> endpoint.handle(request));
    }
}
