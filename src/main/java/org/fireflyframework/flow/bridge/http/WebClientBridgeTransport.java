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


package org.fireflyframework.flow.bridge.http;

import org.fireflyframework.flow.bridge.BridgeProtocolException;
import org.fireflyframework.flow.bridge.BridgeTransport;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * HTTP transport for the cross-domain bridge: POSTs the encoded request to the target URL and returns
 * the response body. Headers (including {@code X-Flow-Trace-Id}) are copied onto the request.
 * Non-2xx statuses fail the exchange, which the bridge reports as a remote handler failure.
 */
public class WebClientBridgeTransport implements BridgeTransport {
    private final WebClient webClient;

    public WebClientBridgeTransport(WebClient webClient) {
        this.webClient = webClient;
    }

    public WebClientBridgeTransport() {
        this(WebClient.create());
    }

    @Override
    public Mono<byte[]> exchange(String targetUrl, byte[] request, Map<String, String> headers) {
        WebClient.RequestBodySpec spec = webClient.post()
                .uri(targetUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON);
        if (headers != null) {
            for (Map.Entry<String, String> e : headers.entrySet()) {
                if (e.getKey() != null && e.getValue() != null) {
                    spec = spec.header(e.getKey(), e.getValue());
                }
            }
        }
        return spec.bodyValue(request).exchangeToMono(this::handleResponse);
    }

    private Mono<byte[]> handleResponse(ClientResponse resp) {
        if (resp.statusCode().is2xxSuccessful()) {
            return resp.bodyToMono(byte[].class).defaultIfEmpty(new byte[0]);
        }
        int status = resp.statusCode().value();
        return resp.releaseBody()
                .then(Mono.error(new BridgeProtocolException("Remote domain answered HTTP " + status)));
    }
}
