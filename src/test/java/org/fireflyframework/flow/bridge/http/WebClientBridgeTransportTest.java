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
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class WebClientBridgeTransportTest {

    @Test
    void postsRequestWithHeadersAndReturnsBody() {
        AtomicReference<ClientRequest> captured = new AtomicReference<>();
        WebClient client = WebClient.builder()
                .exchangeFunction(req -> {
                    captured.set(req);
                    return Mono.just(ClientResponse.create(HttpStatus.OK)
                            .header(HttpHeaders.CONTENT_TYPE, "application/json")
                            .body("{\"kind\":\"ok\",\"value\":42}")
                            .build());
                })
                .build();
        WebClientBridgeTransport transport = new WebClientBridgeTransport(client);

        byte[] body = transport.exchange("http://remote.local/flow",
                "{}".getBytes(StandardCharsets.UTF_8),
                Map.of("X-Flow-Trace-Id", "t-1", "X-Tenant", "acme")).block();

        assertNotNull(body);
        assertEquals("{\"kind\":\"ok\",\"value\":42}", new String(body, StandardCharsets.UTF_8));
        ClientRequest req = captured.get();
        assertEquals(HttpMethod.POST, req.method());
        assertEquals("http://remote.local/flow", req.url().toString());
        assertEquals("t-1", req.headers().getFirst("X-Flow-Trace-Id"));
        assertEquals("acme", req.headers().getFirst("X-Tenant"));
        assertEquals("application/json", req.headers().getFirst(HttpHeaders.CONTENT_TYPE));
    }

    @Test
    void emptyBodyYieldsEmptyArray() {
        WebClient client = WebClient.builder()
                .exchangeFunction(req -> Mono.just(ClientResponse.create(HttpStatus.OK).build()))
                .build();

        byte[] body = new WebClientBridgeTransport(client)
                .exchange("http://remote.local/flow", new byte[0], Map.of()).block();

        assertNotNull(body);
        assertEquals(0, body.length);
    }

    @Test
    void errorStatusFailsWithProtocolException() {
        WebClient client = WebClient.builder()
                .exchangeFunction(req -> Mono.just(ClientResponse.create(HttpStatus.INTERNAL_SERVER_ERROR)
                        .body("boom")
                        .build()))
                .build();

        StepVerifier.create(new WebClientBridgeTransport(client)
                        .exchange("http://remote.local/flow", new byte[0], null))
                .expectErrorSatisfies(e -> {
                    assertTrue(e instanceof BridgeProtocolException);
                    assertTrue(e.getMessage().contains("500"));
                })
                .verify();
    }
}
