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

import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CrossDomainBridgeTest {

    private final BridgeCodec codec = new BridgeCodec();
    private final List<CrossDomainBridge> bridges = new CopyOnWriteArrayList<>();

    @AfterEach
    void tearDown() {
        bridges.forEach(CrossDomainBridge::dispose);
    }

    private CrossDomainBridge bridge(BridgeTransport transport) {
        return bridge(CrossDomainBridge.builder().transport(transport));
    }

    private CrossDomainBridge bridge(CrossDomainBridge.Builder builder) {
        CrossDomainBridge b = builder.targetUrl("http://remote/flow").timeoutMs(5_000).build();
        bridges.add(b);
        return b;
    }

    private byte[] okReply(int value) {
        return codec.encodeResponse(BridgeResponse.ok(IntNode.valueOf(value), List.of()));
    }

    private static BridgeRequest request(String traceId) {
        return BridgeRequest.step("wf", "R", IntNode.valueOf(1), traceId);
    }

    @Test
    void identicalCallsReachTheTransportOnce() {
        AtomicInteger calls = new AtomicInteger();
        CrossDomainBridge bridge = bridge((url, bytes, headers) -> {
            calls.incrementAndGet();
            return Mono.just(okReply(42));
        });

        BridgeResponse first = bridge.call(request("t1")).response();
        BridgeResponse second = bridge.call(request("t1")).response();

        assertTrue(first.isOk());
        assertEquals(IntNode.valueOf(42), second.value());
        assertEquals(1, calls.get());
        assertEquals(1, bridge.cachedResponses());

        bridge.call(request("t2"));
        assertEquals(2, calls.get());

        bridge.clearCache();
        bridge.call(request("t1"));
        assertEquals(3, calls.get());
    }

    @Test
    void errorRepliesAreNotCached() {
        AtomicInteger calls = new AtomicInteger();
        CrossDomainBridge bridge = bridge((url, bytes, headers) -> {
            calls.incrementAndGet();
            return Mono.just(codec.encodeResponse(BridgeResponse.err("remote says no")));
        });

        BridgeResponse response = bridge.call(request("t1")).response();
        bridge.call(request("t1"));

        assertFalse(response.isOk());
        assertEquals("remote says no", response.error());
        assertEquals(2, calls.get());
        assertEquals(0, bridge.cachedResponses());
    }

    @Test
    void transportSeesTargetUrlHeadersAndTraceId() {
        List<Map<String, String>> seenHeaders = new CopyOnWriteArrayList<>();
        List<String> seenUrls = new CopyOnWriteArrayList<>();
        List<BridgeRequest> seenRequests = new CopyOnWriteArrayList<>();
        CrossDomainBridge bridge = bridge(CrossDomainBridge.builder()
                .header("X-Tenant", "acme")
                .transport((url, bytes, headers) -> {
                    seenUrls.add(url);
                    seenHeaders.add(headers);
                    seenRequests.add(codec.decodeRequest(bytes));
                    return Mono.just(okReply(1));
                }));

        bridge.call(request("t1"));

        assertEquals(List.of("http://remote/flow"), seenUrls);
        assertEquals("acme", seenHeaders.get(0).get("X-Tenant"));
        assertEquals("t1", seenHeaders.get(0).get(SharedChannelExchange.TRACE_HEADER));
        BridgeRequest decoded = seenRequests.get(0);
        assertEquals(BridgeRequest.KIND_STEP, decoded.kind());
        assertEquals("wf", decoded.instanceId());
        assertEquals("R", decoded.stepName());
        assertEquals("t1", decoded.traceId());
    }

    @Test
    void invalidJsonBecomesAnErrorResponse() {
        CrossDomainBridge bridge = bridge((url, bytes, headers) ->
                Mono.just("not json".getBytes(StandardCharsets.UTF_8)));

        BridgeResponse response = bridge.call(request("t1")).response();

        assertFalse(response.isOk());
        assertEquals("Invalid JSON from remote", response.error());
    }

    @Test
    void oversizedReplyIsReportedAsBufferOverflow() {
        byte[] big = codec.encodeResponse(BridgeResponse.ok(TextNode.valueOf("x".repeat(500)), List.of()));
        CrossDomainBridge bridge = bridge(CrossDomainBridge.builder()
                .capacityBytes(256)
                .transport((url, bytes, headers) -> Mono.just(big)));

        BridgeBufferOverflowException e = assertThrows(BridgeBufferOverflowException.class,
                () -> bridge.call(request("t1")));

        assertEquals(big.length, e.getRequiredBytes());
        assertEquals(256, e.getCapacityBytes());
    }

    @Test
    void failingTransportIsAProtocolErrorButNotAnOverflow() {
        CrossDomainBridge bridge = bridge((url, bytes, headers) ->
                Mono.error(new IllegalStateException("connection refused")));

        BridgeProtocolException e = assertThrows(BridgeProtocolException.class, () -> bridge.call(request("t1")));

        assertFalse(e instanceof BridgeBufferOverflowException);
    }

    @Test
    void exchangeTimesOutWhenTheRemoteNeverAnswers() {
        SharedChannel channel = new SharedChannel(1024);
        RemoteDomainWorker worker = new RemoteDomainWorker(channel, (url, bytes, headers) -> Mono.never(), Duration.ofSeconds(5));
        SharedChannelExchange exchange = new SharedChannelExchange(channel, worker, codec, "http://remote", Map.of(), 50);
        try {
            BridgeTimeoutException e = assertThrows(BridgeTimeoutException.class,
                    () -> exchange.exchange(codec.encodeRequest(request("t1")), "t1"));
            assertEquals(50, e.getTimeoutMs());
            // the slot is released for the next caller
            assertDoesNotThrow(() -> assertTrue(channel.acquire(10)));
        } finally {
            worker.dispose();
        }
    }

    @Test
    void disposedBridgeRejectsCalls() {
        CrossDomainBridge bridge = bridge((url, bytes, headers) -> Mono.just(okReply(1)));
        bridge.dispose();

        assertTrue(bridge.isDisposed());
        assertThrows(BridgeException.class, () -> bridge.call(request("t1")));
    }

    @Test
    void suspendingBridgeSettlesThenServesTheResult() {
        AtomicInteger calls = new AtomicInteger();
        CrossDomainBridge bridge = bridge(CrossDomainBridge.builder()
                .blockingAllowed(false)
                .transport((url, bytes, headers) -> {
                    calls.incrementAndGet();
                    return Mono.delay(Duration.ofMillis(20)).thenReturn(okReply(7));
                }));
        assertFalse(bridge.isBlockingAllowed());

        BridgeOutcome first = bridge.call(request("t1"));
        BridgeOutcome again = bridge.call(request("t1"));

        assertFalse(first.isCompleted());
        assertSame(first.pending(), again.pending());
        first.pending().whenSettled().block(Duration.ofSeconds(5));

        BridgeOutcome replay = bridge.call(request("t1"));
        assertTrue(replay.isCompleted());
        assertEquals(IntNode.valueOf(7), replay.response().value());
        assertTrue(bridge.call(request("t1")).isCompleted(), "served from cache");
        assertEquals(1, calls.get());
    }

    @Test
    void suspendingBridgeServesAFailureOnlyOnce() {
        AtomicInteger calls = new AtomicInteger();
        CrossDomainBridge bridge = bridge(CrossDomainBridge.builder()
                .blockingAllowed(false)
                .transport((url, bytes, headers) -> {
                    calls.incrementAndGet();
                    return Mono.error(new IllegalStateException("down"));
                }));

        BridgeOutcome first = bridge.call(request("t1"));
        first.pending().whenSettled().block(Duration.ofSeconds(5));

        assertThrows(BridgeProtocolException.class, () -> bridge.call(request("t1")));
        BridgeOutcome next = bridge.call(request("t1"));
        assertFalse(next.isCompleted());
        next.pending().whenSettled().block(Duration.ofSeconds(5));
        assertEquals(2, calls.get());
    }

    @Test
    void codecRoundTripsStepRequestsAndRejectsIncompleteOnes() {
        byte[] encoded = codec.encodeRequest(request("t9"));

        assertEquals(request("t9"), codec.decodeRequest(encoded));
        assertThrows(BridgeProtocolException.class,
                () -> codec.decodeRequest("{\"kind\":\"step\"}".getBytes(StandardCharsets.UTF_8)));
    }
}
