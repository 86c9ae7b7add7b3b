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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Caller side of one request/reply round trip over the {@link SharedChannel}. Blocks the calling thread.
 */
public class SharedChannelExchange {
    public static final String TRACE_HEADER = "X-Flow-Trace-Id";

    private static final Logger log = LoggerFactory.getLogger(SharedChannelExchange.class);

    private final SharedChannel channel;
    private final RemoteDomainWorker worker;
    private final BridgeCodec codec;
    private final String targetUrl;
    private final Map<String, String> headers;
    private final long timeoutMs;
    private final AtomicInteger nextRequestId = new AtomicInteger();

    public SharedChannelExchange(SharedChannel channel, RemoteDomainWorker worker, BridgeCodec codec,
                                 String targetUrl, Map<String, String> headers, long timeoutMs) {
        this.channel = channel;
        this.worker = worker;
        this.codec = codec;
        this.targetUrl = targetUrl;
        this.headers = headers != null ? Map.copyOf(headers) : Map.of();
        this.timeoutMs = timeoutMs;
    }

    public long timeoutMs() {
        return timeoutMs;
    }

    /**
     * Sends {@code request} and waits for the reply.
     *
     * @throws BridgeTimeoutException         no reply (or no free slot) within the timeout
     * @throws BridgeBufferOverflowException  request or reply larger than the channel
     * @throws BridgeProtocolException        id mismatch or remote handler failure
     */
    public BridgeResponse exchange(byte[] request, String traceId) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        boolean acquired;
        try {
            acquired = channel.acquire(timeoutMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BridgeTimeoutException("Interrupted while waiting for the bridge channel", timeoutMs);
        }
        if (!acquired) {
            throw new BridgeTimeoutException("Bridge channel busy for " + timeoutMs + " ms", timeoutMs);
        }
        int id = nextRequestId.updateAndGet(v -> v == Integer.MAX_VALUE ? 1 : v + 1);
        try {
            channel.beginRequest(id, request);
            worker.post(id, targetUrl, withTrace(traceId));
            awaitReply(id, deadline);
            int signal = channel.load(SharedChannel.Word.LOCK);
            int length = channel.load(SharedChannel.Word.LENGTH);
            if (signal == id) {
                return codec.decodeResponse(channel.read(length));
            }
            if (signal == -id) {
                if (length > channel.capacity()) {
                    throw new BridgeBufferOverflowException(length, channel.capacity());
                }
                throw new BridgeProtocolException("Remote handler failed for request " + id);
            }
            throw new BridgeProtocolException("Bridge id mismatch: expected " + id + ", got " + signal);
        } finally {
            channel.abandon(id);
            channel.release();
        }
    }

    private void awaitReply(int id, long deadline) {
        try {
            while (true) {
                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                SharedChannel.WaitResult r = channel.await(SharedChannel.Word.LOCK, 0, Math.max(0L, remainingMs));
                if (r != SharedChannel.WaitResult.TIMED_OUT) {
                    return;
                }
                if (channel.load(SharedChannel.Word.LOCK) == 0) {
                    log.debug("Bridge request {} timed out after {} ms", id, timeoutMs);
                    throw new BridgeTimeoutException("Bridge call timed out after " + timeoutMs + " ms", timeoutMs);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BridgeTimeoutException("Interrupted while waiting for bridge reply", timeoutMs);
        }
    }

    private Map<String, String> withTrace(String traceId) {
        if (traceId == null) return headers;
        Map<String, String> h = new LinkedHashMap<>(headers);
        h.put(TRACE_HEADER, traceId);
        return h;
    }
}
