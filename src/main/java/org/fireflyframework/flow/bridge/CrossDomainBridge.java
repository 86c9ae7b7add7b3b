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
import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Synchronous-looking call into the remote execution domain.
 * <p>
 * Requests travel through a single-slot {@link SharedChannel} to a {@link RemoteDomainWorker}, which
 * forwards them over a {@link BridgeTransport}. Successful responses are cached by
 * {@code (targetUrl, encoded request, headers)} for the lifetime of the bridge, so repeating an
 * identical call does not reach the transport again. Errors are never cached.
 * <p>
 * Whether the caller blocks depends on the {@code blockingAllowed} capability flag: blocking callers
 * use {@link BlockingBridgeStrategy}, the others {@link SuspendingBridgeStrategy}.
 */
public class CrossDomainBridge implements Disposable {
    private static final Logger log = LoggerFactory.getLogger(CrossDomainBridge.class);

    public static final long DEFAULT_TIMEOUT_MS = 15_000L;

    private final String targetUrl;
    private final Map<String, String> headers;
    private final BridgeCodec codec;
    private final SharedChannel channel;
    private final RemoteDomainWorker worker;
    private final BridgeCallStrategy strategy;
    private final boolean blockingAllowed;
    private final Scheduler ownedScheduler;
    private final Map<String, BridgeResponse> cache = new ConcurrentHashMap<>();
    private volatile boolean disposed;

    private CrossDomainBridge(Builder b) {
        this.targetUrl = Objects.requireNonNull(b.targetUrl, "targetUrl");
        this.headers = Map.copyOf(b.headers);
        this.codec = b.codec != null ? b.codec : new BridgeCodec();
        this.channel = new SharedChannel(b.capacityBytes);
        this.worker = new RemoteDomainWorker(channel, Objects.requireNonNull(b.transport, "transport"), b.timeout);
        SharedChannelExchange exchange = new SharedChannelExchange(channel, worker, codec, targetUrl, headers, b.timeout.toMillis());
        this.blockingAllowed = b.blockingAllowed;
        if (blockingAllowed) {
            this.ownedScheduler = null;
            this.strategy = new BlockingBridgeStrategy(exchange);
        } else {
            Scheduler s = b.suspendScheduler;
            this.ownedScheduler = s == null ? Schedulers.newBoundedElastic(4, 1024, "flow-bridge-call") : null;
            this.strategy = new SuspendingBridgeStrategy(exchange, s != null ? s : ownedScheduler);
        }
        log.info("Cross-domain bridge ready: target={}, capacity={} bytes, timeout={} ms, blocking={}",
                targetUrl, b.capacityBytes, b.timeout.toMillis(), blockingAllowed);
    }

    public static Builder builder() {
        return new Builder();
    }

    public BridgeOutcome call(BridgeRequest request) {
        if (disposed) {
            throw new BridgeException("Bridge has been disposed");
        }
        byte[] encoded = codec.encodeRequest(request);
        String key = cacheKey(encoded);
        BridgeResponse cached = cache.get(key);
        if (cached != null) {
            log.debug("Bridge cache hit for step {} (trace {})", request.stepName(), request.traceId());
            return BridgeOutcome.completed(cached);
        }
        BridgeOutcome outcome = strategy.call(key, encoded, request.traceId());
        if (outcome.isCompleted() && outcome.response().isOk()) {
            cache.put(key, outcome.response());
        }
        return outcome;
    }

    public boolean isBlockingAllowed() {
        return blockingAllowed;
    }

    public String targetUrl() {
        return targetUrl;
    }

    public int capacityBytes() {
        return channel.capacity();
    }

    public int cachedResponses() {
        return cache.size();
    }

    public void clearCache() {
        cache.clear();
    }

    String cacheKey(byte[] encodedRequest) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(targetUrl.getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            digest.update(encodedRequest);
            digest.update((byte) 0);
            new TreeMap<>(headers).forEach((k, v) -> {
                digest.update(k.getBytes(StandardCharsets.UTF_8));
                digest.update((byte) '=');
                digest.update(v.getBytes(StandardCharsets.UTF_8));
                digest.update((byte) ';');
            });
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public void dispose() {
        disposed = true;
        strategy.dispose();
        worker.dispose();
        if (ownedScheduler != null) ownedScheduler.dispose();
        cache.clear();
    }

    @Override
    public boolean isDisposed() {
        return disposed;
    }

    public static class Builder {
        private String targetUrl;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private int capacityBytes = SharedChannel.DEFAULT_CAPACITY;
        private Duration timeout = Duration.ofMillis(DEFAULT_TIMEOUT_MS);
        private boolean blockingAllowed = true;
        private BridgeTransport transport;
        private BridgeCodec codec;
        private Scheduler suspendScheduler;

        private Builder() {}

        public Builder targetUrl(String targetUrl) { this.targetUrl = targetUrl; return this; }
        public Builder header(String name, String value) { this.headers.put(name, value); return this; }
        public Builder headers(Map<String, String> headers) { if (headers != null) this.headers.putAll(headers); return this; }
        public Builder capacityBytes(int capacityBytes) { this.capacityBytes = capacityBytes; return this; }
        public Builder timeout(Duration timeout) { this.timeout = timeout != null ? timeout : Duration.ofMillis(DEFAULT_TIMEOUT_MS); return this; }
        /** Convenience overload: set timeout in milliseconds. */
        public Builder timeoutMs(long ms) { return timeout(Duration.ofMillis(ms)); }
        public Builder blockingAllowed(boolean blockingAllowed) { this.blockingAllowed = blockingAllowed; return this; }
        public Builder transport(BridgeTransport transport) { this.transport = transport; return this; }
        public Builder codec(BridgeCodec codec) { this.codec = codec; return this; }
        /** Scheduler running suspended calls; a private bounded elastic one is created when unset. */
        public Builder suspendScheduler(Scheduler scheduler) { this.suspendScheduler = scheduler; return this; }

        public CrossDomainBridge build() {
            return new CrossDomainBridge(this);
        }
    }
}
