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
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Never blocks the caller. The channel exchange runs on a worker scheduler and the call returns
 * {@link BridgeOutcome#suspended(PendingBridgeCall)} immediately. When the exchange settles its result
 * is kept until the request is replayed; each settled result is handed out exactly once.
 */
public class SuspendingBridgeStrategy implements BridgeCallStrategy {
    private static final Logger log = LoggerFactory.getLogger(SuspendingBridgeStrategy.class);

    private final SharedChannelExchange exchange;
    private final Scheduler scheduler;
    private final Map<String, PendingBridgeCall> inFlight = new ConcurrentHashMap<>();
    private final Map<String, Settled> settled = new ConcurrentHashMap<>();

    public SuspendingBridgeStrategy(SharedChannelExchange exchange, Scheduler scheduler) {
        this.exchange = exchange;
        this.scheduler = scheduler;
    }

    @Override
    public BridgeOutcome call(String key, byte[] request, String traceId) {
        Settled done = settled.remove(key);
        if (done != null) {
            if (done.error != null) {
                throw done.error;
            }
            return BridgeOutcome.completed(done.response);
        }
        PendingBridgeCall fresh = new PendingBridgeCall(key, traceId);
        PendingBridgeCall existing = inFlight.putIfAbsent(key, fresh);
        if (existing != null) {
            return BridgeOutcome.suspended(existing);
        }
        Mono.fromCallable(() -> exchange.exchange(request, traceId))
                .subscribeOn(scheduler)
                .subscribe(
                        response -> settle(fresh, new Settled(response, null)),
                        error -> settle(fresh, new Settled(null, asRuntime(error))));
        return BridgeOutcome.suspended(fresh);
    }

    private void settle(PendingBridgeCall call, Settled result) {
        settled.put(call.key(), result);
        inFlight.remove(call.key());
        log.debug("Bridge call settled (trace {}, ok={})", call.traceId(), result.error == null);
        call.markSettled();
    }

    private static RuntimeException asRuntime(Throwable error) {
        return error instanceof RuntimeException re ? re : new BridgeException(error.getMessage(), error);
    }

    int inFlightCount() {
        return inFlight.size();
    }

    private static final class Settled {
        final BridgeResponse response;
        final RuntimeException error;

        Settled(BridgeResponse response, RuntimeException error) {
            this.response = response;
            this.error = error;
        }
    }
}
