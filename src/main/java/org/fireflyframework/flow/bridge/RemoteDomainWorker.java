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

import java.time.Duration;
import java.util.Map;

/**
 * Remote-domain side of the shared channel. Runs on its own single thread: picks up a posted request,
 * forwards it through the {@link BridgeTransport}, writes the reply back and signals the caller.
 */
public class RemoteDomainWorker implements Disposable {
    private static final Logger log = LoggerFactory.getLogger(RemoteDomainWorker.class);

    private final SharedChannel channel;
    private final BridgeTransport transport;
    private final Duration timeout;
    private final Scheduler scheduler;

    public RemoteDomainWorker(SharedChannel channel, BridgeTransport transport, Duration timeout) {
        this.channel = channel;
        this.transport = transport;
        this.timeout = timeout;
        // one thread that may block on the transport
        this.scheduler = Schedulers.newBoundedElastic(1, Integer.MAX_VALUE, "flow-remote-domain", 60, true);
    }

    public void post(int requestId, String targetUrl, Map<String, String> headers) {
        scheduler.schedule(() -> handle(requestId, targetUrl, headers));
    }

    void handle(int requestId, String targetUrl, Map<String, String> headers) {
        byte[] request = channel.readRequest(requestId);
        if (request == null) {
            log.debug("Bridge request {} abandoned before pickup", requestId);
            return;
        }
        try {
            byte[] reply = transport.exchange(targetUrl, request, headers).block(timeout);
            if (reply == null) {
                throw new BridgeProtocolException("Empty reply from remote for request " + requestId);
            }
            if (!channel.completeRequest(requestId, reply)) {
                log.debug("Discarded reply for abandoned bridge request {}", requestId);
            }
        } catch (RuntimeException e) {
            log.warn("Remote handler failed for bridge request {}: {}", requestId, e.toString());
            channel.failRequest(requestId);
        }
    }

    @Override
    public void dispose() {
        scheduler.dispose();
    }

    @Override
    public boolean isDisposed() {
        return scheduler.isDisposed();
    }
}
