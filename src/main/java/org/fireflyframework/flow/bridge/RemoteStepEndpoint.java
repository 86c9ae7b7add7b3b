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

import org.fireflyframework.flow.core.WorkflowInstance;
import org.fireflyframework.flow.registry.WorkflowRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Remote-domain entry point: decodes a bridge request, runs the step in-process against the local
 * instance with the same id and encodes {@code ok(value, logs)} or {@code err(message)}.
 * Any transport can front it.
 */
public class RemoteStepEndpoint {
    private static final Logger log = LoggerFactory.getLogger(RemoteStepEndpoint.class);

    /** Runs one step in-process in the remote domain. */
    @FunctionalInterface
    public interface RemoteStepRunner {
        BridgeResponse run(WorkflowInstance instance, BridgeRequest request);
    }

    private final WorkflowRegistry workflows;
    private final RemoteStepRunner runner;
    private final BridgeCodec codec;

    public RemoteStepEndpoint(WorkflowRegistry workflows, RemoteStepRunner runner, BridgeCodec codec) {
        this.workflows = workflows;
        this.runner = runner;
        this.codec = codec != null ? codec : new BridgeCodec();
    }

    public byte[] handle(byte[] requestBytes) {
        return codec.encodeResponse(handle(codec.decodeRequest(requestBytes)));
    }

    public BridgeResponse handle(BridgeRequest request) {
        if (!BridgeRequest.KIND_STEP.equals(request.kind())) {
            return BridgeResponse.err("Unsupported request kind: " + request.kind());
        }
        WorkflowInstance instance = workflows.find(request.instanceId()).orElse(null);
        if (instance == null) {
            log.warn("Remote step {} requested for unknown workflow {}", request.stepName(), request.instanceId());
            return BridgeResponse.err("Workflow not found: " + request.instanceId());
        }
        if (!instance.steps().contains(request.stepName())) {
            return BridgeResponse.err("Step not found: " + request.stepName());
        }
        return runner.run(instance, request);
    }
}
