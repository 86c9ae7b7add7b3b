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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * JSON encoding of bridge messages.
 */
public class BridgeCodec {
    private static final Logger log = LoggerFactory.getLogger(BridgeCodec.class);

    static final String INVALID_JSON = "Invalid JSON from remote";

    private final ObjectMapper objectMapper;

    public BridgeCodec() {
        this(defaultObjectMapper());
    }

    public BridgeCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    private static ObjectMapper defaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    public byte[] encodeRequest(BridgeRequest request) {
        try {
            return objectMapper.writeValueAsBytes(request);
        } catch (IOException e) {
            throw new BridgeProtocolException("Failed to encode bridge request for step " + request.stepName(), e);
        }
    }

    public BridgeRequest decodeRequest(byte[] bytes) {
        try {
            BridgeRequest request = objectMapper.readValue(bytes, BridgeRequest.class);
            if (request.stepName() == null || request.instanceId() == null) {
                throw new BridgeProtocolException("Bridge request is missing instanceId or stepName");
            }
            return request;
        } catch (IOException e) {
            throw new BridgeProtocolException("Malformed bridge request", e);
        }
    }

    public byte[] encodeResponse(BridgeResponse response) {
        try {
            return objectMapper.writeValueAsBytes(response);
        } catch (IOException e) {
            throw new BridgeProtocolException("Failed to encode bridge response", e);
        }
    }

    /** Undecodable replies become {@code err("Invalid JSON from remote")}. */
    public BridgeResponse decodeResponse(byte[] bytes) {
        try {
            BridgeResponse response = objectMapper.readValue(bytes, BridgeResponse.class);
            if (response == null || response.kind() == null) {
                return BridgeResponse.err(INVALID_JSON);
            }
            return response;
        } catch (IOException e) {
            log.debug("Undecodable bridge response ({} bytes)", bytes.length, e);
            return BridgeResponse.err(INVALID_JSON);
        }
    }
}
