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


package org.fireflyframework.flow.persistence.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * JSON-based implementation of WorkflowSnapshotSerializer using Jackson.
 * <p>
 * The snapshot is wrapped together with its content type and version so incompatible
 * data is rejected on read.
 */
public class JsonWorkflowSnapshotSerializer implements WorkflowSnapshotSerializer {

    private static final Logger log = LoggerFactory.getLogger(JsonWorkflowSnapshotSerializer.class);

    private static final String CONTENT_TYPE = "application/json";
    private static final String VERSION = "1.0";

    private final ObjectMapper objectMapper;

    public JsonWorkflowSnapshotSerializer() {
        this(createDefaultObjectMapper());
    }

    public JsonWorkflowSnapshotSerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public byte[] serialize(WorkflowSnapshot snapshot) throws SerializationException {
        try {
            log.debug("Serializing workflow snapshot for instance: {}", snapshot.getId());
            SnapshotWrapper wrapper = new SnapshotWrapper(snapshot, CONTENT_TYPE, VERSION);
            return objectMapper.writeValueAsString(wrapper).getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            String message = String.format("Failed to serialize workflow snapshot for instance: %s", snapshot.getId());
            log.error(message, e);
            throw new SerializationException(message, e);
        }
    }

    @Override
    public WorkflowSnapshot deserialize(byte[] data) throws SerializationException {
        SnapshotWrapper wrapper;
        try {
            log.debug("Deserializing workflow snapshot from JSON: {} bytes", data.length);
            wrapper = objectMapper.readValue(data, SnapshotWrapper.class);
        } catch (IOException e) {
            String message = "Failed to deserialize workflow snapshot from JSON";
            log.error(message, e);
            throw new SerializationException(message, e);
        }
        if (!canDeserialize(wrapper.getContentType(), wrapper.getVersion())) {
            throw new SerializationException(String.format(
                    "Incompatible serialization format: %s version %s",
                    wrapper.getContentType(), wrapper.getVersion()));
        }
        if (wrapper.getSnapshot() == null) {
            throw new SerializationException("Serialized data holds no workflow snapshot");
        }
        return wrapper.getSnapshot();
    }

    @Override
    public String getContentType() {
        return CONTENT_TYPE;
    }

    @Override
    public String getVersion() {
        return VERSION;
    }

    @Override
    public boolean canDeserialize(String contentType, String version) {
        return CONTENT_TYPE.equals(contentType) && VERSION.equals(version);
    }

    private static ObjectMapper createDefaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    /**
     * Wrapper carrying format metadata along with the snapshot.
     */
    private static class SnapshotWrapper {
        private String contentType;
        private String version;
        private WorkflowSnapshot snapshot;

        // Default constructor for Jackson
        public SnapshotWrapper() {}

        SnapshotWrapper(WorkflowSnapshot snapshot, String contentType, String version) {
            this.snapshot = snapshot;
            this.contentType = contentType;
            this.version = version;
        }

        public String getContentType() { return contentType; }
        public void setContentType(String contentType) { this.contentType = contentType; }

        public String getVersion() { return version; }
        public void setVersion(String version) { this.version = version; }

        public WorkflowSnapshot getSnapshot() { return snapshot; }
        public void setSnapshot(WorkflowSnapshot snapshot) { this.snapshot = snapshot; }
    }
}
