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

/**
 * Interface for serializing and deserializing workflow snapshots.
 * <p>
 * This abstraction allows for different serialization strategies while keeping one
 * contract for the engine. Implementations must reject data written in a format or
 * version they cannot read.
 */
public interface WorkflowSnapshotSerializer {

    /**
     * Serializes a workflow snapshot to bytes.
     *
     * @param snapshot the snapshot to serialize
     * @return serialized bytes
     * @throws SerializationException if serialization fails
     */
    byte[] serialize(WorkflowSnapshot snapshot) throws SerializationException;

    /**
     * Deserializes bytes back to a workflow snapshot.
     *
     * @param data the serialized bytes
     * @return the snapshot
     * @throws SerializationException if the data is corrupted or in an unsupported format
     */
    WorkflowSnapshot deserialize(byte[] data) throws SerializationException;

    /** Content type identifier, e.g. {@code application/json}. */
    String getContentType();

    String getVersion();

    boolean canDeserialize(String contentType, String version);
}
