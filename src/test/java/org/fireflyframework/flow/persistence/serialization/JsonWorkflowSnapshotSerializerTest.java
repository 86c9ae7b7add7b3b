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

import com.fasterxml.jackson.databind.node.IntNode;
import org.fireflyframework.flow.core.LogLevel;
import org.fireflyframework.flow.core.QueueItem;
import org.fireflyframework.flow.engine.FlowEngine;
import org.fireflyframework.flow.engine.WorkflowHandle;
import org.fireflyframework.flow.registry.BranchSpec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonWorkflowSnapshotSerializerTest {

    private final JsonWorkflowSnapshotSerializer serializer = new JsonWorkflowSnapshotSerializer();
    private final FlowEngine engine = FlowEngine.builder().serializer(serializer).build();

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private WorkflowHandle orders(String id) {
        WorkflowHandle flow = engine.open(id);
        flow.step("A").effect(ctx -> IntNode.valueOf(ctx.input().asInt() * 2)).next("B").add()
            .step("B").effect(ctx -> IntNode.valueOf(ctx.input().asInt() + 1)).add()
            .step("C").branch(BranchSpec.when(ctx -> true, "A")).add();
        return flow;
    }

    @Test
    void snapshotRestoresQueueSharedOutputsAndLogs() throws Exception {
        WorkflowHandle flow = orders("orders");
        flow.shared().put("customer", "c-1");
        flow.start("A", 3);
        flow.enqueue("A", 10, "t-resume");
        flow.log("A").append(LogLevel.INFO, "note", 1);

        byte[] data = flow.serialize();
        WorkflowHandle copy = orders("copy");
        copy.deserialize(data);

        assertEquals(1, copy.queued());
        QueueItem queued = copy.instance().queue().peekFirst();
        assertEquals("A", queued.stepName());
        assertEquals("t-resume", queued.traceId());
        assertEquals(IntNode.valueOf(10), queued.payload());
        assertEquals("c-1", copy.shared().get("customer").asText());
        assertEquals(IntNode.valueOf(7), copy.output("B"));
        assertEquals(2, copy.stats().steps());
        assertEquals(List.of("note", 1), copy.log("A").last().args());

        copy.pump();
        assertEquals(IntNode.valueOf(21), copy.output("B"));
    }

    @Test
    void snapshotCarriesStepMetadataAndEdges() throws Exception {
        WorkflowHandle flow = orders("meta");
        flow.connect("B", "C");

        WorkflowSnapshot snapshot = serializer.deserialize(engine.serialize("meta"));

        assertEquals("meta", snapshot.getId());
        assertNotNull(snapshot.getCapturedAt());
        assertTrue(snapshot.getSteps().get("A").isHasEffect());
        assertEquals(List.of("B"), snapshot.getSteps().get("A").getStaticNext());
        assertEquals("predicate", snapshot.getSteps().get("C").getBranch());
        assertEquals(List.of("A"), snapshot.getSteps().get("C").getBranchTargets());
        assertEquals(List.of("C"), snapshot.getEdges().get("B"));
    }

    @Test
    void deserializeOpensTheSnapshotInstanceWhenNoTargetIsGiven() throws Exception {
        WorkflowHandle flow = orders("source");
        flow.enqueue("B", 1);
        byte[] data = flow.serialize();
        engine.remove("source");

        WorkflowHandle restored = engine.deserialize(data, null);

        assertEquals("source", restored.id());
        assertEquals(1, restored.queued());
    }

    @Test
    void wrapperCarriesContentTypeAndVersion() throws Exception {
        String json = new String(engine.serialize(orders("wrapped").id()), StandardCharsets.UTF_8);

        assertTrue(json.contains("\"contentType\":\"application/json\""));
        assertTrue(json.contains("\"version\":\"1.0\""));
        assertTrue(serializer.canDeserialize("application/json", "1.0"));
        assertFalse(serializer.canDeserialize("application/x-protobuf", "1.0"));
    }

    @Test
    void incompatibleOrMalformedDataIsRejected() {
        byte[] otherVersion = "{\"contentType\":\"application/json\",\"version\":\"9.9\",\"snapshot\":{}}"
                .getBytes(StandardCharsets.UTF_8);

        assertThrows(SerializationException.class, () -> serializer.deserialize(otherVersion));
        assertThrows(SerializationException.class, () -> serializer.deserialize("{oops".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void engineWithoutSerializerRefusesSnapshots() {
        try (FlowEngine plain = FlowEngine.builder().build()) {
            plain.open("wf");
            assertThrows(SerializationUnsupportedException.class, () -> plain.serialize("wf"));
        }
    }
}
