/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.pulsar.rpc.bridge.serializer;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNull;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.Map;
import org.apache.pulsar.rpc.bridge.common.Packet;
import org.apache.pulsar.rpc.bridge.common.SerializationException;
import org.testng.annotations.Test;

public class JsonPacketSerializerTest {
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final JsonPacketSerializer serializer = new JsonPacketSerializer(objectMapper);

    @Test
    public void testRequestEnvelope() throws Exception {
        SerializedPacket serialized = serializer.serialize(new Packet("req-1", "math.sum", Map.of("a", 1)));

        JsonNode body = objectMapper.readTree(serialized.payload());
        assertEquals(body.get("id").asText(), "req-1");
        assertEquals(body.get("pattern").asText(), "math.sum");
        assertEquals(body.get("data").get("a").asInt(), 1);
        assertNull(serialized.options());
    }

    @Test
    public void testEventEnvelopeHasNoId() throws Exception {
        SerializedPacket serialized = serializer.serialize(Packet.of("user.created", "ada"));

        JsonNode body = objectMapper.readTree(serialized.payload());
        assertFalse(body.has("id"));
        assertEquals(body.get("data").asText(), "ada");
    }

    @Test
    public void testRecordOptionsTravelBesideTheBody() throws Exception {
        Instant deliverAt = Instant.parse("2030-01-01T00:00:00Z");
        PulsarRecord<String> record = new PulsarRecordBuilder<>("payload")
                .setKey("k1")
                .setProperties(Map.of("a", "1"))
                .addProperty("b", "2")
                .setDeliverAt(deliverAt)
                .build();

        SerializedPacket serialized = serializer.serialize(new Packet("req-1", "jobs", record));

        JsonNode body = objectMapper.readTree(serialized.payload());
        assertEquals(body.get("data").asText(), "payload");
        assertEquals(serialized.options().key(), "k1");
        assertEquals(serialized.options().properties(), Map.of("a", "1", "b", "2"));
        assertEquals(serialized.options().deliverAt().longValue(), deliverAt.toEpochMilli());
    }

    @Test(expectedExceptions = SerializationException.class)
    public void testUnserializableDataFails() {
        serializer.serialize(Packet.of("jobs", new Object()));
    }
}
