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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.NonNull;
import org.apache.pulsar.rpc.bridge.common.Packet;
import org.apache.pulsar.rpc.bridge.common.RecordOptions;
import org.apache.pulsar.rpc.bridge.common.SerializationException;

/**
 * Encodes packets as the JSON envelope {@code {"id", "pattern", "data"}}. When the data is a
 * {@link PulsarRecord} its options are lifted out and only the wrapped data is written.
 */
public class JsonPacketSerializer implements PacketSerializer {
    private final ObjectMapper objectMapper;

    public JsonPacketSerializer(@NonNull ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public SerializedPacket serialize(Packet packet) {
        Object data = packet.data();
        RecordOptions options = null;
        if (data instanceof PulsarRecord<?> record) {
            data = record.getData();
            options = record.getOptions();
        }
        try {
            ObjectNode envelope = objectMapper.createObjectNode();
            if (packet.id() != null) {
                envelope.put("id", packet.id());
            }
            envelope.set("pattern", objectMapper.valueToTree(packet.pattern()));
            envelope.set("data", objectMapper.valueToTree(data));
            return new SerializedPacket(objectMapper.writeValueAsBytes(envelope), options);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new SerializationException("Failed to serialize packet for pattern " + packet.pattern(), e);
        }
    }
}
