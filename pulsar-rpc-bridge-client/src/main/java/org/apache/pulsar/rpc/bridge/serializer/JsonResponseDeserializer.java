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
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import lombok.NonNull;
import org.apache.pulsar.rpc.bridge.common.IncomingResponse;
import org.apache.pulsar.rpc.bridge.common.SerializationException;

/**
 * Decodes the JSON envelope {@code {"id", "err", "response", "isDisposed"}}.
 *
 * <p>A body carrying none of {@code err}, {@code response} or {@code isDisposed} was produced by a
 * responder that does not speak the envelope; the whole body is then taken as a final response for
 * the {@code id} it carries.
 */
public class JsonResponseDeserializer implements ResponseDeserializer {
    private final ObjectMapper objectMapper;

    public JsonResponseDeserializer(@NonNull ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public IncomingResponse deserialize(byte[] payload) {
        JsonNode body;
        try {
            body = objectMapper.readTree(payload);
        } catch (IOException e) {
            throw new SerializationException("Malformed reply payload", e);
        }
        if (body == null || !body.isObject()) {
            throw new SerializationException("Reply payload is not a JSON object");
        }
        String id = body.hasNonNull("id") ? body.get("id").asText() : null;
        try {
            if (isExternal(body)) {
                return new IncomingResponse(id, null, toValue(body), true);
            }
            return new IncomingResponse(id,
                    toValue(body.get("err")),
                    toValue(body.get("response")),
                    body.path("isDisposed").asBoolean(false));
        } catch (JsonProcessingException e) {
            throw new SerializationException("Malformed reply payload for id " + id, e);
        }
    }

    private static boolean isExternal(JsonNode body) {
        return !body.has("err") && !body.has("response") && !body.has("isDisposed");
    }

    private Object toValue(JsonNode node) throws JsonProcessingException {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return objectMapper.treeToValue(node, Object.class);
    }
}
