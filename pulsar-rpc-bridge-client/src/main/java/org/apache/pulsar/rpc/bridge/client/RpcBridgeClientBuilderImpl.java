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
package org.apache.pulsar.rpc.bridge.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Collections;
import java.util.Map;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Supplier;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import org.apache.pulsar.rpc.bridge.common.Constants;
import org.apache.pulsar.rpc.bridge.common.IncomingResponse;
import org.apache.pulsar.rpc.bridge.serializer.JsonPacketSerializer;
import org.apache.pulsar.rpc.bridge.serializer.JsonResponseDeserializer;
import org.apache.pulsar.rpc.bridge.serializer.PacketSerializer;
import org.apache.pulsar.rpc.bridge.serializer.ResponseDeserializer;
import org.apache.pulsar.rpc.bridge.session.BrokerSessionFactory;
import org.apache.pulsar.rpc.bridge.session.pulsar.PulsarBrokerSessionFactory;
import org.apache.pulsar.rpc.bridge.session.pulsar.PulsarSessionConfig;

@Getter(AccessLevel.PACKAGE)
class RpcBridgeClientBuilderImpl implements RpcBridgeClientBuilder {
    private String serviceUrl = Constants.DEFAULT_SERVICE_URL;
    private Map<String, Object> clientConfig = Collections.emptyMap();
    private String replySubscription = Constants.DEFAULT_REPLY_SUBSCRIPTION_PREFIX + UUID.randomUUID();
    private String topicPrefix = Constants.DEFAULT_TOPIC_PREFIX;
    private Map<String, String> userProperties = Collections.emptyMap();
    private PacketSerializer serializer;
    private ResponseDeserializer deserializer;
    private Supplier<String> idGenerator = () -> UUID.randomUUID().toString();
    private BrokerSessionFactory sessionFactory;
    private ObjectMapper objectMapper;
    private Consumer<IncomingResponse> unmatchedResponseListener;

    public RpcBridgeClientBuilderImpl serviceUrl(@NonNull String serviceUrl) {
        this.serviceUrl = serviceUrl;
        return this;
    }

    public RpcBridgeClientBuilderImpl clientConfig(@NonNull Map<String, Object> clientConfig) {
        this.clientConfig = clientConfig;
        return this;
    }

    public RpcBridgeClientBuilderImpl replySubscription(@NonNull String replySubscription) {
        this.replySubscription = replySubscription;
        return this;
    }

    public RpcBridgeClientBuilderImpl topicPrefix(@NonNull String topicPrefix) {
        this.topicPrefix = topicPrefix;
        return this;
    }

    public RpcBridgeClientBuilderImpl userProperties(@NonNull Map<String, String> userProperties) {
        this.userProperties = Map.copyOf(userProperties);
        return this;
    }

    public RpcBridgeClientBuilderImpl serializer(@NonNull PacketSerializer serializer) {
        this.serializer = serializer;
        return this;
    }

    public RpcBridgeClientBuilderImpl deserializer(@NonNull ResponseDeserializer deserializer) {
        this.deserializer = deserializer;
        return this;
    }

    public RpcBridgeClientBuilderImpl idGenerator(@NonNull Supplier<String> idGenerator) {
        this.idGenerator = idGenerator;
        return this;
    }

    public RpcBridgeClientBuilderImpl sessionFactory(@NonNull BrokerSessionFactory sessionFactory) {
        this.sessionFactory = sessionFactory;
        return this;
    }

    public RpcBridgeClientBuilderImpl objectMapper(@NonNull ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        return this;
    }

    public RpcBridgeClientBuilderImpl unmatchedResponseListener(@NonNull Consumer<IncomingResponse> listener) {
        this.unmatchedResponseListener = listener;
        return this;
    }

    public RpcBridgeClientImpl build() {
        if (objectMapper == null) {
            objectMapper = new ObjectMapper();
        }
        if (serializer == null) {
            serializer = new JsonPacketSerializer(objectMapper);
        }
        if (deserializer == null) {
            deserializer = new JsonResponseDeserializer(objectMapper);
        }
        if (sessionFactory == null) {
            sessionFactory = new PulsarBrokerSessionFactory(
                    new PulsarSessionConfig(serviceUrl, clientConfig, replySubscription, topicPrefix));
        }
        return RpcBridgeClientImpl.create(this);
    }
}
