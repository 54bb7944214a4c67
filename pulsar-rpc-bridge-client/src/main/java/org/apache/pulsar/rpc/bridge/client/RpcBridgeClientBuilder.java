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
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Supplier;
import lombok.NonNull;
import org.apache.pulsar.client.api.ClientBuilder;
import org.apache.pulsar.rpc.bridge.common.IncomingResponse;
import org.apache.pulsar.rpc.bridge.serializer.PacketSerializer;
import org.apache.pulsar.rpc.bridge.serializer.ResponseDeserializer;
import org.apache.pulsar.rpc.bridge.session.BrokerSessionFactory;

/**
 * Builder for {@link RpcBridgeClient}. Everything has a default; {@link #build()} on a fresh builder
 * talks JSON to a broker on {@code pulsar://localhost:6650}.
 */
public interface RpcBridgeClientBuilder {

    RpcBridgeClientBuilder serviceUrl(@NonNull String serviceUrl);

    /**
     * Extra Pulsar client settings, applied through {@link ClientBuilder#loadConf(Map)}.
     */
    RpcBridgeClientBuilder clientConfig(@NonNull Map<String, Object> clientConfig);

    /**
     * Subscription name used for reply channels. Defaults to a name unique to this client, so that
     * every client sees all replies published on the channels it reads.
     */
    RpcBridgeClientBuilder replySubscription(@NonNull String replySubscription);

    RpcBridgeClientBuilder topicPrefix(@NonNull String topicPrefix);

    /**
     * Message properties added to every published message. Properties set on a
     * {@link org.apache.pulsar.rpc.bridge.serializer.PulsarRecord} override them.
     */
    RpcBridgeClientBuilder userProperties(@NonNull Map<String, String> userProperties);

    RpcBridgeClientBuilder serializer(@NonNull PacketSerializer serializer);

    RpcBridgeClientBuilder deserializer(@NonNull ResponseDeserializer deserializer);

    RpcBridgeClientBuilder idGenerator(@NonNull Supplier<String> idGenerator);

    /**
     * Replaces the Pulsar session, in which case the connection settings above are not used.
     */
    RpcBridgeClientBuilder sessionFactory(@NonNull BrokerSessionFactory sessionFactory);

    /**
     * Mapper used by the default codec and to convert replies to the type asked by
     * {@link RpcBridgeClient#send}.
     */
    RpcBridgeClientBuilder objectMapper(@NonNull ObjectMapper objectMapper);

    RpcBridgeClientBuilder unmatchedResponseListener(@NonNull Consumer<IncomingResponse> listener);

    RpcBridgeClient build();
}
