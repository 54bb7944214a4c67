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
package org.apache.pulsar.rpc.bridge.session.pulsar;

import java.util.concurrent.CompletableFuture;
import lombok.RequiredArgsConstructor;
import org.apache.pulsar.client.api.Consumer;
import org.apache.pulsar.client.api.MessageListener;
import org.apache.pulsar.client.api.Producer;
import org.apache.pulsar.client.api.ProducerAccessMode;
import org.apache.pulsar.client.api.PulsarClient;
import org.apache.pulsar.client.api.Schema;
import org.apache.pulsar.client.api.SubscriptionInitialPosition;
import org.apache.pulsar.client.api.SubscriptionMode;
import org.apache.pulsar.client.api.SubscriptionType;

/**
 * Creates the producers and consumers a session publishes and subscribes through. Payloads are raw
 * bytes; encoding is left to the packet serializer.
 */
@RequiredArgsConstructor
public class SessionDispatcherFactory {
    private final PulsarClient client;
    private final String subscription;

    /**
     * Starts creating a producer for one channel topic. The returned future is completed by the
     * client's IO thread, so callers chain on it instead of waiting.
     *
     * @param topic the fully qualified topic name
     * @return a future completed with the producer once the broker registered it
     */
    public CompletableFuture<Producer<byte[]>> channelProducer(String topic) {
        return client.newProducer(Schema.BYTES)
                .topic(topic)
                .accessMode(ProducerAccessMode.Shared)
                .createAsync();
    }

    /**
     * Subscribes to one channel topic. Every session reads the channel through its own subscription,
     * so each one sees every message published after it subscribed.
     *
     * @param topic the fully qualified topic name
     * @param listener receives the messages
     * @return a future completed with the consumer once the broker confirmed the subscription
     */
    public CompletableFuture<Consumer<byte[]>> channelConsumer(String topic, MessageListener<byte[]> listener) {
        return client.newConsumer(Schema.BYTES)
                .topic(topic)
                .subscriptionName(subscription)
                .subscriptionType(SubscriptionType.Exclusive)
                .subscriptionMode(SubscriptionMode.NonDurable)
                .subscriptionInitialPosition(SubscriptionInitialPosition.Latest)
                .messageListener(listener)
                .subscribeAsync();
    }
}
