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

import static org.apache.pulsar.rpc.bridge.common.Constants.NOT_INITIALIZED_ERROR_MESSAGE;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.apache.pulsar.client.api.Consumer;
import org.apache.pulsar.client.api.Message;
import org.apache.pulsar.client.api.Producer;
import org.apache.pulsar.client.api.PulsarClient;
import org.apache.pulsar.client.api.PulsarClientException;
import org.apache.pulsar.client.api.TypedMessageBuilder;
import org.apache.pulsar.rpc.bridge.common.ConnectionErrors;
import org.apache.pulsar.rpc.bridge.common.RecordOptions;
import org.apache.pulsar.rpc.bridge.common.RpcBridgeException;
import org.apache.pulsar.rpc.bridge.session.BrokerEvent;
import org.apache.pulsar.rpc.bridge.session.BrokerSession;
import org.apache.pulsar.rpc.bridge.session.InboundMessage;
import org.apache.pulsar.rpc.bridge.session.SessionEvent;
import org.apache.pulsar.rpc.bridge.session.SessionEventListener;
import org.apache.pulsar.rpc.bridge.session.SessionEventRegistry;
import reactor.core.Disposable;

/**
 * {@link BrokerSession} running on a {@link PulsarClient}.
 *
 * <p>Publishing goes through one producer per topic, created asynchronously on first use and kept
 * until the session ends; a failed creation is forgotten so that the next publish retries it.
 * Subscribing opens one consumer per channel whose listener emits {@link BrokerEvent#MESSAGE} and
 * acknowledges every message. No method waits on a broker round trip.
 *
 * <p>The Pulsar client connects lazily and reconnects on its own, so lifecycle events are derived:
 * the session counts as online once the client is built, goes {@link BrokerEvent#OFFLINE} (followed
 * by {@link BrokerEvent#RECONNECT}) on the first connection failure reported by a publish or
 * subscribe, and emits {@link BrokerEvent#CONNECT} again on the next successful broker round trip.
 */
@Slf4j
public class PulsarBrokerSession implements BrokerSession {
    private final PulsarSessionConfig config;
    private final PulsarClientFactory clientFactory;
    private final SessionEventRegistry listeners = new SessionEventRegistry();
    private final Map<String, Consumer<byte[]>> consumers = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<Producer<byte[]>>> producers = new ConcurrentHashMap<>();
    private final AtomicBoolean online = new AtomicBoolean();
    private final AtomicBoolean ended = new AtomicBoolean();

    private volatile PulsarClient client;
    private volatile SessionDispatcherFactory dispatcherFactory;

    public PulsarBrokerSession(@NonNull PulsarSessionConfig config, @NonNull PulsarClientFactory clientFactory) {
        this.config = config;
        this.clientFactory = clientFactory;
    }

    @Override
    public synchronized void connect() {
        if (client != null || ended.get()) {
            return;
        }
        PulsarClient created;
        try {
            created = clientFactory.create(config);
        } catch (PulsarClientException e) {
            ended.set(true);
            listeners.emit(SessionEvent.failure(BrokerEvent.ERROR, e));
            listeners.emit(SessionEvent.failure(BrokerEvent.CLOSE, e));
            return;
        }
        client = created;
        dispatcherFactory = new SessionDispatcherFactory(created, config.replySubscription());
        log.info("Pulsar client created for {}", config.serviceUrl());
        onBrokerReachable();
    }

    @Override
    public CompletableFuture<Void> publish(String channel, byte[] payload, RecordOptions options) {
        SessionDispatcherFactory factory = dispatcherFactory;
        if (factory == null || ended.get()) {
            return CompletableFuture.failedFuture(notConnected());
        }
        return producer(factory, config.toTopic(channel))
                .thenCompose(producer -> {
                    TypedMessageBuilder<byte[]> message = producer.newMessage().value(payload);
                    applyOptions(message, options);
                    return message.sendAsync();
                })
                .handle((messageId, ex) -> {
                    if (ex != null) {
                        onBrokerFailure(channel, ex);
                        throw new CompletionException(ConnectionErrors.unwrap(ex));
                    }
                    log.debug("[{}] Published message {}", channel, messageId);
                    onBrokerReachable();
                    return null;
                });
    }

    @Override
    public CompletableFuture<Void> subscribe(String channel) {
        SessionDispatcherFactory factory = dispatcherFactory;
        if (factory == null || ended.get()) {
            return CompletableFuture.failedFuture(notConnected());
        }
        return factory.channelConsumer(config.toTopic(channel), (consumer, msg) -> received(channel, consumer, msg))
                .handle((consumer, ex) -> {
                    if (ex != null) {
                        onBrokerFailure(channel, ex);
                        throw new CompletionException(ConnectionErrors.unwrap(ex));
                    }
                    if (ended.get()) {
                        consumer.closeAsync();
                        throw new CompletionException(
                                new RpcBridgeException.ClosedException("Session ended while subscribing to " + channel));
                    }
                    Consumer<byte[]> previous = consumers.put(channel, consumer);
                    if (previous != null) {
                        previous.closeAsync();
                    }
                    onBrokerReachable();
                    return null;
                });
    }

    @Override
    public CompletableFuture<Void> unsubscribe(String channel) {
        Consumer<byte[]> consumer = consumers.remove(channel);
        if (consumer == null) {
            return CompletableFuture.completedFuture(null);
        }
        return consumer.closeAsync();
    }

    @Override
    public Disposable on(BrokerEvent event, SessionEventListener listener) {
        return listeners.register(event, listener);
    }

    @Override
    public void end() {
        if (!ended.compareAndSet(false, true)) {
            return;
        }
        online.set(false);
        List<CompletableFuture<Void>> closing = new ArrayList<>();
        consumers.values().forEach(consumer -> closing.add(consumer.closeAsync()));
        consumers.clear();
        producers.values().forEach(producer -> closing.add(closeProducer(producer)));
        producers.clear();
        PulsarClient current = client;
        CompletableFuture.allOf(closing.toArray(new CompletableFuture[0]))
                .handle((ignored, ex) -> {
                    if (ex != null) {
                        log.warn("Failed to close consumers and producers", ex);
                    }
                    return null;
                })
                .thenCompose(ignored -> current == null
                        ? CompletableFuture.<Void>completedFuture(null) : current.closeAsync())
                .whenComplete((ignored, ex) -> {
                    if (ex != null) {
                        log.warn("Failed to close Pulsar client for {}", config.serviceUrl(), ex);
                        listeners.emit(SessionEvent.failure(BrokerEvent.CLOSE, ConnectionErrors.unwrap(ex)));
                    } else {
                        listeners.emit(SessionEvent.of(BrokerEvent.CLOSE));
                    }
                });
    }

    @Override
    public PulsarClient nativeHandle() {
        return client;
    }

    private void received(String channel, Consumer<byte[]> consumer, Message<byte[]> msg) {
        try {
            listeners.emit(SessionEvent.message(new InboundMessage(channel, msg.getValue())));
        } finally {
            consumer.acknowledgeAsync(msg).exceptionally(ex -> {
                log.warn("[{}] [{}] Acknowledging message {} failed", msg.getTopicName(), channel,
                        msg.getMessageId(), ex);
                return null;
            });
        }
    }

    private void onBrokerFailure(String channel, Throwable t) {
        Throwable cause = ConnectionErrors.unwrap(t);
        if (ended.get() || !ConnectionErrors.isConnectionLost(cause)) {
            return;
        }
        listeners.emit(SessionEvent.failure(BrokerEvent.ERROR, cause));
        if (online.compareAndSet(true, false)) {
            log.warn("[{}] Lost connection to {}", channel, config.serviceUrl());
            listeners.emit(SessionEvent.of(BrokerEvent.OFFLINE));
            listeners.emit(SessionEvent.of(BrokerEvent.RECONNECT));
        }
    }

    private void onBrokerReachable() {
        if (!ended.get() && online.compareAndSet(false, true)) {
            listeners.emit(SessionEvent.of(BrokerEvent.CONNECT));
        }
    }

    private static void applyOptions(TypedMessageBuilder<byte[]> message, RecordOptions options) {
        if (options == null) {
            return;
        }
        if (options.key() != null) {
            message.key(options.key());
        }
        if (!options.properties().isEmpty()) {
            message.properties(options.properties());
        }
        if (options.deliverAt() != null) {
            message.deliverAt(options.deliverAt());
        }
    }

    private CompletableFuture<Producer<byte[]>> producer(SessionDispatcherFactory factory, String topic) {
        CompletableFuture<Producer<byte[]>> producer = producers.computeIfAbsent(topic, factory::channelProducer);
        producer.whenComplete((created, ex) -> {
            if (ex != null) {
                producers.remove(topic, producer);
            }
        });
        if (ended.get() && producers.remove(topic, producer)) {
            closeProducer(producer);
            return CompletableFuture.failedFuture(
                    new RpcBridgeException.ClosedException("Session ended while publishing to " + topic));
        }
        return producer;
    }

    private static CompletableFuture<Void> closeProducer(CompletableFuture<Producer<byte[]>> producer) {
        return producer.handle((created, ex) -> created)
                .thenCompose(created -> created == null
                        ? CompletableFuture.<Void>completedFuture(null) : created.closeAsync());
    }

    private static RpcBridgeException.NotConnectedException notConnected() {
        return new RpcBridgeException.NotConnectedException(NOT_INITIALIZED_ERROR_MESSAGE);
    }
}
