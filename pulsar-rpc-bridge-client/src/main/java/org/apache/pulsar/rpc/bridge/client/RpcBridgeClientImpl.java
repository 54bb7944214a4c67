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

import static org.apache.pulsar.rpc.bridge.common.Constants.NOT_INITIALIZED_ERROR_MESSAGE;
import static org.apache.pulsar.rpc.bridge.common.Constants.REPLY_CHANNEL_SUFFIX;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.apache.pulsar.rpc.bridge.common.ConnectionErrors;
import org.apache.pulsar.rpc.bridge.common.IncomingResponse;
import org.apache.pulsar.rpc.bridge.common.InvalidMessageException;
import org.apache.pulsar.rpc.bridge.common.Packet;
import org.apache.pulsar.rpc.bridge.common.PatternNormalizer;
import org.apache.pulsar.rpc.bridge.common.RecordOptions;
import org.apache.pulsar.rpc.bridge.common.Reply;
import org.apache.pulsar.rpc.bridge.common.RpcBridgeException;
import org.apache.pulsar.rpc.bridge.common.SerializationException;
import org.apache.pulsar.rpc.bridge.serializer.PacketSerializer;
import org.apache.pulsar.rpc.bridge.serializer.ResponseDeserializer;
import org.apache.pulsar.rpc.bridge.serializer.SerializedPacket;
import org.apache.pulsar.rpc.bridge.session.BrokerEvent;
import org.apache.pulsar.rpc.bridge.session.BrokerSession;
import org.apache.pulsar.rpc.bridge.session.BrokerSessionFactory;
import org.apache.pulsar.rpc.bridge.session.SessionEvent;
import org.apache.pulsar.rpc.bridge.session.SessionEventListener;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Slf4j
class RpcBridgeClientImpl implements RpcBridgeClient {
    private final BrokerSessionFactory sessionFactory;
    private final PacketSerializer serializer;
    private final ResponseDeserializer deserializer;
    private final Supplier<String> idGenerator;
    private final Map<String, String> userProperties;
    private final ObjectMapper objectMapper;

    private final CorrelationRouter router;
    private final SubscriptionLedger ledger = new SubscriptionLedger();
    private final ConnectionStateMachine stateMachine = new ConnectionStateMachine();
    private final PendingListenerQueue pendingListeners = new PendingListenerQueue();
    private final List<Disposable> sessionRegistrations = new ArrayList<>();

    private volatile BrokerSession session;

    RpcBridgeClientImpl(BrokerSessionFactory sessionFactory,
                        PacketSerializer serializer,
                        ResponseDeserializer deserializer,
                        Supplier<String> idGenerator,
                        Map<String, String> userProperties,
                        ObjectMapper objectMapper,
                        CorrelationRouter router) {
        this.sessionFactory = sessionFactory;
        this.serializer = serializer;
        this.deserializer = deserializer;
        this.idGenerator = idGenerator;
        this.userProperties = userProperties;
        this.objectMapper = objectMapper;
        this.router = router;
    }

    /**
     * Creates a new instance of {@link RpcBridgeClientImpl} using the specified builder settings.
     * No connection is made until {@link #connect()}.
     */
    static RpcBridgeClientImpl create(@NonNull RpcBridgeClientBuilderImpl builder) {
        return new RpcBridgeClientImpl(
                builder.getSessionFactory(),
                builder.getSerializer(),
                builder.getDeserializer(),
                builder.getIdGenerator(),
                builder.getUserProperties(),
                builder.getObjectMapper(),
                new CorrelationRouter(builder.getUnmatchedResponseListener()));
    }

    @Override
    public synchronized CompletableFuture<Void> connect() {
        if (session != null) {
            return stateMachine.connection();
        }
        BrokerSession created = sessionFactory.create();
        session = created;
        registerLifecycleListeners(created);
        pendingListeners.drainTo(created);
        CompletableFuture<Void> firstSignal = ConnectSignal.first(created);
        stateMachine.connecting(firstSignal);
        created.connect();
        return firstSignal;
    }

    private void registerLifecycleListeners(BrokerSession created) {
        sessionRegistrations.add(created.on(BrokerEvent.ERROR, event -> {
            if (isCurrent(created) && !ConnectionErrors.isConnectionRefused(event.cause())) {
                log.error("Broker session error", event.cause());
            }
        }));
        sessionRegistrations.add(created.on(BrokerEvent.OFFLINE, event -> {
            if (isCurrent(created)) {
                log.warn("Broker session is offline");
                stateMachine.offline();
            }
        }));
        sessionRegistrations.add(created.on(BrokerEvent.RECONNECT, event -> {
            if (isCurrent(created)) {
                log.warn("Reconnecting to the broker");
                stateMachine.reconnecting();
            }
        }));
        sessionRegistrations.add(created.on(BrokerEvent.CONNECT, event -> {
            if (isCurrent(created) && stateMachine.connected()) {
                log.info("Connected to the broker");
                synchronized (this) {
                    sessionRegistrations.add(created.on(BrokerEvent.MESSAGE, this::onMessage));
                }
            }
        }));
        sessionRegistrations.add(created.on(BrokerEvent.DISCONNECT, event -> {
            if (isCurrent(created)) {
                log.warn("Disconnected from the broker");
                stateMachine.disconnected();
            }
        }));
        sessionRegistrations.add(created.on(BrokerEvent.CLOSE, event -> {
            if (isCurrent(created)) {
                log.info("Broker session closed");
                stateMachine.closed();
            }
        }));
    }

    private boolean isCurrent(BrokerSession candidate) {
        return session == candidate;
    }

    private void onMessage(SessionEvent event) {
        IncomingResponse response;
        try {
            response = deserializer.deserialize(event.message().payload());
        } catch (SerializationException e) {
            log.warn("[{}] Dropping reply that cannot be decoded", event.message().channel(), e);
            return;
        }
        router.dispatch(response);
    }

    @Override
    public void close() {
        BrokerSession closing;
        List<Disposable> registrations;
        synchronized (this) {
            closing = session;
            if (closing == null) {
                return;
            }
            session = null;
            registrations = new ArrayList<>(sessionRegistrations);
            sessionRegistrations.clear();
            ledger.clear();
            pendingListeners.clear();
            stateMachine.reset();
        }
        registrations.forEach(Disposable::dispose);
        router.failAll(new RpcBridgeException.ClosedException("The client was closed"));
        closing.end();
        stateMachine.closed();
        log.info("Client closed");
    }

    @Override
    public void on(BrokerEvent event, SessionEventListener listener) {
        BrokerSession current;
        synchronized (this) {
            current = session;
            if (current == null) {
                pendingListeners.add(event, listener);
                return;
            }
        }
        current.on(event, listener);
    }

    @Override
    public <T> T unwrap(Class<T> type) throws RpcBridgeException.NotConnectedException {
        BrokerSession current = session;
        if (current == null) {
            throw new RpcBridgeException.NotConnectedException(NOT_INITIALIZED_ERROR_MESSAGE);
        }
        return type.cast(current.nativeHandle());
    }

    @Override
    public Flux<ConnectionStatus> status() {
        return stateMachine.status();
    }

    @Override
    public Disposable publish(Packet packet, ReplyCallback callback) {
        BrokerSession current = session;
        if (current == null) {
            callback.onReply(Reply.failure(new RpcBridgeException.NotConnectedException(NOT_INITIALIZED_ERROR_MESSAGE)));
            return Disposables.disposed();
        }
        String id;
        String pattern;
        SerializedPacket serialized;
        try {
            id = idGenerator.get();
            pattern = PatternNormalizer.normalize(packet.pattern());
            serialized = serializer.serialize(new Packet(id, pattern, packet.data()));
        } catch (RuntimeException e) {
            callback.onReply(Reply.failure(e));
            return Disposables.disposed();
        }

        SubscriptionLedger.Lease lease = ledger.acquire(pattern + REPLY_CHANNEL_SUFFIX, current);
        RequestTeardown teardown = new RequestTeardown(id, lease, router);
        lease.ready().whenComplete((ignored, ex) -> {
            if (teardown.isDisposed()) {
                return;
            }
            if (ex != null) {
                callback.onReply(Reply.failure(ConnectionErrors.unwrap(ex)));
                return;
            }
            router.register(id, callback);
            if (teardown.isDisposed()) {
                router.remove(id);
                return;
            }
            current.publish(pattern, serialized.payload(), RecordOptions.merge(userProperties, serialized.options()))
                    .whenComplete((sent, publishError) -> {
                        if (publishError != null) {
                            log.warn("[{}] [{}] Failed to publish request", pattern, id, publishError);
                            router.fail(id, ConnectionErrors.unwrap(publishError));
                        }
                    });
        });
        return teardown;
    }

    @Override
    public CompletableFuture<Void> dispatchEvent(Packet packet) {
        BrokerSession current = session;
        if (current == null) {
            return CompletableFuture.failedFuture(
                    new RpcBridgeException.NotConnectedException(NOT_INITIALIZED_ERROR_MESSAGE));
        }
        try {
            String pattern = PatternNormalizer.normalize(packet.pattern());
            SerializedPacket serialized = serializer.serialize(Packet.of(pattern, packet.data()));
            return current.publish(pattern, serialized.payload(),
                    RecordOptions.merge(userProperties, serialized.options()));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public <V> Flux<V> send(Object pattern, Object data, Class<V> responseType) {
        if (pattern == null || data == null) {
            return Flux.error(new InvalidMessageException());
        }
        return Mono.fromFuture(this::connect, true)
                .thenMany(Flux.<V>create(sink -> sink.onDispose(
                        publish(Packet.of(pattern, data), new FluxReplyCallback<>(sink, responseType, objectMapper)))));
    }

    @Override
    public Mono<Void> emit(Object pattern, Object data) {
        if (pattern == null || data == null) {
            return Mono.error(new InvalidMessageException());
        }
        CompletableFuture<Void> dispatched;
        try {
            dispatched = connect().thenCompose(connected -> dispatchEvent(Packet.of(pattern, data)));
        } catch (RuntimeException e) {
            return Mono.error(e);
        }
        return Mono.fromFuture(dispatched, true);
    }

    @Override
    public int pendingRequestSize() {
        return router.size();
    }

    @Override
    public long unmatchedResponseCount() {
        return router.unmatchedCount();
    }
}
