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

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertSame;
import static org.testng.Assert.assertTrue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.ConnectException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.apache.pulsar.rpc.bridge.common.IncomingResponse;
import org.apache.pulsar.rpc.bridge.common.InvalidMessageException;
import org.apache.pulsar.rpc.bridge.common.Packet;
import org.apache.pulsar.rpc.bridge.common.RemoteInvocationException;
import org.apache.pulsar.rpc.bridge.common.Reply;
import org.apache.pulsar.rpc.bridge.common.RpcBridgeException;
import org.apache.pulsar.rpc.bridge.common.SerializationException;
import org.apache.pulsar.rpc.bridge.serializer.PulsarRecordBuilder;
import org.apache.pulsar.rpc.bridge.session.BrokerEvent;
import org.apache.pulsar.rpc.bridge.session.InMemoryBrokerSession;
import org.awaitility.Awaitility;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

public class RpcBridgeClientImplTest {
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<InMemoryBrokerSession> sessions = new CopyOnWriteArrayList<>();
    private final List<IncomingResponse> unmatched = new CopyOnWriteArrayList<>();
    private Supplier<InMemoryBrokerSession> nextSession;
    private RpcBridgeClient client;

    @BeforeMethod
    public void setUp() {
        sessions.clear();
        unmatched.clear();
        nextSession = InMemoryBrokerSession::new;
        AtomicInteger ids = new AtomicInteger();
        client = RpcBridgeClient.builder()
                .sessionFactory(() -> {
                    InMemoryBrokerSession session = nextSession.get();
                    sessions.add(session);
                    return session;
                })
                .idGenerator(() -> "req-" + ids.incrementAndGet())
                .userProperties(Map.of("tenant", "acme", "trace", "client"))
                .unmatchedResponseListener(unmatched::add)
                .build();
    }

    @AfterMethod(alwaysRun = true)
    public void tearDown() {
        client.close();
    }

    private InMemoryBrokerSession session() {
        return sessions.get(sessions.size() - 1);
    }

    private JsonNode body(InMemoryBrokerSession.Published message) throws Exception {
        return objectMapper.readTree(message.payload());
    }

    @Test
    public void testConnectTwiceReturnsSameFuture() {
        nextSession = () -> new InMemoryBrokerSession().connectOnStart(false);

        CompletableFuture<Void> first = client.connect();
        CompletableFuture<Void> second = client.connect();

        assertSame(first, second);
        assertEquals(sessions.size(), 1);
        assertEquals(session().connectCount(), 1);
        assertFalse(first.isDone());

        session().fire(BrokerEvent.CONNECT);
        assertTrue(first.isDone());
        assertSame(client.connect(), first);
    }

    @Test
    public void testCloseBeforeConnectFailsConnection() {
        IllegalStateException cause = new IllegalStateException("broker gone");
        nextSession = () -> new InMemoryBrokerSession().closeOnStart(cause);

        CompletableFuture<Void> connection = client.connect();

        assertTrue(connection.isCompletedExceptionally());
        try {
            connection.join();
            Assert.fail("connection should have failed");
        } catch (CompletionException e) {
            assertSame(e.getCause(), cause);
        }
    }

    @Test
    public void testCloseWithoutCauseFailsWithClosedException() {
        nextSession = () -> new InMemoryBrokerSession().connectOnStart(false);
        CompletableFuture<Void> connection = client.connect();

        session().fire(BrokerEvent.CLOSE);

        StepVerifier.create(Mono.fromFuture(connection))
                .expectError(RpcBridgeException.ClosedException.class)
                .verify(TIMEOUT);
    }

    @Test
    public void testCloseAfterConnectDoesNotReopenConnection() {
        CompletableFuture<Void> connection = client.connect();

        session().fire(BrokerEvent.CLOSE);

        assertTrue(connection.isDone());
        assertFalse(connection.isCompletedExceptionally());
        StepVerifier.create(client.status().take(1))
                .expectNext(ConnectionStatus.CLOSED)
                .verifyComplete();
    }

    @Test
    public void testSendRoutesReplyToCaller() throws Exception {
        StepVerifier.create(client.send("math.sum", List.of(1, 2), Integer.class))
                .then(() -> session().deliver("math.sum/reply",
                        "{\"id\":\"req-1\",\"response\":3,\"isDisposed\":true}"))
                .expectNext(3)
                .expectComplete()
                .verify(TIMEOUT);

        InMemoryBrokerSession.Published request = session().published().get(0);
        assertEquals(request.channel(), "math.sum");
        JsonNode body = body(request);
        assertEquals(body.get("id").asText(), "req-1");
        assertEquals(body.get("pattern").asText(), "math.sum");
        assertEquals(body.get("data").toString(), "[1,2]");

        assertEquals(session().subscribeCount("math.sum/reply"), 1);
        assertEquals(session().unsubscribeCount("math.sum/reply"), 1);
        assertEquals(client.pendingRequestSize(), 0);
    }

    @Test
    public void testSendStreamsEveryReply() {
        StepVerifier.create(client.send("numbers", "three", Integer.class))
                .then(() -> {
                    session().deliver("numbers/reply", "{\"id\":\"req-1\",\"response\":1}");
                    session().deliver("numbers/reply", "{\"id\":\"req-1\",\"response\":2,\"isDisposed\":false}");
                    session().deliver("numbers/reply", "{\"id\":\"req-1\",\"response\":3,\"isDisposed\":true}");
                    session().deliver("numbers/reply", "{\"id\":\"req-1\",\"response\":4,\"isDisposed\":true}");
                })
                .expectNext(1, 2, 3)
                .expectComplete()
                .verify(TIMEOUT);

        assertEquals(client.unmatchedResponseCount(), 1);
    }

    @Test
    public void testSendConvertsReplyToRequestedType() {
        StepVerifier.create(client.send("users.find", Map.of("id", 7), UserView.class))
                .then(() -> session().deliver("users.find/reply",
                        "{\"id\":\"req-1\",\"response\":{\"id\":7,\"name\":\"ada\"},\"isDisposed\":true}"))
                .expectNextMatches(user -> user.id == 7 && "ada".equals(user.name))
                .expectComplete()
                .verify(TIMEOUT);
    }

    @Test
    public void testErrorReplyFailsTheFlux() {
        StepVerifier.create(client.send("math.div", Map.of("by", 0), Integer.class))
                .then(() -> session().deliver("math.div/reply",
                        "{\"id\":\"req-1\",\"err\":{\"message\":\"division by zero\"}}"))
                .expectErrorSatisfies(e -> {
                    assertTrue(e instanceof RemoteInvocationException);
                    assertEquals(e.getMessage(), "division by zero");
                    assertTrue(((RemoteInvocationException) e).getError() instanceof Map);
                })
                .verify(TIMEOUT);

        assertEquals(session().unsubscribeCount("math.div/reply"), 1);
    }

    @Test
    public void testRepliesForOtherIdsAreIgnored() {
        StepVerifier.create(client.send("math.sum", 1, Integer.class))
                .then(() -> {
                    session().deliver("math.sum/reply", "{\"id\":\"someone-else\",\"response\":9,\"isDisposed\":true}");
                    session().deliver("math.sum/reply", "{\"id\":\"req-1\",\"response\":1,\"isDisposed\":true}");
                })
                .expectNext(1)
                .expectComplete()
                .verify(TIMEOUT);

        assertEquals(client.unmatchedResponseCount(), 1);
        assertEquals(unmatched.size(), 1);
        assertEquals(unmatched.get(0).id(), "someone-else");
    }

    @Test
    public void testCancelReleasesRequest() {
        Disposable subscription = client.send("slow.job", 1, Integer.class).subscribe();
        assertEquals(client.pendingRequestSize(), 1);

        subscription.dispose();

        assertEquals(client.pendingRequestSize(), 0);
        assertEquals(session().unsubscribeCount("slow.job/reply"), 1);
        session().deliver("slow.job/reply", "{\"id\":\"req-1\",\"response\":1,\"isDisposed\":true}");
        assertEquals(client.unmatchedResponseCount(), 1);
    }

    @Test
    public void testConcurrentRequestsShareOneSubscription() {
        List<Integer> first = new CopyOnWriteArrayList<>();
        List<Integer> second = new CopyOnWriteArrayList<>();
        client.send("math.sum", 1, Integer.class).subscribe(first::add);
        client.send("math.sum", 2, Integer.class).subscribe(second::add);

        assertEquals(session().subscribeCount("math.sum/reply"), 1);
        assertEquals(client.pendingRequestSize(), 2);

        session().deliver("math.sum/reply", "{\"id\":\"req-2\",\"response\":20,\"isDisposed\":true}");
        assertEquals(session().unsubscribeCount("math.sum/reply"), 0);
        session().deliver("math.sum/reply", "{\"id\":\"req-1\",\"response\":10,\"isDisposed\":true}");

        assertEquals(first, List.of(10));
        assertEquals(second, List.of(20));
        assertEquals(session().unsubscribeCount("math.sum/reply"), 1);
        assertEquals(client.pendingRequestSize(), 0);
    }

    @Test
    public void testTeardownBeforeSubscribeCompletesSkipsPublish() {
        CompletableFuture<Void> subscribed = new CompletableFuture<>();
        nextSession = () -> new InMemoryBrokerSession().onSubscribe(channel -> subscribed);

        Disposable subscription = client.send("slow.job", 1, Integer.class).subscribe();
        subscription.dispose();
        subscribed.complete(null);

        assertTrue(session().published().isEmpty());
        assertEquals(session().unsubscribeCount("slow.job/reply"), 1);
        assertEquals(client.pendingRequestSize(), 0);
    }

    @Test
    public void testTeardownIsIdempotent() {
        client.connect().join();
        Disposable teardown = client.publish(Packet.of("jobs", 1), reply -> { });

        teardown.dispose();
        teardown.dispose();

        assertTrue(teardown.isDisposed());
        assertEquals(session().unsubscribeCount("jobs/reply"), 1);
    }

    @Test
    public void testSerializationFailureReachesCallback() {
        client.close();
        client = RpcBridgeClient.builder()
                .sessionFactory(() -> {
                    InMemoryBrokerSession session = new InMemoryBrokerSession();
                    sessions.add(session);
                    return session;
                })
                .serializer(packet -> {
                    throw new SerializationException("cannot encode");
                })
                .build();
        client.connect().join();
        List<Reply> replies = new CopyOnWriteArrayList<>();

        Disposable teardown = client.publish(Packet.of("jobs", 1), replies::add);

        assertEquals(replies.size(), 1);
        assertTrue(replies.get(0).err() instanceof SerializationException);
        assertTrue(replies.get(0).isDisposed());
        assertTrue(teardown.isDisposed());
        assertEquals(session().subscribeCount("jobs/reply"), 0);
    }

    @Test
    public void testPublishFailureReachesCallback() {
        IllegalStateException failure = new IllegalStateException("send rejected");
        nextSession = () -> new InMemoryBrokerSession().onPublish(message -> CompletableFuture.failedFuture(failure));

        StepVerifier.create(client.send("jobs", 1, Integer.class))
                .expectErrorMatches(e -> e == failure)
                .verify(TIMEOUT);

        assertEquals(client.pendingRequestSize(), 0);
    }

    @Test
    public void testSubscribeFailureReachesCallbackWithoutPublishing() {
        IllegalStateException failure = new IllegalStateException("subscribe rejected");
        nextSession = () -> new InMemoryBrokerSession().onSubscribe(channel -> CompletableFuture.failedFuture(failure));

        StepVerifier.create(client.send("jobs", 1, Integer.class))
                .expectErrorMatches(e -> e == failure)
                .verify(TIMEOUT);

        assertTrue(session().published().isEmpty());
    }

    @Test
    public void testPublishBeforeConnectFails() {
        List<Reply> replies = new CopyOnWriteArrayList<>();

        client.publish(Packet.of("jobs", 1), replies::add);

        assertEquals(replies.size(), 1);
        assertTrue(replies.get(0).err() instanceof RpcBridgeException.NotConnectedException);
    }

    @Test
    public void testDispatchEventPublishesWithoutReplyChannel() throws Exception {
        client.connect().join();

        client.dispatchEvent(Packet.of("user.created", Map.of("name", "ada"))).join();

        InMemoryBrokerSession.Published event = session().published().get(0);
        assertEquals(event.channel(), "user.created");
        JsonNode body = body(event);
        assertFalse(body.has("id"));
        assertEquals(body.get("data").get("name").asText(), "ada");
        assertEquals(session().subscribeCount("user.created/reply"), 0);
        assertEquals(client.pendingRequestSize(), 0);
    }

    @Test
    public void testDispatchEventReportsBrokerError() {
        IllegalStateException failure = new IllegalStateException("send rejected");
        nextSession = () -> new InMemoryBrokerSession().onPublish(message -> CompletableFuture.failedFuture(failure));
        client.connect().join();

        CompletableFuture<Void> dispatched = client.dispatchEvent(Packet.of("user.created", 1));

        assertTrue(dispatched.isCompletedExceptionally());
    }

    @Test
    public void testEmitDispatchesWithoutSubscriber() {
        client.emit("user.created", Map.of("name", "ada"));

        Awaitility.await().atMost(5, TimeUnit.SECONDS).until(() -> !sessions.isEmpty()
                && session().published().size() == 1);
        assertEquals(session().published().get(0).channel(), "user.created");
    }

    @Test
    public void testEmitReportsOutcome() {
        StepVerifier.create(client.emit("user.created", 1))
                .expectComplete()
                .verify(TIMEOUT);

        IllegalStateException failure = new IllegalStateException("send rejected");
        session().onPublish(message -> CompletableFuture.failedFuture(failure));
        StepVerifier.create(client.emit("user.created", 2))
                .expectErrorMatches(e -> e == failure)
                .verify(TIMEOUT);
    }

    @Test
    public void testNullPatternOrDataIsRejected() {
        StepVerifier.create(client.send(null, 1, Integer.class))
                .expectError(InvalidMessageException.class)
                .verify(TIMEOUT);
        StepVerifier.create(client.send("jobs", null, Integer.class))
                .expectError(InvalidMessageException.class)
                .verify(TIMEOUT);
        StepVerifier.create(client.emit(null, 1))
                .expectError(InvalidMessageException.class)
                .verify(TIMEOUT);
        StepVerifier.create(client.emit("jobs", null))
                .expectError(InvalidMessageException.class)
                .verify(TIMEOUT);
        assertTrue(sessions.isEmpty());
    }

    @Test
    public void testStructuredPatternIsNormalized() throws Exception {
        client.send(Map.of("role", "math", "cmd", "sum"), 1, Integer.class).subscribe();

        String channel = "{\"cmd\":\"sum\",\"role\":\"math\"}";
        assertEquals(session().published().get(0).channel(), channel);
        assertEquals(session().subscribeCount(channel + "/reply"), 1);
        assertEquals(body(session().published().get(0)).get("pattern").asText(), channel);
    }

    @Test
    public void testRecordOptionsAreMergedWithUserProperties() throws Exception {
        client.send("jobs", new PulsarRecordBuilder<>(Map.of("n", 1))
                        .setKey("job-key")
                        .addProperty("trace", "request")
                        .build(), Integer.class)
                .subscribe();

        InMemoryBrokerSession.Published request = session().published().get(0);
        assertEquals(request.options().key(), "job-key");
        assertEquals(request.options().properties(), Map.of("tenant", "acme", "trace", "request"));
        assertEquals(body(request).get("data").get("n").asInt(), 1);
        assertFalse(body(request).get("data").has("options"));
    }

    @Test
    public void testUserPropertiesAreAttachedToEvents() {
        client.connect().join();

        client.dispatchEvent(Packet.of("audit", "x")).join();

        assertEquals(session().published().get(0).options().properties(),
                Map.of("tenant", "acme", "trace", "client"));
        assertNull(session().published().get(0).options().key());
    }

    @Test
    public void testListenersRegisteredBeforeConnectAreAttachedInOrder() {
        List<String> calls = new CopyOnWriteArrayList<>();
        client.on(BrokerEvent.CONNECT, event -> calls.add("first"));
        client.on(BrokerEvent.CONNECT, event -> calls.add("second"));

        client.connect().join();
        client.on(BrokerEvent.CONNECT, event -> calls.add("third"));
        session().fire(BrokerEvent.CONNECT);

        assertEquals(calls, List.of("first", "second", "first", "second", "third"));
    }

    @Test
    public void testUnwrapRequiresConnect() throws Exception {
        try {
            client.unwrap(InMemoryBrokerSession.class);
            Assert.fail("unwrap should fail before connect");
        } catch (RpcBridgeException.NotConnectedException e) {
            assertEquals(e.getMessage(), "Not initialized. Please call the \"connect\" method first.");
        }

        client.connect();

        assertSame(client.unwrap(InMemoryBrokerSession.class), session());
    }

    @Test
    public void testOfflineThenReconnect() {
        client.connect().join();
        InMemoryBrokerSession session = session();

        session.fire(BrokerEvent.OFFLINE);
        CompletableFuture<Void> offline = client.connect();
        assertTrue(offline.isCompletedExceptionally());
        StepVerifier.create(Mono.fromFuture(offline))
                .expectError(RpcBridgeException.OfflineException.class)
                .verify(TIMEOUT);

        session.fire(BrokerEvent.RECONNECT);
        StepVerifier.create(client.status().take(1))
                .expectNext(ConnectionStatus.RECONNECTING)
                .verifyComplete();

        session.fire(BrokerEvent.CONNECT);
        assertFalse(client.connect().isCompletedExceptionally());
        assertEquals(session.listenerCount(BrokerEvent.MESSAGE), 1);
        assertEquals(sessions.size(), 1);

        List<Integer> replies = new CopyOnWriteArrayList<>();
        client.send("math.sum", 1, Integer.class).subscribe(replies::add);
        session.deliver("math.sum/reply", "{\"id\":\"req-1\",\"response\":1,\"isDisposed\":true}");
        assertEquals(replies, List.of(1));
    }

    @Test
    public void testConnectionRefusedErrorDoesNotChangeStatus() {
        client.connect().join();

        session().fire(BrokerEvent.ERROR, new ConnectException("Connection refused"));
        session().fire(BrokerEvent.ERROR, new IllegalStateException("unexpected"));

        StepVerifier.create(client.status().take(1))
                .expectNext(ConnectionStatus.CONNECTED)
                .verifyComplete();
    }

    @Test
    public void testCloseFailsOutstandingRequestsAndAllowsReconnect() {
        StepVerifier.create(client.send("slow.job", 1, Integer.class))
                .then(client::close)
                .expectError(RpcBridgeException.ClosedException.class)
                .verify(TIMEOUT);

        InMemoryBrokerSession closed = session();
        assertEquals(closed.endCount(), 1);
        assertEquals(client.pendingRequestSize(), 0);
        StepVerifier.create(client.status().take(1))
                .expectNext(ConnectionStatus.CLOSED)
                .verifyComplete();

        client.connect().join();
        assertEquals(sessions.size(), 2);
        assertEquals(session().listenerCount(BrokerEvent.MESSAGE), 1);

        closed.fire(BrokerEvent.OFFLINE);
        assertFalse(client.connect().isCompletedExceptionally());
    }

    @Test
    public void testCloseWithoutSessionIsNoop() {
        client.close();
        client.close();

        assertTrue(sessions.isEmpty());
    }

    public static class UserView {
        public int id;
        public String name;
    }
}
