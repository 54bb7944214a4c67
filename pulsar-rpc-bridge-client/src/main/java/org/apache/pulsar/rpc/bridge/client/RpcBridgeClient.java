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

import java.util.concurrent.CompletableFuture;
import org.apache.pulsar.rpc.bridge.common.Packet;
import org.apache.pulsar.rpc.bridge.common.RpcBridgeException;
import org.apache.pulsar.rpc.bridge.session.BrokerEvent;
import org.apache.pulsar.rpc.bridge.session.SessionEventListener;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Request/response and one-way messaging over publish/subscribe channels.
 *
 * <p>A request on pattern {@code p} is published to channel {@code p}; its replies are read from
 * {@code p/reply}, a channel the client subscribes to while at least one request on it is pending.
 * Replies are matched to requests by an id the client assigns.
 */
public interface RpcBridgeClient extends AutoCloseable {

    /**
     * Creates a builder for configuring a new {@link RpcBridgeClient}.
     *
     * @return A new instance of {@link RpcBridgeClientBuilder}.
     */
    static RpcBridgeClientBuilder builder() {
        return new RpcBridgeClientBuilderImpl();
    }

    /**
     * Opens the broker session if none exists.
     *
     * <p>Calling this again without {@link #close()} in between does not open a second session; it
     * returns the future describing the current one. While the session is offline that future is
     * already failed with {@link RpcBridgeException.OfflineException}.
     *
     * @return a future completed on the first CONNECT, or failed if the session closes first
     */
    CompletableFuture<Void> connect();

    /**
     * Ends the session. Pending requests fail with {@link RpcBridgeException.ClosedException}; a later
     * {@link #connect()} starts from scratch.
     */
    @Override
    void close();

    /**
     * Registers a listener for a session event. Before {@link #connect()} the listener is queued and
     * attached once the session is created.
     */
    void on(BrokerEvent event, SessionEventListener listener);

    /**
     * @return the broker client behind the current session
     * @throws RpcBridgeException.NotConnectedException if {@link #connect()} has not been called
     */
    <T> T unwrap(Class<T> type) throws RpcBridgeException.NotConnectedException;

    /**
     * @return connection status changes; a new subscriber first receives the current status
     */
    Flux<ConnectionStatus> status();

    /**
     * Publishes a request and routes its replies to {@code callback}. Failures, local or remote,
     * reach the callback as a disposed reply carrying {@code err}.
     *
     * @return a teardown that stops routing replies and releases the reply channel
     */
    Disposable publish(Packet packet, ReplyCallback callback);

    /**
     * Publishes a one-way event. No reply channel is involved.
     *
     * @return a future completed once the broker accepted the event
     */
    CompletableFuture<Void> dispatchEvent(Packet packet);

    /**
     * Sends a request, connecting first if needed. Each reply emits its response converted to
     * {@code responseType}; the flux completes with the last reply. Cancelling releases the request.
     */
    <V> Flux<V> send(Object pattern, Object data, Class<V> responseType);

    /**
     * Dispatches an event right away, whether or not the returned {@link Mono} is subscribed.
     */
    Mono<Void> emit(Object pattern, Object data);

    int pendingRequestSize();

    /**
     * @return replies received for ids nobody waits for (any more)
     */
    long unmatchedResponseCount();
}
