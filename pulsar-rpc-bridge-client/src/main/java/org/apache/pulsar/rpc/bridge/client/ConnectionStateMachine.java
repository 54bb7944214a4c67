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

import static org.apache.pulsar.rpc.bridge.common.Constants.OFFLINE_ERROR_MESSAGE;
import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;
import org.apache.pulsar.rpc.bridge.common.RpcBridgeException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Tracks the session lifecycle and owns the future that {@link RpcBridgeClient#connect()} hands
 * out.
 *
 * <pre>
 * UNINITIALIZED -> CONNECTING -> CONNECTED <-> RECONNECTING
 *                                    |  OFFLINE (until the next CONNECT)
 *                                    |  DISCONNECTED
 *                                    -> CLOSED
 * </pre>
 *
 * <p>Status changes are broadcast through a latest-value sink, so every subscriber, early or late,
 * sees the current status first.
 */
@Slf4j
class ConnectionStateMachine {
    private final Sinks.Many<ConnectionStatus> statusSink = Sinks.many().replay().latest();

    private SessionState state = SessionState.UNINITIALIZED;
    private boolean reconnecting;
    private boolean initialConnection;
    private CompletableFuture<Void> connection;

    synchronized void connecting(CompletableFuture<Void> firstSignal) {
        state = SessionState.CONNECTING;
        connection = firstSignal;
    }

    /**
     * @return {@code true} for the first CONNECT since the machine was created or reset
     */
    synchronized boolean connected() {
        reconnecting = false;
        state = SessionState.CONNECTED;
        if (connection == null || connection.isCompletedExceptionally()) {
            connection = CompletableFuture.completedFuture(null);
        }
        // a pending first signal is completed by its own CONNECT listener and keeps its identity
        emit(ConnectionStatus.CONNECTED);
        if (!initialConnection) {
            initialConnection = true;
            return true;
        }
        return false;
    }

    synchronized void reconnecting() {
        reconnecting = true;
        state = SessionState.RECONNECTING;
        emit(ConnectionStatus.RECONNECTING);
    }

    synchronized void offline() {
        state = SessionState.OFFLINE;
        connection = CompletableFuture.failedFuture(new RpcBridgeException.OfflineException(OFFLINE_ERROR_MESSAGE));
    }

    synchronized void disconnected() {
        state = SessionState.DISCONNECTED;
        emit(ConnectionStatus.DISCONNECTED);
    }

    synchronized void closed() {
        state = SessionState.CLOSED;
        emit(ConnectionStatus.CLOSED);
    }

    /**
     * Forgets the current session so that the next connect starts from scratch.
     */
    synchronized void reset() {
        connection = null;
        reconnecting = false;
        initialConnection = false;
    }

    synchronized CompletableFuture<Void> connection() {
        return connection;
    }

    synchronized SessionState state() {
        return state;
    }

    synchronized boolean isReconnecting() {
        return reconnecting;
    }

    Flux<ConnectionStatus> status() {
        return statusSink.asFlux();
    }

    private void emit(ConnectionStatus status) {
        Sinks.EmitResult result = statusSink.tryEmitNext(status);
        if (result.isFailure()) {
            log.warn("Failed to publish connection status {}: {}", status, result);
        }
    }
}
