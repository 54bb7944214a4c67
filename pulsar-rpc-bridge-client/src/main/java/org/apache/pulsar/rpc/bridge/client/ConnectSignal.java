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
import org.apache.pulsar.rpc.bridge.common.RpcBridgeException;
import org.apache.pulsar.rpc.bridge.session.BrokerEvent;
import org.apache.pulsar.rpc.bridge.session.BrokerSession;
import org.apache.pulsar.rpc.bridge.session.SessionEvent;
import reactor.core.publisher.Mono;

/**
 * The outcome of the first connection attempt of a session: whichever of CONNECT and CLOSE arrives
 * first settles it, and the listener for the other one is removed.
 */
final class ConnectSignal {

    private ConnectSignal() {
    }

    /**
     * Must be called before {@link BrokerSession#connect()}.
     */
    static CompletableFuture<Void> first(BrokerSession session) {
        Mono<Void> connected = Mono.create(sink -> sink.onDispose(
                session.on(BrokerEvent.CONNECT, event -> sink.success())));
        Mono<Void> closed = Mono.create(sink -> sink.onDispose(
                session.on(BrokerEvent.CLOSE, event -> sink.error(closeError(event)))));
        return Mono.firstWithSignal(connected, closed).toFuture();
    }

    private static Throwable closeError(SessionEvent event) {
        if (event.cause() != null) {
            return event.cause();
        }
        return new RpcBridgeException.ClosedException("The connection closed before it was established");
    }
}
