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
package org.apache.pulsar.rpc.bridge.session;

import java.util.concurrent.CompletableFuture;
import org.apache.pulsar.rpc.bridge.common.RecordOptions;
import reactor.core.Disposable;

/**
 * One physical connection to a publish/subscribe broker.
 *
 * <p>A session is created idle: listeners are registered first and {@link #connect()} starts the
 * connection afterwards, so no lifecycle event can be missed. Channel names are logical; mapping
 * them to broker topics is up to the implementation.
 */
public interface BrokerSession {

    /**
     * Starts connecting. Completion is reported through {@link BrokerEvent#CONNECT} or
     * {@link BrokerEvent#CLOSE}.
     */
    void connect();

    /**
     * Publishes {@code payload} to {@code channel}.
     *
     * @return a future completed once the broker accepted the message
     */
    CompletableFuture<Void> publish(String channel, byte[] payload, RecordOptions options);

    /**
     * Subscribes to {@code channel}; every message read from it is emitted as {@link BrokerEvent#MESSAGE}.
     *
     * @return a future completed once the broker acknowledged the subscription
     */
    CompletableFuture<Void> subscribe(String channel);

    CompletableFuture<Void> unsubscribe(String channel);

    Disposable on(BrokerEvent event, SessionEventListener listener);

    /**
     * Tears the connection down. {@link BrokerEvent#CLOSE} is emitted once the session is closed.
     */
    void end();

    /**
     * @return the broker client object backing this session
     */
    Object nativeHandle();
}
