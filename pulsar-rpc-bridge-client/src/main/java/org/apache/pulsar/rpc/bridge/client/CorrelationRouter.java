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

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.apache.pulsar.rpc.bridge.common.IncomingResponse;
import org.apache.pulsar.rpc.bridge.common.Reply;

/**
 * Maps request ids to the callbacks waiting for their replies.
 *
 * <p>A route stays registered until its owner removes it, but once a terminal reply went through it
 * nothing more is delivered on it. Replies for unknown or finished ids are dropped; they are
 * expected with at-least-once delivery and late duplicates, and are only counted.
 */
@Slf4j
class CorrelationRouter {
    private final Map<String, Route> routes = new ConcurrentHashMap<>();
    private final AtomicLong unmatchedResponses = new AtomicLong();
    private final Consumer<IncomingResponse> unmatchedResponseListener;

    CorrelationRouter(Consumer<IncomingResponse> unmatchedResponseListener) {
        this.unmatchedResponseListener = unmatchedResponseListener;
    }

    void register(String id, ReplyCallback callback) {
        routes.put(id, new Route(callback));
    }

    void remove(String id) {
        routes.remove(id);
    }

    /**
     * @return {@code true} if the response reached a waiting callback
     */
    boolean dispatch(IncomingResponse response) {
        Route route = response.id() == null ? null : routes.get(response.id());
        if (route == null || !route.deliver(toReply(response))) {
            onUnmatched(response);
            return false;
        }
        return true;
    }

    /**
     * Ends the exchange for {@code id} with a local failure, if it is still waiting.
     */
    void fail(String id, Throwable cause) {
        Route route = routes.get(id);
        if (route != null) {
            route.deliver(Reply.failure(cause));
        }
    }

    /**
     * Ends every waiting exchange with {@code cause} and forgets all routes.
     */
    void failAll(Throwable cause) {
        routes.values().forEach(route -> route.deliver(Reply.failure(cause)));
        routes.clear();
    }

    int size() {
        return routes.size();
    }

    long unmatchedCount() {
        return unmatchedResponses.get();
    }

    private void onUnmatched(IncomingResponse response) {
        unmatchedResponses.incrementAndGet();
        log.debug("[{}] No pending request for reply, dropping it", response.id());
        if (unmatchedResponseListener != null) {
            unmatchedResponseListener.accept(response);
        }
    }

    private static Reply toReply(IncomingResponse response) {
        if (response.isTerminal()) {
            return new Reply(response.err(), response.response(), true);
        }
        return new Reply(response.err(), response.response(), false);
    }

    private static final class Route {
        private final ReplyCallback callback;
        private boolean terminated;

        private Route(ReplyCallback callback) {
            this.callback = callback;
        }

        synchronized boolean deliver(Reply reply) {
            if (terminated) {
                return false;
            }
            terminated = reply.isDisposed();
            callback.onReply(reply);
            return true;
        }
    }
}
