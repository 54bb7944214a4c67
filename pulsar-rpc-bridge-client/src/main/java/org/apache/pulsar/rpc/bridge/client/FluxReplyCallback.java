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
import org.apache.pulsar.rpc.bridge.common.RemoteInvocationException;
import org.apache.pulsar.rpc.bridge.common.Reply;
import org.apache.pulsar.rpc.bridge.common.SerializationException;
import reactor.core.publisher.FluxSink;

/**
 * Feeds the replies of one request into a {@link FluxSink}: an error reply fails the sink, a
 * disposed reply completes it after emitting its response, if any.
 */
class FluxReplyCallback<V> implements ReplyCallback {
    private final FluxSink<V> sink;
    private final Class<V> responseType;
    private final ObjectMapper objectMapper;

    FluxReplyCallback(FluxSink<V> sink, Class<V> responseType, ObjectMapper objectMapper) {
        this.sink = sink;
        this.responseType = responseType;
        this.objectMapper = objectMapper;
    }

    @Override
    public void onReply(Reply reply) {
        if (reply.err() != null) {
            sink.error(reply.err() instanceof Throwable t ? t : new RemoteInvocationException(reply.err()));
            return;
        }
        if (reply.response() != null) {
            V value;
            try {
                value = convert(reply.response());
            } catch (IllegalArgumentException e) {
                sink.error(new SerializationException("Cannot read reply as " + responseType.getName(), e));
                return;
            }
            sink.next(value);
        }
        if (reply.isDisposed()) {
            sink.complete();
        }
    }

    private V convert(Object response) {
        if (responseType.isInstance(response)) {
            return responseType.cast(response);
        }
        return objectMapper.convertValue(response, responseType);
    }
}
