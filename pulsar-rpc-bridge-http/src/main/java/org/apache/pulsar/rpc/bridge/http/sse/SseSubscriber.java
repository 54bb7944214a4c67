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
package org.apache.pulsar.rpc.bridge.http.sse;

import lombok.extern.slf4j.Slf4j;
import org.reactivestreams.Subscription;
import reactor.core.Disposable;
import reactor.core.publisher.BaseSubscriber;
import reactor.core.publisher.SignalType;

/**
 * Writes a stream into an {@link SseSink} one event at a time. The next event is requested only
 * once the sink took the previous one, so a slow client holds at most one drain callback.
 */
@Slf4j
public class SseSubscriber extends BaseSubscriber<Object> {
    private final SseStream stream;
    private final SseSink sink;
    private final Runnable requestNext = () -> request(1);

    private volatile Disposable pendingDrain;
    private volatile Disposable closeRegistration;

    public SseSubscriber(SseStream stream, SseSink sink) {
        this.stream = stream;
        this.sink = sink;
    }

    /**
     * Cancels the stream when {@code request} closes.
     */
    public void closeWith(SseRequest request) {
        closeRegistration = request.onClose(this::dispose);
    }

    @Override
    protected void hookOnSubscribe(Subscription subscription) {
        subscription.request(1);
    }

    @Override
    protected void hookOnNext(Object value) {
        SseMessage message = value instanceof SseMessage sseMessage ? sseMessage : SseMessage.of(value);
        if (sink.write(stream.frame(message))) {
            request(1);
        } else {
            pendingDrain = sink.onDrain(requestNext);
        }
    }

    @Override
    protected void hookOnComplete() {
        sink.end();
    }

    @Override
    protected void hookOnError(Throwable throwable) {
        log.warn("Event stream failed", throwable);
        String message = throwable.getMessage() != null ? throwable.getMessage() : throwable.toString();
        sink.write(stream.frame(SseMessage.error(message)));
        sink.end();
    }

    @Override
    protected void hookOnCancel() {
        log.debug("Event stream cancelled after {} events", stream.lastEventId());
        sink.end();
    }

    @Override
    protected void hookFinally(SignalType type) {
        Disposable drain = pendingDrain;
        if (drain != null) {
            drain.dispose();
        }
        Disposable close = closeRegistration;
        if (close != null) {
            close.dispose();
        }
    }
}
