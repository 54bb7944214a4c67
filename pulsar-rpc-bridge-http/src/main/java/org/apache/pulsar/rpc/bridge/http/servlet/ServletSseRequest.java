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
package org.apache.pulsar.rpc.bridge.http.servlet;

import jakarta.servlet.AsyncContext;
import jakarta.servlet.AsyncEvent;
import jakarta.servlet.AsyncListener;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.pulsar.rpc.bridge.http.sse.SseRequest;
import reactor.core.Disposable;
import reactor.core.Disposables;

/**
 * {@link SseRequest} over an async servlet call: completion, error and timeout all count as close.
 */
public class ServletSseRequest implements SseRequest, AsyncListener {
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean();

    public ServletSseRequest(AsyncContext asyncContext) {
        asyncContext.addListener(this);
    }

    @Override
    public Disposable onClose(Runnable callback) {
        if (closed.get()) {
            callback.run();
            return Disposables.disposed();
        }
        callbacks.add(callback);
        if (closed.get() && callbacks.remove(callback)) {
            callback.run();
        }
        return () -> callbacks.remove(callback);
    }

    @Override
    public void onComplete(AsyncEvent event) {
        close();
    }

    @Override
    public void onTimeout(AsyncEvent event) {
        close();
    }

    @Override
    public void onError(AsyncEvent event) {
        close();
    }

    @Override
    public void onStartAsync(AsyncEvent event) {
        // the listener stays attached for the whole call
    }

    private void close() {
        if (closed.compareAndSet(false, true)) {
            for (Runnable callback : callbacks) {
                if (callbacks.remove(callback)) {
                    callback.run();
                }
            }
        }
    }
}
