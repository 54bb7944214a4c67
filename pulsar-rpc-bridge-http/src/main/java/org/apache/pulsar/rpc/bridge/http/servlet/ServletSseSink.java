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
import jakarta.servlet.ServletOutputStream;
import jakarta.servlet.WriteListener;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.apache.pulsar.rpc.bridge.http.HttpAdapterException;
import org.apache.pulsar.rpc.bridge.http.sse.SseSink;
import reactor.core.Disposable;

/**
 * {@link SseSink} over a non-blocking servlet output stream. The sink reports saturation whenever
 * {@link ServletOutputStream#isReady()} does, holds back what it could not write yet, and signals
 * drain from {@link WriteListener#onWritePossible()}.
 */
@Slf4j
public class ServletSseSink implements SseSink, WriteListener {
    private final AsyncContext asyncContext;
    private final HttpServletResponse response;
    private final ServletOutputStream out;
    private final Deque<byte[]> pending = new ArrayDeque<>();
    private final AtomicReference<Runnable> drainCallback = new AtomicReference<>();

    private boolean endRequested;
    private boolean ended;

    private ServletSseSink(AsyncContext asyncContext) throws IOException {
        this.asyncContext = asyncContext;
        this.response = (HttpServletResponse) asyncContext.getResponse();
        this.out = response.getOutputStream();
    }

    /**
     * Opens a sink on the response of {@code asyncContext} and switches its output to non-blocking mode.
     */
    public static ServletSseSink open(AsyncContext asyncContext) {
        try {
            ServletSseSink sink = new ServletSseSink(asyncContext);
            sink.out.setWriteListener(sink);
            return sink;
        } catch (IOException e) {
            throw new HttpAdapterException("Cannot open event stream", e);
        }
    }

    @Override
    public synchronized void writeHead(int statusCode, Map<String, String> headers) {
        response.setStatus(statusCode);
        headers.forEach(response::setHeader);
    }

    @Override
    public synchronized boolean write(String chunk) {
        if (ended || endRequested) {
            return false;
        }
        byte[] bytes = chunk.getBytes(StandardCharsets.UTF_8);
        if (!pending.isEmpty() || !out.isReady()) {
            pending.add(bytes);
            return false;
        }
        writeNow(bytes);
        return !ended && out.isReady();
    }

    @Override
    public Disposable onDrain(Runnable callback) {
        drainCallback.set(callback);
        if (isWritable() && drainCallback.compareAndSet(callback, null)) {
            callback.run();
        }
        return () -> drainCallback.compareAndSet(callback, null);
    }

    @Override
    public synchronized void end() {
        if (ended || endRequested) {
            return;
        }
        endRequested = true;
        if (pending.isEmpty() && out.isReady()) {
            complete();
        }
    }

    @Override
    public synchronized boolean isEnded() {
        return ended || endRequested;
    }

    @Override
    public void onWritePossible() {
        Runnable callback;
        synchronized (this) {
            if (ended) {
                return;
            }
            while (!pending.isEmpty() && out.isReady() && !ended) {
                writeNow(pending.poll());
            }
            if (ended || !pending.isEmpty() || !out.isReady()) {
                return;
            }
            if (endRequested) {
                complete();
                return;
            }
            callback = drainCallback.getAndSet(null);
        }
        if (callback != null) {
            callback.run();
        }
    }

    @Override
    public synchronized void onError(Throwable t) {
        log.warn("Event stream write failed", t);
        pending.clear();
        complete();
    }

    private synchronized boolean isWritable() {
        return !ended && pending.isEmpty() && out.isReady();
    }

    private void writeNow(byte[] bytes) {
        try {
            out.write(bytes);
            if (out.isReady()) {
                out.flush();
            }
        } catch (IOException e) {
            onError(e);
        }
    }

    private void complete() {
        if (ended) {
            return;
        }
        ended = true;
        drainCallback.set(null);
        try {
            asyncContext.complete();
        } catch (IllegalStateException e) {
            log.debug("Async context already completed", e);
        }
    }
}
