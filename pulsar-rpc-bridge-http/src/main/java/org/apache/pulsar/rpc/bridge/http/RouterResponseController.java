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
package org.apache.pulsar.rpc.bridge.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import lombok.NonNull;
import org.apache.pulsar.rpc.bridge.http.sse.SseOptions;
import org.apache.pulsar.rpc.bridge.http.sse.SseRequest;
import org.apache.pulsar.rpc.bridge.http.sse.SseSink;
import org.apache.pulsar.rpc.bridge.http.sse.SseStream;
import org.apache.pulsar.rpc.bridge.http.sse.SseSubscriber;
import org.apache.pulsar.rpc.bridge.http.sse.StreamInputException;
import org.reactivestreams.Publisher;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

/**
 * Turns what a route handler returned into an HTTP response: a buffered body, a rendered view, a
 * redirect, or a stream of server-sent events.
 *
 * @param <R> the server's response handle
 */
public class RouterResponseController<R> {
    private final HttpServerAdapter<R> adapter;
    private final ObjectMapper objectMapper;

    public RouterResponseController(@NonNull HttpServerAdapter<R> adapter) {
        this(adapter, new ObjectMapper());
    }

    public RouterResponseController(@NonNull HttpServerAdapter<R> adapter, @NonNull ObjectMapper objectMapper) {
        this.adapter = adapter;
        this.objectMapper = objectMapper;
    }

    public CompletableFuture<Void> apply(Object result, R response, Integer statusCode) {
        return transformToResult(result).thenAccept(value -> adapter.reply(response, value, statusCode));
    }

    /**
     * Resolves a handler result: a {@link CompletionStage} to its value, a {@link Publisher} to the
     * last value it emits ({@code null} if it emits none), anything else to itself.
     */
    public CompletableFuture<Object> transformToResult(Object result) {
        if (result instanceof CompletionStage<?> stage) {
            return stage.<Object>thenApply(value -> value).toCompletableFuture();
        }
        if (result instanceof Publisher<?> publisher) {
            return Flux.<Object>from(publisher).takeLast(1).singleOrEmpty().toFuture();
        }
        return CompletableFuture.completedFuture(result);
    }

    public int getStatusByMethod(RequestMethod requestMethod) {
        return requestMethod == RequestMethod.POST ? HttpStatus.CREATED : HttpStatus.OK;
    }

    public CompletableFuture<Void> render(Object result, R response, String template) {
        return transformToResult(result).thenAccept(value -> adapter.render(response, template, value));
    }

    public void setHeaders(R response, List<CustomHeader> headers) {
        headers.forEach(header -> adapter.setHeader(response, header.name(), header.value()));
    }

    public void setStatus(R response, int statusCode) {
        adapter.status(response, statusCode);
    }

    /**
     * Redirects using the status code and URL of the resolved result where it carries them, falling
     * back to {@code redirectResponse}.
     */
    public CompletableFuture<Void> redirect(Object result, R response, RedirectResponse redirectResponse) {
        return transformToResult(result).thenAccept(value -> {
            RedirectResponse resolved = asRedirect(value);
            Integer statusCode = resolved.statusCode() != null ? resolved.statusCode() : redirectResponse.statusCode();
            String url = resolved.url() != null ? resolved.url() : redirectResponse.url();
            adapter.redirect(response, statusCode != null ? statusCode : HttpStatus.FOUND, url);
        });
    }

    public Disposable sse(Object result, SseSink sink, SseRequest request) {
        return sse(result, sink, request, SseOptions.defaults());
    }

    /**
     * Streams {@code result} as server-sent events until it terminates or {@code request} closes.
     * Values the source pushes while the sink is saturated are buffered and written in order once it
     * drains.
     *
     * @throws StreamInputException if {@code result} is not a {@link Publisher}; nothing is written then
     */
    public Disposable sse(Object result, SseSink sink, SseRequest request, SseOptions options) {
        if (!(result instanceof Publisher<?> publisher)) {
            throw new StreamInputException();
        }
        Publisher<?> source = options.interceptor().apply(Flux.from(publisher));
        SseStream stream = new SseStream(objectMapper);
        stream.pipe(sink, options.additionalHeaders());
        SseSubscriber subscriber = new SseSubscriber(stream, sink);
        subscriber.closeWith(request);
        // hot sources ignore demand; values queue here while the sink waits for drain
        Flux.from(source).onBackpressureBuffer().subscribe(subscriber);
        return subscriber;
    }

    private static RedirectResponse asRedirect(Object value) {
        if (value instanceof RedirectResponse redirect) {
            return redirect;
        }
        if (value instanceof Map<?, ?> map) {
            Object url = map.get("url");
            Object statusCode = map.get("statusCode");
            return new RedirectResponse(url == null ? null : String.valueOf(url),
                    statusCode instanceof Number number ? Integer.valueOf(number.intValue()) : null);
        }
        return new RedirectResponse(null, null);
    }
}
