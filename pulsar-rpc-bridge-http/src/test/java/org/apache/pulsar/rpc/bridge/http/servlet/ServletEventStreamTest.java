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

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertTrue;
import jakarta.servlet.AsyncContext;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.pulsar.rpc.bridge.http.RedirectResponse;
import org.apache.pulsar.rpc.bridge.http.RequestMethod;
import org.apache.pulsar.rpc.bridge.http.RouterResponseController;
import org.awaitility.Awaitility;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;
import org.reactivestreams.Publisher;
import org.testng.annotations.AfterClass;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public class ServletEventStreamTest {
    private static final int LARGE_EVENTS = 500;

    private final RouterResponseController<ServletExchange> controller =
            new RouterResponseController<>(new ServletHttpServerAdapter());
    private final AtomicBoolean endlessCancelled = new AtomicBoolean();

    private Server server;
    private HttpClient http;
    private URI base;

    @BeforeClass(alwaysRun = true)
    public void start() throws Exception {
        server = new Server(0);
        ServletContextHandler context = new ServletContextHandler();
        context.setContextPath("/");
        ServletHolder holder = new ServletHolder(new RoutingServlet());
        holder.setAsyncSupported(true);
        context.addServlet(holder, "/*");
        server.setHandler(context);
        server.start();

        int port = ((ServerConnector) server.getConnectors()[0]).getLocalPort();
        base = URI.create("http://localhost:" + port);
        http = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @AfterClass(alwaysRun = true)
    public void stop() throws Exception {
        if (server != null) {
            server.stop();
        }
    }

    @Test
    public void testEventStream() throws Exception {
        HttpResponse<String> response = get("/events");

        assertEquals(response.statusCode(), 200);
        assertTrue(response.headers().firstValue("Content-Type").orElse("").startsWith("text/event-stream"));
        assertEquals(response.headers().firstValue("X-Accel-Buffering").orElse(""), "no");
        assertEquals(response.body(), "id: 1\ndata: a\n\nid: 2\ndata: b\n\n");
    }

    @Test
    public void testEventStreamError() throws Exception {
        HttpResponse<String> response = get("/events/error");

        assertEquals(response.statusCode(), 200);
        assertEquals(response.body(), "id: 1\ndata: a\n\nevent: error\nid: 2\ndata: boom\n\n");
    }

    @Test
    public void testLargeEventStreamArrivesInOrder() throws Exception {
        HttpResponse<String> response = get("/events/large");

        String[] frames = response.body().split("\n\n");
        assertEquals(frames.length, LARGE_EVENTS);
        for (int i = 0; i < LARGE_EVENTS; i++) {
            assertTrue(frames[i].startsWith("id: " + (i + 1) + "\ndata: " + i + "-"), frames[i].substring(0, 20));
        }
    }

    @Test
    public void testClientDisconnectCancelsStream() throws Exception {
        HttpRequest request = HttpRequest.newBuilder(base.resolve("/events/endless")).GET().build();
        HttpResponse<InputStream> response = http.send(request, HttpResponse.BodyHandlers.ofInputStream());
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(response.body(), StandardCharsets.UTF_8))) {
            assertEquals(reader.readLine(), "id: 1");
            assertEquals(reader.readLine(), "data: 0");
        }

        Awaitility.await().atMost(10, TimeUnit.SECONDS).untilTrue(endlessCancelled);
    }

    @Test
    public void testJsonReplyUsesMethodStatus() throws Exception {
        HttpRequest request = HttpRequest.newBuilder(base.resolve("/json"))
                .POST(HttpRequest.BodyPublishers.noBody())
                .build();
        HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());

        assertEquals(response.statusCode(), 201);
        assertTrue(response.headers().firstValue("Content-Type").orElse("").startsWith("application/json"));
        assertEquals(response.body(), "{\"sum\":3}");

        assertEquals(get("/json").statusCode(), 200);
    }

    @Test
    public void testTextReply() throws Exception {
        HttpResponse<String> response = get("/text");

        assertEquals(response.statusCode(), 200);
        assertEquals(response.body(), "hello");
    }

    @Test
    public void testRedirect() throws Exception {
        HttpResponse<String> response = get("/redirect");

        assertEquals(response.statusCode(), 302);
        assertTrue(response.headers().firstValue("Location").orElse("").endsWith("/json"));
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(base.resolve(path)).GET().build();
        return http.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private class RoutingServlet extends HttpServlet {
        @Override
        protected void service(HttpServletRequest req, HttpServletResponse resp) {
            ServletExchange exchange = new ServletExchange(req, resp);
            switch (req.getRequestURI()) {
                case "/events" -> stream(exchange, Flux.just("a", "b"));
                case "/events/error" -> stream(exchange,
                        Flux.just("a").concatWith(Flux.error(new IllegalStateException("boom"))));
                case "/events/large" -> stream(exchange,
                        Flux.range(0, LARGE_EVENTS).map(i -> i + "-" + "x".repeat(4096)));
                case "/events/endless" -> stream(exchange, Flux.interval(Duration.ofMillis(20))
                        .onBackpressureDrop()
                        .doOnCancel(() -> endlessCancelled.set(true)));
                case "/json" -> controller.apply(Map.of("sum", 3), exchange,
                        controller.getStatusByMethod(RequestMethod.valueOf(req.getMethod()))).join();
                case "/text" -> controller.apply(Mono.just("hello"), exchange, 200).join();
                case "/redirect" -> controller.redirect(Mono.just(Map.of("url", "/json")), exchange,
                        RedirectResponse.to("/fallback")).join();
                default -> resp.setStatus(404);
            }
        }

        private void stream(ServletExchange exchange, Publisher<?> events) {
            AsyncContext async = exchange.startAsync();
            controller.sse(events, ServletSseSink.open(async), new ServletSseRequest(async));
        }
    }
}
