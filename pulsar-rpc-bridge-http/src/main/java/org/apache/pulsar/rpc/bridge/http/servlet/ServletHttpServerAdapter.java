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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.RequestDispatcher;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.apache.pulsar.rpc.bridge.http.HttpAdapterException;
import org.apache.pulsar.rpc.bridge.http.HttpServerAdapter;

@Slf4j
public class ServletHttpServerAdapter implements HttpServerAdapter<ServletExchange> {
    private static final String JSON_CONTENT_TYPE = "application/json; charset=utf-8";
    private static final String TEXT_CONTENT_TYPE = "text/html; charset=utf-8";

    private final ObjectMapper objectMapper;

    public ServletHttpServerAdapter() {
        this(new ObjectMapper());
    }

    public ServletHttpServerAdapter(@NonNull ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void reply(ServletExchange exchange, Object body, Integer status) {
        HttpServletResponse response = exchange.response();
        if (status != null) {
            response.setStatus(status);
        }
        try {
            if (body != null) {
                boolean plain = body instanceof CharSequence || body instanceof Number
                        || body instanceof Boolean || body instanceof Character;
                byte[] bytes = plain
                        ? String.valueOf(body).getBytes(StandardCharsets.UTF_8)
                        : objectMapper.writeValueAsBytes(body);
                if (response.getContentType() == null) {
                    response.setContentType(plain ? TEXT_CONTENT_TYPE : JSON_CONTENT_TYPE);
                }
                response.setContentLength(bytes.length);
                response.getOutputStream().write(bytes);
            }
            response.flushBuffer();
        } catch (JsonProcessingException e) {
            throw new HttpAdapterException("Cannot serialize response body", e);
        } catch (IOException e) {
            throw new HttpAdapterException("Failed to write response", e);
        }
    }

    @Override
    public void status(ServletExchange exchange, int statusCode) {
        exchange.response().setStatus(statusCode);
    }

    @Override
    public void setHeader(ServletExchange exchange, String name, String value) {
        exchange.response().setHeader(name, value);
    }

    @Override
    public void redirect(ServletExchange exchange, int statusCode, String url) {
        HttpServletResponse response = exchange.response();
        response.setStatus(statusCode);
        response.setHeader("Location", url);
        try {
            response.flushBuffer();
        } catch (IOException e) {
            throw new HttpAdapterException("Failed to redirect to " + url, e);
        }
    }

    /**
     * Forwards to {@code view} with the model exposed as request attributes: each entry of a map
     * model, or the whole model under {@code model}.
     */
    @Override
    public void render(ServletExchange exchange, String view, Object model) {
        HttpServletRequest request = exchange.request();
        if (model instanceof Map<?, ?> attributes) {
            attributes.forEach((name, value) -> request.setAttribute(String.valueOf(name), value));
        } else if (model != null) {
            request.setAttribute("model", model);
        }
        RequestDispatcher dispatcher = request.getRequestDispatcher(view);
        if (dispatcher == null) {
            throw new HttpAdapterException("No view found at " + view, null);
        }
        try {
            dispatcher.forward(request, exchange.response());
        } catch (ServletException | IOException e) {
            log.warn("[{}] Rendering view {} failed", request.getRequestURI(), view, e);
            throw new HttpAdapterException("Failed to render " + view, e);
        }
    }
}
