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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Frames messages in the {@code text/event-stream} format. Each stream numbers the messages that
 * carry no id of their own, starting at 1.
 */
public class SseStream {
    static final Map<String, String> HEADERS = standardHeaders();
    private static final Pattern LINE_BREAK = Pattern.compile("\r\n|\r|\n");

    private final ObjectMapper objectMapper;
    private long lastEventId;

    public SseStream(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Writes the status line and headers of an event stream to {@code sink}.
     */
    public void pipe(SseSink sink, Map<String, String> additionalHeaders) {
        Map<String, String> headers = new LinkedHashMap<>(HEADERS);
        headers.putAll(additionalHeaders);
        sink.writeHead(200, headers);
    }

    public synchronized String frame(SseMessage message) {
        SseMessage framed = message;
        if (framed.id() == null || framed.id().isEmpty()) {
            framed = framed.withId(Long.toString(++lastEventId));
        }
        StringBuilder out = new StringBuilder();
        if (framed.type() != null && !framed.type().isEmpty()) {
            out.append("event: ").append(framed.type()).append('\n');
        }
        out.append("id: ").append(framed.id()).append('\n');
        if (framed.retry() != null) {
            out.append("retry: ").append(framed.retry()).append('\n');
        }
        appendData(out, framed.data());
        return out.append('\n').toString();
    }

    synchronized long lastEventId() {
        return lastEventId;
    }

    private void appendData(StringBuilder out, Object data) {
        if (data == null) {
            return;
        }
        if (!(data instanceof CharSequence)) {
            out.append("data: ").append(toJson(data)).append('\n');
            return;
        }
        String text = data.toString();
        if (text.isEmpty()) {
            return;
        }
        for (String line : LINE_BREAK.split(text, -1)) {
            out.append("data: ").append(line).append('\n');
        }
    }

    private String toJson(Object data) {
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialize event data", e);
        }
    }

    private static Map<String, String> standardHeaders() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Content-Type", "text/event-stream");
        headers.put("Connection", "keep-alive");
        headers.put("Cache-Control", "private, no-cache, no-store, must-revalidate, max-age=0, no-transform");
        headers.put("Pragma", "no-cache");
        headers.put("Expire", "0");
        headers.put("X-Accel-Buffering", "no");
        return Collections.unmodifiableMap(headers);
    }
}
