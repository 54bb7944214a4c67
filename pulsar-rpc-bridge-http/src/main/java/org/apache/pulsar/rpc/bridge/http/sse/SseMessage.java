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

/**
 * One server-sent event. Emit instances of this type to control the event fields; any other value
 * emitted by the stream becomes the {@code data} of an otherwise empty message.
 *
 * @param data the payload; strings are sent line by line, other values as JSON
 * @param type the {@code event:} field
 * @param id the {@code id:} field; assigned from the stream counter when {@code null}
 * @param retry the {@code retry:} field in milliseconds
 */
public record SseMessage(Object data, String type, String id, Long retry) {

    public static SseMessage of(Object data) {
        return new SseMessage(data, null, null, null);
    }

    static SseMessage error(String message) {
        return new SseMessage(message, "error", null, null);
    }

    SseMessage withId(String id) {
        return new SseMessage(data, type, id, retry);
    }
}
