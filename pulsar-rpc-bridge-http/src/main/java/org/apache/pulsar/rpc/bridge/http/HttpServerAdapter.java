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

/**
 * The writes a response controller needs from an HTTP server.
 *
 * @param <R> the server's response handle
 */
public interface HttpServerAdapter<R> {

    /**
     * Writes {@code body} as the whole response. A {@code null} body sends an empty response; strings,
     * numbers and booleans are sent as text, anything else as JSON.
     *
     * @param status the status code, or {@code null} to keep the current one
     */
    void reply(R response, Object body, Integer status);

    void status(R response, int statusCode);

    void setHeader(R response, String name, String value);

    void redirect(R response, int statusCode, String url);

    void render(R response, String view, Object model);
}
