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

import java.util.Map;
import reactor.core.Disposable;

/**
 * The response side of an event stream.
 */
public interface SseSink {

    /**
     * Sets the status and headers. Called once, before the first {@link #write(String)}.
     */
    void writeHead(int statusCode, Map<String, String> headers);

    /**
     * Queues {@code chunk} for the client.
     *
     * @return {@code false} if the sink is saturated; the writer should wait for {@link #onDrain(Runnable)}
     */
    boolean write(String chunk);

    /**
     * Runs {@code callback} once, the next time the sink can take data. Only the latest registered
     * callback is kept.
     *
     * @return a handle that withdraws the callback
     */
    Disposable onDrain(Runnable callback);

    /**
     * Finishes the response once everything written so far has been sent. Calling it again has no
     * effect.
     */
    void end();

    boolean isEnded();
}
