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
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.NonNull;

/**
 * The request and response of one servlet call, as seen by {@link ServletHttpServerAdapter}.
 */
public record ServletExchange(@NonNull HttpServletRequest request, @NonNull HttpServletResponse response) {

    /**
     * Puts the call in asynchronous mode with no timeout, as long-lived event streams need.
     * The servlet must be registered with async support.
     */
    public AsyncContext startAsync() {
        AsyncContext asyncContext = request.startAsync(request, response);
        asyncContext.setTimeout(0);
        return asyncContext;
    }
}
