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
import java.util.function.Function;
import lombok.NonNull;
import org.reactivestreams.Publisher;
import reactor.core.publisher.Flux;

/**
 * @param additionalHeaders response headers added to, or replacing, the standard event-stream headers
 * @param interceptor applied to the handler's stream before it is subscribed
 */
public record SseOptions(@NonNull Map<String, String> additionalHeaders,
                         @NonNull Function<Flux<?>, ? extends Publisher<?>> interceptor) {

    public static SseOptions defaults() {
        return new SseOptions(Map.of(), Function.identity());
    }

    public SseOptions withAdditionalHeaders(Map<String, String> headers) {
        return new SseOptions(headers, interceptor);
    }

    public SseOptions withInterceptor(Function<Flux<?>, ? extends Publisher<?>> interceptor) {
        return new SseOptions(additionalHeaders, interceptor);
    }
}
