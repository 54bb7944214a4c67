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
package org.apache.pulsar.rpc.bridge.common;

/**
 * What a request callback receives. A reply with {@code isDisposed} set is the last one for its
 * request.
 *
 * @param err the remote error payload, or the local {@link Throwable} that failed the request
 * @param response the reply payload, may be {@code null}
 * @param isDisposed whether the exchange is finished
 */
public record Reply(Object err, Object response, boolean isDisposed) {

    public static Reply failure(Throwable cause) {
        return new Reply(cause, null, true);
    }
}
