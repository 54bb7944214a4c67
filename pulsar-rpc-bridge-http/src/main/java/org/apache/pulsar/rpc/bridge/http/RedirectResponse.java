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
 * Where a handler redirects to. Either field may be left {@code null} and supplied by the handler's
 * result instead.
 *
 * @param url the target location
 * @param statusCode the redirect status, {@link HttpStatus#FOUND} when absent everywhere
 */
public record RedirectResponse(String url, Integer statusCode) {

    public static RedirectResponse to(String url) {
        return new RedirectResponse(url, null);
    }
}
