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

import java.util.Map;
import lombok.Getter;

/**
 * The remote side answered a request with an error. The raw {@code err} payload is kept as-is.
 */
@Getter
public class RemoteInvocationException extends RuntimeException {

    private final transient Object error;

    public RemoteInvocationException(Object error) {
        super(describe(error));
        this.error = error;
    }

    private static String describe(Object error) {
        if (error instanceof Map<?, ?> map && map.get("message") != null) {
            return String.valueOf(map.get("message"));
        }
        return String.valueOf(error);
    }
}
