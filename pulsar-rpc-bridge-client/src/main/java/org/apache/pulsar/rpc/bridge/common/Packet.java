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
 * A logical message handed to the transport. {@code id} is assigned by the transport for
 * request/response exchanges and stays {@code null} for one-way events.
 *
 * @param id correlation id, never chosen by the caller
 * @param pattern the route name (a string, or a structured pattern normalized to a string)
 * @param data the payload, optionally wrapped in a {@link org.apache.pulsar.rpc.bridge.serializer.PulsarRecord}
 */
public record Packet(String id, Object pattern, Object data) {

    public static Packet of(Object pattern, Object data) {
        return new Packet(null, pattern, data);
    }

    public Packet withId(String id) {
        return new Packet(id, pattern, data);
    }
}
