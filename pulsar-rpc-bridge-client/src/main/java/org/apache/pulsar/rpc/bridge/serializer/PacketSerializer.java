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
package org.apache.pulsar.rpc.bridge.serializer;

import org.apache.pulsar.rpc.bridge.common.Packet;

/**
 * Turns an outgoing request or event into wire bytes plus the transport options that travel beside
 * them.
 */
@FunctionalInterface
public interface PacketSerializer {

    /**
     * @throws org.apache.pulsar.rpc.bridge.common.SerializationException if the packet cannot be encoded
     */
    SerializedPacket serialize(Packet packet);
}
