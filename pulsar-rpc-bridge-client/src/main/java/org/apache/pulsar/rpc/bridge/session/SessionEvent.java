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
package org.apache.pulsar.rpc.bridge.session;

/**
 * One notification from a {@link BrokerSession}. {@code cause} is set for {@link BrokerEvent#ERROR}
 * and may be set for {@link BrokerEvent#CLOSE}; {@code message} is set for {@link BrokerEvent#MESSAGE}.
 */
public record SessionEvent(BrokerEvent event, Throwable cause, InboundMessage message) {

    public static SessionEvent of(BrokerEvent event) {
        return new SessionEvent(event, null, null);
    }

    public static SessionEvent failure(BrokerEvent event, Throwable cause) {
        return new SessionEvent(event, cause, null);
    }

    public static SessionEvent message(InboundMessage message) {
        return new SessionEvent(BrokerEvent.MESSAGE, null, message);
    }
}
