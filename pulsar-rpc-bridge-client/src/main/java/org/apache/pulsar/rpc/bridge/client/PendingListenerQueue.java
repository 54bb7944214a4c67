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
package org.apache.pulsar.rpc.bridge.client;

import java.util.ArrayList;
import java.util.List;
import org.apache.pulsar.rpc.bridge.session.BrokerEvent;
import org.apache.pulsar.rpc.bridge.session.BrokerSession;
import org.apache.pulsar.rpc.bridge.session.SessionEventListener;

/**
 * Listeners registered before a session exists. They are handed to the session, in registration
 * order, right after it is created.
 */
class PendingListenerQueue {
    private final List<PendingListener> listeners = new ArrayList<>();

    synchronized void add(BrokerEvent event, SessionEventListener listener) {
        listeners.add(new PendingListener(event, listener));
    }

    synchronized void drainTo(BrokerSession session) {
        for (PendingListener pending : listeners) {
            session.on(pending.event(), pending.listener());
        }
        listeners.clear();
    }

    synchronized void clear() {
        listeners.clear();
    }

    synchronized int size() {
        return listeners.size();
    }

    private record PendingListener(BrokerEvent event, SessionEventListener listener) {
    }
}
