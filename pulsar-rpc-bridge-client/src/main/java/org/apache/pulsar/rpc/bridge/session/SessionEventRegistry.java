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

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;

/**
 * Listener registry keyed by {@link BrokerEvent}. Listeners run in registration order on the thread
 * that emits the event; a failing listener does not keep the others from running.
 */
@Slf4j
public class SessionEventRegistry {
    private final Map<BrokerEvent, List<SessionEventListener>> listeners = new EnumMap<>(BrokerEvent.class);

    public SessionEventRegistry() {
        for (BrokerEvent event : BrokerEvent.values()) {
            listeners.put(event, new CopyOnWriteArrayList<>());
        }
    }

    public Disposable register(BrokerEvent event, SessionEventListener listener) {
        List<SessionEventListener> registered = listeners.get(event);
        registered.add(listener);
        return () -> registered.remove(listener);
    }

    public void emit(SessionEvent event) {
        for (SessionEventListener listener : listeners.get(event.event())) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.error("[{}] Session event listener failed", event.event(), e);
            }
        }
    }

    public int listenerCount(BrokerEvent event) {
        return listeners.get(event).size();
    }

    public void clear() {
        listeners.values().forEach(List::clear);
    }
}
