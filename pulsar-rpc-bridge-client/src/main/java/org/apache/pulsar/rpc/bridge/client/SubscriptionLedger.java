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

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.apache.pulsar.rpc.bridge.common.ConnectionErrors;
import org.apache.pulsar.rpc.bridge.session.BrokerSession;

/**
 * Reference counts reply channel subscriptions so that each channel is subscribed at most once no
 * matter how many requests wait on it.
 *
 * <p>The first lease on a channel issues the subscribe; later leases share its acknowledgement. The
 * last released lease issues the unsubscribe. Subscribe and unsubscribe for the same channel never
 * overlap: a subscribe that follows an unsubscribe waits for it to finish. A failed subscribe drops
 * the channel entry, so the next lease starts over.
 *
 * <p>Counts and entries are guarded by this object's monitor; broker calls are non-blocking.
 */
@Slf4j
class SubscriptionLedger {
    private final Map<String, Entry> entries = new HashMap<>();
    private final Map<String, CompletableFuture<Void>> pendingUnsubscribes = new HashMap<>();

    /**
     * Takes a lease on {@code channel}, subscribing through {@code session} if nobody holds one.
     */
    Lease acquire(String channel, BrokerSession session) {
        Entry entry;
        CompletableFuture<Void> previousUnsubscribe = null;
        synchronized (this) {
            entry = entries.get(channel);
            if (entry == null) {
                entry = new Entry(channel, session);
                entries.put(channel, entry);
                previousUnsubscribe = pendingUnsubscribes.getOrDefault(channel, CompletableFuture.completedFuture(null));
            }
            entry.refCount++;
        }
        if (previousUnsubscribe != null) {
            subscribe(entry, previousUnsubscribe);
        }
        return new Lease(entry);
    }

    synchronized int refCount(String channel) {
        Entry entry = entries.get(channel);
        return entry == null ? 0 : entry.refCount;
    }

    synchronized boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Drops all bookkeeping without talking to the broker; used when the session itself goes away.
     */
    synchronized void clear() {
        entries.clear();
        pendingUnsubscribes.clear();
    }

    private void subscribe(Entry entry, CompletableFuture<Void> previousUnsubscribe) {
        previousUnsubscribe
                .handle((ignored, ex) -> null)
                .thenCompose(ignored -> entry.session.subscribe(entry.channel))
                .whenComplete((ignored, ex) -> {
                    if (ex == null) {
                        log.debug("[{}] Subscribed to reply channel", entry.channel);
                        entry.ready.complete(null);
                        return;
                    }
                    Throwable cause = ConnectionErrors.unwrap(ex);
                    log.warn("[{}] Failed to subscribe to reply channel", entry.channel, cause);
                    synchronized (this) {
                        entries.remove(entry.channel, entry);
                    }
                    entry.ready.completeExceptionally(cause);
                });
    }

    private void release(Entry entry) {
        CompletableFuture<Void> unsubscribed;
        synchronized (this) {
            if (entries.get(entry.channel) != entry) {
                // failed subscribe or cleared ledger; nothing is held on the broker for this entry
                return;
            }
            if (--entry.refCount > 0) {
                return;
            }
            entries.remove(entry.channel);
            unsubscribed = entry.ready
                    .handle((ignored, ex) -> ex == null)
                    .thenCompose(subscribed -> subscribed
                            ? entry.session.unsubscribe(entry.channel)
                            : CompletableFuture.<Void>completedFuture(null));
            pendingUnsubscribes.put(entry.channel, unsubscribed);
        }
        unsubscribed.whenComplete((ignored, ex) -> {
            if (ex != null) {
                log.warn("[{}] Failed to unsubscribe from reply channel", entry.channel,
                        ConnectionErrors.unwrap(ex));
            } else {
                log.debug("[{}] Unsubscribed from reply channel", entry.channel);
            }
            synchronized (this) {
                pendingUnsubscribes.remove(entry.channel, unsubscribed);
            }
        });
    }

    private static final class Entry {
        private final String channel;
        private final BrokerSession session;
        private final CompletableFuture<Void> ready = new CompletableFuture<>();
        private int refCount;

        private Entry(String channel, BrokerSession session) {
            this.channel = channel;
            this.session = session;
        }
    }

    /**
     * One holder's share of a channel subscription. {@link #release()} is idempotent.
     */
    final class Lease {
        private final Entry entry;
        private final AtomicBoolean released = new AtomicBoolean();

        private Lease(Entry entry) {
            this.entry = entry;
        }

        CompletableFuture<Void> ready() {
            return entry.ready;
        }

        String channel() {
            return entry.channel;
        }

        void release() {
            if (released.compareAndSet(false, true)) {
                SubscriptionLedger.this.release(entry);
            }
        }
    }
}
