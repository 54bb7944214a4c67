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

import java.util.concurrent.atomic.AtomicBoolean;
import reactor.core.Disposable;

/**
 * Ends the caller's interest in one request: gives back its reply channel lease and forgets its
 * route. Safe to call any number of times, before or after the last reply.
 */
class RequestTeardown implements Disposable {
    private final String requestId;
    private final SubscriptionLedger.Lease lease;
    private final CorrelationRouter router;
    private final AtomicBoolean disposed = new AtomicBoolean();

    RequestTeardown(String requestId, SubscriptionLedger.Lease lease, CorrelationRouter router) {
        this.requestId = requestId;
        this.lease = lease;
        this.router = router;
    }

    @Override
    public void dispose() {
        if (disposed.compareAndSet(false, true)) {
            router.remove(requestId);
            lease.release();
        }
    }

    @Override
    public boolean isDisposed() {
        return disposed.get();
    }
}
