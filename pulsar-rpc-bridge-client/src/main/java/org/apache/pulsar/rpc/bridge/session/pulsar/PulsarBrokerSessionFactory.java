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
package org.apache.pulsar.rpc.bridge.session.pulsar;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.apache.pulsar.rpc.bridge.session.BrokerSession;
import org.apache.pulsar.rpc.bridge.session.BrokerSessionFactory;

@RequiredArgsConstructor
public class PulsarBrokerSessionFactory implements BrokerSessionFactory {
    @NonNull
    private final PulsarSessionConfig config;
    @NonNull
    private final PulsarClientFactory clientFactory;

    public PulsarBrokerSessionFactory(PulsarSessionConfig config) {
        this(config, PulsarClientFactory.defaultFactory());
    }

    @Override
    public BrokerSession create() {
        return new PulsarBrokerSession(config, clientFactory);
    }
}
