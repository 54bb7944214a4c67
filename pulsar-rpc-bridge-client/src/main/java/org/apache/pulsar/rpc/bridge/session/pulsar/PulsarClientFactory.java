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

import org.apache.pulsar.client.api.PulsarClient;
import org.apache.pulsar.client.api.PulsarClientException;

/**
 * Builds the {@link PulsarClient} a session runs on.
 */
@FunctionalInterface
public interface PulsarClientFactory {

    PulsarClient create(PulsarSessionConfig config) throws PulsarClientException;

    static PulsarClientFactory defaultFactory() {
        return config -> PulsarClient.builder()
                .loadConf(config.clientConfig())
                .serviceUrl(config.serviceUrl())
                .build();
    }
}
