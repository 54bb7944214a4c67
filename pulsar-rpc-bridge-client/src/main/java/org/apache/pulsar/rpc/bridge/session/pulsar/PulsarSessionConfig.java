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

import java.util.Collections;
import java.util.Map;
import lombok.NonNull;
import org.apache.pulsar.rpc.bridge.common.Constants;

/**
 * Settings of a Pulsar-backed session.
 *
 * @param serviceUrl the broker service URL
 * @param clientConfig passed to {@link org.apache.pulsar.client.api.ClientBuilder#loadConf(Map)}
 * @param replySubscription subscription name used for every channel this session subscribes to
 * @param topicPrefix prepended to channel names that are not fully qualified topic names
 */
public record PulsarSessionConfig(@NonNull String serviceUrl,
                                  Map<String, Object> clientConfig,
                                  @NonNull String replySubscription,
                                  @NonNull String topicPrefix) {

    private static final String SCHEME_SEPARATOR = "://";

    public PulsarSessionConfig {
        clientConfig = clientConfig == null ? Collections.emptyMap() : Map.copyOf(clientConfig);
    }

    /**
     * Maps a channel name onto a Pulsar topic. Channel names may contain {@code /} (reply channels
     * end with {@code /reply}); inside the local topic name it is replaced by {@code .}.
     */
    public String toTopic(String channel) {
        int schemeEnd = channel.indexOf(SCHEME_SEPARATOR);
        if (schemeEnd < 0) {
            return topicPrefix + channel.replace('/', '.');
        }
        // scheme://tenant/namespace/local
        int tenantEnd = channel.indexOf('/', schemeEnd + SCHEME_SEPARATOR.length());
        int namespaceEnd = tenantEnd < 0 ? -1 : channel.indexOf('/', tenantEnd + 1);
        if (namespaceEnd < 0) {
            return channel;
        }
        return channel.substring(0, namespaceEnd + 1) + channel.substring(namespaceEnd + 1).replace('/', '.');
    }

    public static PulsarSessionConfig defaults(String replySubscription) {
        return new PulsarSessionConfig(Constants.DEFAULT_SERVICE_URL, null, replySubscription,
                Constants.DEFAULT_TOPIC_PREFIX);
    }
}
