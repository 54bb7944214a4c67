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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Transport-only options of a record. They travel as Pulsar message metadata and never as part of
 * the JSON body.
 *
 * @param key the message key, may be {@code null}
 * @param properties message properties, never {@code null}
 * @param deliverAt absolute delivery time in epoch millis, may be {@code null}
 */
public record RecordOptions(String key, Map<String, String> properties, Long deliverAt) {

    public RecordOptions {
        properties = properties == null ? Collections.emptyMap() : Collections.unmodifiableMap(properties);
    }

    /**
     * Lays {@code defaults} under the properties of {@code options}; properties set on the record win.
     *
     * @return the merged options, or {@code null} when there is nothing to send
     */
    public static RecordOptions merge(Map<String, String> defaults, RecordOptions options) {
        if (options == null && (defaults == null || defaults.isEmpty())) {
            return null;
        }
        Map<String, String> merged = new LinkedHashMap<>();
        if (defaults != null) {
            merged.putAll(defaults);
        }
        if (options == null) {
            return new RecordOptions(null, merged, null);
        }
        merged.putAll(options.properties());
        return new RecordOptions(options.key(), merged, options.deliverAt());
    }
}
