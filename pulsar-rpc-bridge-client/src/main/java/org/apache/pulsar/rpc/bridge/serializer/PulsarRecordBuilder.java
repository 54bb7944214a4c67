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

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.NonNull;
import org.apache.pulsar.rpc.bridge.common.RecordOptions;

/**
 * Builder for {@link PulsarRecord}.
 *
 * @param <T> the type of the payload data
 */
public class PulsarRecordBuilder<T> {
    private T data;
    private String key;
    private final Map<String, String> properties = new LinkedHashMap<>();
    private Long deliverAt;

    public PulsarRecordBuilder() {
    }

    public PulsarRecordBuilder(T data) {
        this.data = data;
    }

    public PulsarRecordBuilder<T> setData(T data) {
        this.data = data;
        return this;
    }

    public PulsarRecordBuilder<T> setKey(String key) {
        this.key = key;
        return this;
    }

    public PulsarRecordBuilder<T> setProperties(@NonNull Map<String, String> properties) {
        this.properties.clear();
        this.properties.putAll(properties);
        return this;
    }

    public PulsarRecordBuilder<T> addProperty(@NonNull String name, @NonNull String value) {
        this.properties.put(name, value);
        return this;
    }

    public PulsarRecordBuilder<T> setDeliverAt(@NonNull Instant deliverAt) {
        this.deliverAt = deliverAt.toEpochMilli();
        return this;
    }

    public PulsarRecord<T> build() {
        return new PulsarRecord<>(data, new RecordOptions(key, new LinkedHashMap<>(properties), deliverAt));
    }
}
