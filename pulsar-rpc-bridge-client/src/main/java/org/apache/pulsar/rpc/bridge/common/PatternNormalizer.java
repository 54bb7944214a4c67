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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Turns a message pattern into the channel name it is published on. Strings are used as-is; any
 * other pattern becomes its JSON form with keys in alphabetical order at every level, so equal
 * patterns always map to the same channel.
 */
public final class PatternNormalizer {
    private static final JsonMapper SORTED_MAPPER = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    private PatternNormalizer() {
    }

    public static String normalize(Object pattern) {
        if (pattern instanceof String text) {
            return text;
        }
        try {
            return SORTED_MAPPER.writeValueAsString(pattern);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Cannot normalize message pattern " + pattern, e);
        }
    }
}
