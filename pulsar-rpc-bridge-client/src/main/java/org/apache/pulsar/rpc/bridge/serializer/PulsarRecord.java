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

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.apache.pulsar.rpc.bridge.common.RecordOptions;

/**
 * Payload data together with the Pulsar message options it should be sent with. Build one with
 * {@link PulsarRecordBuilder} and pass it as the data of a request or event.
 *
 * @param <T> the type of the payload data
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PACKAGE)
public class PulsarRecord<T> {
    private final T data;
    private final RecordOptions options;
}
