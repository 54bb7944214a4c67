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

public final class Constants {

    public static final String DEFAULT_SERVICE_URL = "pulsar://localhost:6650";
    public static final String DEFAULT_TOPIC_PREFIX = "persistent://public/default/";
    public static final String DEFAULT_REPLY_SUBSCRIPTION_PREFIX = "rpc-bridge-reply-";

    public static final String REPLY_CHANNEL_SUFFIX = "/reply";

    public static final String OFFLINE_ERROR_MESSAGE = "Connection lost. Trying to reconnect...";
    public static final String NOT_INITIALIZED_ERROR_MESSAGE =
            "Not initialized. Please call the \"connect\" method first.";

    private Constants() {
    }
}
