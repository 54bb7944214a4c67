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

import static org.testng.Assert.assertEquals;
import org.testng.annotations.Test;

public class PulsarSessionConfigTest {
    private final PulsarSessionConfig config = PulsarSessionConfig.defaults("reply-sub");

    @Test
    public void testShortChannelUsesPrefix() {
        assertEquals(config.toTopic("math.sum"), "persistent://public/default/math.sum");
        assertEquals(config.toTopic("math.sum/reply"), "persistent://public/default/math.sum.reply");
    }

    @Test
    public void testQualifiedChannelKeepsNamespace() {
        assertEquals(config.toTopic("persistent://acme/rpc/math.sum/reply"), "persistent://acme/rpc/math.sum.reply");
        assertEquals(config.toTopic("non-persistent://acme/rpc/jobs"), "non-persistent://acme/rpc/jobs");
    }

    @Test
    public void testCustomPrefix() {
        PulsarSessionConfig custom = new PulsarSessionConfig("pulsar://broker:6650", null, "sub",
                "persistent://acme/rpc/");

        assertEquals(custom.toTopic("jobs/reply"), "persistent://acme/rpc/jobs.reply");
        assertEquals(custom.clientConfig().size(), 0);
    }
}
