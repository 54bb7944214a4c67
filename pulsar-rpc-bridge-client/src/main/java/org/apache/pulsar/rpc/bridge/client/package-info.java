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
/**
 * Request/response messaging over publish/subscribe channels.
 *
 * <p>Key classes and interfaces include:
 * <ul>
 *   <li>{@link org.apache.pulsar.rpc.bridge.client.RpcBridgeClient} - sends requests and events, and exposes
 *   the connection status.
 *   <li>{@link org.apache.pulsar.rpc.bridge.client.RpcBridgeClientBuilder} - configures a client.
 *   <li>{@link org.apache.pulsar.rpc.bridge.client.ReplyCallback} - receives the replies of one request.
 * </ul>
 */
package org.apache.pulsar.rpc.bridge.client;
