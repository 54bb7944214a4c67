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

public class RpcBridgeException extends Exception {

    /**
     * Constructs an {@code RpcBridgeException} with the specified detail message.
     *
     * @param message
     *        The detail message (which is saved for later retrieval
     *        by the {@link #getMessage()} method)
     */
    public RpcBridgeException(String message) {
        super(message);
    }

    /**
     * Constructs an {@code RpcBridgeException} with the specified cause.
     *
     * @param cause
     *        The cause (which is saved for later retrieval by the
     *        {@link #getCause()} method).  (A null value is permitted,
     *        and indicates that the cause is nonexistent or unknown.)
     */
    public RpcBridgeException(Throwable cause) {
        super(cause);
    }

    public RpcBridgeException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * The broker could not be reached.
     */
    public static class ConnectionException extends RpcBridgeException {
        public ConnectionException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * The session reported itself offline; the broker client keeps retrying in the background.
     */
    public static class OfflineException extends RpcBridgeException {
        public OfflineException(String message) {
            super(message);
        }
    }

    /**
     * An operation needed a session but {@code connect()} has not been called.
     */
    public static class NotConnectedException extends RpcBridgeException {
        public NotConnectedException(String message) {
            super(message);
        }
    }

    /**
     * The session closed, either before it connected or while requests were outstanding.
     */
    public static class ClosedException extends RpcBridgeException {
        public ClosedException(String message) {
            super(message);
        }

        public ClosedException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
