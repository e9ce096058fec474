/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */
package me.golemcore.gateway.adapter.outbound.mcp;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Message channel to one capability server. Carries serialized JSON-RPC
 * messages in both directions; request/response correlation is done by
 * {@link McpClient}.
 */
public interface McpTransport {

    /**
     * Opens the channel. Messages arriving from the server are handed to
     * {@code listener}, possibly from a transport-owned thread.
     */
    void start(Listener listener, Duration timeout) throws IOException;

    /**
     * Sends one JSON-RPC message. The future fails if the message could not be
     * delivered.
     */
    CompletableFuture<Void> send(String message);

    boolean isOpen();

    void close();

    /**
     * Receiver of server-to-client traffic.
     */
    interface Listener {

        /**
         * One raw JSON payload: a single message or a batch array.
         */
        void onMessage(String payload);

        /**
         * The channel ended without {@link #close()} being called.
         */
        void onClosed(String reason);
    }
}
