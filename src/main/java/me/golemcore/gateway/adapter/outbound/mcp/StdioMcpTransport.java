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

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Capability server running as a subprocess, exchanging newline-delimited
 * JSON-RPC over stdin/stdout.
 *
 * <p>
 * A reader thread feeds stdout lines to the listener; a second thread drains
 * stderr to the DEBUG log.
 */
@Slf4j
public class StdioMcpTransport implements McpTransport {

    private static final long DESTROY_GRACE_SECONDS = 5;

    private final String serverName;
    private final String command;
    private final List<String> args;
    private final Map<String, String> env;

    private Process process;
    private BufferedWriter writer;
    private volatile boolean running;

    public StdioMcpTransport(String serverName, String command, List<String> args, Map<String, String> env) {
        this.serverName = serverName;
        this.command = command;
        this.args = List.copyOf(args);
        this.env = Map.copyOf(env);
    }

    @Override
    public void start(Listener listener, Duration timeout) throws IOException {
        List<String> commandLine = new ArrayList<>();
        commandLine.add(command);
        commandLine.addAll(args);
        log.info("[Upstream:{}] Starting process: {}", serverName, String.join(" ", commandLine));

        ProcessBuilder pb = new ProcessBuilder(commandLine);
        pb.redirectErrorStream(false);
        pb.environment().putAll(env);

        process = pb.start();
        running = true;
        writer = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));

        Thread readerThread = new Thread(() -> readLoop(listener), "mcp-reader-" + serverName);
        readerThread.setDaemon(true);
        readerThread.start();

        Thread stderrThread = new Thread(this::stderrDrain, "mcp-stderr-" + serverName);
        stderrThread.setDaemon(true);
        stderrThread.start();
    }

    @Override
    public CompletableFuture<Void> send(String message) {
        if (writer == null || !running) {
            return CompletableFuture.failedFuture(new IOException("Process for '" + serverName + "' is not running"));
        }
        try {
            synchronized (writer) {
                writer.write(message);
                writer.newLine();
                writer.flush();
            }
            return CompletableFuture.completedFuture(null);
        } catch (IOException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public boolean isOpen() {
        return running && process != null && process.isAlive();
    }

    @Override
    public void close() {
        running = false;
        if (writer != null) {
            try {
                writer.close();
            } catch (IOException e) {
                log.debug("[Upstream:{}] Error closing stdin: {}", serverName, e.getMessage());
            }
        }
        if (process != null && process.isAlive()) {
            process.destroy();
            try {
                if (!process.waitFor(DESTROY_GRACE_SECONDS, TimeUnit.SECONDS)) {
                    process.destroyForcibly();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
            }
        }
    }

    private void readLoop(Listener listener) {
        Process p = this.process;
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while (running && (line = reader.readLine()) != null) {
                line = line.trim();
                if (!line.isEmpty()) {
                    listener.onMessage(line);
                }
            }
        } catch (IOException e) {
            if (running) {
                log.warn("[Upstream:{}] Reader thread error: {}", serverName, e.getMessage());
            }
        } finally {
            if (running) {
                running = false;
                listener.onClosed("process exited");
            }
        }
    }

    private void stderrDrain() {
        Process p = this.process;
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(p.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.debug("[Upstream:{}] stderr: {}", serverName, line);
            }
        } catch (IOException e) {
            log.debug("[Upstream:{}] Stderr drain ended: {}", serverName, e.getMessage());
        }
    }
}
