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
package me.golemcore.gateway.port.outbound;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Durable store the gateway keeps its records in. Files are organized by
 * directory (agents, servers, capabilities, usage, audit); all operations are
 * asynchronous.
 */
public interface StoragePort {

    /**
     * Write text content to file, replacing any previous content.
     *
     * @param directory
     *            top-level directory (e.g., "agents", "usage")
     * @param path
     *            relative path within directory
     * @param content
     *            UTF-8 text
     */
    CompletableFuture<Void> putText(String directory, String path, String content);

    /**
     * Read text content from file, completing with {@code null} when the file
     * does not exist.
     */
    CompletableFuture<String> getText(String directory, String path);

    CompletableFuture<Boolean> exists(String directory, String path);

    CompletableFuture<Void> deleteObject(String directory, String path);

    /**
     * List files below {@code directory/prefix}, relative to the directory.
     */
    CompletableFuture<List<String>> listObjects(String directory, String prefix);

    /**
     * Append text to a file (JSONL logs).
     */
    CompletableFuture<Void> appendText(String directory, String path, String content);

    /**
     * Crash-safe replace: write to a {@code .tmp} sibling, fsync, optionally
     * keep the previous version as {@code .bak}, then rename over the target.
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup);

    CompletableFuture<Void> ensureDirectory(String directory);
}
