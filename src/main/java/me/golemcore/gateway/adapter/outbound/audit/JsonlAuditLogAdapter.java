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
package me.golemcore.gateway.adapter.outbound.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.gateway.domain.model.AuditEvent;
import me.golemcore.gateway.port.outbound.AuditLogPort;
import me.golemcore.gateway.port.outbound.StoragePort;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.CompletableFuture;

/**
 * Appends audit events to {@code audit/audit_<yyyy-MM-dd>.jsonl}, one JSON
 * object per line. Appends are serialized so lines never interleave.
 */
@Component
@RequiredArgsConstructor
public class JsonlAuditLogAdapter implements AuditLogPort {

    private static final String AUDIT_DIR = "audit";
    private static final String FILE_PREFIX = "audit_";
    private static final String JSONL_EXTENSION = ".jsonl";
    private static final String NEWLINE = "\n";
    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    private final Object appendLock = new Object();

    @Override
    public CompletableFuture<Void> append(AuditEvent event) {
        String line;
        try {
            line = objectMapper.writeValueAsString(event) + NEWLINE;
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(new UncheckedIOException("Failed to serialize audit event", e));
        }
        String file = FILE_PREFIX + DAY.format(event.getTimestamp()) + JSONL_EXTENSION;
        return CompletableFuture.runAsync(() -> {
            synchronized (appendLock) {
                storagePort.appendText(AUDIT_DIR, file, line).join();
            }
        });
    }
}
