package me.golemcore.gateway.adapter.outbound.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.gateway.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.gateway.domain.model.AuditEvent;
import me.golemcore.gateway.domain.model.AuditEventType;
import me.golemcore.gateway.domain.model.AuditSeverity;
import me.golemcore.gateway.infrastructure.config.GatewayConfiguration;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonlAuditLogAdapterTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = GatewayConfiguration.objectMapper();
    private JsonlAuditLogAdapter adapter;

    @BeforeEach
    void setUp() {
        GatewayProperties properties = new GatewayProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        adapter = new JsonlAuditLogAdapter(storage, objectMapper);
    }

    @Test
    void shouldAppendOneJsonLinePerEventInDailyFile() throws Exception {
        adapter.append(event("c-1", AuditEventType.CALL_ATTEMPT, Instant.parse("2026-05-04T10:00:00Z"))).join();
        adapter.append(event("c-1", AuditEventType.TOOL_RESULT, Instant.parse("2026-05-04T10:00:01Z"))).join();
        adapter.append(event("c-2", AuditEventType.CALL_ATTEMPT, Instant.parse("2026-05-05T00:00:00Z"))).join();

        Path day = tempDir.resolve("audit").resolve("audit_2026-05-04.jsonl");
        List<String> lines = Files.readAllLines(day, StandardCharsets.UTF_8);
        assertEquals(2, lines.size());
        assertTrue(Files.exists(tempDir.resolve("audit").resolve("audit_2026-05-05.jsonl")));

        JsonNode first = objectMapper.readTree(lines.get(0));
        assertEquals("call_attempt", first.get("eventType").asText());
        assertEquals("c-1", first.get("correlationId").asText());
        assertEquals("gateway", first.get("source").asText());
        assertEquals("info", first.get("severity").asText());
        assertEquals("2026-05-04T10:00:00Z", first.get("timestamp").asText());
        assertEquals("read_file", first.get("payload").get("tool").asText());
    }

    private static AuditEvent event(String correlationId, AuditEventType type, Instant timestamp) {
        return AuditEvent.builder()
                .timestamp(timestamp)
                .eventType(type)
                .correlationId(correlationId)
                .sessionId("s-1")
                .agentId("agent-1")
                .severity(AuditSeverity.INFO)
                .payload(Map.of("tool", "read_file"))
                .build();
    }
}
