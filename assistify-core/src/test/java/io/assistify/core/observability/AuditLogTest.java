package io.assistify.core.observability;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AuditLogTest {
    @TempDir
    Path tempDir;

    @Test
    void shouldSummarizeToolExecutionsAndTurns() throws Exception {
        AuditLog log = logAt(tempDir.resolve("audit.jsonl"), "2026-03-01T10:00:00Z");
        log.record("tool_started", Map.of("tool_name", "get_setting"));
        log.record("tool_succeeded", Map.of("tool_name", "get_setting", "duration_ms", 40));
        log.record("tool_started", Map.of("tool_name", "update_setting"));
        log.record("tool_succeeded", Map.of("tool_name", "update_setting", "duration_ms", 120));
        log.record("tool_started", Map.of("tool_name", "update_setting"));
        log.record("tool_failed", Map.of("tool_name", "update_setting", "error", "disk full"));
        log.record("tool_rejected", Map.of("tool_name", "drop_tables", "error", "invalid_tool"));
        log.record("turn_completed", Map.of("provider", "openai"));
        log.record("confirmation_required", Map.of("provider", "openai"));

        AuditSummary summary = log.summary();

        assertThat(summary.toolExecutions()).isEqualTo(3);
        assertThat(summary.toolSucceeded()).isEqualTo(2);
        assertThat(summary.toolFailed()).isEqualTo(1);
        assertThat(summary.toolRejected()).isEqualTo(1);
        assertThat(summary.toolSuccessRate()).isEqualTo(66.67);
        assertThat(summary.p50ToolLatencyMs()).isEqualTo(40.0);
        assertThat(summary.p95ToolLatencyMs()).isEqualTo(120.0);
        assertThat(summary.turnsCompleted()).isEqualTo(1);
        assertThat(summary.confirmationsRequested()).isEqualTo(1);
        assertThat(summary.executionsByTool()).containsEntry("get_setting", 1).containsEntry("update_setting", 2);
        assertThat(summary.auditEvents()).isEqualTo(9);
    }

    @Test
    void shouldFilterByToolAndPurgeOldEvents() throws Exception {
        Path file = tempDir.resolve("audit.jsonl");
        logAt(file, "2026-02-01T00:00:00Z").record("tool_started", Map.of("tool_name", "get_setting"));
        AuditLog current = logAt(file, "2026-03-01T00:00:00Z");
        current.record("tool_started", Map.of("tool_name", "update_setting"));

        assertThat(current.forTool("get_setting", 10)).hasSize(1);
        assertThat(current.recent(1)).extracting(AuditEvent::attributes)
            .containsExactly(Map.of("tool_name", "update_setting"));

        int removed = current.purgeBefore(Instant.parse("2026-02-15T00:00:00Z"));

        assertThat(removed).isEqualTo(1);
        assertThat(current.recent(10)).hasSize(1);
        assertThat(current.purgeBefore(Instant.parse("2026-02-15T00:00:00Z"))).isZero();
    }

    @Test
    void shouldSkipUnreadableLines() throws Exception {
        Path file = tempDir.resolve("audit.jsonl");
        AuditLog log = logAt(file, "2026-03-01T00:00:00Z");
        log.record("turn_completed", Map.of());
        Files.writeString(file, "{broken\n", StandardOpenOption.APPEND);
        log.record("turn_failed", Map.of("error", "api_error"));

        List<AuditEvent> events = new FileAuditStore(file).load();

        assertThat(events).extracting(AuditEvent::type).containsExactly("turn_completed", "turn_failed");
        assertThat(events.get(1).attribute("error")).isEqualTo("api_error");
        assertThat(events.get(0).timestamp()).isEqualTo(Instant.parse("2026-03-01T00:00:00Z"));
    }

    private static AuditLog logAt(Path file, String instant) {
        return new AuditLog(new FileAuditStore(file), Clock.fixed(Instant.parse(instant), ZoneOffset.UTC));
    }
}
