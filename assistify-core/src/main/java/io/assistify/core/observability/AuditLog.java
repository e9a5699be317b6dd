package io.assistify.core.observability;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.UUID;

public final class AuditLog implements AuditSink {
    private final AuditStore store;
    private final Clock clock;

    public AuditLog(AuditStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public void record(String type, Map<String, Object> attributes) throws IOException {
        append(type, attributes);
    }

    public synchronized AuditEvent append(String type, Map<String, Object> attributes) throws IOException {
        AuditEvent event = new AuditEvent(
            UUID.randomUUID().toString(),
            clock.instant(),
            type,
            attributes
        );
        store.append(event);
        return event;
    }

    public synchronized List<AuditEvent> recent(int limit) throws IOException {
        int safe = Math.max(1, limit);
        return store.load().stream()
            .sorted(Comparator.comparing(AuditEvent::timestamp).reversed())
            .limit(safe)
            .toList();
    }

    public synchronized List<AuditEvent> forTool(String toolName, int limit) throws IOException {
        int safe = Math.max(1, limit);
        return store.load().stream()
            .filter(e -> toolName.equals(e.attribute("tool_name")))
            .sorted(Comparator.comparing(AuditEvent::timestamp).reversed())
            .limit(safe)
            .toList();
    }

    public synchronized int purgeBefore(Instant cutoff) throws IOException {
        List<AuditEvent> all = store.load();
        List<AuditEvent> kept = all.stream()
            .filter(e -> !e.timestamp().isBefore(cutoff))
            .toList();
        int removed = all.size() - kept.size();
        if (removed > 0) {
            store.replace(kept);
        }
        return removed;
    }

    public synchronized AuditSummary summary() throws IOException {
        List<AuditEvent> all = store.load();

        List<AuditEvent> started = byType(all, "tool_started");
        List<AuditEvent> succeeded = byType(all, "tool_succeeded");
        List<AuditEvent> failed = byType(all, "tool_failed");
        List<AuditEvent> rejected = byType(all, "tool_rejected");

        List<Double> latencies = succeeded.stream()
            .map(e -> toDouble(e.attributes().get("duration_ms")))
            .filter(v -> v != null && v >= 0)
            .sorted()
            .toList();

        Map<String, Integer> byTool = new TreeMap<>();
        for (AuditEvent event : started) {
            String tool = event.attribute("tool_name");
            if (!tool.isBlank()) {
                byTool.merge(tool, 1, Integer::sum);
            }
        }

        double successRate = started.isEmpty() ? 0.0 : (succeeded.size() * 100.0) / started.size();
        return new AuditSummary(
            started.size(),
            succeeded.size(),
            failed.size(),
            rejected.size(),
            round2(successRate),
            round2(percentile(latencies, 50)),
            round2(percentile(latencies, 95)),
            byType(all, "turn_completed").size(),
            byType(all, "turn_failed").size(),
            byType(all, "confirmation_required").size(),
            byTool,
            all.size()
        );
    }

    private List<AuditEvent> byType(List<AuditEvent> events, String type) {
        return events.stream().filter(e -> type.equalsIgnoreCase(e.type())).toList();
    }

    private Double toDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value == null) {
            return null;
        }
        String raw = String.valueOf(value).trim();
        if (!raw.matches("-?\\d+(\\.\\d+)?")) {
            return null;
        }
        return Double.parseDouble(raw);
    }

    private double percentile(List<Double> sorted, int percentile) {
        if (sorted.isEmpty()) {
            return 0.0;
        }
        int index = (int) Math.ceil((percentile / 100.0) * sorted.size()) - 1;
        index = Math.max(0, Math.min(sorted.size() - 1, index));
        return sorted.get(index);
    }

    private double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
