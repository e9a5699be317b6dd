package io.assistify.core.observability;

import java.util.Map;

public record AuditSummary(
    int toolExecutions,
    int toolSucceeded,
    int toolFailed,
    int toolRejected,
    double toolSuccessRate,
    double p50ToolLatencyMs,
    double p95ToolLatencyMs,
    int turnsCompleted,
    int turnsFailed,
    int confirmationsRequested,
    Map<String, Integer> executionsByTool,
    int auditEvents
) {
    public AuditSummary {
        executionsByTool = executionsByTool == null ? Map.of() : Map.copyOf(executionsByTool);
    }
}
