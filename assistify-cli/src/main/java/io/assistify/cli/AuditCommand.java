package io.assistify.cli;

import io.assistify.core.observability.AuditEvent;
import io.assistify.core.observability.AuditSummary;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "audit", description = "Inspect tool execution and turn events")
public final class AuditCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"-n", "--limit"}, defaultValue = "20", description = "Number of recent events to show")
    int limit;

    @Option(names = {"-t", "--tool"}, description = "Only events for this tool")
    String tool;

    @Option(names = "--summary", description = "Show aggregate statistics instead of events")
    boolean summary;

    @Option(names = "--purge-days", description = "Delete events older than this many days")
    Integer purgeDays;

    public AuditCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            if (purgeDays != null) {
                Instant cutoff = Instant.now().minus(Duration.ofDays(Math.max(0, purgeDays)));
                int removed = context.auditLog().purgeBefore(cutoff);
                System.out.println("Removed " + removed + " audit events older than " + purgeDays + " days.");
                return 0;
            }
            if (summary) {
                printSummary(context.auditLog().summary());
                return 0;
            }

            List<AuditEvent> events = tool == null || tool.isBlank()
                ? context.auditLog().recent(limit)
                : context.auditLog().forTool(tool.trim(), limit);
            for (AuditEvent event : events) {
                System.out.println(event.timestamp() + " " + event.type() + " " + event.attributes());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Audit command failed: " + e.getMessage());
            return 1;
        }
    }

    private void printSummary(AuditSummary summary) {
        System.out.println("Tool executions: " + summary.toolExecutions());
        System.out.println("Succeeded: " + summary.toolSucceeded()
            + ", failed: " + summary.toolFailed()
            + ", rejected: " + summary.toolRejected());
        System.out.println("Success rate: " + summary.toolSuccessRate() + "%");
        System.out.println("Latency p50/p95 (ms): " + summary.p50ToolLatencyMs() + " / " + summary.p95ToolLatencyMs());
        System.out.println("Turns completed: " + summary.turnsCompleted() + ", failed: " + summary.turnsFailed());
        System.out.println("Confirmations requested: " + summary.confirmationsRequested());
        summary.executionsByTool().forEach((name, count) -> System.out.println("  " + name + ": " + count));
    }
}
