package io.assistify.cli;

import io.assistify.core.usage.UsageEntry;
import java.time.LocalDate;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "usage", description = "Show token usage per provider")
public final class UsageCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"-p", "--provider"}, description = "Show daily usage for one provider")
    String provider;

    public UsageCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            if (provider != null && !provider.isBlank()) {
                Map<LocalDate, UsageEntry> entries = context.usageLedger().entries(provider.trim());
                if (entries.isEmpty()) {
                    System.out.println("No usage recorded for " + provider + ".");
                    return 0;
                }
                entries.forEach((day, entry) -> print(day.toString(), entry));
                return 0;
            }

            Map<String, UsageEntry> totals = context.usageLedger().totalsByProvider();
            if (totals.isEmpty()) {
                System.out.println("No usage recorded yet.");
                return 0;
            }
            totals.forEach(this::print);
            return 0;
        } catch (Exception e) {
            System.err.println("Usage command failed: " + e.getMessage());
            return 1;
        }
    }

    private void print(String label, UsageEntry entry) {
        System.out.printf(
            "%-12s requests=%d prompt=%d completion=%d total=%d%n",
            label,
            entry.requestCount(),
            entry.promptTokens(),
            entry.completionTokens(),
            entry.totalTokens()
        );
    }
}
