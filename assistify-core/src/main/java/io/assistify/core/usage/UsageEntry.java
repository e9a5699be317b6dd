package io.assistify.core.usage;

import io.assistify.core.model.Usage;

public record UsageEntry(long promptTokens, long completionTokens, long totalTokens, long requestCount) {
    public static final UsageEntry EMPTY = new UsageEntry(0, 0, 0, 0);

    public UsageEntry {
        promptTokens = Math.max(0, promptTokens);
        completionTokens = Math.max(0, completionTokens);
        totalTokens = Math.max(0, totalTokens);
        requestCount = Math.max(0, requestCount);
    }

    public UsageEntry plus(Usage usage) {
        return new UsageEntry(
            promptTokens + usage.promptTokens(),
            completionTokens + usage.completionTokens(),
            totalTokens + usage.totalTokens(),
            requestCount + 1
        );
    }

    public UsageEntry plus(UsageEntry other) {
        return new UsageEntry(
            promptTokens + other.promptTokens,
            completionTokens + other.completionTokens,
            totalTokens + other.totalTokens,
            requestCount + other.requestCount
        );
    }
}
