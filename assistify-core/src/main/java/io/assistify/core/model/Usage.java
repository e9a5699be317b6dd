package io.assistify.core.model;

public record Usage(long promptTokens, long completionTokens, long totalTokens) {
    public static final Usage ZERO = new Usage(0, 0, 0);

    public Usage {
        promptTokens = Math.max(0, promptTokens);
        completionTokens = Math.max(0, completionTokens);
        totalTokens = Math.max(0, totalTokens);
    }

    public Usage plus(Usage other) {
        if (other == null) {
            return this;
        }
        return new Usage(
            promptTokens + other.promptTokens,
            completionTokens + other.completionTokens,
            totalTokens + other.totalTokens
        );
    }
}
