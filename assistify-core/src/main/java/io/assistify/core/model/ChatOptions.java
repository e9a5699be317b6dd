package io.assistify.core.model;

public record ChatOptions(String model, double temperature, int maxTokens, String systemPrompt, int timeoutSeconds) {
    public static final double DEFAULT_TEMPERATURE = 0.7;
    public static final int DEFAULT_MAX_TOKENS = 2048;
    public static final int DEFAULT_TIMEOUT_SECONDS = 60;

    public ChatOptions {
        model = model == null || model.isBlank() ? null : model.trim();
        maxTokens = maxTokens <= 0 ? DEFAULT_MAX_TOKENS : maxTokens;
        systemPrompt = systemPrompt == null || systemPrompt.isBlank() ? null : systemPrompt;
        timeoutSeconds = timeoutSeconds <= 0 ? DEFAULT_TIMEOUT_SECONDS : timeoutSeconds;
    }

    public static ChatOptions defaults() {
        return new ChatOptions(null, DEFAULT_TEMPERATURE, DEFAULT_MAX_TOKENS, null, DEFAULT_TIMEOUT_SECONDS);
    }

    public ChatOptions withModel(String value) {
        return new ChatOptions(value, temperature, maxTokens, systemPrompt, timeoutSeconds);
    }

    public ChatOptions withMaxTokens(int value) {
        return new ChatOptions(model, temperature, value, systemPrompt, timeoutSeconds);
    }

    public ChatOptions withSystemPrompt(String value) {
        return new ChatOptions(model, temperature, maxTokens, value, timeoutSeconds);
    }
}
