package io.assistify.core.agent;

import io.assistify.core.model.ChatOptions;

public record AgentSettings(
    ChatOptions chatOptions,
    int maxToolIterations,
    boolean destructiveAuthorized
) {
    public static final int DEFAULT_MAX_TOOL_ITERATIONS = 5;

    public AgentSettings {
        chatOptions = chatOptions == null ? ChatOptions.defaults() : chatOptions;
        maxToolIterations = maxToolIterations <= 0 ? DEFAULT_MAX_TOOL_ITERATIONS : maxToolIterations;
    }

    public static AgentSettings defaults() {
        return new AgentSettings(ChatOptions.defaults(), DEFAULT_MAX_TOOL_ITERATIONS, false);
    }

    public AgentSettings authorizeDestructive() {
        return new AgentSettings(chatOptions, maxToolIterations, true);
    }
}
