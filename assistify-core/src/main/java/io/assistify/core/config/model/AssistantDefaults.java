package io.assistify.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AssistantDefaults(
    String provider,
    String model,
    double temperature,
    int maxTokens,
    int timeoutSeconds,
    int maxToolIterations,
    String systemPrompt
) {

    public static AssistantDefaults defaults() {
        return new AssistantDefaults(
            "openai",
            "",
            0.7,
            2048,
            60,
            5,
            "You are a helpful AI assistant for an online store. You help store administrators manage products, "
                + "orders, customers and store settings. Use the available tools to read and change store data, "
                + "and confirm what you changed."
        );
    }
}
