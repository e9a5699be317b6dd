package io.assistify.core.tool;

import java.util.Locale;

public enum ToolFormat {
    OPENAI,
    ANTHROPIC;

    public static ToolFormat parse(String value) {
        if (value == null || value.isBlank()) {
            return OPENAI;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "openai" -> OPENAI;
            case "anthropic" -> ANTHROPIC;
            default -> throw new IllegalArgumentException("Unknown tool format: " + value);
        };
    }
}
