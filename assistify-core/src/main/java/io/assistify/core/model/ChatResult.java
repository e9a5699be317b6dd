package io.assistify.core.model;

import java.util.List;
import java.util.Objects;

public record ChatResult(Kind kind, String content, List<ToolCall> toolCalls, Usage usage, String model) {

    public enum Kind {
        CONTENT,
        TOOL_CALLS
    }

    public ChatResult {
        Objects.requireNonNull(kind, "kind must not be null");
        content = content == null ? "" : content;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
        usage = usage == null ? Usage.ZERO : usage;
        model = model == null ? "" : model;
    }

    public static ChatResult content(String content, Usage usage, String model) {
        return new ChatResult(Kind.CONTENT, content, List.of(), usage, model);
    }

    public static ChatResult toolCalls(String content, List<ToolCall> toolCalls, Usage usage, String model) {
        return new ChatResult(Kind.TOOL_CALLS, content, toolCalls, usage, model);
    }

    public boolean requestsTools() {
        return kind == Kind.TOOL_CALLS;
    }
}
