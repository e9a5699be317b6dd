package io.assistify.core.model;

import java.util.Objects;

public record ToolResult(String toolCallId, String toolName, boolean success, String content) {

    public ToolResult {
        Objects.requireNonNull(toolName, "toolName must not be null");
        toolCallId = toolCallId == null ? "" : toolCallId;
        content = content == null ? "" : content;
    }
}
