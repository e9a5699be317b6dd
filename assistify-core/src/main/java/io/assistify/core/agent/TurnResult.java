package io.assistify.core.agent;

import io.assistify.core.error.AssistifyError;
import io.assistify.core.model.ChatMessage;
import io.assistify.core.model.ToolCall;
import io.assistify.core.model.ToolResult;
import io.assistify.core.model.Usage;
import java.util.List;
import java.util.Objects;

public record TurnResult(
    TurnStatus status,
    String content,
    List<ToolResult> toolResults,
    List<ToolCall> pendingCalls,
    List<ChatMessage> transcript,
    Usage usage,
    AssistifyError error,
    int rounds
) {
    public TurnResult {
        Objects.requireNonNull(status, "status must not be null");
        content = content == null ? "" : content;
        toolResults = toolResults == null ? List.of() : List.copyOf(toolResults);
        pendingCalls = pendingCalls == null ? List.of() : List.copyOf(pendingCalls);
        transcript = transcript == null ? List.of() : List.copyOf(transcript);
        usage = usage == null ? Usage.ZERO : usage;
        rounds = Math.max(0, rounds);
    }

    public boolean completed() {
        return status == TurnStatus.COMPLETED;
    }

    public boolean awaitingConfirmation() {
        return status == TurnStatus.CONFIRMATION_REQUIRED;
    }
}
