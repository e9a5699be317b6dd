package io.assistify.core.agent;

import io.assistify.core.model.ToolCall;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record PendingConfirmation(String token, List<ToolCall> calls, Instant createdAt, Instant expiresAt) {

    public PendingConfirmation {
        Objects.requireNonNull(token, "token must not be null");
        calls = calls == null ? List.of() : List.copyOf(calls);
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        Objects.requireNonNull(expiresAt, "expiresAt must not be null");
    }

    public boolean expired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
