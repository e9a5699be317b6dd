package io.assistify.core.agent;

import io.assistify.core.error.ErrorCode;
import io.assistify.core.error.Outcome;
import io.assistify.core.model.ToolCall;
import io.assistify.core.model.ToolResult;
import io.assistify.core.observability.AuditSink;
import io.assistify.core.tool.ToolRegistry;
import java.io.IOException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ActionConfirmationService {
    private static final Logger LOG = LoggerFactory.getLogger(ActionConfirmationService.class);
    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

    private final ToolCallExecutor executor;
    private final AuditSink audit;
    private final Clock clock;
    private final Duration ttl;
    private final SecureRandom random = new SecureRandom();
    private final Map<String, PendingConfirmation> pending = new LinkedHashMap<>();

    public ActionConfirmationService(ToolRegistry registry, AuditSink audit, Clock clock) {
        this(registry, audit, clock, DEFAULT_TTL);
    }

    public ActionConfirmationService(ToolRegistry registry, AuditSink audit, Clock clock, Duration ttl) {
        this.executor = new ToolCallExecutor(registry);
        this.audit = audit == null ? AuditSink.NOOP : audit;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.ttl = Objects.requireNonNull(ttl, "ttl must not be null");
    }

    public synchronized PendingConfirmation request(List<ToolCall> calls) {
        purgeExpired();
        Instant now = clock.instant();
        byte[] bytes = new byte[16];
        random.nextBytes(bytes);
        PendingConfirmation confirmation = new PendingConfirmation(
            HexFormat.of().formatHex(bytes),
            calls,
            now,
            now.plus(ttl)
        );
        pending.put(confirmation.token(), confirmation);
        return confirmation;
    }

    public synchronized Outcome<List<ToolResult>> confirm(String token) {
        PendingConfirmation confirmation = pending.remove(token);
        if (confirmation == null || confirmation.expired(clock.instant())) {
            return Outcome.failure(ErrorCode.CONFIRMATION_EXPIRED, "This confirmation is no longer valid.");
        }

        List<ToolResult> results = new ArrayList<>();
        for (ToolCall call : confirmation.calls()) {
            results.add(executor.execute(call));
        }
        emit("confirmed_action", confirmation);
        return Outcome.success(results);
    }

    public synchronized boolean cancel(String token) {
        PendingConfirmation confirmation = pending.remove(token);
        if (confirmation == null) {
            return false;
        }
        emit("cancelled_action", confirmation);
        return true;
    }

    public synchronized List<PendingConfirmation> pending() {
        purgeExpired();
        return List.copyOf(pending.values());
    }

    private void purgeExpired() {
        Instant now = clock.instant();
        pending.values().removeIf(confirmation -> confirmation.expired(now));
    }

    private void emit(String type, PendingConfirmation confirmation) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("tools", confirmation.calls().stream().map(ToolCall::name).toList());
        attrs.put("calls", confirmation.calls().size());
        try {
            audit.record(type, attrs);
        } catch (IOException e) {
            LOG.warn("Failed to record {} audit event: {}", type, e.getMessage());
        }
    }
}
