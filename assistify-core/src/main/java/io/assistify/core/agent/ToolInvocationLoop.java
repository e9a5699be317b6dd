package io.assistify.core.agent;

import io.assistify.core.error.AssistifyError;
import io.assistify.core.error.ErrorCode;
import io.assistify.core.error.Outcome;
import io.assistify.core.model.ChatMessage;
import io.assistify.core.model.ChatResult;
import io.assistify.core.model.ToolCall;
import io.assistify.core.model.ToolResult;
import io.assistify.core.model.Usage;
import io.assistify.core.observability.AuditSink;
import io.assistify.core.provider.ChatProvider;
import io.assistify.core.provider.ProviderFactory;
import io.assistify.core.tool.ToolRegistry;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ToolInvocationLoop {
    private static final Logger LOG = LoggerFactory.getLogger(ToolInvocationLoop.class);

    private final ProviderFactory providerFactory;
    private final ToolRegistry toolRegistry;
    private final ToolCallExecutor executor;
    private final AuditSink audit;

    public ToolInvocationLoop(ProviderFactory providerFactory, ToolRegistry toolRegistry, AuditSink audit) {
        this.providerFactory = Objects.requireNonNull(providerFactory, "providerFactory must not be null");
        this.toolRegistry = Objects.requireNonNull(toolRegistry, "toolRegistry must not be null");
        this.executor = new ToolCallExecutor(toolRegistry);
        this.audit = audit == null ? AuditSink.NOOP : audit;
    }

    public TurnResult run(List<ChatMessage> conversation, AgentSettings settings) {
        Outcome<ChatProvider> provider = providerFactory.getConfiguredProvider();
        if (!provider.ok()) {
            return failed(conversation, List.of(), Usage.ZERO, provider.error(), "", 0);
        }
        return run(provider.value(), conversation, settings);
    }

    public TurnResult run(ChatProvider provider, List<ChatMessage> conversation, AgentSettings settings) {
        Objects.requireNonNull(provider, "provider must not be null");
        List<ChatMessage> transcript = new ArrayList<>(conversation == null ? List.of() : conversation);
        emit("turn_started", Map.of("provider", provider.id(), "tools", toolRegistry.all().size()));
        return loop(provider, transcript, new ArrayList<>(), Usage.ZERO, settings, 1);
    }

    public TurnResult resume(TurnResult held, List<ToolResult> confirmedResults, AgentSettings settings) {
        Outcome<ChatProvider> provider = providerFactory.getConfiguredProvider();
        if (!provider.ok()) {
            return failed(held.transcript(), held.toolResults(), held.usage(), provider.error(), "", held.rounds());
        }
        return resume(provider.value(), held, confirmedResults, settings);
    }

    /**
     * Continues a turn held for confirmation. {@code confirmedResults} are the results of the held calls, in
     * call order, and are replayed to the model before the next round.
     */
    public TurnResult resume(
        ChatProvider provider,
        TurnResult held,
        List<ToolResult> confirmedResults,
        AgentSettings settings
    ) {
        Objects.requireNonNull(provider, "provider must not be null");
        Objects.requireNonNull(held, "held must not be null");
        if (!held.awaitingConfirmation()) {
            throw new IllegalArgumentException("Only a turn awaiting confirmation can be resumed, got " + held.status());
        }
        List<ChatMessage> transcript = new ArrayList<>(held.transcript());
        List<ToolResult> toolResults = new ArrayList<>(held.toolResults());
        for (ToolResult toolResult : confirmedResults == null ? List.<ToolResult>of() : confirmedResults) {
            toolResults.add(toolResult);
            transcript.add(ChatMessage.tool(toolResult.content(), toolResult.toolCallId(), toolResult.toolName()));
        }
        emit("turn_resumed", Map.of("provider", provider.id(), "tool_calls", toolResults.size()));
        return loop(provider, transcript, toolResults, held.usage(), settings, held.rounds() + 1);
    }

    private TurnResult loop(
        ChatProvider provider,
        List<ChatMessage> transcript,
        List<ToolResult> toolResults,
        Usage usageSoFar,
        AgentSettings settings,
        int firstRound
    ) {
        AgentSettings effective = settings == null ? AgentSettings.defaults() : settings;
        List<Map<String, Object>> catalog = toolRegistry.projectFor(provider.toolFormat());
        Usage usage = usageSoFar;
        int bound = effective.maxToolIterations();

        for (int round = firstRound; round <= bound; round++) {
            trace(LoopState.AWAITING_MODEL, round, provider);
            Outcome<ChatResult> reply = provider.chatWithTools(transcript, catalog, effective.chatOptions());
            if (!reply.ok()) {
                return failed(transcript, toolResults, usage, reply.error(), provider.id(), round);
            }
            ChatResult result = reply.value();
            usage = usage.plus(result.usage());

            if (!result.requestsTools()) {
                trace(LoopState.DONE, round, provider);
                transcript.add(ChatMessage.assistant(result.content()));
                emit("turn_completed", turnAttributes(provider.id(), round, toolResults.size(), usage));
                return new TurnResult(
                    TurnStatus.COMPLETED, result.content(), toolResults, List.of(), transcript, usage, null, round
                );
            }

            trace(LoopState.TOOLS_REQUESTED, round, provider);
            List<ToolCall> calls = result.toolCalls();
            if (round == bound) {
                break;
            }
            transcript.add(ChatMessage.assistantWithToolCalls(result.content(), calls));
            if (!effective.destructiveAuthorized() && requiresConfirmation(calls)) {
                Map<String, Object> attrs = new LinkedHashMap<>();
                attrs.put("provider", provider.id());
                attrs.put("tools", calls.stream().map(ToolCall::name).toList());
                emit("confirmation_required", attrs);
                return new TurnResult(
                    TurnStatus.CONFIRMATION_REQUIRED,
                    "This action needs your confirmation before it runs.",
                    toolResults,
                    calls,
                    transcript,
                    usage,
                    null,
                    round
                );
            }

            trace(LoopState.EXECUTING_TOOLS, round, provider);
            for (ToolCall call : calls) {
                ToolResult toolResult = executor.execute(call);
                toolResults.add(toolResult);
                transcript.add(ChatMessage.tool(toolResult.content(), call.id(), call.name()));
            }
        }

        AssistifyError exceeded = AssistifyError.of(
            ErrorCode.TOOL_LOOP_EXCEEDED,
            "Stopped after " + bound + " model round-trips without a final answer."
        );
        return failed(transcript, toolResults, usage, exceeded, provider.id(), bound);
    }

    private boolean requiresConfirmation(List<ToolCall> calls) {
        return calls.stream().anyMatch(call -> toolRegistry.isDestructive(call.name()));
    }

    private TurnResult failed(
        List<ChatMessage> transcript,
        List<ToolResult> toolResults,
        Usage usage,
        AssistifyError error,
        String providerId,
        int rounds
    ) {
        LOG.warn("Turn failed with {}: {}", error.code(), error.message());
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("provider", providerId);
        attrs.put("error", error.code().wireName());
        attrs.put("message", error.message());
        emit("turn_failed", attrs);
        return new TurnResult(
            TurnStatus.FAILED,
            "Sorry, I couldn't complete that request: " + error.message(),
            toolResults,
            List.of(),
            transcript,
            usage,
            error,
            rounds
        );
    }

    private Map<String, Object> turnAttributes(String providerId, int rounds, int toolCalls, Usage usage) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("provider", providerId);
        attrs.put("rounds", rounds);
        attrs.put("tool_calls", toolCalls);
        attrs.put("total_tokens", usage.totalTokens());
        return attrs;
    }

    private void trace(LoopState state, int round, ChatProvider provider) {
        LOG.debug("Turn on {}: {} (round {})", provider.id(), state, round);
    }

    private void emit(String type, Map<String, Object> attrs) {
        try {
            audit.record(type, attrs);
        } catch (IOException e) {
            LOG.warn("Failed to record {} audit event: {}", type, e.getMessage());
        }
    }
}
