package io.assistify.core.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.assistify.core.error.AssistifyError;
import io.assistify.core.error.ErrorCode;
import io.assistify.core.error.Outcome;
import io.assistify.core.model.ChatMessage;
import io.assistify.core.model.ChatOptions;
import io.assistify.core.model.ChatResult;
import io.assistify.core.model.MessageRole;
import io.assistify.core.model.ToolCall;
import io.assistify.core.model.Usage;
import io.assistify.core.tool.ToolFormat;
import io.assistify.core.usage.UsageLedger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class OpenAiCompatProvider implements ChatProvider {
    private static final Logger LOG = LoggerFactory.getLogger(OpenAiCompatProvider.class);

    private final ProviderConfig config;
    private final HttpUrl apiBase;
    private final ProviderHttp http;
    private final UsageLedger ledger;

    public OpenAiCompatProvider(ProviderConfig config, ProviderHttp http, UsageLedger ledger) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.apiBase = HttpUrl.get(config.baseUrl());
        this.http = Objects.requireNonNull(http, "http must not be null");
        this.ledger = ledger;
    }

    @Override
    public String id() {
        return config.id();
    }

    @Override
    public String displayName() {
        return config.displayName();
    }

    @Override
    public ProviderConfig config() {
        return config;
    }

    @Override
    public ToolFormat toolFormat() {
        return ToolFormat.OPENAI;
    }

    @Override
    public Outcome<ChatResult> chat(List<ChatMessage> messages, ChatOptions options) {
        return send(messages, List.of(), options, false);
    }

    @Override
    public Outcome<ChatResult> chatWithTools(List<ChatMessage> messages, List<Map<String, Object>> tools, ChatOptions options) {
        return send(messages, tools == null ? List.of() : tools, options, true);
    }

    private Outcome<ChatResult> send(
        List<ChatMessage> messages,
        List<Map<String, Object>> tools,
        ChatOptions options,
        boolean toolsAllowed
    ) {
        ChatOptions effective = options == null ? ChatOptions.defaults() : options;
        if (!configured()) {
            return Outcome.failure(ErrorCode.NOT_CONFIGURED, displayName() + " API key is not configured.");
        }

        String model = config.resolveModel(effective.model());
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("messages", toWireMessages(messages, effective));
        payload.put("temperature", effective.temperature());
        payload.put("max_tokens", effective.maxTokens());
        if (!tools.isEmpty()) {
            payload.put("tools", toWireTools(tools));
            payload.put("tool_choice", "auto");
        }

        LOG.debug("Sending {} request: model={}, messages={}, tools={}", id(), model, messages.size(), tools.size());
        Outcome<JsonNode> response = http.postJson(
            completionsUrl(),
            Map.of("Authorization", "Bearer " + config.credential()),
            payload,
            effective.timeoutSeconds()
        );
        if (!response.ok()) {
            return Outcome.failure(response.error());
        }
        return parse(response.value(), model, toolsAllowed);
    }

    private HttpUrl completionsUrl() {
        return apiBase.newBuilder()
            .addPathSegment("chat")
            .addPathSegment("completions")
            .build();
    }

    private List<Map<String, Object>> toWireMessages(List<ChatMessage> messages, ChatOptions options) {
        List<Map<String, Object>> wire = new ArrayList<>();
        String system = AdapterSupport.systemContent(messages, options);
        if (!system.isBlank()) {
            wire.add(Map.of("role", "system", "content", system));
        }

        for (ChatMessage message : messages) {
            if (message.role() == MessageRole.SYSTEM) {
                continue;
            }
            Map<String, Object> row = new LinkedHashMap<>();
            switch (message.role()) {
                case USER -> {
                    row.put("role", "user");
                    row.put("content", message.content());
                }
                case ASSISTANT -> {
                    row.put("role", "assistant");
                    if (message.hasToolCalls()) {
                        row.put("content", message.content().isBlank() ? null : message.content());
                        row.put("tool_calls", toWireToolCalls(message.toolCalls()));
                    } else {
                        row.put("content", message.content());
                    }
                }
                case TOOL -> {
                    row.put("role", "tool");
                    row.put("tool_call_id", message.toolCallId() == null ? "" : message.toolCallId());
                    row.put("content", message.content());
                }
                default -> throw new IllegalStateException("Unexpected role " + message.role());
            }
            wire.add(row);
        }
        return wire;
    }

    private List<Map<String, Object>> toWireToolCalls(List<ToolCall> toolCalls) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (ToolCall call : toolCalls) {
            Map<String, Object> function = new LinkedHashMap<>();
            function.put("name", call.name());
            function.put("arguments", call.arguments());

            Map<String, Object> item = new LinkedHashMap<>();
            item.put("id", call.id());
            item.put("type", "function");
            item.put("function", function);
            wire.add(item);
        }
        return wire;
    }

    private List<Map<String, Object>> toWireTools(List<Map<String, Object>> tools) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (Map<String, Object> tool : tools) {
            Map<String, Object> spec = AdapterSupport.functionSpec(tool);
            if (!spec.isEmpty()) {
                wire.add(Map.of("type", "function", "function", spec));
            }
        }
        return wire;
    }

    private Outcome<ChatResult> parse(JsonNode root, String model, boolean toolsAllowed) {
        JsonNode message = root.path("choices").path(0).path("message");
        if (!message.isObject()) {
            return invalid(root);
        }

        Usage usage = AdapterSupport.usage(root.path("usage"), "prompt_tokens", "completion_tokens", "total_tokens");
        String responseModel = root.path("model").asText(model);
        JsonNode toolCallsNode = message.path("tool_calls");
        String content = message.path("content").isTextual() ? message.path("content").asText() : "";

        if (toolsAllowed && toolCallsNode.isArray() && !toolCallsNode.isEmpty()) {
            List<ToolCall> toolCalls = new ArrayList<>();
            for (JsonNode item : toolCallsNode) {
                JsonNode function = item.path("function");
                String name = function.path("name").asText("");
                if (name.isBlank()) {
                    return invalid(root);
                }
                toolCalls.add(new ToolCall(item.path("id").asText(""), name, argumentsJson(function.path("arguments"))));
            }
            AdapterSupport.recordUsage(ledger, id(), usage);
            return Outcome.success(ChatResult.toolCalls(content, toolCalls, usage, responseModel));
        }

        if (!toolsAllowed && !message.path("content").isTextual()) {
            return invalid(root);
        }
        AdapterSupport.recordUsage(ledger, id(), usage);
        return Outcome.success(ChatResult.content(content, usage, responseModel));
    }

    private String argumentsJson(JsonNode arguments) {
        if (arguments.isTextual()) {
            return arguments.asText();
        }
        if (arguments.isObject()) {
            try {
                return http.mapper().writeValueAsString(arguments);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Could not re-encode tool arguments", e);
            }
        }
        return "{}";
    }

    private Outcome<ChatResult> invalid(JsonNode root) {
        return Outcome.failure(new AssistifyError(
            ErrorCode.INVALID_RESPONSE,
            "Invalid response format from " + displayName() + ".",
            0,
            root.toString()
        ));
    }
}
