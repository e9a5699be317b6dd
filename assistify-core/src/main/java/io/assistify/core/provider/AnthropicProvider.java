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

public final class AnthropicProvider implements ChatProvider {
    private static final Logger LOG = LoggerFactory.getLogger(AnthropicProvider.class);
    static final String API_VERSION = "2023-06-01";

    private final ProviderConfig config;
    private final HttpUrl apiBase;
    private final ProviderHttp http;
    private final UsageLedger ledger;

    public AnthropicProvider(ProviderConfig config, ProviderHttp http, UsageLedger ledger) {
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
        return ToolFormat.ANTHROPIC;
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
        payload.put("max_tokens", effective.maxTokens());
        payload.put("temperature", effective.temperature());
        try {
            payload.put("messages", toWireMessages(messages));
        } catch (IllegalArgumentException e) {
            return Outcome.failure(AssistifyError.api("Could not encode request: " + e.getMessage(), 0, ""));
        }

        String system = AdapterSupport.systemContent(messages, effective);
        if (!system.isBlank()) {
            payload.put("system", system);
        }
        if (!tools.isEmpty()) {
            payload.put("tools", toAnthropicTools(tools));
        }

        LOG.debug("Sending anthropic request: model={}, messages={}, tools={}", model, messages.size(), tools.size());
        Outcome<JsonNode> response = http.postJson(
            messagesUrl(),
            Map.of(
                "x-api-key", config.credential(),
                "anthropic-version", API_VERSION
            ),
            payload,
            effective.timeoutSeconds()
        );
        if (!response.ok()) {
            return Outcome.failure(response.error());
        }
        return parse(response.value(), model, toolsAllowed);
    }

    private HttpUrl messagesUrl() {
        return apiBase.newBuilder()
            .addPathSegment("messages")
            .build();
    }

    private List<Map<String, Object>> toWireMessages(List<ChatMessage> messages) {
        List<Map<String, Object>> wire = new ArrayList<>();
        List<Map<String, Object>> pendingResults = new ArrayList<>();

        for (ChatMessage message : messages) {
            if (message.role() == MessageRole.SYSTEM) {
                continue;
            }
            if (message.role() == MessageRole.TOOL) {
                Map<String, Object> block = new LinkedHashMap<>();
                block.put("type", "tool_result");
                block.put("tool_use_id", message.toolCallId() == null ? "" : message.toolCallId());
                block.put("content", message.content());
                pendingResults.add(block);
                continue;
            }
            flushResults(wire, pendingResults);

            Map<String, Object> row = new LinkedHashMap<>();
            if (message.role() == MessageRole.ASSISTANT && message.hasToolCalls()) {
                List<Map<String, Object>> content = new ArrayList<>();
                if (!message.content().isBlank()) {
                    content.add(Map.of("type", "text", "text", message.content()));
                }
                for (ToolCall call : message.toolCalls()) {
                    Map<String, Object> block = new LinkedHashMap<>();
                    block.put("type", "tool_use");
                    block.put("id", call.id());
                    block.put("name", call.name());
                    block.put("input", call.argumentMap());
                    content.add(block);
                }
                row.put("role", "assistant");
                row.put("content", content);
            } else {
                row.put("role", message.role() == MessageRole.ASSISTANT ? "assistant" : "user");
                row.put("content", message.content());
            }
            wire.add(row);
        }
        flushResults(wire, pendingResults);
        return wire;
    }

    // consecutive tool results travel in one user turn
    private void flushResults(List<Map<String, Object>> wire, List<Map<String, Object>> pendingResults) {
        if (pendingResults.isEmpty()) {
            return;
        }
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("role", "user");
        row.put("content", List.copyOf(pendingResults));
        wire.add(row);
        pendingResults.clear();
    }

    private List<Map<String, Object>> toAnthropicTools(List<Map<String, Object>> tools) {
        List<Map<String, Object>> mapped = new ArrayList<>();
        for (Map<String, Object> tool : tools) {
            Map<String, Object> function = AdapterSupport.functionSpec(tool);
            if (function.isEmpty()) {
                continue;
            }
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("name", function.get("name"));
            item.put("description", function.get("description"));
            item.put("input_schema", function.get("parameters"));
            mapped.add(item);
        }
        return mapped;
    }

    private Outcome<ChatResult> parse(JsonNode root, String model, boolean toolsAllowed) {
        JsonNode blocks = root.path("content");
        if (!blocks.isArray()) {
            return invalid(root);
        }

        List<ToolCall> toolCalls = new ArrayList<>();
        StringBuilder content = new StringBuilder();
        boolean sawText = false;
        for (JsonNode item : blocks) {
            String type = item.path("type").asText("");
            if ("text".equals(type)) {
                sawText = true;
                content.append(item.path("text").asText(""));
            } else if ("tool_use".equals(type) && toolsAllowed) {
                String name = item.path("name").asText("");
                if (name.isBlank()) {
                    return invalid(root);
                }
                toolCalls.add(new ToolCall(item.path("id").asText(""), name, inputJson(item.path("input"))));
            }
        }

        Usage usage = AdapterSupport.usage(root.path("usage"), "input_tokens", "output_tokens", null);
        String responseModel = root.path("model").asText(model);
        if (!toolCalls.isEmpty()) {
            AdapterSupport.recordUsage(ledger, id(), usage);
            return Outcome.success(ChatResult.toolCalls(content.toString(), toolCalls, usage, responseModel));
        }
        if (!toolsAllowed && !sawText) {
            return invalid(root);
        }
        AdapterSupport.recordUsage(ledger, id(), usage);
        return Outcome.success(ChatResult.content(content.toString(), usage, responseModel));
    }

    private String inputJson(JsonNode input) {
        if (!input.isObject()) {
            return "{}";
        }
        try {
            return http.mapper().writeValueAsString(input);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not re-encode tool input", e);
        }
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
