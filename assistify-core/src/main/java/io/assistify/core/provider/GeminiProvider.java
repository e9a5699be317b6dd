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
import java.util.UUID;
import okhttp3.HttpUrl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class GeminiProvider implements ChatProvider {
    private static final Logger LOG = LoggerFactory.getLogger(GeminiProvider.class);

    private final ProviderConfig config;
    private final HttpUrl apiBase;
    private final ProviderHttp http;
    private final UsageLedger ledger;

    public GeminiProvider(ProviderConfig config, ProviderHttp http, UsageLedger ledger) {
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
        try {
            payload.put("contents", toContents(messages));
        } catch (IllegalArgumentException e) {
            return Outcome.failure(AssistifyError.api("Could not encode request: " + e.getMessage(), 0, ""));
        }

        Map<String, Object> generationConfig = new LinkedHashMap<>();
        generationConfig.put("maxOutputTokens", effective.maxTokens());
        generationConfig.put("temperature", effective.temperature());
        payload.put("generationConfig", generationConfig);

        String system = AdapterSupport.systemContent(messages, effective);
        if (!system.isBlank()) {
            payload.put("systemInstruction", Map.of("parts", List.of(Map.of("text", system))));
        }
        if (!tools.isEmpty()) {
            payload.put("tools", List.of(Map.of("function_declarations", toDeclarations(tools))));
        }

        LOG.debug("Sending gemini request: model={}, messages={}, tools={}", model, messages.size(), tools.size());
        Outcome<JsonNode> response = http.postJson(
            generateUrl(model),
            Map.of(),
            payload,
            effective.timeoutSeconds()
        );
        if (!response.ok()) {
            return Outcome.failure(response.error());
        }
        return parse(response.value(), model, toolsAllowed);
    }

    private HttpUrl generateUrl(String model) {
        return apiBase.newBuilder()
            .addPathSegment("models")
            .addPathSegment(model + ":generateContent")
            .addQueryParameter("key", config.credential())
            .build();
    }

    private List<Map<String, Object>> toContents(List<ChatMessage> messages) {
        List<Map<String, Object>> contents = new ArrayList<>();
        List<Map<String, Object>> pendingResponses = new ArrayList<>();

        for (ChatMessage message : messages) {
            if (message.role() == MessageRole.SYSTEM) {
                continue;
            }
            if (message.role() == MessageRole.TOOL) {
                Map<String, Object> functionResponse = new LinkedHashMap<>();
                functionResponse.put("name", AdapterSupport.toolNameFor(message, messages));
                functionResponse.put("response", Map.of("result", message.content()));
                pendingResponses.add(Map.of("functionResponse", functionResponse));
                continue;
            }
            flushResponses(contents, pendingResponses);

            List<Map<String, Object>> parts = new ArrayList<>();
            if (!message.content().isBlank() || !message.hasToolCalls()) {
                parts.add(Map.of("text", message.content()));
            }
            for (ToolCall call : message.toolCalls()) {
                Map<String, Object> functionCall = new LinkedHashMap<>();
                functionCall.put("name", call.name());
                functionCall.put("args", call.argumentMap());
                parts.add(Map.of("functionCall", functionCall));
            }

            Map<String, Object> content = new LinkedHashMap<>();
            content.put("role", message.role() == MessageRole.ASSISTANT ? "model" : "user");
            content.put("parts", parts);
            contents.add(content);
        }
        flushResponses(contents, pendingResponses);
        return contents;
    }

    private void flushResponses(List<Map<String, Object>> contents, List<Map<String, Object>> pendingResponses) {
        if (pendingResponses.isEmpty()) {
            return;
        }
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("role", "function");
        content.put("parts", List.copyOf(pendingResponses));
        contents.add(content);
        pendingResponses.clear();
    }

    private List<Map<String, Object>> toDeclarations(List<Map<String, Object>> tools) {
        List<Map<String, Object>> declarations = new ArrayList<>();
        for (Map<String, Object> tool : tools) {
            Map<String, Object> function = AdapterSupport.functionSpec(tool);
            if (!function.isEmpty()) {
                declarations.add(function);
            }
        }
        return declarations;
    }

    private Outcome<ChatResult> parse(JsonNode root, String model, boolean toolsAllowed) {
        JsonNode candidate = root.path("candidates").path(0);
        JsonNode parts = candidate.path("content").path("parts");
        if (!parts.isArray()) {
            String finishReason = candidate.path("finishReason").asText("");
            String message = finishReason.isBlank()
                ? "Invalid response format from " + displayName() + "."
                : displayName() + " returned no content (finish reason " + finishReason + ").";
            return Outcome.failure(new AssistifyError(ErrorCode.INVALID_RESPONSE, message, 0, root.toString()));
        }

        List<ToolCall> toolCalls = new ArrayList<>();
        StringBuilder content = new StringBuilder();
        boolean sawText = false;
        for (JsonNode part : parts) {
            if (part.has("text")) {
                sawText = true;
                content.append(part.path("text").asText(""));
            }
            JsonNode functionCall = part.path("functionCall");
            if (toolsAllowed && functionCall.isObject()) {
                String name = functionCall.path("name").asText("");
                if (name.isBlank()) {
                    return invalid(root);
                }
                toolCalls.add(new ToolCall(newCallId(), name, argsJson(functionCall.path("args"))));
            }
        }

        Usage usage = AdapterSupport.usage(
            root.path("usageMetadata"),
            "promptTokenCount",
            "candidatesTokenCount",
            "totalTokenCount"
        );
        String responseModel = root.path("modelVersion").asText(model);
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

    private String argsJson(JsonNode args) {
        if (!args.isObject()) {
            return "{}";
        }
        try {
            return http.mapper().writeValueAsString(args);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not re-encode function call args", e);
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

    private String newCallId() {
        return "call_" + UUID.randomUUID().toString().replace("-", "").substring(0, 24);
    }
}
