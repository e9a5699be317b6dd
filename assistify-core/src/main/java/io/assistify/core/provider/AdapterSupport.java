package io.assistify.core.provider;

import com.fasterxml.jackson.databind.JsonNode;
import io.assistify.core.model.ChatMessage;
import io.assistify.core.model.ChatOptions;
import io.assistify.core.model.MessageRole;
import io.assistify.core.model.ToolCall;
import io.assistify.core.model.Usage;
import io.assistify.core.usage.UsageLedger;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class AdapterSupport {
    private static final Logger LOG = LoggerFactory.getLogger(AdapterSupport.class);

    private AdapterSupport() {
    }

    static String systemContent(List<ChatMessage> messages, ChatOptions options) {
        List<String> parts = new ArrayList<>();
        if (options.systemPrompt() != null) {
            parts.add(options.systemPrompt());
        }
        for (ChatMessage message : messages) {
            if (message.role() == MessageRole.SYSTEM && !message.content().isBlank()) {
                parts.add(message.content());
            }
        }
        return String.join("\n\n", parts);
    }

    static Usage usage(JsonNode node, String promptField, String completionField, String totalField) {
        if (node == null || !node.isObject()) {
            return Usage.ZERO;
        }
        long prompt = node.path(promptField).asLong(0);
        long completion = node.path(completionField).asLong(0);
        long total = totalField == null ? prompt + completion : node.path(totalField).asLong(prompt + completion);
        return new Usage(prompt, completion, total);
    }

    static void recordUsage(UsageLedger ledger, String providerId, Usage usage) {
        if (ledger == null) {
            return;
        }
        try {
            ledger.record(providerId, usage);
        } catch (IOException e) {
            LOG.warn("Failed to record usage for provider {}: {}", providerId, e.getMessage());
        }
    }

    static Map<String, Object> functionSpec(Map<String, Object> tool) {
        Map<?, ?> source = tool;
        if (tool.get("function") instanceof Map<?, ?> function) {
            source = function;
        }
        Object name = source.get("name");
        if (!(name instanceof String s) || s.isBlank()) {
            return Map.of();
        }
        Object description = source.get("description");
        Object parameters = source.containsKey("parameters") ? source.get("parameters") : source.get("input_schema");

        Map<String, Object> spec = new LinkedHashMap<>();
        spec.put("name", s);
        spec.put("description", description == null ? "" : String.valueOf(description));
        spec.put("parameters", objectSchema(parameters));
        return spec;
    }

    static Map<String, Object> objectSchema(Object schema) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        if (schema instanceof Map<?, ?> map) {
            map.forEach((key, value) -> normalized.put(String.valueOf(key), value));
        }
        normalized.putIfAbsent("type", "object");
        if (!(normalized.get("properties") instanceof Map<?, ?>)) {
            normalized.put("properties", new LinkedHashMap<String, Object>());
        }
        return normalized;
    }

    static String toolNameFor(ChatMessage toolMessage, List<ChatMessage> conversation) {
        if (toolMessage.toolName() != null && !toolMessage.toolName().isBlank()) {
            return toolMessage.toolName();
        }
        String callId = toolMessage.toolCallId();
        if (callId == null || callId.isBlank()) {
            return "";
        }
        for (ChatMessage message : conversation) {
            for (ToolCall call : message.toolCalls()) {
                if (callId.equals(call.id())) {
                    return call.name();
                }
            }
        }
        return "";
    }
}
