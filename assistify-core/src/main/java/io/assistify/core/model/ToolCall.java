package io.assistify.core.model;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import java.util.Objects;

public record ToolCall(String id, String name, String arguments) {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    public ToolCall {
        Objects.requireNonNull(name, "name must not be null");
        id = id == null ? "" : id;
        arguments = arguments == null || arguments.isBlank() ? "{}" : arguments;
    }

    public static ToolCall of(String id, String name, Map<String, Object> arguments) {
        return new ToolCall(id, name, encode(arguments));
    }

    public Map<String, Object> argumentMap() {
        return decode(arguments);
    }

    public static Map<String, Object> decode(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> decoded = JSON.readValue(json, MAP_TYPE);
            return decoded == null ? Map.of() : decoded;
        } catch (Exception e) {
            throw new IllegalArgumentException("Tool arguments are not a JSON object: " + e.getMessage(), e);
        }
    }

    public static String encode(Map<String, Object> arguments) {
        try {
            return JSON.writeValueAsString(arguments == null ? Map.of() : arguments);
        } catch (Exception e) {
            throw new IllegalArgumentException("Tool arguments are not serializable", e);
        }
    }
}
