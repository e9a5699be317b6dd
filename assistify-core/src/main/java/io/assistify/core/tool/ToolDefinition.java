package io.assistify.core.tool;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public record ToolDefinition(
    String name,
    String description,
    Map<String, Object> parameterSchema,
    ToolCallback callback,
    boolean destructive,
    String category
) {
    public static final String DEFAULT_CATEGORY = "store";

    public ToolDefinition {
        Objects.requireNonNull(name, "name must not be null");
        name = name.trim();
        if (name.isEmpty()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        description = description == null ? "" : description;
        parameterSchema = parameterSchema == null ? Map.of() : copyOf(parameterSchema);
        category = category == null || category.isBlank() ? DEFAULT_CATEGORY : category.trim();
    }

    public ToolDefinition(String name, String description, Map<String, Object> parameterSchema, ToolCallback callback) {
        this(name, description, parameterSchema, callback, false, DEFAULT_CATEGORY);
    }

    public ToolDefinition(
        String name,
        String description,
        Map<String, Object> parameterSchema,
        ToolCallback callback,
        boolean destructive
    ) {
        this(name, description, parameterSchema, callback, destructive, DEFAULT_CATEGORY);
    }

    // keeps key order, which ends up in the projected catalog
    private static Map<String, Object> copyOf(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(String.valueOf(key), copyValue(value)));
        return Collections.unmodifiableMap(copy);
    }

    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return copyOf(map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>();
            list.forEach(item -> copy.add(copyValue(item)));
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
