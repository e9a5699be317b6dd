package io.assistify.core.tool;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

final class ParameterValidator {

    private ParameterValidator() {
    }

    static List<String> validate(Map<String, Object> schema, Map<String, Object> arguments) {
        List<String> problems = new ArrayList<>();
        if (schema == null || schema.isEmpty()) {
            return problems;
        }

        if (schema.get("required") instanceof Collection<?> required) {
            for (Object name : required) {
                String key = String.valueOf(name);
                if (!arguments.containsKey(key) || arguments.get(key) == null) {
                    problems.add("missing required parameter '" + key + "'");
                }
            }
        }

        if (schema.get("properties") instanceof Map<?, ?> properties) {
            for (Map.Entry<?, ?> property : properties.entrySet()) {
                String key = String.valueOf(property.getKey());
                Object value = arguments.get(key);
                if (value == null || !(property.getValue() instanceof Map<?, ?> definition)) {
                    continue;
                }
                Object type = definition.get("type");
                if (type instanceof String expected && !matches(expected, value)) {
                    problems.add("parameter '" + key + "' must be of type " + expected);
                }
            }
        }
        return problems;
    }

    private static boolean matches(String type, Object value) {
        return switch (type) {
            case "string" -> value instanceof String;
            case "integer" -> value instanceof Number number && number.doubleValue() == Math.rint(number.doubleValue());
            case "number" -> value instanceof Number;
            case "boolean" -> value instanceof Boolean;
            case "array" -> value instanceof List<?>;
            case "object" -> value instanceof Map<?, ?>;
            default -> true;
        };
    }
}
