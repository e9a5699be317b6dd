package io.assistify.core.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.assistify.core.error.AssistifyError;
import io.assistify.core.error.ErrorCode;
import io.assistify.core.error.Outcome;
import io.assistify.core.model.ToolCall;
import io.assistify.core.observability.AuditSink;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ToolRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(ToolRegistry.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    private final Map<String, ToolDefinition> tools = new LinkedHashMap<>();
    private final AuditSink audit;

    public ToolRegistry() {
        this(AuditSink.NOOP);
    }

    public ToolRegistry(AuditSink audit) {
        this.audit = audit == null ? AuditSink.NOOP : audit;
    }

    public synchronized void register(ToolDefinition tool) {
        ToolDefinition previous = tools.put(tool.name(), tool);
        if (previous != null) {
            LOG.debug("Replaced tool definition {}", tool.name());
        }
    }

    public void register(
        String name,
        String description,
        Map<String, Object> parameterSchema,
        ToolCallback callback,
        boolean destructive
    ) {
        register(new ToolDefinition(name, description, parameterSchema, callback, destructive));
    }

    public synchronized boolean unregister(String name) {
        return tools.remove(name) != null;
    }

    public synchronized Optional<ToolDefinition> find(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public synchronized Collection<ToolDefinition> all() {
        return List.copyOf(tools.values());
    }

    public synchronized List<ToolDefinition> byCategory(String category) {
        return tools.values().stream()
            .filter(tool -> tool.category().equalsIgnoreCase(category))
            .toList();
    }

    public synchronized boolean isDestructive(String name) {
        ToolDefinition tool = tools.get(name);
        return tool != null && tool.destructive();
    }

    public List<Map<String, Object>> projectFor(String format) {
        return projectFor(ToolFormat.parse(format));
    }

    public synchronized List<Map<String, Object>> projectFor(ToolFormat format) {
        List<Map<String, Object>> projected = new ArrayList<>();
        for (ToolDefinition tool : tools.values()) {
            Map<String, Object> schema = schemaFor(tool);
            if (format == ToolFormat.ANTHROPIC) {
                Map<String, Object> item = new LinkedHashMap<>();
                item.put("name", tool.name());
                item.put("description", tool.description());
                item.put("input_schema", schema);
                projected.add(item);
            } else {
                Map<String, Object> function = new LinkedHashMap<>();
                function.put("name", tool.name());
                function.put("description", tool.description());
                function.put("parameters", schema);
                Map<String, Object> item = new LinkedHashMap<>();
                item.put("type", "function");
                item.put("function", function);
                projected.add(item);
            }
        }
        return projected;
    }

    public Outcome<Object> execute(ToolCall call) {
        Map<String, Object> arguments;
        try {
            arguments = call.argumentMap();
        } catch (IllegalArgumentException e) {
            return reject(call.name(), AssistifyError.of(ErrorCode.INVALID_ARGUMENTS, e.getMessage()));
        }
        return execute(call.name(), arguments);
    }

    public Outcome<Object> execute(String name, Map<String, Object> arguments) {
        Map<String, Object> input = arguments == null ? Map.of() : arguments;
        Optional<ToolDefinition> found = find(name);
        if (found.isEmpty()) {
            return reject(name, AssistifyError.of(ErrorCode.INVALID_TOOL, "Tool '" + name + "' is not registered."));
        }
        ToolDefinition tool = found.get();
        if (tool.callback() == null) {
            return reject(name, AssistifyError.of(ErrorCode.INVALID_CALLBACK, "Tool '" + name + "' has no callback."));
        }
        List<String> problems = ParameterValidator.validate(tool.parameterSchema(), input);
        if (!problems.isEmpty()) {
            return reject(name, AssistifyError.of(
                ErrorCode.INVALID_ARGUMENTS,
                "Invalid arguments for tool '" + name + "': " + String.join("; ", problems)
            ));
        }

        long started = System.currentTimeMillis();
        record("tool_started", name, started, Map.of("input_chars", encodedLength(input)));
        try {
            Object result = tool.callback().invoke(input);
            record("tool_succeeded", name, started, Map.of("output_chars", encodedLength(result)));
            return Outcome.success(result);
        } catch (Exception e) {
            LOG.warn("Tool {} failed", name, e);
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            record("tool_failed", name, started, Map.of("error", message));
            return Outcome.failure(ErrorCode.TOOL_EXECUTION_ERROR, "Tool '" + name + "' failed: " + message);
        }
    }

    private Outcome<Object> reject(String name, AssistifyError error) {
        LOG.debug("Rejected call to tool {}: {}", name, error.message());
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("tool_name", name == null ? "" : name);
        attrs.put("error", error.code().wireName());
        emit("tool_rejected", attrs);
        return Outcome.failure(error);
    }

    private void record(String type, String toolName, long startedAtMillis, Map<String, Object> extra) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("tool_name", toolName);
        attrs.put("duration_ms", Math.max(0, System.currentTimeMillis() - startedAtMillis));
        attrs.putAll(extra);
        emit(type, attrs);
    }

    private void emit(String type, Map<String, Object> attrs) {
        try {
            audit.record(type, attrs);
        } catch (IOException e) {
            LOG.warn("Failed to record {} audit event: {}", type, e.getMessage());
        }
    }

    private Map<String, Object> schemaFor(ToolDefinition tool) {
        Map<String, Object> schema = new LinkedHashMap<>(tool.parameterSchema());
        schema.putIfAbsent("type", "object");
        if (!(schema.get("properties") instanceof Map<?, ?>)) {
            schema.put("properties", new LinkedHashMap<String, Object>());
        }
        return schema;
    }

    private int encodedLength(Object value) {
        try {
            return JSON.writeValueAsString(value).length();
        } catch (IOException e) {
            return String.valueOf(value).length();
        }
    }
}
