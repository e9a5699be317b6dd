package io.assistify.core.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.assistify.core.error.Outcome;
import io.assistify.core.model.ToolCall;
import io.assistify.core.model.ToolResult;
import io.assistify.core.tool.ToolRegistry;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class ToolCallExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(ToolCallExecutor.class);

    private final ToolRegistry registry;
    private final ObjectMapper mapper = new ObjectMapper();

    ToolCallExecutor(ToolRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    ToolResult execute(ToolCall call) {
        Outcome<Object> outcome = registry.execute(call);
        if (outcome.ok()) {
            return new ToolResult(call.id(), call.name(), true, toJson(outcome.value()));
        }
        return new ToolResult(call.id(), call.name(), false, toJson(outcome.error().toMap()));
    }

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            LOG.warn("Tool result is not JSON serializable, sending its string form: {}", e.getOriginalMessage());
            return String.valueOf(value);
        }
    }
}
