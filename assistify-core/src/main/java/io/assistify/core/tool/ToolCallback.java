package io.assistify.core.tool;

import java.util.Map;

@FunctionalInterface
public interface ToolCallback {
    Object invoke(Map<String, Object> arguments) throws Exception;
}
