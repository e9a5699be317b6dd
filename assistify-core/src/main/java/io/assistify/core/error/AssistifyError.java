package io.assistify.core.error;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record AssistifyError(ErrorCode code, String message, int statusCode, String rawBody) {

    public AssistifyError {
        Objects.requireNonNull(code, "code must not be null");
        message = message == null || message.isBlank() ? code.wireName() : message;
        statusCode = Math.max(0, statusCode);
        rawBody = rawBody == null ? "" : rawBody;
    }

    public static AssistifyError of(ErrorCode code, String message) {
        return new AssistifyError(code, message, 0, "");
    }

    public static AssistifyError api(String message, int statusCode, String rawBody) {
        return new AssistifyError(ErrorCode.API_ERROR, message, statusCode, rawBody);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("success", false);
        map.put("error", code.wireName());
        map.put("message", message);
        if (statusCode > 0) {
            map.put("status", statusCode);
        }
        return map;
    }
}
