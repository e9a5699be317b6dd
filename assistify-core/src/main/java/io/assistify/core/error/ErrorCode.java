package io.assistify.core.error;

public enum ErrorCode {
    NOT_CONFIGURED("not_configured"),
    INVALID_PROVIDER("invalid_provider"),
    API_ERROR("api_error"),
    INVALID_RESPONSE("invalid_response"),
    INVALID_TOOL("invalid_tool"),
    INVALID_CALLBACK("invalid_callback"),
    INVALID_ARGUMENTS("invalid_arguments"),
    TOOL_EXECUTION_ERROR("tool_execution_error"),
    TOOL_LOOP_EXCEEDED("tool_loop_exceeded"),
    CONFIRMATION_EXPIRED("confirmation_expired");

    private final String wireName;

    ErrorCode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
