package io.assistify.core.agent;

enum LoopState {
    AWAITING_MODEL,
    TOOLS_REQUESTED,
    EXECUTING_TOOLS,
    DONE
}
