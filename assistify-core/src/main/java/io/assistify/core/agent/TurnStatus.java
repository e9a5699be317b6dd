package io.assistify.core.agent;

public enum TurnStatus {
    COMPLETED,
    CONFIRMATION_REQUIRED,
    FAILED
}
