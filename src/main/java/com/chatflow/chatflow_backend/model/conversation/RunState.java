package com.chatflow.chatflow_backend.model.conversation;

public enum RunState {
    RUNNING,
    AWAITING_INPUT,
    COMPLETED,
    FAILED,
    EXPIRED;

    /** currentNodeId is non-null exactly in these states. */
    public boolean isActive() {
        return this == RUNNING || this == AWAITING_INPUT;
    }

    public boolean isTerminal() {
        return !isActive();
    }
}
