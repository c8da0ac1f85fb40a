package com.chatflow.chatflow_backend.model.conversation;

public enum OutcomeStatus {
    COMPLETED,
    AWAITING_INPUT,
    FAILED,
    WINDOW_EXPIRED;

    public static OutcomeStatus fromRunState(RunState runState) {
        return switch (runState) {
            case AWAITING_INPUT, RUNNING -> AWAITING_INPUT;
            case COMPLETED -> COMPLETED;
            case FAILED, EXPIRED -> FAILED;
        };
    }
}
