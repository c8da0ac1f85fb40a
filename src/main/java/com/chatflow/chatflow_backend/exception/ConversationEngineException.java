package com.chatflow.chatflow_backend.exception;

/**
 * Base of every failure the engine raises. {@link #isRetryable()} tells the caller whether handling
 * the same inbound event again may succeed.
 */
public abstract class ConversationEngineException extends RuntimeException {

    private final boolean retryable;

    protected ConversationEngineException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    protected ConversationEngineException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
