package com.chatflow.chatflow_backend.exception;

/**
 * Timeout, transport failure or non-2xx answer from an external-call node.
 * Timeouts, 5xx and 429 are retryable; other 4xx are not.
 */
public class ExternalCallException extends ConversationEngineException {

    private final int statusCode;

    public ExternalCallException(String message, int statusCode, boolean retryable) {
        super(message, retryable);
        this.statusCode = statusCode;
    }

    public ExternalCallException(String message, boolean retryable, Throwable cause) {
        super(message, retryable, cause);
        this.statusCode = -1;
    }

    public static ExternalCallException timeout(String target, long timeoutMs) {
        return new ExternalCallException("External call to " + target + " timed out after " + timeoutMs + " ms", -1, true);
    }

    public static ExternalCallException forStatus(String target, int statusCode) {
        boolean retryable = statusCode >= 500 || statusCode == 429;
        return new ExternalCallException("External call to " + target + " returned HTTP " + statusCode, statusCode, retryable);
    }

    /** -1 when no HTTP answer was received. */
    public int getStatusCode() {
        return statusCode;
    }
}
