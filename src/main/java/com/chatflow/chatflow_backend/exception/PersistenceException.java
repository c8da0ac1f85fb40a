package com.chatflow.chatflow_backend.exception;

public class PersistenceException extends ConversationEngineException {

    public PersistenceException(String message, Throwable cause) {
        super(message, false, cause);
    }
}
