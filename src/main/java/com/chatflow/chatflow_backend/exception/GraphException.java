package com.chatflow.chatflow_backend.exception;

/** Malformed flow: dangling node reference, missing default branch, bad expression. */
public class GraphException extends ConversationEngineException {

    public GraphException(String message) {
        super(message, false);
    }
}
