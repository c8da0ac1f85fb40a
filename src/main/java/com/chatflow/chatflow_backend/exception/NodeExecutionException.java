package com.chatflow.chatflow_backend.exception;

/** Unexpected failure inside a node handler. */
public class NodeExecutionException extends ConversationEngineException {

    public NodeExecutionException(String nodeId, Throwable cause) {
        super("Node '" + nodeId + "' failed: "
                + (cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName()), false, cause);
    }
}
