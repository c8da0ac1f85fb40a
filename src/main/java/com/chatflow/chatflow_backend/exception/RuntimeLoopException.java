package com.chatflow.chatflow_backend.exception;

public class RuntimeLoopException extends ConversationEngineException {

    public RuntimeLoopException(int cap, String lastNodeId) {
        super("Execution stopped: more than " + cap + " node steps in one event (last node '"
                + lastNodeId + "'). Possible cycle in flow.", false);
    }
}
