package com.chatflow.chatflow_backend.exception;

import java.util.UUID;

public class FlowNotFoundException extends GraphException {

    private final UUID flowId;

    public FlowNotFoundException(UUID flowId) {
        super("Flow not found or not published: " + flowId);
        this.flowId = flowId;
    }

    public UUID getFlowId() {
        return flowId;
    }
}
