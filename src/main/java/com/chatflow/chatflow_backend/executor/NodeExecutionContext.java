package com.chatflow.chatflow_backend.executor;

import com.chatflow.chatflow_backend.model.flow.FlowDefinition;

import java.util.Collections;
import java.util.Map;

/**
 * Read-only inputs of one node step.
 *
 * @param variables    current conversation variables (unmodifiable)
 * @param pendingInput inbound text not yet consumed by any node this event, or null
 * @param resuming     true when this node is the question that was awaiting the contact's answer
 * @param inputAttempts invalid answers already given to the awaiting question
 */
public record NodeExecutionContext(String contactAddress,
                                   FlowDefinition flow,
                                   Map<String, String> variables,
                                   String pendingInput,
                                   boolean resuming,
                                   int inputAttempts) {

    public NodeExecutionContext {
        variables = variables != null ? Collections.unmodifiableMap(variables) : Map.of();
    }

    public boolean hasPendingInput() {
        return pendingInput != null;
    }
}
