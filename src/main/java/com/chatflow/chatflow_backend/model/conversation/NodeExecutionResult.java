package com.chatflow.chatflow_backend.model.conversation;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Effect of running one node. Handlers describe what should happen; the executor applies it.
 * Never persisted.
 */
@Value
@Builder
public class NodeExecutionResult {

    @Singular("message")
    List<OutboundMessage> messagesToSend;

    @Singular
    Map<String, String> variableUpdates;

    String nextNodeId;

    /** Set by JUMP: continue at this flow's start node. */
    UUID jumpToFlowId;

    boolean awaitingInput;
    boolean terminal;

    /** The triggering text was used by this node and must not be offered to later nodes. */
    boolean inputConsumed;

    /** Invalid-answer counter to store while awaiting input; null leaves it reset. */
    Integer inputAttempts;

    public static NodeExecutionResult continueTo(String nextNodeId) {
        return NodeExecutionResult.builder().nextNodeId(nextNodeId).build();
    }
}
