package com.chatflow.chatflow_backend.executor;

import com.chatflow.chatflow_backend.exception.GraphException;
import com.chatflow.chatflow_backend.model.conversation.NodeExecutionResult;
import com.chatflow.chatflow_backend.model.domain.NodeType;
import com.chatflow.chatflow_backend.model.flow.NodeDefinition;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Executes JUMP nodes: { "targetFlowId": "uuid-of-other-flow" }.
 *
 * The conversation keeps its key and its variables; only the active flow changes and execution
 * continues at the target flow's start node. Jumping to the current flow restarts it, which is a
 * legitimate loop bounded by the iteration cap.
 */
@Component
public class JumpHandler implements NodeHandler {

    @Override
    public NodeType supportedType() {
        return NodeType.JUMP;
    }

    @Override
    public NodeExecutionResult execute(NodeDefinition node, NodeExecutionContext context) {
        String target = node.configString("targetFlowId");
        if (target == null || target.isBlank()) {
            throw new GraphException("JUMP node '" + node.id() + "' has no targetFlowId configured");
        }
        UUID targetFlowId;
        try {
            targetFlowId = UUID.fromString(target.trim());
        } catch (IllegalArgumentException ex) {
            throw new GraphException("JUMP node '" + node.id() + "' has invalid targetFlowId: " + target);
        }
        return NodeExecutionResult.builder().jumpToFlowId(targetFlowId).build();
    }
}
