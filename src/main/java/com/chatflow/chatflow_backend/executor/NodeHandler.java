package com.chatflow.chatflow_backend.executor;

import com.chatflow.chatflow_backend.model.conversation.NodeExecutionResult;
import com.chatflow.chatflow_backend.model.domain.NodeType;
import com.chatflow.chatflow_backend.model.flow.NodeDefinition;

public interface NodeHandler {

    NodeType supportedType();

    // Computes the node's effect from the context; never mutates conversation state itself
    NodeExecutionResult execute(NodeDefinition node, NodeExecutionContext context);
}
