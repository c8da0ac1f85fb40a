package com.chatflow.chatflow_backend.executor;

import com.chatflow.chatflow_backend.exception.GraphException;
import com.chatflow.chatflow_backend.model.conversation.NodeExecutionResult;
import com.chatflow.chatflow_backend.model.conversation.OutboundMessage;
import com.chatflow.chatflow_backend.model.domain.NodeType;
import com.chatflow.chatflow_backend.model.flow.NodeDefinition;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class MessageHandler implements NodeHandler {

    private final MessageComposer composer;

    @Override
    public NodeType supportedType() {
        return NodeType.MESSAGE;
    }

    @Override
    public NodeExecutionResult execute(NodeDefinition node, NodeExecutionContext context) {
        OutboundMessage message = composer.compose(node, "text", context.variables())
                .orElseThrow(() -> new GraphException("MESSAGE node '" + node.id() + "' has neither text nor template"));

        return NodeExecutionResult.builder()
                .message(message)
                .nextNodeId(node.defaultNext())
                .build();
    }
}
