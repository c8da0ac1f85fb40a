package com.chatflow.chatflow_backend.executor;

import com.chatflow.chatflow_backend.model.conversation.NodeExecutionResult;
import com.chatflow.chatflow_backend.model.domain.NodeType;
import com.chatflow.chatflow_backend.model.flow.NodeDefinition;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class EndHandler implements NodeHandler {

    private final MessageComposer composer;

    @Override
    public NodeType supportedType() {
        return NodeType.END;
    }

    /*
     * Config shape (all optional):
     * { "text": "Bye {{name}}" }  or  { "template": { ... } }
     */
    @Override
    public NodeExecutionResult execute(NodeDefinition node, NodeExecutionContext context) {
        NodeExecutionResult.NodeExecutionResultBuilder result = NodeExecutionResult.builder().terminal(true);
        composer.compose(node, "text", context.variables()).ifPresent(result::message);
        return result.build();
    }
}
