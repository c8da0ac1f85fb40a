package com.chatflow.chatflow_backend.executor;

import com.chatflow.chatflow_backend.model.conversation.NodeExecutionResult;
import com.chatflow.chatflow_backend.model.domain.NodeType;
import com.chatflow.chatflow_backend.model.flow.NodeDefinition;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class AssignmentHandler implements NodeHandler {

    private final VariableResolver resolver;

    @Override
    public NodeType supportedType() {
        return NodeType.ASSIGNMENT;
    }

    /*
     * Config shape:
     * {
     *   "assignments": {
     *     "plan":     "premium",
     *     "greeting": "Hi {{name}}",
     *     "total":    "{{price * qty}}"
     *   }
     * }
     * Assignments see the variables as they were before the node; they do not chain.
     */
    @Override
    @SuppressWarnings("unchecked")
    public NodeExecutionResult execute(NodeDefinition node, NodeExecutionContext context) {
        Map<String, Object> assignments = (Map<String, Object>) node.config().getOrDefault("assignments", new HashMap<>());

        Map<String, String> resolved = new LinkedHashMap<>(resolver.resolveMap(assignments, context.variables()));
        resolved.replaceAll((key, value) -> value != null ? value : "");

        return NodeExecutionResult.builder()
                .variableUpdates(resolved)
                .nextNodeId(node.defaultNext())
                .build();
    }
}
