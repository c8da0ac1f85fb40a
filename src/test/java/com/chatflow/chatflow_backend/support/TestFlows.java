package com.chatflow.chatflow_backend.support;

import com.chatflow.chatflow_backend.model.domain.NodeType;
import com.chatflow.chatflow_backend.model.flow.FlowDefinition;
import com.chatflow.chatflow_backend.model.flow.NodeDefinition;
import com.chatflow.chatflow_backend.model.flow.NodeTransitions;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/** Small factory for in-memory flow graphs used across tests. */
public final class TestFlows {

    private TestFlows() {
    }

    public static FlowDefinition flow(UUID id, String startNodeId, NodeDefinition... nodes) {
        return flow(id, 1, startNodeId, nodes);
    }

    public static FlowDefinition flow(UUID id, int version, String startNodeId, NodeDefinition... nodes) {
        Map<String, NodeDefinition> byId = Arrays.stream(nodes)
                .collect(Collectors.toMap(NodeDefinition::id, Function.identity(), (a, b) -> b, LinkedHashMap::new));
        return new FlowDefinition(id, version, "tenant-a", startNodeId, byId);
    }

    public static NodeDefinition node(String id, NodeType type, Map<String, Object> config, String next) {
        return new NodeDefinition(id, type, id, config, NodeTransitions.to(next));
    }

    public static NodeDefinition node(String id, NodeType type, Map<String, Object> config,
                                      String next, Map<String, String> branches) {
        return new NodeDefinition(id, type, id, config, new NodeTransitions(next, branches));
    }

    public static NodeDefinition message(String id, String text, String next) {
        return node(id, NodeType.MESSAGE, Map.of("text", text), next);
    }

    public static NodeDefinition template(String id, String templateName, String next) {
        return node(id, NodeType.MESSAGE,
                Map.of("template", Map.of("name", templateName, "language", "en", "params", Map.of("1", "{{name}}"))),
                next);
    }

    public static NodeDefinition question(String id, String prompt, String variable, String next) {
        return node(id, NodeType.QUESTION, Map.of("prompt", prompt, "variable", variable), next);
    }

    public static NodeDefinition assign(String id, Map<String, Object> assignments, String next) {
        return node(id, NodeType.ASSIGNMENT, Map.of("assignments", assignments), next);
    }

    public static NodeDefinition end(String id) {
        return node(id, NodeType.END, Map.of(), null);
    }
}
