package com.chatflow.chatflow_backend.model.flow;

import com.chatflow.chatflow_backend.exception.GraphException;

import java.util.Collection;
import java.util.Map;
import java.util.UUID;

/**
 * Published, immutable view of a flow graph. Shared read-only across every execution.
 */
public record FlowDefinition(UUID id,
                             int version,
                             String tenantId,
                             String startNodeId,
                             Map<String, NodeDefinition> nodes) {

    public FlowDefinition {
        nodes = nodes != null ? Map.copyOf(nodes) : Map.of();
        tenantId = tenantId != null ? tenantId : "default";
    }

    public NodeDefinition requireNode(String nodeId) {
        NodeDefinition node = nodeId != null ? nodes.get(nodeId) : null;
        if (node == null) {
            throw new GraphException("Flow " + id + " v" + version + " has no node '" + nodeId + "'");
        }
        return node;
    }

    public boolean hasNode(String nodeId) {
        return nodeId != null && nodes.containsKey(nodeId);
    }

    public Collection<NodeDefinition> allNodes() {
        return nodes.values();
    }
}
