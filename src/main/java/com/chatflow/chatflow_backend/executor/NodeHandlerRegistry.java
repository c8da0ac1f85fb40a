package com.chatflow.chatflow_backend.executor;

import com.chatflow.chatflow_backend.exception.GraphException;
import com.chatflow.chatflow_backend.model.domain.NodeType;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class NodeHandlerRegistry {

    private final Map<NodeType, NodeHandler> registry = new EnumMap<>(NodeType.class);

    public NodeHandlerRegistry(List<NodeHandler> handlers) {
        for (NodeHandler handler : handlers) {
            NodeHandler previous = registry.put(handler.supportedType(), handler);
            if (previous != null) {
                throw new IllegalStateException("Two handlers registered for " + handler.supportedType()
                        + ": " + previous.getClass().getSimpleName() + ", " + handler.getClass().getSimpleName());
            }
        }
    }

    public NodeHandler get(NodeType type) {
        NodeHandler handler = type != null ? registry.get(type) : null;
        if (handler == null) {
            throw new GraphException("No handler registered for node type: " + type);
        }
        return handler;
    }
}
