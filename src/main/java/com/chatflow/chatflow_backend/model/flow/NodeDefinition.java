package com.chatflow.chatflow_backend.model.flow;

import com.chatflow.chatflow_backend.model.domain.NodeType;

import java.util.Map;

public record NodeDefinition(String id,
                             NodeType type,
                             String label,
                             Map<String, Object> config,
                             NodeTransitions transitions) {

    public NodeDefinition {
        config = config != null ? Map.copyOf(config) : Map.of();
        transitions = transitions != null ? transitions : NodeTransitions.NONE;
    }

    public String configString(String key) {
        Object value = config.get(key);
        return value != null ? value.toString() : null;
    }

    public String configString(String key, String fallback) {
        String value = configString(key);
        return value != null ? value : fallback;
    }

    public String defaultNext() {
        return transitions.defaultNext();
    }
}
