package com.chatflow.chatflow_backend.model.flow;

import java.util.Map;

/**
 * Outgoing edges of a node: the default next node plus named branches.
 */
public record NodeTransitions(String defaultNext, Map<String, String> branches) {

    public static final NodeTransitions NONE = new NodeTransitions(null, Map.of());

    public NodeTransitions {
        branches = branches != null ? Map.copyOf(branches) : Map.of();
    }

    public static NodeTransitions to(String next) {
        return new NodeTransitions(next, Map.of());
    }

    public String branch(String key) {
        return key != null ? branches.get(key) : null;
    }
}
