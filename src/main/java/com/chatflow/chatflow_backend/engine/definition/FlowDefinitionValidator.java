package com.chatflow.chatflow_backend.engine.definition;

import com.chatflow.chatflow_backend.exception.GraphException;
import com.chatflow.chatflow_backend.model.domain.NodeType;
import com.chatflow.chatflow_backend.model.flow.FlowDefinition;
import com.chatflow.chatflow_backend.model.flow.NodeDefinition;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Structural checks run once per published version, before any conversation executes it.
 * All problems are collected and reported together.
 */
@Component
public class FlowDefinitionValidator {

    public void validate(FlowDefinition flow) {
        List<String> problems = new ArrayList<>();

        if (flow.startNodeId() == null) {
            problems.add("no start node designated");
        } else if (!flow.hasNode(flow.startNodeId())) {
            problems.add("start node '" + flow.startNodeId() + "' does not exist");
        }

        for (NodeDefinition node : flow.allNodes()) {
            checkNode(flow, node, problems);
        }

        if (!problems.isEmpty()) {
            throw new GraphException("Flow " + flow.id() + " v" + flow.version() + " is invalid: "
                    + String.join("; ", problems));
        }
    }

    private void checkNode(FlowDefinition flow, NodeDefinition node, List<String> problems) {
        String id = node.id();
        if (node.type() == null) {
            problems.add("node '" + id + "' has no type");
            return;
        }

        String next = node.defaultNext();
        if (next != null && !flow.hasNode(next)) {
            problems.add("node '" + id + "' points to missing node '" + next + "'");
        }
        node.transitions().branches().forEach((branch, target) -> {
            if (!flow.hasNode(target)) {
                problems.add("node '" + id + "' branch '" + branch + "' points to missing node '" + target + "'");
            }
        });

        switch (node.type()) {
            case MESSAGE, ASSIGNMENT, EXTERNAL_CALL -> {
                if (next == null) problems.add(node.type() + " node '" + id + "' has no next node");
            }
            case QUESTION -> {
                if (next == null) problems.add("QUESTION node '" + id + "' has no next node");
                if (blank(node.configString("variable"))) {
                    problems.add("QUESTION node '" + id + "' names no variable");
                }
            }
            case CONDITION -> {
                if (next == null && node.transitions().branches().isEmpty()) {
                    problems.add("CONDITION node '" + id + "' has neither branches nor a default");
                }
            }
            case JUMP -> {
                String target = node.configString("targetFlowId");
                if (blank(target)) {
                    problems.add("JUMP node '" + id + "' has no targetFlowId");
                } else if (!isUuid(target)) {
                    problems.add("JUMP node '" + id + "' has invalid targetFlowId '" + target + "'");
                }
            }
            case END -> {
                if (next != null || !node.transitions().branches().isEmpty()) {
                    problems.add("END node '" + id + "' must not have outgoing edges");
                }
            }
            default -> problems.add("node '" + id + "' has unsupported type " + node.type());
        }
    }

    private static boolean blank(String s) {
        return s == null || s.isBlank();
    }

    private static boolean isUuid(String s) {
        try {
            UUID.fromString(s.trim());
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
