package com.chatflow.chatflow_backend.engine.definition;

import com.chatflow.chatflow_backend.FlowStatus;
import com.chatflow.chatflow_backend.exception.FlowNotFoundException;
import com.chatflow.chatflow_backend.exception.GraphException;
import com.chatflow.chatflow_backend.model.domain.Flow;
import com.chatflow.chatflow_backend.model.domain.FlowEdge;
import com.chatflow.chatflow_backend.model.domain.FlowNode;
import com.chatflow.chatflow_backend.model.flow.FlowDefinition;
import com.chatflow.chatflow_backend.model.flow.NodeDefinition;
import com.chatflow.chatflow_backend.model.flow.NodeTransitions;
import com.chatflow.chatflow_backend.repository.FlowEdgeRepository;
import com.chatflow.chatflow_backend.repository.FlowNodeRepository;
import com.chatflow.chatflow_backend.repository.FlowRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Assembles {@link FlowDefinition}s from the flows / flow_nodes / flow_edges tables.
 * Published versions are immutable, so an assembled definition is cached per (id, version).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RepositoryFlowDefinitionSource implements FlowDefinitionSource {

    private final FlowRepository flowRepository;
    private final FlowNodeRepository nodeRepository;
    private final FlowEdgeRepository edgeRepository;
    private final FlowDefinitionValidator validator;

    private final Map<String, FlowDefinition> cache = new ConcurrentHashMap<>();

    @Override
    @Transactional(readOnly = true)
    public FlowDefinition get(UUID flowId) {
        Flow flow = flowRepository.findByIdAndStatus(flowId, FlowStatus.PUBLISHED)
                .orElseThrow(() -> new FlowNotFoundException(flowId));

        String cacheKey = flowId + ":" + flow.getVersion();
        FlowDefinition cached = cache.get(cacheKey);
        if (cached != null) {
            return cached;
        }

        FlowDefinition definition = assemble(flow);
        validator.validate(definition);
        cache.put(cacheKey, definition);
        log.info("Loaded flow {} v{} ({} nodes)", flowId, flow.getVersion(), definition.nodes().size());
        return definition;
    }

    private FlowDefinition assemble(Flow flow) {
        List<FlowNode> nodes = nodeRepository.findByFlowIdOrderByCreatedAtAsc(flow.getId());
        List<FlowEdge> edges = edgeRepository.findByFlowIdOrderByCreatedAtAsc(flow.getId());

        // Edges and the start pointer reference rows; the runtime graph uses each node's runtime id
        Map<UUID, String> runtimeIds = new HashMap<>();
        Set<String> seen = new HashSet<>();
        for (FlowNode node : nodes) {
            if (!seen.add(node.runtimeId())) {
                throw new GraphException("Flow " + flow.getId() + ": node key '" + node.runtimeId() + "' is used twice");
            }
            runtimeIds.put(node.getId(), node.runtimeId());
        }

        Map<UUID, String> defaults = new HashMap<>();
        Map<UUID, Map<String, String>> branches = new HashMap<>();
        for (FlowEdge edge : edges) {
            UUID source = edge.getSourceNodeId();
            String target = runtimeIds.getOrDefault(edge.getTargetNodeId(), edge.getTargetNodeId().toString());
            if (edge.isBranch()) {
                String key = edge.getBranchKey();
                if (key == null || key.isBlank()) {
                    throw new GraphException("Flow " + flow.getId() + ": branch edge " + edge.getId() + " has no branch key");
                }
                String previous = branches.computeIfAbsent(source, s -> new LinkedHashMap<>()).putIfAbsent(key, target);
                if (previous != null && !previous.equals(target)) {
                    throw new GraphException("Flow " + flow.getId() + ": node " + source + " has two '" + key + "' branches");
                }
            } else {
                String previous = defaults.putIfAbsent(source, target);
                if (previous != null && !previous.equals(target)) {
                    throw new GraphException("Flow " + flow.getId() + ": node " + source + " has more than one default edge");
                }
            }
        }

        Map<String, NodeDefinition> definitions = new LinkedHashMap<>();
        for (FlowNode node : nodes) {
            NodeTransitions transitions = new NodeTransitions(defaults.get(node.getId()),
                    branches.getOrDefault(node.getId(), Map.of()));
            definitions.put(node.runtimeId(), new NodeDefinition(node.runtimeId(),
                    node.getNodeType(), node.getLabel(), withoutNulls(node.getConfig()), transitions));
        }

        UUID startRow = flow.getStartNodeId();
        String start = startRow == null ? null : runtimeIds.getOrDefault(startRow, startRow.toString());
        return new FlowDefinition(flow.getId(), flow.getVersion(), flow.getTenantId(), start, definitions);
    }

    // JSON nulls are dropped so the immutable node config can hold the rest
    private static Map<String, Object> withoutNulls(Map<String, Object> config) {
        if (config == null) return Map.of();
        Map<String, Object> out = new LinkedHashMap<>();
        config.forEach((k, v) -> {
            if (k != null && v != null) out.put(k, v);
        });
        return out;
    }
}
