package com.chatflow.chatflow_backend.model.domain;

import com.chatflow.chatflow_backend.EdgeCondition;
import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

/**
 * Transition between two nodes of the same flow. A node has at most one DEFAULT edge and at most
 * one BRANCH edge per branch key; both rules are enforced when the flow is loaded.
 */
@Entity
@Table(name = "flow_edges", indexes = @Index(name = "idx_flow_edges_source", columnList = "source_node_id"))
@Data
public class FlowEdge {

    @Id
    private UUID id;

    @Column(name = "flow_id", nullable = false)
    private UUID flowId;

    @Column(name = "source_node_id", nullable = false)
    private UUID sourceNodeId;

    @Column(name = "target_node_id", nullable = false)
    private UUID targetNodeId;

    @Enumerated(EnumType.STRING)
    @Column(name = "edge_kind", nullable = false, length = 16)
    private EdgeCondition edgeKind = EdgeCondition.DEFAULT;

    // "true"/"false" for expressions, a rule's branch name, or "invalid" for questions
    @Column(name = "branch_key", length = 100)
    private String branchKey;

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();

    public boolean isBranch() {
        return edgeKind == EdgeCondition.BRANCH;
    }
}
