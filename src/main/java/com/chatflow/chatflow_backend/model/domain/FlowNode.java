package com.chatflow.chatflow_backend.model.domain;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "flow_nodes",
        uniqueConstraints = @UniqueConstraint(name = "uk_flow_nodes_key", columnNames = {"flow_id", "node_key"}))
@Data
public class FlowNode {

    @Id
    private UUID id;

    @Column(name = "flow_id", nullable = false)
    private UUID flowId;

    /**
     * Author-facing id such as "ask_name". When set, conversations record it as their current node
     * instead of the row id, so a paused conversation still finds its node after the flow is republished.
     */
    @Column(name = "node_key", length = 100)
    private String nodeKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "node_type", nullable = false, length = 32)
    private NodeType nodeType;

    private String label;

    // prompt / expression / assignments / call settings / retry, depending on nodeType
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> config;

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();

    public String runtimeId() {
        return nodeKey != null && !nodeKey.isBlank() ? nodeKey : id.toString();
    }
}
