package com.chatflow.chatflow_backend.model.domain;

import com.chatflow.chatflow_backend.FlowStatus;
import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "flows")
@Data
public class Flow {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String name;

    private String description;

    /** Owner of the flow; conversations inherit it so sweeps can be partitioned per tenant. */
    @Column(name = "tenant_id", nullable = false)
    private String tenantId = "default";

    /** Bumped on every publish. Conversations record the version they were started on. */
    @Column(nullable = false)
    private int version = 1;

    @Enumerated(EnumType.STRING)
    private FlowStatus status = FlowStatus.DRAFT;

    @Column(name = "start_node_id")
    private UUID startNodeId;

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at")
    private Instant updatedAt = Instant.now();

    @PreUpdate
    public void onUpdate() {
        updatedAt = Instant.now();
    }
}
