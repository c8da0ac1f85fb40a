package com.chatflow.chatflow_backend.repository;

import com.chatflow.chatflow_backend.model.domain.FlowEdge;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface FlowEdgeRepository extends JpaRepository<FlowEdge, UUID> {
    // Stable order keeps validation messages deterministic
    List<FlowEdge> findByFlowIdOrderByCreatedAtAsc(UUID flowId);
}
