package com.chatflow.chatflow_backend.repository;

import com.chatflow.chatflow_backend.model.domain.FlowNode;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface FlowNodeRepository extends JpaRepository<FlowNode, UUID> {
    List<FlowNode> findByFlowIdOrderByCreatedAtAsc(UUID flowId);
}
