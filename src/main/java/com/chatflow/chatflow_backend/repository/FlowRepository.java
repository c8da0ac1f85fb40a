package com.chatflow.chatflow_backend.repository;

import com.chatflow.chatflow_backend.FlowStatus;
import com.chatflow.chatflow_backend.model.domain.Flow;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface FlowRepository extends JpaRepository<Flow, UUID> {

    // Conversations only ever run published flows
    Optional<Flow> findByIdAndStatus(UUID id, FlowStatus status);
}
