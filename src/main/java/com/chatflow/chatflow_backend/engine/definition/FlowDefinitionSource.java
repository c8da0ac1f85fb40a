package com.chatflow.chatflow_backend.engine.definition;

import com.chatflow.chatflow_backend.model.flow.FlowDefinition;

import java.util.UUID;

public interface FlowDefinitionSource {

    /**
     * Latest published, validated definition of a flow.
     *
     * @throws com.chatflow.chatflow_backend.exception.FlowNotFoundException unknown or unpublished flow
     * @throws com.chatflow.chatflow_backend.exception.GraphException the published graph is malformed
     */
    FlowDefinition get(UUID flowId);
}
