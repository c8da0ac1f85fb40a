package com.chatflow.chatflow_backend;

public enum FlowStatus {
    DRAFT,
    PUBLISHED,  // read-only from here on; the only status the engine will execute
    ARCHIVED
}
