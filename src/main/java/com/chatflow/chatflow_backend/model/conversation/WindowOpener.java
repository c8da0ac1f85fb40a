package com.chatflow.chatflow_backend.model.conversation;

/** Who last opened or extended the messaging window. Kept for auditing. */
public enum WindowOpener {
    CONTACT,
    TEMPLATE
}
