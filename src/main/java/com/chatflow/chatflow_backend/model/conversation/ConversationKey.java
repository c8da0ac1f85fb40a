package com.chatflow.chatflow_backend.model.conversation;

import java.util.Objects;
import java.util.UUID;

/**
 * Identity of a conversation: the contact's address and the flow the contact entered through.
 * A JUMP changes the conversation's active flow but never its key.
 */
public record ConversationKey(String contactAddress, UUID flowId) {

    public ConversationKey {
        Objects.requireNonNull(contactAddress, "contactAddress");
        Objects.requireNonNull(flowId, "flowId");
        if (contactAddress.isBlank()) {
            throw new IllegalArgumentException("contactAddress must not be blank");
        }
    }

    @Override
    public String toString() {
        return contactAddress + "@" + flowId;
    }
}
