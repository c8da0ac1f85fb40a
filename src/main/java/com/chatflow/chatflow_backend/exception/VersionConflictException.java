package com.chatflow.chatflow_backend.exception;

import com.chatflow.chatflow_backend.model.conversation.ConversationKey;

public class VersionConflictException extends ConversationEngineException {

    public VersionConflictException(ConversationKey key, long expectedVersion) {
        super("Conversation " + key + " was modified concurrently (expected version " + expectedVersion + ")", true);
    }

    public VersionConflictException(ConversationKey key, long expectedVersion, Throwable cause) {
        super("Conversation " + key + " was modified concurrently (expected version " + expectedVersion + ")", true, cause);
    }
}
