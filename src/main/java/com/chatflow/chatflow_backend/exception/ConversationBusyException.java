package com.chatflow.chatflow_backend.exception;

import com.chatflow.chatflow_backend.model.conversation.ConversationKey;

import java.time.Duration;

/** The per-key lock could not be acquired in time; another event for the same conversation is running. */
public class ConversationBusyException extends ConversationEngineException {

    public ConversationBusyException(ConversationKey key, Duration waited) {
        super("Conversation " + key + " is busy (lock not acquired within " + waited.toMillis() + " ms)", true);
    }
}
