package com.chatflow.chatflow_backend.engine.lock;

import com.chatflow.chatflow_backend.model.conversation.ConversationKey;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * At most one holder per conversation key at a time.
 */
public interface ConversationLockManager {

    /**
     * Runs {@code action} while holding the key's lock, waiting up to the configured timeout.
     *
     * @throws com.chatflow.chatflow_backend.exception.ConversationBusyException the lock was not acquired in time
     */
    <T> T withLock(ConversationKey key, Supplier<T> action);

    /** Runs {@code action} only if the lock is free right now; empty otherwise. */
    <T> Optional<T> tryWithLock(ConversationKey key, Supplier<T> action);
}
