package com.chatflow.chatflow_backend.engine.lock;

import com.chatflow.chatflow_backend.exception.ConversationBusyException;
import com.chatflow.chatflow_backend.model.conversation.ConversationKey;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Striped in-process locks. Two keys may share a stripe, which only costs some extra waiting.
 * Correct for a single instance only; use the Redis variant when several instances share a store.
 */
public class LocalConversationLockManager implements ConversationLockManager {

    private final ReentrantLock[] stripes;
    private final Duration waitTimeout;

    public LocalConversationLockManager(int stripeCount, Duration waitTimeout) {
        if (stripeCount < 1) {
            throw new IllegalArgumentException("stripeCount must be >= 1");
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
        this.waitTimeout = waitTimeout;
    }

    @Override
    public <T> T withLock(ConversationKey key, Supplier<T> action) {
        ReentrantLock lock = stripeFor(key);
        boolean acquired;
        try {
            acquired = lock.tryLock(waitTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConversationBusyException(key, waitTimeout);
        }
        if (!acquired) {
            throw new ConversationBusyException(key, waitTimeout);
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public <T> Optional<T> tryWithLock(ConversationKey key, Supplier<T> action) {
        ReentrantLock lock = stripeFor(key);
        if (!lock.tryLock()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(action.get());
        } finally {
            lock.unlock();
        }
    }

    private ReentrantLock stripeFor(ConversationKey key) {
        return stripes[Math.floorMod(key.hashCode(), stripes.length)];
    }
}
