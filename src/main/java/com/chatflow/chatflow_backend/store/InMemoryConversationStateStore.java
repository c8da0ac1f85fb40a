package com.chatflow.chatflow_backend.store;

import com.chatflow.chatflow_backend.exception.VersionConflictException;
import com.chatflow.chatflow_backend.model.conversation.ConversationKey;
import com.chatflow.chatflow_backend.model.conversation.ConversationState;
import com.chatflow.chatflow_backend.model.conversation.MessageWindow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-process store for development and tests ({@code app.conversation.store=memory}).
 * Version checks run inside {@link ConcurrentHashMap#compute} so they are atomic per key.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.conversation.store", havingValue = "memory")
public class InMemoryConversationStateStore implements ConversationStateStore {

    private final Map<ConversationKey, ConversationState> states = new ConcurrentHashMap<>();

    @Override
    public Optional<ConversationState> load(ConversationKey key) {
        ConversationState state = states.get(key);
        return Optional.ofNullable(state).map(ConversationState::copy);
    }

    @Override
    public ConversationState save(ConversationState state, long expectedVersion) {
        ConversationKey key = state.key();
        ConversationState saved = states.compute(key, (k, current) -> {
            long currentVersion = current != null ? current.getVersion() : 0L;
            if (currentVersion != expectedVersion) {
                throw new VersionConflictException(k, expectedVersion);
            }
            ConversationState next = state.copy();
            next.setVersion(expectedVersion + 1);
            return next;
        });
        return saved.copy();
    }

    @Override
    public List<String> findTenantsWithExpiredOpenWindows(Instant now) {
        return states.values().stream()
                .filter(s -> isExpiredOpen(s.getWindow(), now))
                .map(ConversationState::getTenantId)
                .distinct()
                .toList();
    }

    @Override
    public List<ConversationKey> findExpiredOpenWindows(String tenantId, Instant now, int limit) {
        return states.values().stream()
                .filter(s -> tenantId.equals(s.getTenantId()) && isExpiredOpen(s.getWindow(), now))
                .sorted(Comparator.comparing(s -> s.getWindow().getWindowExpiresAt()))
                .limit(limit)
                .map(ConversationState::key)
                .toList();
    }

    @Override
    public boolean closeWindow(ConversationKey key, Instant now) {
        AtomicBoolean closed = new AtomicBoolean(false);
        states.computeIfPresent(key, (k, current) -> {
            if (!isExpiredOpen(current.getWindow(), now)) {
                return current;
            }
            ConversationState next = current.copy();
            next.getWindow().setWindowOpen(false);
            next.getWindow().setWindowClosedAt(now);
            closed.set(true);
            return next;
        });
        return closed.get();
    }

    @Override
    public List<ConversationKey> findIdleActive(Instant now, int limit) {
        return states.values().stream()
                .filter(s -> s.isActive() && s.isSessionLapsed(now))
                .sorted(Comparator.comparing(ConversationState::getSessionExpiresAt))
                .limit(limit)
                .map(ConversationState::key)
                .toList();
    }

    @Override
    public int deleteTerminalBefore(Instant cutoff) {
        int before = states.size();
        states.values().removeIf(s -> !s.isActive()
                && s.getSessionExpiresAt() != null
                && s.getSessionExpiresAt().isBefore(cutoff));
        int removed = before - states.size();
        if (removed > 0) {
            log.debug("Removed {} terminal conversations", removed);
        }
        return removed;
    }

    public int size() {
        return states.size();
    }

    private static boolean isExpiredOpen(MessageWindow window, Instant now) {
        return window != null && window.isWindowOpen()
                && window.getWindowExpiresAt() != null
                && !now.isBefore(window.getWindowExpiresAt());
    }
}
