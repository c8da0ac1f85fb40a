package com.chatflow.chatflow_backend.store;

import com.chatflow.chatflow_backend.model.conversation.ConversationKey;
import com.chatflow.chatflow_backend.model.conversation.ConversationState;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable conversation records keyed by (contact address, flow id).
 *
 * <p>Every method hands out and accepts detached copies; callers never share mutable state with
 * the store.
 */
public interface ConversationStateStore {

    Optional<ConversationState> load(ConversationKey key);

    /**
     * Writes {@code state} if the stored version still equals {@code expectedVersion}
     * (0 = must not exist yet).
     *
     * @return the stored copy carrying its new version ({@code expectedVersion + 1})
     * @throws com.chatflow.chatflow_backend.exception.VersionConflictException another writer got there first
     * @throws com.chatflow.chatflow_backend.exception.PersistenceException the store is unavailable
     */
    ConversationState save(ConversationState state, long expectedVersion);

    /** Tenants owning at least one conversation still flagged open past its window expiry. */
    List<String> findTenantsWithExpiredOpenWindows(Instant now);

    List<ConversationKey> findExpiredOpenWindows(String tenantId, Instant now, int limit);

    /**
     * Flips the cached window flag to closed when it is still open and expired. Touches window
     * fields only and does not bump the version.
     *
     * @return true when this call performed the transition
     */
    boolean closeWindow(ConversationKey key, Instant now);

    /** Active (running / awaiting input) conversations whose idle TTL has lapsed. */
    List<ConversationKey> findIdleActive(Instant now, int limit);

    /** Deletes terminal conversations whose idle TTL lapsed before {@code cutoff}. */
    int deleteTerminalBefore(Instant cutoff);
}
