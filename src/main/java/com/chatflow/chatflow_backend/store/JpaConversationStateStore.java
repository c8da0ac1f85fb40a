package com.chatflow.chatflow_backend.store;

import com.chatflow.chatflow_backend.exception.PersistenceException;
import com.chatflow.chatflow_backend.exception.VersionConflictException;
import com.chatflow.chatflow_backend.model.conversation.ConversationKey;
import com.chatflow.chatflow_backend.model.conversation.ConversationState;
import com.chatflow.chatflow_backend.model.conversation.MessageWindow;
import com.chatflow.chatflow_backend.model.conversation.RunState;
import com.chatflow.chatflow_backend.model.domain.ConversationStateEntity;
import com.chatflow.chatflow_backend.repository.ConversationStateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Relational store. {@link #save} takes a row lock, compares the stored version and bumps it in
 * the same transaction; a concurrent insert of the same key trips the unique constraint and is
 * reported as a version conflict as well.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.conversation.store", havingValue = "jpa", matchIfMissing = true)
public class JpaConversationStateStore implements ConversationStateStore {

    private static final Set<RunState> ACTIVE = EnumSet.of(RunState.RUNNING, RunState.AWAITING_INPUT);
    private static final Set<RunState> TERMINAL = EnumSet.of(RunState.COMPLETED, RunState.FAILED, RunState.EXPIRED);

    private final ConversationStateRepository repository;

    @Override
    @Transactional(readOnly = true)
    public Optional<ConversationState> load(ConversationKey key) {
        try {
            return repository.findByContactAddressAndFlowId(key.contactAddress(), key.flowId())
                    .map(JpaConversationStateStore::toDomain);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to load conversation " + key, e);
        }
    }

    @Override
    @Transactional
    public ConversationState save(ConversationState state, long expectedVersion) {
        ConversationKey key = state.key();
        try {
            Optional<ConversationStateEntity> existing = repository.lockByKey(key.contactAddress(), key.flowId());
            ConversationStateEntity entity;
            if (existing.isEmpty()) {
                if (expectedVersion != 0) {
                    throw new VersionConflictException(key, expectedVersion);
                }
                entity = new ConversationStateEntity();
            } else {
                entity = existing.get();
                if (entity.getStateVersion() != expectedVersion) {
                    log.debug("Version mismatch on {}: stored {}, expected {}", key, entity.getStateVersion(), expectedVersion);
                    throw new VersionConflictException(key, expectedVersion);
                }
            }
            copyInto(state, entity);
            entity.setStateVersion(expectedVersion + 1);
            return toDomain(repository.saveAndFlush(entity));
        } catch (DataIntegrityViolationException e) {
            throw new VersionConflictException(key, expectedVersion, e);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to save conversation " + key, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> findTenantsWithExpiredOpenWindows(Instant now) {
        try {
            return repository.findTenantsWithExpiredOpenWindows(now);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to list tenants with expired windows", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<ConversationKey> findExpiredOpenWindows(String tenantId, Instant now, int limit) {
        try {
            return repository.findExpiredOpenWindows(tenantId, now, PageRequest.of(0, limit)).stream()
                    .map(e -> new ConversationKey(e.getContactAddress(), e.getFlowId()))
                    .toList();
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to list expired windows for tenant " + tenantId, e);
        }
    }

    @Override
    @Transactional
    public boolean closeWindow(ConversationKey key, Instant now) {
        try {
            return repository.closeExpiredWindow(key.contactAddress(), key.flowId(), now) > 0;
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to close window of " + key, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<ConversationKey> findIdleActive(Instant now, int limit) {
        try {
            return repository.findIdle(ACTIVE, now, PageRequest.of(0, limit)).stream()
                    .map(e -> new ConversationKey(e.getContactAddress(), e.getFlowId()))
                    .toList();
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to list idle conversations", e);
        }
    }

    @Override
    @Transactional
    public int deleteTerminalBefore(Instant cutoff) {
        try {
            return repository.deleteByRunStateInAndSessionExpiresAtBefore(TERMINAL, cutoff);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to delete terminal conversations", e);
        }
    }

    // ── Mapping ───────────────────────────────────────────────────────────────

    static ConversationState toDomain(ConversationStateEntity e) {
        MessageWindow window = MessageWindow.builder()
                .windowExpiresAt(e.getWindowExpiresAt())
                .lastUserMessageAt(e.getLastUserMessageAt())
                .lastOutboundTemplateAt(e.getLastOutboundTemplateAt())
                .openedBy(e.getWindowOpenedBy())
                .windowOpen(e.isWindowOpen())
                .windowClosedAt(e.getWindowClosedAt())
                .build();
        return ConversationState.builder()
                .contactAddress(e.getContactAddress())
                .flowId(e.getFlowId())
                .activeFlowId(e.getActiveFlowId())
                .flowVersion(e.getFlowVersion())
                .tenantId(e.getTenantId())
                .sessionId(e.getSessionId())
                .currentNodeId(e.getCurrentNodeId())
                .runState(e.getRunState())
                .variables(e.getVariables() != null ? new LinkedHashMap<>(e.getVariables()) : new LinkedHashMap<>())
                .executionPath(e.getExecutionPath() != null ? new ArrayList<>(e.getExecutionPath()) : new ArrayList<>())
                .inputAttempts(e.getInputAttempts())
                .errorMessage(e.getErrorMessage())
                .startedAt(e.getStartedAt())
                .lastMessageAt(e.getLastMessageAt())
                .sessionExpiresAt(e.getSessionExpiresAt())
                .updatedAt(e.getUpdatedAt())
                .window(window)
                .version(e.getStateVersion())
                .build();
    }

    static void copyInto(ConversationState s, ConversationStateEntity e) {
        e.setContactAddress(s.getContactAddress());
        e.setFlowId(s.getFlowId());
        e.setActiveFlowId(s.getActiveFlowId());
        e.setFlowVersion(s.getFlowVersion());
        e.setTenantId(s.getTenantId() != null ? s.getTenantId() : "default");
        e.setSessionId(s.getSessionId());
        e.setCurrentNodeId(s.getCurrentNodeId());
        e.setRunState(s.getRunState());
        e.setVariables(new LinkedHashMap<>(s.getVariables()));
        e.setExecutionPath(new ArrayList<>(s.getExecutionPath()));
        e.setInputAttempts(s.getInputAttempts());
        e.setErrorMessage(truncate(s.getErrorMessage()));
        e.setStartedAt(s.getStartedAt());
        e.setLastMessageAt(s.getLastMessageAt());
        e.setSessionExpiresAt(s.getSessionExpiresAt());
        e.setUpdatedAt(s.getUpdatedAt());

        MessageWindow w = s.getWindow() != null ? s.getWindow() : MessageWindow.closed();
        e.setWindowExpiresAt(w.getWindowExpiresAt());
        e.setLastUserMessageAt(w.getLastUserMessageAt());
        e.setLastOutboundTemplateAt(w.getLastOutboundTemplateAt());
        e.setWindowOpenedBy(w.getOpenedBy());
        e.setWindowOpen(w.isWindowOpen());
        e.setWindowClosedAt(w.getWindowClosedAt());
    }

    private static String truncate(String message) {
        return message != null && message.length() > 2000 ? message.substring(0, 2000) : message;
    }
}
