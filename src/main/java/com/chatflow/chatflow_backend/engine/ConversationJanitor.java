package com.chatflow.chatflow_backend.engine;

import com.chatflow.chatflow_backend.config.ConversationEngineProperties;
import com.chatflow.chatflow_backend.engine.lock.ConversationLockManager;
import com.chatflow.chatflow_backend.exception.ConversationEngineException;
import com.chatflow.chatflow_backend.model.conversation.ConversationKey;
import com.chatflow.chatflow_backend.model.conversation.ConversationState;
import com.chatflow.chatflow_backend.model.conversation.RunState;
import com.chatflow.chatflow_backend.store.ConversationStateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Session housekeeping: expires conversations left active past their idle TTL and deletes
 * finished conversations once the retention period has passed.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.conversation.janitor", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ConversationJanitor {

    static final String IDLE_TIMEOUT_MESSAGE = "Session idle timeout";

    private final ConversationStateStore store;
    private final ConversationLockManager lockManager;
    private final ConversationEventPublisher eventPublisher;
    private final ConversationEngineProperties properties;
    private final Clock clock;

    public ConversationJanitor(ConversationStateStore store,
                               ConversationLockManager lockManager,
                               ConversationEventPublisher eventPublisher,
                               ConversationEngineProperties properties,
                               Clock clock) {
        this.store = store;
        this.lockManager = lockManager;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${app.conversation.janitor.interval:PT1H}")
    public void cleanUp() {
        JanitorResult result = runOnce();
        if (result.expired() > 0 || result.deleted() > 0) {
            log.info("Conversation janitor: {} expired, {} deleted", result.expired(), result.deleted());
        }
    }

    public JanitorResult runOnce() {
        Instant now = clock.instant();
        int expired = 0;
        try {
            for (ConversationKey key : store.findIdleActive(now, properties.getJanitor().getBatchSize())) {
                if (expireIfIdle(key, now)) {
                    expired++;
                    eventPublisher.conversationExpired(key);
                }
            }
        } catch (RuntimeException e) {
            log.error("Conversation janitor could not expire idle conversations", e);
        }

        int deleted = 0;
        try {
            deleted = store.deleteTerminalBefore(now.minus(properties.getJanitor().getRetention()));
        } catch (RuntimeException e) {
            log.error("Conversation janitor could not delete finished conversations", e);
        }
        return new JanitorResult(expired, deleted);
    }

    private boolean expireIfIdle(ConversationKey key, Instant now) {
        try {
            Optional<Boolean> result = lockManager.tryWithLock(key, () -> {
                ConversationState state = store.load(key).orElse(null);
                // Re-checked under the lock; an event may have refreshed the session meanwhile
                if (state == null || !state.isActive() || !state.isSessionLapsed(now)) {
                    return false;
                }
                long expectedVersion = state.getVersion();
                state.markFinished(RunState.EXPIRED, IDLE_TIMEOUT_MESSAGE);
                state.setUpdatedAt(now);
                store.save(state, expectedVersion);
                log.debug("Conversation {} expired after idling", key);
                return true;
            });
            return result.orElse(false);
        } catch (ConversationEngineException e) {
            log.warn("Could not expire conversation {}: {}", key, e.getMessage());
            return false;
        }
    }

    public record JanitorResult(int expired, int deleted) {}
}
