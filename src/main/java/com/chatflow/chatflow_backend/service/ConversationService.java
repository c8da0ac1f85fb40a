package com.chatflow.chatflow_backend.service;

import com.chatflow.chatflow_backend.config.ConversationEngineProperties;
import com.chatflow.chatflow_backend.engine.FlowExecutor;
import com.chatflow.chatflow_backend.engine.WindowValidator;
import com.chatflow.chatflow_backend.exception.ConversationEngineException;
import com.chatflow.chatflow_backend.model.conversation.ConversationKey;
import com.chatflow.chatflow_backend.model.conversation.ConversationState;
import com.chatflow.chatflow_backend.model.conversation.ExecutionOutcome;
import com.chatflow.chatflow_backend.store.ConversationStateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Entry point for adapters. Re-runs a whole event when it failed with a retryable error
 * (version conflict, busy conversation); everything else is surfaced unchanged.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationService {

    private static final long RETRY_BASE_DELAY_MS = 25L;

    private final FlowExecutor executor;
    private final ConversationStateStore store;
    private final WindowValidator windowValidator;
    private final ConversationEngineProperties properties;
    private final Clock clock;

    public ExecutionOutcome handleInbound(String contactAddress, UUID flowId, String text) {
        ConversationKey key = new ConversationKey(contactAddress, flowId);
        return withRetries(key, () -> executor.handleInboundMessage(contactAddress, flowId, text));
    }

    public ExecutionOutcome trigger(String contactAddress, UUID flowId, Map<String, String> variables) {
        ConversationKey key = new ConversationKey(contactAddress, flowId);
        return withRetries(key, () -> executor.handleScheduledTrigger(contactAddress, flowId, variables));
    }

    public Optional<ConversationState> find(String contactAddress, UUID flowId) {
        return store.load(new ConversationKey(contactAddress, flowId));
    }

    /** Live answer, computed from the expiry timestamp rather than the cached flag. */
    public boolean canSendFreeform(ConversationState state) {
        return windowValidator.canSendFreeform(state.getWindow(), clock.instant());
    }

    private ExecutionOutcome withRetries(ConversationKey key, Supplier<ExecutionOutcome> event) {
        int maxRetries = properties.getConflictRetries();
        int attempt = 0;
        while (true) {
            try {
                return event.get();
            } catch (ConversationEngineException ex) {
                if (!ex.isRetryable() || attempt >= maxRetries) {
                    throw ex;
                }
                attempt++;
                log.warn("Event for {} hit {} ({}); retry {}/{}", key, ex.getClass().getSimpleName(),
                        ex.getMessage(), attempt, maxRetries);
                try {
                    Thread.sleep(RETRY_BASE_DELAY_MS * attempt);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw ex;
                }
            }
        }
    }
}
