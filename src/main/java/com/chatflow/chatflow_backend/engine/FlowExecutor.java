package com.chatflow.chatflow_backend.engine;

import com.chatflow.chatflow_backend.config.ConversationEngineProperties;
import com.chatflow.chatflow_backend.engine.definition.FlowDefinitionSource;
import com.chatflow.chatflow_backend.engine.lock.ConversationLockManager;
import com.chatflow.chatflow_backend.exception.ConversationEngineException;
import com.chatflow.chatflow_backend.exception.ExternalCallException;
import com.chatflow.chatflow_backend.exception.GraphException;
import com.chatflow.chatflow_backend.exception.NodeExecutionException;
import com.chatflow.chatflow_backend.exception.RuntimeLoopException;
import com.chatflow.chatflow_backend.executor.NodeExecutionContext;
import com.chatflow.chatflow_backend.executor.NodeHandlerRegistry;
import com.chatflow.chatflow_backend.model.conversation.ConversationKey;
import com.chatflow.chatflow_backend.model.conversation.ConversationState;
import com.chatflow.chatflow_backend.model.conversation.DispatchedMessage;
import com.chatflow.chatflow_backend.model.conversation.ExecutionOutcome;
import com.chatflow.chatflow_backend.model.conversation.MessageWindow;
import com.chatflow.chatflow_backend.model.conversation.NodeExecutionResult;
import com.chatflow.chatflow_backend.model.conversation.OutboundMessage;
import com.chatflow.chatflow_backend.model.conversation.OutcomeStatus;
import com.chatflow.chatflow_backend.model.conversation.RetryConfig;
import com.chatflow.chatflow_backend.model.conversation.RunState;
import com.chatflow.chatflow_backend.model.conversation.SendReceipt;
import com.chatflow.chatflow_backend.model.flow.FlowDefinition;
import com.chatflow.chatflow_backend.model.flow.NodeDefinition;
import com.chatflow.chatflow_backend.sender.MessageSender;
import com.chatflow.chatflow_backend.store.ConversationStateStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Advances one conversation per event.
 *
 * <p>Per event, under the conversation's lock: load or create the state, run nodes until the
 * graph pauses, ends or fails, gate the produced messages against the window, persist the state
 * exactly once, then hand the messages to the {@link MessageSender}. Nothing is sent before the
 * state write succeeded, so a version conflict never leaves a half-delivered sequence behind.
 */
@Slf4j
@Service
public class FlowExecutor {

    public static final String CONTACT_ADDRESS_VARIABLE = "contact_address";

    private final FlowDefinitionSource definitions;
    private final NodeHandlerRegistry handlers;
    private final ConversationStateStore store;
    private final WindowValidator windowValidator;
    private final ConversationLockManager lockManager;
    private final MessageSender messageSender;
    private final ConversationEventPublisher eventPublisher;
    private final ConversationEngineProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public FlowExecutor(FlowDefinitionSource definitions,
                        NodeHandlerRegistry handlers,
                        ConversationStateStore store,
                        WindowValidator windowValidator,
                        ConversationLockManager lockManager,
                        MessageSender messageSender,
                        ConversationEventPublisher eventPublisher,
                        ConversationEngineProperties properties,
                        ObjectMapper objectMapper,
                        Clock clock) {
        this.definitions = definitions;
        this.handlers = handlers;
        this.store = store;
        this.windowValidator = windowValidator;
        this.lockManager = lockManager;
        this.messageSender = messageSender;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Handles a message the contact sent. Any such message reopens the messaging window, whatever
     * state the conversation is in.
     */
    public ExecutionOutcome handleInboundMessage(String contactAddress, UUID flowId, String text) {
        ConversationKey key = new ConversationKey(contactAddress, flowId);
        return lockManager.withLock(key, () -> processInbound(key, text));
    }

    /**
     * Starts the flow for a contact on the business side's initiative. The window is not reset,
     * so free-form output is only delivered while the contact's own window is still open.
     * Skipped when the contact is already inside an active conversation of this flow.
     */
    public ExecutionOutcome handleScheduledTrigger(String contactAddress, UUID flowId, Map<String, String> variables) {
        ConversationKey key = new ConversationKey(contactAddress, flowId);
        return lockManager.withLock(key, () -> processTrigger(key, variables));
    }

    // ── Event entry points (lock held) ────────────────────────────────────────

    private ExecutionOutcome processInbound(ConversationKey key, String text) {
        Instant now = clock.instant();
        Optional<ConversationState> loaded = store.load(key);

        ConversationState state;
        long expectedVersion = loaded.map(ConversationState::getVersion).orElse(0L);
        boolean resuming = false;

        if (loaded.isEmpty()) {
            state = freshState(key, definitions.get(key.flowId()), null, now);
            log.info("Conversation {} started", key);
        } else {
            ConversationState previous = loaded.get();
            windowValidator.reconcile(previous.getWindow(), now);

            if (previous.isSessionLapsed(now)) {
                if (previous.isActive()) {
                    log.info("Conversation {} idle past its TTL in {}; starting a new session", key, previous.getRunState());
                    eventPublisher.conversationExpired(key);
                }
                state = freshState(key, definitions.get(key.flowId()), previous.getWindow(), now);
            } else if (!previous.isActive()) {
                // Finished conversations stay finished until their TTL lapses; only the window moves
                windowValidator.resetOnInboundUserMessage(previous.getWindow(), now);
                previous.setLastMessageAt(now);
                previous.setUpdatedAt(now);
                ConversationState saved = store.save(previous, expectedVersion);
                log.debug("Conversation {} is {}; inbound message recorded without running nodes", key, saved.getRunState());
                return ExecutionOutcome.noAction(saved);
            } else {
                state = previous;
                resuming = state.getRunState() == RunState.AWAITING_INPUT;
            }
        }

        windowValidator.resetOnInboundUserMessage(state.getWindow(), now);
        state.setLastMessageAt(now);
        return runAndPersist(key, state, expectedVersion, text, resuming, now);
    }

    private ExecutionOutcome processTrigger(ConversationKey key, Map<String, String> variables) {
        Instant now = clock.instant();
        Optional<ConversationState> loaded = store.load(key);

        if (loaded.isPresent() && loaded.get().isActive() && !loaded.get().isSessionLapsed(now)) {
            log.info("Trigger for {} skipped: conversation already {}", key, loaded.get().getRunState());
            return ExecutionOutcome.noAction(loaded.get());
        }

        FlowDefinition flow = definitions.get(key.flowId());
        long expectedVersion = loaded.map(ConversationState::getVersion).orElse(0L);
        MessageWindow window = loaded.map(ConversationState::getWindow).orElse(null);
        if (loaded.isPresent() && loaded.get().isActive()) {
            eventPublisher.conversationExpired(key);
        }

        ConversationState state = freshState(key, flow, window, now);
        windowValidator.reconcile(state.getWindow(), now);
        if (variables != null) {
            variables.forEach((name, value) -> {
                if (name != null && value != null) state.getVariables().put(name, value);
            });
        }
        log.info("Conversation {} started by trigger", key);
        return runAndPersist(key, state, expectedVersion, null, false, now);
    }

    // ── Run, gate, persist, dispatch ──────────────────────────────────────────

    private ExecutionOutcome runAndPersist(ConversationKey key, ConversationState state, long expectedVersion,
                                           String inboundText, boolean resuming, Instant now) {
        List<OutboundMessage> outbox = new ArrayList<>();
        try {
            runLoop(state, inboundText, resuming, outbox);
        } catch (ConversationEngineException ex) {
            log.warn("Conversation {} failed at node '{}': {}", key, state.getCurrentNodeId(), ex.getMessage());
            state.markFinished(RunState.FAILED, ex.getMessage());
            // A failed run never emits a partial sequence
            outbox.clear();
        }

        MessageWindow working = state.getWindow().copy();
        List<OutboundMessage> blocked = gate(outbox, working, now);
        if (blocked.isEmpty()) {
            state.setWindow(working);
        } else {
            log.info("Conversation {}: {} message(s) withheld, messaging window closed", key, blocked.size());
        }

        state.setSessionExpiresAt(now.plus(properties.getSessionTtl()));
        state.setUpdatedAt(now);
        ConversationState saved = store.save(state, expectedVersion);

        List<DispatchedMessage> sent = blocked.isEmpty() ? dispatch(saved.getContactAddress(), outbox) : List.of();
        OutcomeStatus status = blocked.isEmpty() ? OutcomeStatus.fromRunState(saved.getRunState()) : OutcomeStatus.WINDOW_EXPIRED;

        if (saved.getRunState() == RunState.COMPLETED) {
            log.info("Conversation {} completed", key);
        }
        eventPublisher.conversationAdvanced(saved, status);
        return new ExecutionOutcome(status, saved.getRunState(), saved.getCurrentNodeId(), sent, blocked,
                saved.getErrorMessage(), saved.getVersion());
    }

    private void runLoop(ConversationState state, String inboundText, boolean resuming, List<OutboundMessage> outbox) {
        int cap = properties.getMaxIterations();
        FlowDefinition flow = activeDefinition(state);
        String pendingInput = inboundText;
        boolean resumingNode = resuming;
        int steps = 0;
        long retryDeadline = System.nanoTime() + properties.getRetryBudget().toNanos();

        while (true) {
            String nodeId = state.getCurrentNodeId();
            if (++steps > cap) {
                throw new RuntimeLoopException(cap, nodeId);
            }
            NodeDefinition node = flow.requireNode(nodeId);
            NodeExecutionContext context = new NodeExecutionContext(state.getContactAddress(), flow,
                    state.getVariables(), pendingInput, resumingNode, state.getInputAttempts());

            NodeExecutionResult result = runNode(node, context, retryDeadline);

            state.appendToPath(nodeId, properties.getExecutionPathLimit());
            state.getVariables().putAll(result.getVariableUpdates());
            outbox.addAll(result.getMessagesToSend());
            if (result.isInputConsumed()) {
                pendingInput = null;
            }
            resumingNode = false;

            if (result.isTerminal()) {
                state.markFinished(RunState.COMPLETED, null);
                return;
            }
            if (result.isAwaitingInput()) {
                state.setRunState(RunState.AWAITING_INPUT);
                state.setInputAttempts(result.getInputAttempts() != null ? result.getInputAttempts() : 0);
                return;
            }

            state.setInputAttempts(0);
            state.setRunState(RunState.RUNNING);
            if (result.getJumpToFlowId() != null) {
                flow = definitions.get(result.getJumpToFlowId());
                log.debug("Conversation {} jumps from node '{}' to flow {}", state.key(), nodeId, flow.id());
                state.setActiveFlowId(flow.id());
                state.setFlowVersion(flow.version());
                state.setCurrentNodeId(flow.startNodeId());
                continue;
            }
            String next = result.getNextNodeId();
            if (next == null) {
                throw new GraphException("Node '" + nodeId + "' (" + node.type() + ") produced no next node");
            }
            state.setCurrentNodeId(next);
        }
    }

    // Definition the conversation currently runs; warns when the flow was republished mid-session
    private FlowDefinition activeDefinition(ConversationState state) {
        UUID activeFlowId = state.getActiveFlowId() != null ? state.getActiveFlowId() : state.getFlowId();
        FlowDefinition flow = definitions.get(activeFlowId);
        if (flow.version() != state.getFlowVersion()) {
            log.warn("Conversation {} started on flow {} v{}, continuing on v{}",
                    state.key(), activeFlowId, state.getFlowVersion(), flow.version());
            state.setFlowVersion(flow.version());
        }
        return flow;
    }

    /**
     * Runs one node, retrying retryable external-call failures per the node's "retry" policy until
     * the event's retry budget ({@code retryDeadline}, a {@link System#nanoTime()} instant) runs out.
     * Handlers themselves never retry.
     */
    private NodeExecutionResult runNode(NodeDefinition node, NodeExecutionContext context, long retryDeadline) {
        RetryConfig retry = extractRetryConfig(node);
        int attempt = 0;

        while (true) {
            attempt++;
            try {
                return handlers.get(node.type()).execute(node, context);
            } catch (ExternalCallException ex) {
                if (!ex.isRetryable() || attempt >= retry.totalAttempts()) {
                    throw ex;
                }
                long delayMs = retry.delayBeforeRetry(attempt);
                if (System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(delayMs) - retryDeadline > 0) {
                    log.warn("Node {} ({}) failed on attempt {}: retry budget of {} exhausted",
                            node.id(), node.type(), attempt, properties.getRetryBudget());
                    throw ex;
                }
                log.warn("Node {} ({}) failed on attempt {}/{}: {}. Retrying in {} ms",
                        node.id(), node.type(), attempt, retry.totalAttempts(), ex.getMessage(), delayMs);
                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warn("Retry sleep interrupted for node {}; aborting further retries", node.id());
                    throw ex;
                }
            } catch (ConversationEngineException ex) {
                throw ex;
            } catch (RuntimeException ex) {
                log.error("Node {} ({}) threw unexpectedly", node.id(), node.type(), ex);
                throw new NodeExecutionException(node.id(), ex);
            }
        }
    }

    private RetryConfig extractRetryConfig(NodeDefinition node) {
        Object raw = node.config().get("retry");
        if (raw == null) {
            return RetryConfig.none();
        }
        try {
            return objectMapper.convertValue(raw, RetryConfig.class).normalized();
        } catch (IllegalArgumentException ex) {
            log.warn("Ignoring unreadable retry config on node {}: {}", node.id(), ex.getMessage());
            return RetryConfig.none();
        }
    }

    /**
     * Checks the batch in order against {@code working}: templates always pass and extend the
     * window, free-form text needs an open window.
     *
     * @return the whole batch when any free-form message is blocked, otherwise an empty list
     */
    private List<OutboundMessage> gate(List<OutboundMessage> outbox, MessageWindow working, Instant now) {
        for (OutboundMessage message : outbox) {
            if (message.isFreeform()) {
                if (!windowValidator.canSendFreeform(working, now)) {
                    return List.copyOf(outbox);
                }
            } else if (windowValidator.canSendTemplate(working, now)) {
                windowValidator.extendOnOutboundTemplate(working, now);
            }
        }
        return List.of();
    }

    private List<DispatchedMessage> dispatch(String contactAddress, List<OutboundMessage> outbox) {
        List<DispatchedMessage> sent = new ArrayList<>(outbox.size());
        for (OutboundMessage message : outbox) {
            SendReceipt receipt;
            try {
                receipt = message.isFreeform()
                        ? messageSender.sendFreeform(contactAddress, message.text())
                        : messageSender.sendTemplate(contactAddress, message.templateRef(), message.language(), message.params());
            } catch (RuntimeException ex) {
                log.error("Sending message of node {} to {} failed", message.nodeId(), contactAddress, ex);
                receipt = SendReceipt.failed(ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName());
            }
            if (receipt == null) {
                receipt = SendReceipt.failed("sender returned no receipt");
            }
            if (!receipt.accepted()) {
                log.warn("Message of node {} to {} rejected: {}", message.nodeId(), contactAddress, receipt.error());
            }
            sent.add(new DispatchedMessage(message, receipt));
        }
        return sent;
    }

    private ConversationState freshState(ConversationKey key, FlowDefinition flow, MessageWindow previousWindow, Instant now) {
        ConversationState state = ConversationState.builder()
                .contactAddress(key.contactAddress())
                .flowId(key.flowId())
                .activeFlowId(flow.id())
                .flowVersion(flow.version())
                .tenantId(flow.tenantId())
                .sessionId(UUID.randomUUID())
                .currentNodeId(flow.startNodeId())
                .runState(RunState.RUNNING)
                .startedAt(now)
                .window(previousWindow != null ? previousWindow.copy() : MessageWindow.closed())
                .build();
        state.getVariables().put(CONTACT_ADDRESS_VARIABLE, key.contactAddress());
        return state;
    }
}
