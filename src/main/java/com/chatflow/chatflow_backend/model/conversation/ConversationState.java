package com.chatflow.chatflow_backend.model.conversation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Durable position of one contact inside one flow. {@code currentNodeId} plus {@code variables}
 * is the whole continuation; nothing else is needed to resume after a restart.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ConversationState {

    private String contactAddress;

    /** Entry flow, part of the key. */
    private UUID flowId;

    /** Flow currently being executed; differs from flowId after a JUMP. */
    private UUID activeFlowId;
    private int flowVersion;
    private String tenantId;

    /** New id every time a fresh session replaces an old one under the same key. */
    private UUID sessionId;

    private String currentNodeId;

    @Builder.Default
    private RunState runState = RunState.RUNNING;

    @Builder.Default
    private Map<String, String> variables = new LinkedHashMap<>();

    // Most recent node ids last, bounded by the engine
    @Builder.Default
    private List<String> executionPath = new ArrayList<>();

    /** Invalid answers given to the question currently awaiting input. */
    private int inputAttempts;

    private String errorMessage;

    private Instant startedAt;
    private Instant lastMessageAt;
    private Instant sessionExpiresAt;
    private Instant updatedAt;

    @Builder.Default
    private MessageWindow window = MessageWindow.closed();

    /** Optimistic-lock counter; 0 means never persisted. */
    private long version;

    public ConversationKey key() {
        return new ConversationKey(contactAddress, flowId);
    }

    public boolean isActive() {
        return runState != null && runState.isActive();
    }

    public boolean isSessionLapsed(Instant now) {
        return sessionExpiresAt != null && !now.isBefore(sessionExpiresAt);
    }

    public void appendToPath(String nodeId, int limit) {
        executionPath.add(nodeId);
        while (executionPath.size() > limit) {
            executionPath.remove(0);
        }
    }

    public void markFinished(RunState state, String error) {
        this.runState = state;
        this.currentNodeId = null;
        this.inputAttempts = 0;
        this.errorMessage = error;
    }

    public ConversationState copy() {
        return toBuilder()
                .variables(new LinkedHashMap<>(variables))
                .executionPath(new ArrayList<>(executionPath))
                .window(window != null ? window.copy() : MessageWindow.closed())
                .build();
    }
}
