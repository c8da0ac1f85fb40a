package com.chatflow.chatflow_backend.model.conversation;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * What one inbound (or scheduled) event did to a conversation.
 *
 * @param messagesSent    messages handed to the channel, in node order, with their receipts
 * @param blockedMessages the withheld batch when status is WINDOW_EXPIRED, for the caller to
 *                        substitute templates or queue; empty otherwise
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionOutcome(OutcomeStatus status,
                               RunState runState,
                               String currentNodeId,
                               List<DispatchedMessage> messagesSent,
                               List<OutboundMessage> blockedMessages,
                               String errorMessage,
                               long stateVersion) {

    public ExecutionOutcome {
        messagesSent = messagesSent != null ? List.copyOf(messagesSent) : List.of();
        blockedMessages = blockedMessages != null ? List.copyOf(blockedMessages) : List.of();
    }

    public static ExecutionOutcome noAction(ConversationState state) {
        return new ExecutionOutcome(OutcomeStatus.fromRunState(state.getRunState()), state.getRunState(),
                state.getCurrentNodeId(), List.of(), List.of(), state.getErrorMessage(), state.getVersion());
    }
}
