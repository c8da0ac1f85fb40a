package com.chatflow.chatflow_backend.model.conversation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Free-form messaging window of one conversation.
 *
 * <p>{@code windowOpen} is a cached flag reconciled lazily (on load) and eagerly (by the expiry
 * sweeper). Send decisions never read it: they always recompute from {@code windowExpiresAt}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageWindow {

    private Instant windowExpiresAt;
    private Instant lastUserMessageAt;
    private Instant lastOutboundTemplateAt;
    private WindowOpener openedBy;
    private boolean windowOpen;
    private Instant windowClosedAt;

    public static MessageWindow closed() {
        return new MessageWindow();
    }

    public MessageWindow copy() {
        return new MessageWindow(windowExpiresAt, lastUserMessageAt, lastOutboundTemplateAt,
                openedBy, windowOpen, windowClosedAt);
    }
}
