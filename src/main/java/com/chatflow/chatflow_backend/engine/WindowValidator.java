package com.chatflow.chatflow_backend.engine;

import com.chatflow.chatflow_backend.config.ConversationEngineProperties;
import com.chatflow.chatflow_backend.model.conversation.MessageWindow;
import com.chatflow.chatflow_backend.model.conversation.WindowOpener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Free-form messaging window rules.
 *
 * <p>Send decisions are computed from {@code windowExpiresAt} only; the cached {@code windowOpen}
 * flag is bookkeeping for the sweeper and the read API.
 */
@Component
public class WindowValidator {

    private final Duration windowLength;

    public WindowValidator(ConversationEngineProperties properties) {
        this.windowLength = properties.getWindowLength();
    }

    public boolean canSendFreeform(MessageWindow window, Instant now) {
        return window != null && window.getWindowExpiresAt() != null && now.isBefore(window.getWindowExpiresAt());
    }

    /** Templates are pre-approved by the channel and bypass the window. */
    public boolean canSendTemplate(MessageWindow window, Instant now) {
        return true;
    }

    /** Any message from the contact reopens the window for its full length. */
    public void resetOnInboundUserMessage(MessageWindow window, Instant now) {
        window.setLastUserMessageAt(now);
        window.setWindowExpiresAt(now.plus(windowLength));
        window.setOpenedBy(WindowOpener.CONTACT);
        window.setWindowOpen(true);
        window.setWindowClosedAt(null);
    }

    /** A sent template opens the window as well; never shortens an existing one. */
    public void extendOnOutboundTemplate(MessageWindow window, Instant now) {
        Instant extended = now.plus(windowLength);
        window.setLastOutboundTemplateAt(now);
        if (window.getWindowExpiresAt() == null || extended.isAfter(window.getWindowExpiresAt())) {
            window.setWindowExpiresAt(extended);
            window.setOpenedBy(WindowOpener.TEMPLATE);
        }
        window.setWindowOpen(true);
        window.setWindowClosedAt(null);
    }

    /**
     * Brings the cached flag in line with {@code windowExpiresAt}.
     *
     * @return true when this call closed a window that was still flagged open
     */
    public boolean reconcile(MessageWindow window, Instant now) {
        boolean open = canSendFreeform(window, now);
        if (window.isWindowOpen() && !open) {
            window.setWindowOpen(false);
            window.setWindowClosedAt(now);
            return true;
        }
        window.setWindowOpen(open);
        return false;
    }
}
