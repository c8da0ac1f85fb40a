package com.chatflow.chatflow_backend.sender;

import com.chatflow.chatflow_backend.model.conversation.SendReceipt;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;

/**
 * Default sender when no channel integration is wired: logs and acknowledges every message.
 * A channel integration replaces it by declaring its own sender {@code @Primary}.
 */
@Slf4j
@Component
public class LoggingMessageSender implements MessageSender {

    @Override
    public SendReceipt sendFreeform(String contactAddress, String text) {
        String id = UUID.randomUUID().toString();
        log.info("[SEND] freeform to {} ({}): {}", contactAddress, id, text);
        return SendReceipt.ack(id);
    }

    @Override
    public SendReceipt sendTemplate(String contactAddress, String templateRef, String language, Map<String, String> params) {
        String id = UUID.randomUUID().toString();
        log.info("[SEND] template '{}' ({}) to {} ({}): {}", templateRef, language, contactAddress, id, params);
        return SendReceipt.ack(id);
    }
}
