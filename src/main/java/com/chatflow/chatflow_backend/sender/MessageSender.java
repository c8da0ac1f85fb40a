package com.chatflow.chatflow_backend.sender;

import com.chatflow.chatflow_backend.model.conversation.SendReceipt;

import java.util.Map;

/**
 * Channel delivery. The engine decides whether a message may be sent; implementations only deliver.
 * Failures are reported in the receipt rather than thrown.
 */
public interface MessageSender {

    SendReceipt sendFreeform(String contactAddress, String text);

    SendReceipt sendTemplate(String contactAddress, String templateRef, String language, Map<String, String> params);
}
