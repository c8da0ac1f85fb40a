package com.chatflow.chatflow_backend.model.conversation;

public record DispatchedMessage(OutboundMessage message, SendReceipt receipt) {
}
