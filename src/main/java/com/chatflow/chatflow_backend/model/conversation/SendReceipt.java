package com.chatflow.chatflow_backend.model.conversation;

/** Channel acknowledgement (or rejection) of one outbound message. */
public record SendReceipt(boolean accepted, String providerMessageId, String error) {

    public static SendReceipt ack(String providerMessageId) {
        return new SendReceipt(true, providerMessageId, null);
    }

    public static SendReceipt failed(String error) {
        return new SendReceipt(false, null, error);
    }
}
