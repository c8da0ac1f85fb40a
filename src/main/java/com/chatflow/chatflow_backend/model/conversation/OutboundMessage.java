package com.chatflow.chatflow_backend.model.conversation;

import java.util.Map;

/**
 * A message produced by a node. FREEFORM messages are subject to the messaging window;
 * TEMPLATE messages are pre-approved and always allowed.
 */
public record OutboundMessage(Kind kind,
                              String nodeId,
                              String text,
                              String templateRef,
                              String language,
                              Map<String, String> params) {

    public enum Kind { FREEFORM, TEMPLATE }

    public OutboundMessage {
        params = params != null ? Map.copyOf(params) : Map.of();
    }

    public static OutboundMessage freeform(String nodeId, String text) {
        return new OutboundMessage(Kind.FREEFORM, nodeId, text, null, null, Map.of());
    }

    public static OutboundMessage template(String nodeId, String templateRef, String language, Map<String, String> params) {
        return new OutboundMessage(Kind.TEMPLATE, nodeId, null, templateRef, language, params);
    }

    public boolean isFreeform() {
        return kind == Kind.FREEFORM;
    }
}
