package com.chatflow.chatflow_backend.engine;

import com.chatflow.chatflow_backend.model.conversation.ConversationKey;
import com.chatflow.chatflow_backend.model.conversation.ConversationState;
import com.chatflow.chatflow_backend.model.conversation.OutcomeStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Component
public class ConversationEventPublisher {

    private static final String TOPIC = "/topic/conversations/";

    private final SimpMessagingTemplate messagingTemplate;
    private final ObjectProvider<RedisWebSocketBridge> redisBridgeProvider;

    public ConversationEventPublisher(SimpMessagingTemplate messagingTemplate,
                                      ObjectProvider<RedisWebSocketBridge> redisBridgeProvider) {
        this.messagingTemplate = messagingTemplate;
        this.redisBridgeProvider = redisBridgeProvider;
    }

    public void conversationAdvanced(ConversationState state, OutcomeStatus outcome) {
        Map<String, Object> payload = basePayload("CONVERSATION_ADVANCED", state.key());
        payload.put("runState", state.getRunState().name());
        payload.put("currentNodeId", state.getCurrentNodeId() != null ? state.getCurrentNodeId() : "");
        payload.put("outcome", outcome.name());
        payload.put("version", state.getVersion());
        publish(state.getFlowId().toString(), payload);
    }

    public void windowClosed(ConversationKey key, Instant closedAt) {
        Map<String, Object> payload = basePayload("WINDOW_CLOSED", key);
        payload.put("closedAt", closedAt.toString());
        publish(key.flowId().toString(), payload);
    }

    public void conversationExpired(ConversationKey key) {
        publish(key.flowId().toString(), basePayload("CONVERSATION_EXPIRED", key));
    }

    /** STOMP destination dashboards subscribe to for one flow's conversations. */
    public static String destinationFor(String flowId) {
        return TOPIC + flowId;
    }

    private Map<String, Object> basePayload(String type, ConversationKey key) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", type);
        payload.put("contactAddress", key.contactAddress());
        payload.put("flowId", key.flowId().toString());
        return payload;
    }

    // Events are informational; a failed publish never affects the conversation
    private void publish(String flowId, Map<String, Object> payload) {
        RedisWebSocketBridge bridge = redisBridgeProvider.getIfAvailable();
        try {
            if (bridge != null) {
                bridge.publish(flowId, payload);
            } else {
                messagingTemplate.convertAndSend(destinationFor(flowId), payload);
            }
        } catch (RuntimeException e) {
            log.warn("Failed to publish {} for flow {}: {}", payload.get("type"), flowId, e.getMessage());
        }
    }
}
