package com.chatflow.chatflow_backend.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Relays conversation events between instances. Each flow gets its own Redis channel, and every
 * instance subscribed to the pattern delivers the event to its local STOMP subscribers of that flow.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisWebSocketBridge implements MessageListener {

    public static final String CHANNEL_PREFIX = "chatflow:conversation-events:";
    public static final String CHANNEL_PATTERN = CHANNEL_PREFIX + "*";

    private static final TypeReference<Map<String, Object>> EVENT_TYPE = new TypeReference<>() {};

    private final StringRedisTemplate redisTemplate;
    private final SimpMessagingTemplate messagingTemplate;
    private final ObjectMapper objectMapper;

    public static String channelFor(String flowId) {
        return CHANNEL_PREFIX + flowId;
    }

    public void publish(String flowId, Map<String, Object> event) {
        String json;
        try {
            json = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("Dropping {} for flow {}: not serializable", event.get("type"), flowId, e);
            return;
        }
        redisTemplate.convertAndSend(channelFor(flowId), json);
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        String channel = new String(message.getChannel(), StandardCharsets.UTF_8);
        if (!channel.startsWith(CHANNEL_PREFIX)) {
            log.warn("Ignoring message on unexpected channel {}", channel);
            return;
        }
        String flowId = channel.substring(CHANNEL_PREFIX.length());
        try {
            Map<String, Object> event = objectMapper.readValue(message.getBody(), EVENT_TYPE);
            messagingTemplate.convertAndSend(ConversationEventPublisher.destinationFor(flowId), event);
        } catch (Exception e) {
            // Listener thread belongs to the container; one bad event must not stop delivery
            log.error("Failed to relay conversation event for flow {}", flowId, e);
        }
    }
}
