package com.chatflow.chatflow_backend.config;

import com.chatflow.chatflow_backend.engine.RedisWebSocketBridge;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.PatternTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.messaging.simp.SimpMessagingTemplate;

/**
 * Cross-instance event relay, enabled with {@code app.events.redis-bridge.enabled=true}.
 * Without it, events only reach dashboards connected to the instance that produced them.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "app.events.redis-bridge.enabled", havingValue = "true")
public class RedisWebSocketConfig {

    @Bean
    public RedisWebSocketBridge conversationEventBridge(StringRedisTemplate redisTemplate,
                                                        SimpMessagingTemplate messagingTemplate,
                                                        ObjectMapper objectMapper) {
        return new RedisWebSocketBridge(redisTemplate, messagingTemplate, objectMapper);
    }

    @Bean
    public RedisMessageListenerContainer conversationEventListenerContainer(RedisConnectionFactory connectionFactory,
                                                                            RedisWebSocketBridge bridge) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        container.addMessageListener(bridge, new PatternTopic(RedisWebSocketBridge.CHANNEL_PATTERN));
        container.setErrorHandler(e -> log.error("Conversation event subscription failed", e));
        return container;
    }
}
