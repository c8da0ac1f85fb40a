package com.chatflow.chatflow_backend.config;

import com.chatflow.chatflow_backend.engine.lock.ConversationLockManager;
import com.chatflow.chatflow_backend.engine.lock.LocalConversationLockManager;
import com.chatflow.chatflow_backend.engine.lock.RedisConversationLockManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;

@Slf4j
@Configuration
public class ConversationLockConfig {

    @Bean
    public ConversationLockManager conversationLockManager(ConversationEngineProperties properties,
                                                           ObjectProvider<StringRedisTemplate> redisTemplate) {
        ConversationEngineProperties.Lock lock = properties.getLock();
        if ("redis".equalsIgnoreCase(lock.getMode())) {
            StringRedisTemplate template = redisTemplate.getIfAvailable();
            if (template == null) {
                throw new IllegalStateException("app.conversation.lock.mode=redis but no Redis connection is configured");
            }
            Duration minimumLease = properties.getRetryBudget().plus(properties.getExternalCallTimeout());
            if (lock.getLeaseTime().compareTo(minimumLease) <= 0) {
                throw new IllegalStateException("app.conversation.lock.lease-time (" + lock.getLeaseTime()
                        + ") must exceed retry-budget + external-call-timeout (" + minimumLease + ")");
            }
            log.info("Conversation locks: redis (wait={}, lease={})", lock.getWaitTimeout(), lock.getLeaseTime());
            return new RedisConversationLockManager(template, lock.getWaitTimeout(), lock.getLeaseTime());
        }
        log.info("Conversation locks: local, {} stripes (wait={})", lock.getStripes(), lock.getWaitTimeout());
        return new LocalConversationLockManager(lock.getStripes(), lock.getWaitTimeout());
    }
}
