package com.chatflow.chatflow_backend.config;

import com.chatflow.chatflow_backend.engine.RedisWebSocketBridge;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Logs at startup how conversations are coordinated: which store, which lock mode and whether
 * events fan out through Redis. A multi-instance deployment needs redis locks and the bridge.
 */
@Slf4j
@Component
public class RedisStartupLogger implements ApplicationRunner {

    private final Environment env;
    private final ConversationEngineProperties properties;
    private final ObjectProvider<RedisWebSocketBridge> bridge;

    public RedisStartupLogger(Environment env,
                              ConversationEngineProperties properties,
                              ObjectProvider<RedisWebSocketBridge> bridge) {
        this.env = env;
        this.properties = properties;
        this.bridge = bridge;
    }

    @Override
    public void run(ApplicationArguments args) {
        String redisUrl = env.getProperty("spring.data.redis.url", env.getProperty("REDIS_URL", ""));
        boolean redisLocks = "redis".equalsIgnoreCase(properties.getLock().getMode());
        boolean bridged = bridge.getIfAvailable() != null;

        log.info("Conversation engine: store={}, locks={}, events={}, window={}, sessionTtl={}",
                properties.getStore(), redisLocks ? "redis" : "local", bridged ? "redis-bridge" : "direct",
                properties.getWindowLength(), properties.getSessionTtl());

        if (!redisLocks || !bridged) {
            String reason = redisUrl.isEmpty() ? "no Redis URL configured" : "Redis coordination disabled in app.* settings";
            log.warn("Single-instance mode ({}): per-conversation locks and events do not span instances", reason);
        }
    }
}
