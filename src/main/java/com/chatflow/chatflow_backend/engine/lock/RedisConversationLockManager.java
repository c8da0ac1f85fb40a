package com.chatflow.chatflow_backend.engine.lock;

import com.chatflow.chatflow_backend.exception.ConversationBusyException;
import com.chatflow.chatflow_backend.exception.PersistenceException;
import com.chatflow.chatflow_backend.model.conversation.ConversationKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Cross-instance lock: SET key token NX PX lease, released only by the holder of the token.
 * The lease must outlive the slowest event, otherwise a second instance may enter.
 */
@Slf4j
public class RedisConversationLockManager implements ConversationLockManager {

    static final String KEY_PREFIX = "chatflow:conversation-lock:";
    private static final long POLL_INTERVAL_MS = 25;

    private static final DefaultRedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private final StringRedisTemplate redisTemplate;
    private final Duration waitTimeout;
    private final Duration leaseTime;

    public RedisConversationLockManager(StringRedisTemplate redisTemplate, Duration waitTimeout, Duration leaseTime) {
        this.redisTemplate = redisTemplate;
        this.waitTimeout = waitTimeout;
        this.leaseTime = leaseTime;
    }

    @Override
    public <T> T withLock(ConversationKey key, Supplier<T> action) {
        String redisKey = KEY_PREFIX + key;
        String token = UUID.randomUUID().toString();
        long deadline = System.currentTimeMillis() + waitTimeout.toMillis();

        while (!acquire(redisKey, token)) {
            if (System.currentTimeMillis() >= deadline) {
                throw new ConversationBusyException(key, waitTimeout);
            }
            try {
                Thread.sleep(POLL_INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ConversationBusyException(key, waitTimeout);
            }
        }
        try {
            return action.get();
        } finally {
            release(redisKey, token);
        }
    }

    @Override
    public <T> Optional<T> tryWithLock(ConversationKey key, Supplier<T> action) {
        String redisKey = KEY_PREFIX + key;
        String token = UUID.randomUUID().toString();
        if (!acquire(redisKey, token)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(action.get());
        } finally {
            release(redisKey, token);
        }
    }

    private boolean acquire(String redisKey, String token) {
        try {
            return Boolean.TRUE.equals(redisTemplate.opsForValue().setIfAbsent(redisKey, token, leaseTime));
        } catch (DataAccessException e) {
            throw new PersistenceException("Lock store unavailable while locking " + redisKey, e);
        }
    }

    private void release(String redisKey, String token) {
        try {
            Long deleted = redisTemplate.execute(RELEASE_SCRIPT, List.of(redisKey), token);
            if (deleted == null || deleted == 0) {
                log.warn("Lock {} had already expired before release; lease time may be too short", redisKey);
            }
        } catch (DataAccessException e) {
            // Lease expiry frees the key eventually
            log.error("Failed to release lock {}", redisKey, e);
        }
    }
}
