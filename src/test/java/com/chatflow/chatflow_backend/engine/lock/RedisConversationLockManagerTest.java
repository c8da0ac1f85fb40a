package com.chatflow.chatflow_backend.engine.lock;

import com.chatflow.chatflow_backend.exception.ConversationBusyException;
import com.chatflow.chatflow_backend.exception.PersistenceException;
import com.chatflow.chatflow_backend.model.conversation.ConversationKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RedisConversationLockManagerTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOps;

    private final ConversationKey key = new ConversationKey("+1555", UUID.fromString("11111111-1111-1111-1111-111111111111"));
    private final String redisKey = RedisConversationLockManager.KEY_PREFIX + "+1555@11111111-1111-1111-1111-111111111111";

    private RedisConversationLockManager locks;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        locks = new RedisConversationLockManager(redisTemplate, Duration.ofMillis(60), Duration.ofSeconds(30));
    }

    @Test
    @SuppressWarnings("unchecked")
    void runsActionAndReleasesWithItsToken() {
        when(valueOps.setIfAbsent(eq(redisKey), anyString(), eq(Duration.ofSeconds(30)))).thenReturn(true);
        when(redisTemplate.execute(any(RedisScript.class), anyList(), any())).thenReturn(1L);

        String result = locks.withLock(key, () -> "done");

        assertThat(result).isEqualTo("done");
        verify(redisTemplate).execute(any(RedisScript.class), eq(List.of(redisKey)), anyString());
    }

    @Test
    @SuppressWarnings("unchecked")
    void givesUpAfterWaitTimeout() {
        when(valueOps.setIfAbsent(eq(redisKey), anyString(), any(Duration.class))).thenReturn(false);

        assertThatThrownBy(() -> locks.withLock(key, () -> "never"))
                .isInstanceOf(ConversationBusyException.class);
        assertThat(locks.tryWithLock(key, () -> "never")).isEmpty();
        verify(redisTemplate, never()).execute(any(RedisScript.class), anyList(), any());
    }

    @Test
    void redisOutageIsPersistenceError() {
        when(valueOps.setIfAbsent(anyString(), anyString(), any(Duration.class)))
                .thenThrow(new QueryTimeoutException("redis down"));

        assertThatThrownBy(() -> locks.tryWithLock(key, () -> "x"))
                .isInstanceOf(PersistenceException.class);
    }
}
