package com.agronet.marketplace.infrastructure.lock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("RedisDistributedLock Unit Tests")
class RedisDistributedLockTest {

    @Mock
    private StringRedisTemplate stringRedisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private RedisDistributedLock lock;

    @BeforeEach
    void setUp() {
        lock = new RedisDistributedLock(stringRedisTemplate);
    }

    @Test
    @DisplayName("acquireLock - Success: returns a token when the key was free")
    void acquireLock_Free_ReturnsToken() {
        // Given
        when(stringRedisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent(eq("lock:sweep"), anyString(), eq(Duration.ofMinutes(10)))).thenReturn(true);

        // When
        String token = lock.acquireLock("lock:sweep", Duration.ofMinutes(10));

        // Then
        assertThat(token).isNotBlank();
    }

    @Test
    @DisplayName("acquireLock - Failure: held elsewhere")
    void acquireLock_Held_ReturnsNull() {
        // Given
        when(stringRedisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(false);

        // When / Then
        assertThat(lock.acquireLock("lock:sweep", Duration.ofMinutes(10))).isNull();
    }

    @Test
    @DisplayName("acquireLock - Failure: Redis unreachable")
    void acquireLock_RedisDown_ReturnsNull() {
        // Given
        when(stringRedisTemplate.opsForValue()).thenThrow(new RedisConnectionFailureException("refused"));

        // When / Then
        assertThat(lock.acquireLock("lock:sweep", Duration.ofMinutes(10))).isNull();
    }

    @Test
    @DisplayName("releaseLock - Success: compare-and-delete with the holder's token")
    @SuppressWarnings("unchecked")
    void releaseLock_MatchingToken_Released() {
        // Given
        when(stringRedisTemplate.execute(any(RedisScript.class), eq(List.of("lock:sweep")), eq("token-1")))
                .thenReturn(1L);

        // When / Then
        assertThat(lock.releaseLock("lock:sweep", "token-1")).isTrue();
    }

    @Test
    @DisplayName("releaseLock - Failure: token no longer matches")
    @SuppressWarnings("unchecked")
    void releaseLock_StaleToken_NotReleased() {
        // Given
        when(stringRedisTemplate.execute(any(RedisScript.class), anyList(), any())).thenReturn(0L);

        // When / Then
        assertThat(lock.releaseLock("lock:sweep", "stale")).isFalse();
    }

    @Test
    @DisplayName("releaseLock - Failure: null token")
    void releaseLock_NullToken() {
        assertThat(lock.releaseLock("lock:sweep", null)).isFalse();
        verifyNoInteractions(stringRedisTemplate);
    }
}
