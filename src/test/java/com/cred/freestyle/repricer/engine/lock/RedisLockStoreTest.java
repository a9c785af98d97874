package com.cred.freestyle.repricer.engine.lock;

import com.cred.freestyle.repricer.domain.model.ProcessingLock.LockType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for RedisLockStore.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("RedisLockStore Tests")
class RedisLockStoreTest {

    private static final String KEY = "variant_processing_gid://shopify/ProductVariant/1";
    private static final String REDIS_KEY = RedisLockStore.KEY_PREFIX + KEY;

    @Mock
    private StringRedisTemplate stringRedisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    @InjectMocks
    private RedisLockStore lockStore;

    private final Instant now = Instant.parse("2024-01-01T12:00:00Z");

    @BeforeEach
    void setUp() {
        when(stringRedisTemplate.opsForValue()).thenReturn(valueOperations);
    }

    @Test
    @DisplayName("insertIfAbsent - Should SET NX with the remaining TTL")
    void insertIfAbsent_SetsWithTtl() {
        // Given
        when(valueOperations.setIfAbsent(REDIS_KEY, "node-a:1", Duration.ofSeconds(120))).thenReturn(true);

        // When / Then
        assertThat(lockStore.insertIfAbsent(KEY, LockType.CAMPAIGN_EXECUTION, "node-a:1",
                now.plusSeconds(120), now)).isTrue();
    }

    @Test
    @DisplayName("insertIfAbsent - Should report a held key as not acquired")
    void insertIfAbsent_Held_False() {
        // Given
        when(valueOperations.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(false);

        // When / Then
        assertThat(lockStore.insertIfAbsent(KEY, LockType.CAMPAIGN_EXECUTION, "node-b:2",
                now.plusSeconds(120), now)).isFalse();
    }

    @Test
    @DisplayName("insertIfAbsent - Should refuse a TTL that is already spent")
    void insertIfAbsent_NonPositiveTtl_False() {
        // When
        boolean acquired = lockStore.insertIfAbsent(KEY, LockType.WEBHOOK_PROCESSING, "node-a:1", now, now);

        // Then
        assertThat(acquired).isFalse();
        verify(valueOperations, never()).setIfAbsent(anyString(), anyString(), any(Duration.class));
    }

    @Test
    @DisplayName("reclaimIfExpired - Never reclaims, Redis expires keys itself")
    void reclaimIfExpired_AlwaysFalse() {
        assertThat(lockStore.reclaimIfExpired(KEY, LockType.CAMPAIGN_EXECUTION, "node-a:1",
                now.plusSeconds(120), now)).isFalse();
        assertThat(lockStore.deleteExpired(now)).isZero();
    }

    @Test
    @DisplayName("release - Should run the compare-and-delete script with the key and token")
    void release_MatchingToken_Deletes() {
        // Given
        when(stringRedisTemplate.execute(eq(RedisLockStore.RELEASE_SCRIPT), eq(List.of(REDIS_KEY)), eq("node-a:1")))
                .thenReturn(1L);

        // When
        boolean released = lockStore.release(KEY, "node-a:1");

        // Then
        assertThat(released).isTrue();
        verify(stringRedisTemplate).execute(eq(RedisLockStore.RELEASE_SCRIPT), eq(List.of(REDIS_KEY)), eq("node-a:1"));
        verify(stringRedisTemplate, never()).delete(anyString());
        verify(valueOperations, never()).get(anyString());
    }

    @Test
    @DisplayName("release - Should report a lock now owned by another instance as not released")
    void release_OtherToken_Kept() {
        // Given - the script found a different token and deleted nothing
        when(stringRedisTemplate.execute(eq(RedisLockStore.RELEASE_SCRIPT), eq(List.of(REDIS_KEY)), eq("node-a:1")))
                .thenReturn(0L);

        // When
        boolean released = lockStore.release(KEY, "node-a:1");

        // Then
        assertThat(released).isFalse();
        verify(stringRedisTemplate, never()).delete(anyString());
    }

    @Test
    @DisplayName("Release script compares the stored token before deleting")
    void releaseScript_ComparesThenDeletes() {
        assertThat(RedisLockStore.RELEASE_SCRIPT.getScriptAsString())
                .contains("redis.call('get', KEYS[1]) == ARGV[1]")
                .contains("redis.call('del', KEYS[1])");
        assertThat(RedisLockStore.RELEASE_SCRIPT.getResultType()).isEqualTo(Long.class);
    }
}
