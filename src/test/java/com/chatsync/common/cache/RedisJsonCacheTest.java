package com.chatsync.common.cache;

import com.chatsync.domain.model.ProfileSummary;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RedisJsonCacheTest {

    private StringRedisTemplate redis;
    private ValueOperations<String, String> ops;
    private CacheProperties props;
    private RedisJsonCache cache;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redis = mock(StringRedisTemplate.class);
        ops = mock(ValueOperations.class);
        when(redis.opsForValue()).thenReturn(ops);
        props = new CacheProperties();
        cache = new RedisJsonCache(redis, new ObjectMapper(), props);
    }

    @Test
    void mget_ShouldSkipMissingAndBrokenValues() {
        when(ops.multiGet(anyList())).thenReturn(Arrays.asList(
                "{\"id\":1,\"displayName\":\"alice\",\"avatarRef\":null}",
                null,
                "not-json"));

        Map<String, ProfileSummary> out = cache.mget(List.of("k1", "k2", "k3"), ProfileSummary.class);

        assertEquals(1, out.size());
        assertEquals("alice", out.get("k1").displayName());
    }

    @Test
    void set_ShouldWriteJsonWithTtl() {
        cache.set("k1", new ProfileSummary(1L, "alice", null), Duration.ofSeconds(30));

        verify(ops).set(eq("k1"), eq("{\"id\":1,\"displayName\":\"alice\",\"avatarRef\":null}"), eq(Duration.ofSeconds(30)));
    }

    @Test
    void failure_ShouldSkipRedisDuringFailFastWindow() {
        when(ops.multiGet(anyList())).thenThrow(new RedisConnectionFailureException("down"));

        assertTrue(cache.mget(List.of("k1"), ProfileSummary.class).isEmpty());
        assertTrue(cache.mget(List.of("k1"), ProfileSummary.class).isEmpty());
        cache.set("k1", new ProfileSummary(1L, "alice", null), Duration.ofSeconds(30));

        verify(ops, times(1)).multiGet(anyList());
        verify(ops, never()).set(anyString(), anyString(), any(Duration.class));
    }

    @Test
    void disabled_ShouldNeverTouchRedis() {
        props.setEnabled(false);

        assertTrue(cache.mget(List.of("k1"), ProfileSummary.class).isEmpty());
        verify(redis, never()).opsForValue();
    }
}
