package com.chatsync.common.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * JSON 值缓存。缓存只是加速层：任何 Redis 异常都吞掉并按未命中处理，
 * 同时在 failFastMs 内跳过后续访问，避免每次读写都卡在连接超时上。
 */
@Slf4j
@Component
public class RedisJsonCache {

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final CacheProperties props;

    private final AtomicLong unavailableUntilMs = new AtomicLong(0);

    public RedisJsonCache(StringRedisTemplate redis, ObjectMapper objectMapper, CacheProperties props) {
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.props = props;
    }

    public <T> Map<String, T> mget(List<String> keys, Class<T> type) {
        if (keys == null || keys.isEmpty() || shouldSkip()) {
            return Map.of();
        }
        List<String> raws;
        try {
            raws = redis.opsForValue().multiGet(keys);
        } catch (Exception e) {
            markDown("mget", e);
            return Map.of();
        }
        if (raws == null || raws.isEmpty()) {
            return Map.of();
        }
        Map<String, T> out = new LinkedHashMap<>();
        int n = Math.min(keys.size(), raws.size());
        for (int i = 0; i < n; i++) {
            String raw = raws.get(i);
            if (raw == null || raw.isBlank()) {
                continue;
            }
            try {
                out.put(keys.get(i), objectMapper.readValue(raw, type));
            } catch (Exception e) {
                // 脏数据按未命中处理，下次回填覆盖
                log.debug("cache value parse failed: key={}, err={}", keys.get(i), e.toString());
            }
        }
        return out;
    }

    public void set(String key, Object value, Duration ttl) {
        if (key == null || value == null || shouldSkip()) {
            return;
        }
        try {
            redis.opsForValue().set(key, objectMapper.writeValueAsString(value), ttl);
        } catch (Exception e) {
            markDown("set", e);
        }
    }

    private boolean shouldSkip() {
        return !props.isEnabled() || System.currentTimeMillis() < unavailableUntilMs.get();
    }

    private void markDown(String op, Exception e) {
        log.debug("redis cache {} failed, skip cache for {}ms: {}", op, props.getFailFastMs(), e.toString());
        unavailableUntilMs.accumulateAndGet(System.currentTimeMillis() + props.getFailFastMs(), Math::max);
    }
}
