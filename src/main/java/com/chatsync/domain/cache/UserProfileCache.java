package com.chatsync.domain.cache;

import com.chatsync.common.cache.CacheProperties;
import com.chatsync.common.cache.RedisJsonCache;
import com.chatsync.domain.model.ProfileSummary;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 用户展示资料缓存（消息水合时按批读取）。
 */
@Component
public class UserProfileCache {

    private static final String KEY_PREFIX = "chat:cache:user:profile:";

    private final CacheProperties props;
    private final RedisJsonCache cache;

    public UserProfileCache(CacheProperties props, RedisJsonCache cache) {
        this.props = props;
        this.cache = cache;
    }

    public Map<Long, ProfileSummary> getBatch(Collection<Long> userIds) {
        if (userIds == null || userIds.isEmpty()) {
            return new HashMap<>();
        }
        List<Long> ids = userIds.stream().filter(v -> v != null && v > 0).distinct().toList();
        Map<String, ProfileSummary> byKey = cache.mget(ids.stream().map(this::key).toList(), ProfileSummary.class);

        Map<Long, ProfileSummary> out = new HashMap<>();
        for (Long id : ids) {
            ProfileSummary v = byKey.get(key(id));
            if (v != null) {
                out.put(id, v);
            }
        }
        return out;
    }

    public void put(long userId, ProfileSummary value) {
        cache.set(key(userId), value, Duration.ofSeconds(Math.max(1, props.getUserProfileTtlSeconds())));
    }

    private String key(long userId) {
        return KEY_PREFIX + userId;
    }
}
