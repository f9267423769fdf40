package com.chatsync.common.cache;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "chat.cache")
public class CacheProperties {

    private boolean enabled = true;

    private long userProfileTtlSeconds = 1800;

    /** Redis 出错后多久内直接跳过缓存 */
    private long failFastMs = 10_000;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getUserProfileTtlSeconds() {
        return userProfileTtlSeconds;
    }

    public void setUserProfileTtlSeconds(long userProfileTtlSeconds) {
        this.userProfileTtlSeconds = userProfileTtlSeconds;
    }

    public long getFailFastMs() {
        return failFastMs;
    }

    public void setFailFastMs(long failFastMs) {
        this.failFastMs = failFastMs;
    }
}
