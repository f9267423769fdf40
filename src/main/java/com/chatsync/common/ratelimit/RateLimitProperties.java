package com.chatsync.common.ratelimit;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "chat.ratelimit")
public class RateLimitProperties {

    private boolean enabled = true;
    private boolean trustForwardedHeaders = false;
    private boolean failOpen = true;

    /** 内存窗口表的容量上限，超出后由缓存按访问频率淘汰。 */
    private int maxKeys = 10_000;

    private long sweepIntervalMs = 60_000;

    /** key 为 {@link LimitClass#configKey()}，例如 auth / message。 */
    private Map<String, Limit> limits = new LinkedHashMap<>();

    public long windowSecondsOf(LimitClass limitClass) {
        Limit l = limits == null ? null : limits.get(limitClass.configKey());
        if (l == null || l.getWindowSeconds() == null || l.getWindowSeconds() <= 0) {
            return limitClass.getDefaultWindowSeconds();
        }
        return l.getWindowSeconds();
    }

    public long maxOf(LimitClass limitClass) {
        Limit l = limits == null ? null : limits.get(limitClass.configKey());
        if (l == null || l.getMax() == null || l.getMax() <= 0) {
            return limitClass.getDefaultMax();
        }
        return l.getMax();
    }

    public int maxKeysEffective() {
        return Math.max(16, maxKeys);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isTrustForwardedHeaders() {
        return trustForwardedHeaders;
    }

    public void setTrustForwardedHeaders(boolean trustForwardedHeaders) {
        this.trustForwardedHeaders = trustForwardedHeaders;
    }

    public boolean isFailOpen() {
        return failOpen;
    }

    public void setFailOpen(boolean failOpen) {
        this.failOpen = failOpen;
    }

    public int getMaxKeys() {
        return maxKeys;
    }

    public void setMaxKeys(int maxKeys) {
        this.maxKeys = maxKeys;
    }

    public long getSweepIntervalMs() {
        return sweepIntervalMs;
    }

    public void setSweepIntervalMs(long sweepIntervalMs) {
        this.sweepIntervalMs = sweepIntervalMs;
    }

    public Map<String, Limit> getLimits() {
        return limits;
    }

    public void setLimits(Map<String, Limit> limits) {
        this.limits = limits;
    }

    public static class Limit {

        private Long windowSeconds;
        private Long max;

        public Limit() {
        }

        public Limit(Long windowSeconds, Long max) {
            this.windowSeconds = windowSeconds;
            this.max = max;
        }

        public Long getWindowSeconds() {
            return windowSeconds;
        }

        public void setWindowSeconds(Long windowSeconds) {
            this.windowSeconds = windowSeconds;
        }

        public Long getMax() {
            return max;
        }

        public void setMax(Long max) {
            this.max = max;
        }
    }
}
