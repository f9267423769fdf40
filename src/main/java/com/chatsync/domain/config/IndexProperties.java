package com.chatsync.domain.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 会话列表两阶段扫描的参数。
 *
 * @param recentWindowDays    第一阶段只看最近这么多天
 * @param firstPageSampleMax  第一页每侧最多扫描的消息头数
 * @param nextPageSampleMax   后续页每侧最多扫描的消息头数
 * @param widenedSampleMax    第二阶段（不限时间）每侧上限
 */
@ConfigurationProperties(prefix = "chat.index")
public record IndexProperties(
        Integer recentWindowDays,
        Integer firstPageSampleMax,
        Integer nextPageSampleMax,
        Integer widenedSampleMax
) {

    public int recentWindowDaysEffective() {
        return recentWindowDays == null || recentWindowDays <= 0 ? 90 : recentWindowDays;
    }

    public int firstPageSampleMaxEffective() {
        return firstPageSampleMax == null || firstPageSampleMax <= 0 ? 200 : firstPageSampleMax;
    }

    public int nextPageSampleMaxEffective() {
        return nextPageSampleMax == null || nextPageSampleMax <= 0 ? 500 : nextPageSampleMax;
    }

    public int widenedSampleMaxEffective() {
        return widenedSampleMax == null || widenedSampleMax <= 0 ? 5000 : widenedSampleMax;
    }
}
