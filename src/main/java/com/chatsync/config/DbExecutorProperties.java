package com.chatsync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * WS 帧触发的存储操作所用线程池（Netty eventLoop 上不能直接跑 JDBC）。
 */
@ConfigurationProperties(prefix = "chat.executors.db")
public record DbExecutorProperties(
        Integer corePoolSize,
        Integer maxPoolSize,
        Integer queueCapacity
) {

    public int corePoolSizeEffective() {
        return corePoolSize == null ? 8 : Math.max(1, corePoolSize);
    }

    public int maxPoolSizeEffective() {
        int max = maxPoolSize == null ? 32 : Math.max(1, maxPoolSize);
        return Math.max(max, corePoolSizeEffective());
    }

    public int queueCapacityEffective() {
        return queueCapacity == null ? 10_000 : Math.max(0, queueCapacity);
    }
}
