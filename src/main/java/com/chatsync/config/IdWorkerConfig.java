package com.chatsync.config;

import com.baomidou.mybatisplus.core.toolkit.IdWorker;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

/**
 * 多实例部署时必须给每个实例配置不同的 chat.id.worker-id，否则雪花 id 可能碰撞。
 * 消息 id 同时是 createdAt 相同时的排序兜底，所以单实例内单调递增即可满足排序要求。
 */
@Slf4j
@Configuration
public class IdWorkerConfig {

    private static final long MAX_5_BITS = 31;

    private final long datacenterId;
    private final long workerId;

    public IdWorkerConfig(@Value("${chat.id.datacenter-id:1}") long datacenterId,
                          @Value("${chat.id.worker-id:-1}") long workerId) {
        this.datacenterId = datacenterId;
        this.workerId = workerId;
    }

    @PostConstruct
    public void init() {
        if (workerId < 0) {
            log.info("IdWorker: chat.id.worker-id not set, keep mybatis-plus default sequence");
            return;
        }
        long wid = workerId & MAX_5_BITS;
        long dc = datacenterId & MAX_5_BITS;
        IdWorker.initSequence(wid, dc);
        log.info("IdWorker: initSequence(workerId={}, datacenterId={})", wid, dc);
    }
}
