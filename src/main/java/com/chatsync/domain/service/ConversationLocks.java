package com.chatsync.domain.service;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;

/**
 * 按会话分配的本机锁。值是弱引用：没有线程持有时锁对象可被回收，表不会无限增长。
 */
@Component
public class ConversationLocks {

    private final LoadingCache<String, ReentrantLock> locks = Caffeine.newBuilder()
            .weakValues()
            .build(k -> new ReentrantLock());

    public ReentrantLock lockFor(String conversationId) {
        return locks.get(conversationId);
    }
}
