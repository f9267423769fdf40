package com.chatsync.common.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 进程内固定窗口限流。
 *
 * <ul>
 *   <li>计数 key = 分类 + ":" + 维度 key（user:1 / ip:10.0.0.1）。</li>
 *   <li>窗口到期后第一次请求重置计数；retryAfter = 当前窗口剩余时间（向上取整，至少 1 秒）。</li>
 *   <li>内部异常一律按 failOpen 处理，并记入 errors 计数。</li>
 * </ul>
 *
 * <p>窗口表是 Caffeine 缓存：每条按所属分类的窗口长度过期，总数受 maxKeys 约束。
 * 单 key 的"读-判断-写"在 {@code asMap().compute} 内完成，并发请求不会漏计。</p>
 */
@Slf4j
@Component
public class WindowedRateLimiter {

    private final RateLimitProperties props;
    private final Clock clock;

    private final Cache<String, Window> windows;

    private final AtomicLong total = new AtomicLong();
    private final AtomicLong blocked = new AtomicLong();
    private final AtomicLong bypassed = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();

    @Autowired
    public WindowedRateLimiter(RateLimitProperties props) {
        this(props, Clock.systemUTC());
    }

    public WindowedRateLimiter(RateLimitProperties props, Clock clock) {
        this.props = props;
        this.clock = clock;
        this.windows = Caffeine.newBuilder()
                .maximumSize(props.maxKeysEffective())
                .expireAfter(new WindowExpiry())
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                // 维护任务在调用线程执行，淘汰结果立即可见
                .executor(Runnable::run)
                .build();
    }

    public Decision check(LimitClass limitClass, String key) {
        if (!props.isEnabled() || limitClass == null || key == null || key.isBlank()) {
            bypassed.incrementAndGet();
            return Decision.allow();
        }
        total.incrementAndGet();
        try {
            long now = clock.millis();
            long windowMs = props.windowSecondsOf(limitClass) * 1000L;
            long max = props.maxOf(limitClass);

            Window w = windows.asMap().compute(limitClass.name() + ":" + key, (k, cur) -> {
                if (cur == null || now - cur.startMs() >= windowMs) {
                    return new Window(limitClass, now, 1);
                }
                return new Window(limitClass, cur.startMs(), cur.count() + 1);
            });

            if (w.count() <= max) {
                return Decision.allow();
            }
            blocked.incrementAndGet();
            long remainingMs = Math.max(0, w.startMs() + windowMs - now);
            long retryAfter = Math.max(1, (remainingMs + 999) / 1000);
            log.warn("rate limited: class={}, key={}, count={}, max={}, retryAfter={}s",
                    limitClass, key, w.count(), max, retryAfter);
            return Decision.deny(retryAfter);
        } catch (RuntimeException e) {
            errors.incrementAndGet();
            if (props.isFailOpen()) {
                log.debug("ratelimit check failed, fail-open: class={}, key={}, err={}", limitClass, key, e.toString());
                return Decision.allow();
            }
            return Decision.deny(props.windowSecondsOf(limitClass));
        }
    }

    /**
     * 检查并在拒绝时直接抛出 {@link RateLimitExceededException}。
     */
    public void acquire(LimitClass limitClass, String key) {
        Decision d = check(limitClass, key);
        if (!d.allowed()) {
            throw new RateLimitExceededException("too_many_requests", d.retryAfterSeconds());
        }
    }

    /**
     * 周期清理：让缓存立即处理到期和超容量的条目。
     *
     * @return 本次减少的 key 数
     */
    @Scheduled(fixedDelayString = "${chat.ratelimit.sweep-interval-ms:60000}")
    public int sweep() {
        try {
            long before = windows.estimatedSize();
            windows.cleanUp();
            int removed = (int) Math.max(0, before - windows.estimatedSize());
            if (removed > 0) {
                log.debug("ratelimit sweep removed {} keys, remaining={}", removed, windows.estimatedSize());
            }
            return removed;
        } catch (RuntimeException e) {
            errors.incrementAndGet();
            log.warn("ratelimit sweep failed: {}", e.toString());
            return 0;
        }
    }

    public Metrics metrics() {
        return new Metrics(total.get(), blocked.get(), bypassed.get(), errors.get(), trackedKeys());
    }

    int trackedKeys() {
        return (int) windows.estimatedSize();
    }

    private record Window(LimitClass limitClass, long startMs, long count) {
    }

    /** 条目在窗口结束时过期；读取不续期。 */
    private final class WindowExpiry implements Expiry<String, Window> {

        @Override
        public long expireAfterCreate(String key, Window w, long currentTime) {
            return remainingNanos(w, currentTime);
        }

        @Override
        public long expireAfterUpdate(String key, Window w, long currentTime, long currentDuration) {
            return remainingNanos(w, currentTime);
        }

        @Override
        public long expireAfterRead(String key, Window w, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long remainingNanos(Window w, long nowNanos) {
            long endMs = w.startMs() + props.windowSecondsOf(w.limitClass()) * 1000L;
            return Math.max(0, TimeUnit.MILLISECONDS.toNanos(endMs) - nowNanos);
        }
    }

    public record Decision(boolean allowed, long retryAfterSeconds) {

        private static final Decision ALLOW = new Decision(true, 0);

        public static Decision allow() {
            return ALLOW;
        }

        public static Decision deny(long retryAfterSeconds) {
            return new Decision(false, Math.max(1, retryAfterSeconds));
        }
    }

    public record Metrics(long totalRequests, long blockedRequests, long bypassedRequests, long errorCount, int trackedKeys) {
    }
}
