package com.chatsync.common.ratelimit;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WindowedRateLimiterTest {

    static class MutableClock extends Clock {

        private long millis;
        private boolean broken;

        MutableClock(long millis) {
            this.millis = millis;
        }

        void advanceSeconds(long s) {
            millis += s * 1000;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public long millis() {
            if (broken) {
                throw new IllegalStateException("clock broken");
            }
            return millis;
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochMilli(millis);
        }
    }

    @Test
    void authLimit_ShouldBlockSixthAndRecoverAfterWindow() {
        RateLimitProperties props = new RateLimitProperties();
        props.getLimits().put("auth", new RateLimitProperties.Limit(900L, 5L));
        MutableClock clock = new MutableClock(1_000_000);
        WindowedRateLimiter limiter = new WindowedRateLimiter(props, clock);

        for (int i = 0; i < 5; i++) {
            assertThat(limiter.check(LimitClass.AUTH, "ip:1.2.3.4").allowed()).isTrue();
            clock.advanceSeconds(10);
        }
        // 已过去 50 秒，窗口还剩 850 秒
        WindowedRateLimiter.Decision sixth = limiter.check(LimitClass.AUTH, "ip:1.2.3.4");
        assertThat(sixth.allowed()).isFalse();
        assertThat(sixth.retryAfterSeconds()).isEqualTo(850);

        clock.advanceSeconds(850);
        assertThat(limiter.check(LimitClass.AUTH, "ip:1.2.3.4").allowed()).isTrue();
    }

    @Test
    void retryAfter_ShouldRoundUpAndBeAtLeastOne() {
        RateLimitProperties props = new RateLimitProperties();
        props.getLimits().put("strict", new RateLimitProperties.Limit(10L, 1L));
        MutableClock clock = new MutableClock(0);
        WindowedRateLimiter limiter = new WindowedRateLimiter(props, clock);

        limiter.check(LimitClass.STRICT, "user:1");
        clock.millis = 8_200;
        assertThat(limiter.check(LimitClass.STRICT, "user:1").retryAfterSeconds()).isEqualTo(2);
        clock.millis = 9_500;
        assertThat(limiter.check(LimitClass.STRICT, "user:1").retryAfterSeconds()).isEqualTo(1);
    }

    @Test
    void classesAndKeys_ShouldBeCountedIndependently() {
        RateLimitProperties props = new RateLimitProperties();
        props.getLimits().put("message", new RateLimitProperties.Limit(60L, 1L));
        WindowedRateLimiter limiter = new WindowedRateLimiter(props, new MutableClock(0));

        assertThat(limiter.check(LimitClass.MESSAGE, "user:1").allowed()).isTrue();
        assertThat(limiter.check(LimitClass.MESSAGE, "user:1").allowed()).isFalse();
        assertThat(limiter.check(LimitClass.MESSAGE, "user:2").allowed()).isTrue();
        assertThat(limiter.check(LimitClass.API, "user:1").allowed()).isTrue();
    }

    @Test
    void defaults_ShouldComeFromLimitClass() {
        RateLimitProperties props = new RateLimitProperties();
        assertThat(props.windowSecondsOf(LimitClass.CONNECTION)).isEqualTo(300);
        assertThat(props.maxOf(LimitClass.CONNECTION)).isEqualTo(20);
        assertThat(props.maxOf(LimitClass.REALTIME)).isEqualTo(100);
    }

    @Test
    void disabled_ShouldBypassAndCount() {
        RateLimitProperties props = new RateLimitProperties();
        props.setEnabled(false);
        WindowedRateLimiter limiter = new WindowedRateLimiter(props, new MutableClock(0));

        assertThat(limiter.check(LimitClass.STRICT, "user:1").allowed()).isTrue();
        assertThat(limiter.metrics().bypassedRequests()).isEqualTo(1);
        assertThat(limiter.metrics().totalRequests()).isZero();
    }

    @Test
    void internalError_ShouldFailOpen() {
        RateLimitProperties props = new RateLimitProperties();
        MutableClock clock = new MutableClock(0);
        WindowedRateLimiter limiter = new WindowedRateLimiter(props, clock);
        clock.broken = true;

        assertThat(limiter.check(LimitClass.API, "user:1").allowed()).isTrue();
        assertThat(limiter.metrics().errorCount()).isEqualTo(1);
    }

    @Test
    void internalError_ShouldDenyWhenFailClosed() {
        RateLimitProperties props = new RateLimitProperties();
        props.setFailOpen(false);
        MutableClock clock = new MutableClock(0);
        WindowedRateLimiter limiter = new WindowedRateLimiter(props, clock);
        clock.broken = true;

        assertThat(limiter.check(LimitClass.API, "user:1").allowed()).isFalse();
    }

    @Test
    void acquire_ShouldThrowWithRetryAfter() {
        RateLimitProperties props = new RateLimitProperties();
        props.getLimits().put("api", new RateLimitProperties.Limit(60L, 1L));
        WindowedRateLimiter limiter = new WindowedRateLimiter(props, new MutableClock(0));

        limiter.acquire(LimitClass.API, "user:1");
        assertThatThrownBy(() -> limiter.acquire(LimitClass.API, "user:1"))
                .isInstanceOf(RateLimitExceededException.class)
                .satisfies(e -> assertThat(((RateLimitExceededException) e).getRetryAfterSeconds()).isEqualTo(60));
    }

    @Test
    void sweep_ShouldEvictExpiredWindows() {
        RateLimitProperties props = new RateLimitProperties();
        MutableClock clock = new MutableClock(0);
        WindowedRateLimiter limiter = new WindowedRateLimiter(props, clock);

        limiter.check(LimitClass.MESSAGE, "user:1");
        limiter.check(LimitClass.STRICT, "user:1");
        clock.advanceSeconds(90);

        assertThat(limiter.sweep()).isEqualTo(1);
        assertThat(limiter.trackedKeys()).isEqualTo(1);
    }

    @Test
    void maxKeys_ShouldBoundTrackedWindows() {
        RateLimitProperties props = new RateLimitProperties();
        props.setMaxKeys(20);
        WindowedRateLimiter limiter = new WindowedRateLimiter(props, new MutableClock(0));

        for (int i = 0; i < 60; i++) {
            assertThat(limiter.check(LimitClass.STRICT, "user:" + i).allowed()).isTrue();
        }
        limiter.sweep();

        assertThat(limiter.trackedKeys()).isPositive().isLessThanOrEqualTo(20);
        assertThat(limiter.metrics().trackedKeys()).isEqualTo(limiter.trackedKeys());
    }

    @Test
    void expiredWindow_ShouldRestartCountWithoutSweep() {
        RateLimitProperties props = new RateLimitProperties();
        props.getLimits().put("message", new RateLimitProperties.Limit(60L, 1L));
        MutableClock clock = new MutableClock(0);
        WindowedRateLimiter limiter = new WindowedRateLimiter(props, clock);

        assertThat(limiter.check(LimitClass.MESSAGE, "user:1").allowed()).isTrue();
        assertThat(limiter.check(LimitClass.MESSAGE, "user:1").allowed()).isFalse();
        clock.advanceSeconds(60);

        assertThat(limiter.check(LimitClass.MESSAGE, "user:1").allowed()).isTrue();
    }
}
