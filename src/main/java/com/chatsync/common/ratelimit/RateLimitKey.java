package com.chatsync.common.ratelimit;

/**
 * 限流维度。
 */
public enum RateLimitKey {

    /** 已登录按 user:&lt;id&gt;，未登录退化为 ip:&lt;addr&gt; */
    AUTO,

    /** 只按来源 IP */
    IP,

    /** 只按登录用户；未登录时不限流 */
    USER
}
