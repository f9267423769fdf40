package com.chatsync.common.ratelimit;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 限流分类：每类有独立的窗口与上限，计数互不影响。
 *
 * <p>这里的数值只是默认值，可通过 chat.ratelimit.limits.&lt;class&gt; 覆盖。</p>
 */
@Getter
@RequiredArgsConstructor
public enum LimitClass {

    /** 登录/换 token 等鉴权动作 */
    AUTH(900, 10),
    /** 发消息、编辑、删除 */
    MESSAGE(60, 30),
    /** 表情、已读、正在输入等高频实时动作 */
    REALTIME(60, 100),
    /** 普通查询接口 */
    API(900, 100),
    /** 删除会话/删除群等破坏性操作 */
    STRICT(3600, 10),
    /** WS 建连 */
    CONNECTION(300, 20);

    private final long defaultWindowSeconds;
    private final long defaultMax;

    public String configKey() {
        return name().toLowerCase();
    }
}
