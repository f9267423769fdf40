package com.chatsync.common.time;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * 服务端时间戳统一截断到毫秒，与 DATETIME(3) 列精度一致，游标比较才不会漂移。
 */
public final class ChatTime {

    private ChatTime() {
    }

    public static LocalDateTime now() {
        return LocalDateTime.now().truncatedTo(ChronoUnit.MILLIS);
    }
}
