package com.chatsync.common.error;

/**
 * 业务异常基类。
 *
 * <p>reason 是对外暴露的 snake_case 原因码（HTTP 的 Result.message、WS 的 ERROR.reason 都用它）；
 * detail 只进日志，不直接返回给调用方。</p>
 */
public abstract class ChatException extends RuntimeException {

    private final String reason;

    protected ChatException(String reason, String detail, Throwable cause) {
        super(detail == null || detail.isBlank() ? reason : reason + ": " + detail, cause);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
