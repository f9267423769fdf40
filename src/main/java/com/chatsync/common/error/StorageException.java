package com.chatsync.common.error;

/**
 * 存储层失败（数据库不可用、SQL 错误等）。
 *
 * <p>对外统一表现为 internal_error；抛出后调用方不得再做推送。</p>
 */
public class StorageException extends ChatException {

    public StorageException(String operation, Throwable cause) {
        super("internal_error", operation, cause);
    }
}
