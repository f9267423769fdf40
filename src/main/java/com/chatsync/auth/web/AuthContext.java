package com.chatsync.auth.web;

import io.jsonwebtoken.JwtException;

/**
 * 请求级别的"当前用户"上下文。
 *
 * <p>由 AccessTokenInterceptor 在 preHandle 写入、afterCompletion 清理；线程复用时不清理会串号。</p>
 */
public final class AuthContext {

    private static final ThreadLocal<Long> USER_ID = new ThreadLocal<>();

    private AuthContext() {
    }

    public static void setUserId(Long userId) {
        USER_ID.set(userId);
    }

    public static Long getUserId() {
        return USER_ID.get();
    }

    public static long requireUserId() {
        Long uid = USER_ID.get();
        if (uid == null) {
            throw new JwtException("unauthorized");
        }
        return uid;
    }

    public static void clear() {
        USER_ID.remove();
    }
}
