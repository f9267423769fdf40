package com.chatsync.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * accessToken 校验参数。token 由账号服务签发，这里只做验签，不签发。
 */
@ConfigurationProperties(prefix = "chat.auth")
public record AuthProperties(
        String issuer,
        String jwtSecret
) {
}
