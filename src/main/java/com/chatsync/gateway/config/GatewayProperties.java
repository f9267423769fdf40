package com.chatsync.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "chat.gateway.ws")
public record GatewayProperties(
        String host,
        int port,
        String path,
        Integer maxFrameBytes,
        Integer writerIdleSeconds
) {

    public int maxFrameBytesEffective() {
        return maxFrameBytes == null || maxFrameBytes <= 0 ? 65536 : maxFrameBytes;
    }

    public int writerIdleSecondsEffective() {
        return writerIdleSeconds == null || writerIdleSeconds <= 0 ? 60 : writerIdleSeconds;
    }
}
