package com.chatsync.gateway.ws;

import com.chatsync.gateway.session.PresenceRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;

/**
 * 把一次变更推给受众的全部在线连接。
 *
 * <ul>
 *   <li>每次调用只序列化一次，同一个 JSON 写到所有目标连接。</li>
 *   <li>写操作投递到目标 channel 自己的 eventLoop，调用方不等待结果。</li>
 *   <li>离线用户直接跳过；单个连接写失败只记 debug 日志，不影响其它连接，也不向上抛。</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FanOutDispatcher {

    private final PresenceRegistry presence;
    private final ObjectMapper objectMapper;

    /**
     * @return 实际投递写操作的连接数
     */
    public int notify(Collection<Long> audience, String event, Object payload) {
        if (audience == null || audience.isEmpty()) {
            return 0;
        }
        String json = encode(WsEnvelope.event(event, payload));
        if (json == null) {
            return 0;
        }
        int delivered = 0;
        for (Long userId : new LinkedHashSet<>(audience)) {
            if (userId == null || userId <= 0) {
                continue;
            }
            for (Channel ch : presence.connectionsFor(userId)) {
                if (write(ch, json)) {
                    delivered++;
                }
            }
        }
        return delivered;
    }

    public int notifyUser(long userId, String event, Object payload) {
        return notify(List.of(userId), event, payload);
    }

    /** 推给本机全部连接（在线列表快照）。 */
    public int broadcast(String event, Object payload) {
        String json = encode(WsEnvelope.event(event, payload));
        if (json == null) {
            return 0;
        }
        int delivered = 0;
        for (Channel ch : presence.allConnections()) {
            if (write(ch, json)) {
                delivered++;
            }
        }
        return delivered;
    }

    /** 单连接回包（ERROR / PONG / PING）。 */
    public boolean send(Channel ch, WsEnvelope envelope) {
        String json = encode(envelope);
        return json != null && write(ch, json);
    }

    private String encode(WsEnvelope envelope) {
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            log.warn("ws envelope serialize failed: type={}, event={}, err={}", envelope.type, envelope.event, e.toString());
            return null;
        }
    }

    private boolean write(Channel ch, String json) {
        if (ch == null || !ch.isActive()) {
            return false;
        }
        try {
            ch.eventLoop().execute(() -> ch.writeAndFlush(new TextWebSocketFrame(json))
                    .addListener((ChannelFutureListener) f -> {
                        if (!f.isSuccess()) {
                            log.debug("ws delivery failed: channel={}, err={}", ch.id(), String.valueOf(f.cause()));
                        }
                    }));
            return true;
        } catch (RejectedExecutionException e) {
            // eventLoop 正在关闭
            log.debug("ws delivery rejected: channel={}, err={}", ch.id(), e.toString());
            return false;
        }
    }
}
