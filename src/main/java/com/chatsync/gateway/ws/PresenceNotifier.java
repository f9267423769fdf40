package com.chatsync.gateway.ws;

import com.chatsync.gateway.session.PresenceRegistry;
import io.netty.channel.Channel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 连接生命周期 -> 在线表 + 在线列表广播。
 *
 * <p>每次连接建立/断开都向全部连接广播一次完整在线列表（快照，不是增量），
 * 广播在在线表更新完成之后进行。</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PresenceNotifier {

    private final PresenceRegistry presence;
    private final FanOutDispatcher dispatcher;

    public void connected(long userId, Channel channel) {
        if (presence.register(userId, channel)) {
            log.info("ws connected: userId={}, channel={}", userId, channel.id());
            broadcastSnapshot();
        }
    }

    public void disconnected(Channel channel) {
        Long userId = presence.unregister(channel);
        if (userId != null) {
            log.info("ws disconnected: userId={}, channel={}", userId, channel.id());
            broadcastSnapshot();
        }
    }

    private void broadcastSnapshot() {
        // id 以字符串下发，与 HTTP 接口里的 id 表示一致
        List<String> online = presence.onlineUserIds().stream().map(String::valueOf).toList();
        dispatcher.broadcast(ChatEvents.GET_ONLINE_USERS, online);
    }
}
