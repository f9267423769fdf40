package com.chatsync.gateway.session;

import io.netty.channel.Channel;
import io.netty.util.AttributeKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 本机在线表：userId -> 该用户当前的全部 WS 连接（多设备）。
 *
 * <ul>
 *   <li>同一用户的增删都在 {@link ConcurrentHashMap#compute} 内完成，连接/断开回调交错时不会丢连接。</li>
 *   <li>最后一个连接断开时整条记录移除，所以 "key 存在" 等价于 "在线"。</li>
 *   <li>对外只返回快照，调用方遍历时不持有任何锁。</li>
 * </ul>
 *
 * <p>Channel 的 equals 是对象同一性，这里直接用 Channel 作为集合元素，不依赖 channel id 文本。</p>
 */
@Slf4j
@Component
public class PresenceRegistry {

    public static final AttributeKey<Long> ATTR_USER_ID = AttributeKey.valueOf("uid");

    private final ConcurrentHashMap<Long, Set<Channel>> connections = new ConcurrentHashMap<>();

    /**
     * 幂等：同一连接重复注册不会产生重复条目。
     *
     * @return 本次是否新增了连接
     */
    public boolean register(long userId, Channel channel) {
        if (channel == null || userId <= 0) {
            return false;
        }
        channel.attr(ATTR_USER_ID).set(userId);
        boolean[] added = new boolean[1];
        connections.compute(userId, (k, set) -> {
            Set<Channel> s = set == null ? ConcurrentHashMap.newKeySet() : set;
            added[0] = s.add(channel);
            return s;
        });
        if (added[0]) {
            log.debug("presence register: userId={}, channel={}", userId, channel.id());
        }
        return added[0];
    }

    /**
     * @return 连接所属的 userId；未注册过的连接返回 null
     */
    public Long unregister(Channel channel) {
        if (channel == null) {
            return null;
        }
        Long userId = channel.attr(ATTR_USER_ID).get();
        if (userId == null) {
            return null;
        }
        boolean[] removed = new boolean[1];
        connections.computeIfPresent(userId, (k, set) -> {
            removed[0] = set.remove(channel);
            return set.isEmpty() ? null : set;
        });
        if (!removed[0]) {
            return null;
        }
        log.debug("presence unregister: userId={}, channel={}", userId, channel.id());
        return userId;
    }

    public boolean isOnline(long userId) {
        return connections.containsKey(userId);
    }

    /** 从不返回 null；离线时为空列表。 */
    public List<Channel> connectionsFor(long userId) {
        Set<Channel> set = connections.get(userId);
        return set == null ? List.of() : new ArrayList<>(set);
    }

    public List<Long> onlineUserIds() {
        return new ArrayList<>(connections.keySet());
    }

    public Collection<Channel> allConnections() {
        List<Channel> all = new ArrayList<>();
        for (Map.Entry<Long, Set<Channel>> e : connections.entrySet()) {
            all.addAll(e.getValue());
        }
        return all;
    }
}
