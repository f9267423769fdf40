package com.chatsync.domain.model;

import java.time.LocalDateTime;

/**
 * 会话索引用的消息头：只有定位会话和排序需要的列。
 */
public record MessageHead(long id, long senderId, Long receiverId, Long groupId, LocalDateTime createdAt) {

    public ConversationKey key() {
        return groupId != null ? ConversationKey.group(groupId) : ConversationKey.direct(senderId, receiverId);
    }

    /** (createdAt, id) 字典序比较，id 兜底同毫秒消息。 */
    public boolean isNewerThan(MessageHead other) {
        int c = createdAt.compareTo(other.createdAt);
        return c > 0 || (c == 0 && id > other.id);
    }
}
