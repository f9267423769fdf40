package com.chatsync.domain.model;

import com.chatsync.common.error.ValidationException;

/**
 * 会话标识：单聊是无序用户对（小 id 在前），群聊是 groupId。
 */
public record ConversationKey(Long lowUserId, Long highUserId, Long groupId) {

    public static ConversationKey direct(long a, long b) {
        if (a <= 0 || b <= 0) {
            throw new ValidationException("invalid_participants");
        }
        return new ConversationKey(Math.min(a, b), Math.max(a, b), null);
    }

    public static ConversationKey group(long groupId) {
        if (groupId <= 0) {
            throw new ValidationException("invalid_group_id");
        }
        return new ConversationKey(null, null, groupId);
    }

    public boolean isGroup() {
        return groupId != null;
    }

    public boolean involves(long userId) {
        return !isGroup() && (lowUserId == userId || highUserId == userId);
    }

    /** 单聊中 userId 的对端。 */
    public long peerOf(long userId) {
        return lowUserId == userId ? highUserId : lowUserId;
    }

    public String asString() {
        return isGroup() ? "g:" + groupId : "d:" + lowUserId + ":" + highUserId;
    }
}
