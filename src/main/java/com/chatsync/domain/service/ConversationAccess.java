package com.chatsync.domain.service;

import com.chatsync.common.error.ForbiddenException;
import com.chatsync.common.error.NotFoundException;
import com.chatsync.domain.entity.GroupEntity;
import com.chatsync.domain.entity.MessageEntity;
import com.chatsync.domain.model.ConversationKey;
import com.chatsync.domain.store.GroupStore;
import com.chatsync.domain.store.MessageStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 加载 + 权限判断 + 受众计算，所有变更处理器共用。
 */
@Component
@RequiredArgsConstructor
public class ConversationAccess {

    private final MessageStore messages;
    private final GroupStore groups;

    public MessageEntity requireMessage(long messageId) {
        return messages.findById(messageId).orElseThrow(() -> new NotFoundException("message_not_found"));
    }

    public GroupEntity requireGroup(long groupId) {
        return groups.findById(groupId).orElseThrow(() -> new NotFoundException("group_not_found"));
    }

    /**
     * 校验 actor 属于消息所在会话，返回该会话的推送受众。
     */
    public Set<Long> requireParticipant(long actorId, MessageEntity m) {
        return requireParticipant(actorId, m.conversationKey());
    }

    public Set<Long> requireParticipant(long actorId, ConversationKey key) {
        if (key.isGroup()) {
            GroupEntity g = requireGroup(key.groupId());
            if (!g.isMemberOrAdmin(actorId)) {
                throw new ForbiddenException("not_group_member");
            }
            return g.audience();
        }
        if (!key.involves(actorId)) {
            throw new ForbiddenException("not_conversation_member");
        }
        Set<Long> out = new LinkedHashSet<>();
        out.add(key.lowUserId());
        out.add(key.highUserId());
        return out;
    }

    public void requireSender(long actorId, MessageEntity m) {
        if (m.getSenderId() == null || m.getSenderId() != actorId) {
            throw new ForbiddenException("not_message_sender");
        }
    }

    public void requireAdmin(long actorId, GroupEntity g) {
        if (!g.isAdmin(actorId)) {
            throw new ForbiddenException("not_group_admin");
        }
    }
}
