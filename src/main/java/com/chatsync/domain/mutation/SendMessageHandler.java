package com.chatsync.domain.mutation;

import com.chatsync.common.error.ForbiddenException;
import com.chatsync.common.error.NotFoundException;
import com.chatsync.common.error.ValidationException;
import com.chatsync.common.time.ChatTime;
import com.chatsync.domain.dto.MessageView;
import com.chatsync.domain.entity.GroupEntity;
import com.chatsync.domain.entity.MessageEntity;
import com.chatsync.domain.model.MessageContent;
import com.chatsync.domain.model.MessageRefs;
import com.chatsync.domain.service.ConversationAccess;
import com.chatsync.domain.service.ProfileHydrator;
import com.chatsync.domain.store.MessageStore;
import com.chatsync.domain.store.UserDirectory;
import com.chatsync.gateway.ws.ChatEvents;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 发消息：先落库，成功后再推送。发送方自己的其它连接也会收到 newMessage（多端同步）。
 *
 * <p>回复目标必须在同一会话；转发要求发送者能看到来源消息，并记下来源发送者。</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SendMessageHandler {

    private final MessageStore messages;
    private final UserDirectory users;
    private final ConversationAccess access;
    private final ProfileHydrator hydrator;
    private final MessageEventPublisher events;

    public MessageView sendDirect(long senderId, long receiverId, MessageContent content, MessageRefs refs) {
        if (senderId == receiverId) {
            throw new ValidationException("receiver_is_sender");
        }
        if (receiverId <= 0 || users.findProfiles(List.of(receiverId)).isEmpty()) {
            throw new NotFoundException("receiver_not_found");
        }

        MessageEntity m = newMessage(senderId, content);
        m.setReceiverId(receiverId);
        applyRefs(senderId, m, refs);
        MessageEntity saved = messages.insert(m, content.attachments());

        MessageView view = hydrator.message(saved);
        Set<Long> audience = new LinkedHashSet<>(List.of(senderId, receiverId));
        int delivered = events.publish(audience, view, ChatEvents.NEW_MESSAGE, ChatEvents.NEW_MESSAGE);
        log.debug("direct message sent: id={}, from={}, to={}, delivered={}", saved.getId(), senderId, receiverId, delivered);
        return view;
    }

    public MessageView sendGroup(long senderId, long groupId, MessageContent content, MessageRefs refs) {
        GroupEntity g = access.requireGroup(groupId);
        if (!g.isMemberOrAdmin(senderId)) {
            throw new ForbiddenException("not_group_member");
        }
        if (Boolean.TRUE.equals(g.getOnlyAdminsCanPost()) && !g.isAdmin(senderId)) {
            throw new ForbiddenException("only_admins_can_post");
        }

        MessageEntity m = newMessage(senderId, content);
        m.setGroupId(groupId);
        applyRefs(senderId, m, refs);
        MessageEntity saved = messages.insert(m, content.attachments());

        MessageView view = hydrator.message(saved);
        int delivered = events.publish(g.audience(), view, ChatEvents.NEW_MESSAGE, ChatEvents.NEW_MESSAGE);
        log.debug("group message sent: id={}, from={}, groupId={}, delivered={}", saved.getId(), senderId, groupId, delivered);
        return view;
    }

    private void applyRefs(long senderId, MessageEntity m, MessageRefs refs) {
        if (refs == null || refs.isEmpty()) {
            return;
        }
        if (refs.replyToId() != null) {
            MessageEntity target = messages.findById(refs.replyToId())
                    .orElseThrow(() -> new NotFoundException("reply_target_not_found"));
            if (!target.conversationKey().equals(m.conversationKey())) {
                throw new ValidationException("reply_target_other_conversation");
            }
            m.setReplyToId(target.getId());
        }
        if (refs.forwardedFromId() != null) {
            MessageEntity source = messages.findById(refs.forwardedFromId())
                    .orElseThrow(() -> new NotFoundException("forward_source_not_found"));
            access.requireParticipant(senderId, source);
            m.setForwardedFromId(source.getId());
            m.setForwardedFromSenderId(source.getSenderId());
        }
    }

    static MessageEntity newMessage(long senderId, MessageContent content) {
        MessageEntity m = new MessageEntity();
        m.setSenderId(senderId);
        m.setText(content.text());
        m.setLinkUrl(content.linkUrl());
        m.setEdited(false);
        m.setPinned(false);
        m.setCreatedAt(ChatTime.now());
        m.setUpdatedAt(m.getCreatedAt());
        return m;
    }
}
