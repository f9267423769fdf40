package com.chatsync.domain.mutation;

import com.chatsync.common.error.ValidationException;
import com.chatsync.common.time.ChatTime;
import com.chatsync.domain.dto.ConversationDeletedPayload;
import com.chatsync.domain.dto.MediaDeleteResult;
import com.chatsync.domain.dto.MessageDeletedPayload;
import com.chatsync.domain.dto.MessageView;
import com.chatsync.domain.entity.MessageAttachmentEntity;
import com.chatsync.domain.entity.MessageEntity;
import com.chatsync.domain.enums.AttachmentKind;
import com.chatsync.domain.enums.DeleteType;
import com.chatsync.domain.model.ConversationKey;
import com.chatsync.domain.service.ConversationAccess;
import com.chatsync.domain.service.ProfileHydrator;
import com.chatsync.domain.store.MessageStore;
import com.chatsync.gateway.ws.ChatEvents;
import com.chatsync.gateway.ws.FanOutDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.Set;

/**
 * 删除消息 / 删除媒体 / 删除整个单聊会话。
 *
 * <p>forEveryone 删除的如果是会话最后一条，推送里带上删除后的新最后一条，
 * 会话删空时 conversationDeleted=true，客户端据此更新会话列表。</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeleteMessageHandler {

    private final MessageStore messages;
    private final ConversationAccess access;
    private final ProfileHydrator hydrator;
    private final FanOutDispatcher dispatcher;
    private final MessageEventPublisher events;

    public MessageDeletedPayload delete(long actorId, long messageId, DeleteType deleteType) {
        if (deleteType == null) {
            throw new ValidationException("invalid_delete_type");
        }
        MessageEntity m = access.requireMessage(messageId);
        Set<Long> audience = access.requireParticipant(actorId, m);

        if (deleteType == DeleteType.FOR_ME) {
            MessageDeletedPayload payload = new MessageDeletedPayload(messageId, m.getGroupId(), DeleteType.FOR_ME,
                    null, null, null);
            dispatcher.notifyUser(actorId, eventOf(m), payload);
            return payload;
        }

        access.requireSender(actorId, m);
        return deleteForEveryone(m, audience);
    }

    public MediaDeleteResult deleteMedia(long actorId, long messageId, AttachmentKind kind) {
        if (kind == null || !kind.isMedia()) {
            throw new ValidationException("invalid_media_type");
        }
        MessageEntity m = access.requireMessage(messageId);
        access.requireSender(actorId, m);
        if (!m.hasAttachment(kind)) {
            throw new ValidationException("media_not_present", kind.getDesc());
        }
        Set<Long> audience = access.requireParticipant(actorId, m);

        boolean hasText = m.getText() != null && !m.getText().isBlank();
        boolean hasOther = false;
        for (MessageAttachmentEntity a : m.getAttachments()) {
            if (a.getKind() != kind) {
                hasOther = true;
                break;
            }
        }
        if (!hasText && !hasOther) {
            // 删完什么都不剩：等同于 forEveryone 删除整条
            deleteForEveryone(m, audience);
            return new MediaDeleteResult(messageId, true, null);
        }

        messages.removeAttachments(messageId, kind, ChatTime.now());
        MessageView view = hydrator.message(access.requireMessage(messageId));
        events.publish(audience, view, ChatEvents.MESSAGE_EDITED, ChatEvents.GROUP_MESSAGE_EDITED);
        return new MediaDeleteResult(messageId, false, view);
    }

    /**
     * 删除与 peer 的整个单聊。forEveryone 物理删除并通知双方（各自看到的 userId 是对端）；
     * forMe 只通知自己。
     *
     * @return 删除的消息条数
     */
    public int deleteConversation(long actorId, long peerId, DeleteType deleteType) {
        if (deleteType == null) {
            throw new ValidationException("invalid_delete_type");
        }
        if (actorId == peerId) {
            throw new ValidationException("invalid_participants");
        }
        ConversationKey key = ConversationKey.direct(actorId, peerId);

        if (deleteType == DeleteType.FOR_ME) {
            dispatcher.notifyUser(actorId, ChatEvents.CONVERSATION_DELETED,
                    new ConversationDeletedPayload(peerId, DeleteType.FOR_ME));
            return 0;
        }

        int deleted = messages.deleteConversation(key);
        dispatcher.notifyUser(actorId, ChatEvents.CONVERSATION_DELETED,
                new ConversationDeletedPayload(peerId, DeleteType.FOR_EVERYONE));
        dispatcher.notifyUser(peerId, ChatEvents.CONVERSATION_DELETED,
                new ConversationDeletedPayload(actorId, DeleteType.FOR_EVERYONE));
        log.info("conversation deleted: key={}, by={}, messages={}", key.asString(), actorId, deleted);
        return deleted;
    }

    private MessageDeletedPayload deleteForEveryone(MessageEntity m, Set<Long> audience) {
        ConversationKey key = m.conversationKey();
        boolean wasLast = messages.findLatest(key)
                .map(last -> last.getId().equals(m.getId()))
                .orElse(false);

        messages.deleteById(m.getId());

        MessageDeletedPayload payload;
        if (wasLast) {
            Optional<MessageEntity> newLast = messages.findLatest(key);
            payload = new MessageDeletedPayload(m.getId(), m.getGroupId(), DeleteType.FOR_EVERYONE,
                    true,
                    newLast.map(hydrator::message).orElse(null),
                    newLast.isEmpty());
        } else {
            payload = new MessageDeletedPayload(m.getId(), m.getGroupId(), DeleteType.FOR_EVERYONE,
                    false, null, null);
        }
        dispatcher.notify(audience, eventOf(m), payload);
        return payload;
    }

    private static String eventOf(MessageEntity m) {
        return m.isGroupMessage() ? ChatEvents.GROUP_MESSAGE_DELETED : ChatEvents.MESSAGE_DELETED;
    }
}
