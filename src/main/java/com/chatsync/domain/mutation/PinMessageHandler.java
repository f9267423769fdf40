package com.chatsync.domain.mutation;

import com.chatsync.common.error.StorageException;
import com.chatsync.common.error.ValidationException;
import com.chatsync.common.time.ChatTime;
import com.chatsync.domain.dto.MessageView;
import com.chatsync.domain.entity.MessageEntity;
import com.chatsync.domain.enums.AttachmentKind;
import com.chatsync.domain.model.ConversationKey;
import com.chatsync.domain.model.MessageContent;
import com.chatsync.domain.model.ProfileSummary;
import com.chatsync.domain.service.ConversationAccess;
import com.chatsync.domain.service.ConversationLocks;
import com.chatsync.domain.service.ProfileHydrator;
import com.chatsync.domain.store.MessageStore;
import com.chatsync.gateway.ws.ChatEvents;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 置顶 / 取消置顶。每个会话最多一条置顶。
 *
 * <p>同一会话的置顶操作在本机按会话加锁串行执行；"取消旧置顶 + 置顶新消息"由 store 在一个事务里完成。
 * 置顶成功后在会话里追加一条状态消息，状态消息写失败只记日志，不影响置顶结果。</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PinMessageHandler {

    private final MessageStore messages;
    private final ConversationAccess access;
    private final ConversationLocks locks;
    private final ProfileHydrator hydrator;
    private final MessageEventPublisher events;

    public MessageView pin(long actorId, long messageId) {
        MessageEntity m = access.requireMessage(messageId);
        Set<Long> audience = access.requireParticipant(actorId, m);
        ConversationKey key = m.conversationKey();

        ReentrantLock lock = locks.lockFor(key.asString());
        lock.lock();
        try {
            messages.pin(messageId, key, actorId, ChatTime.now());
        } finally {
            lock.unlock();
        }

        MessageView view = hydrator.message(access.requireMessage(messageId));
        events.publish(audience, view, ChatEvents.MESSAGE_PINNED, ChatEvents.GROUP_MESSAGE_PINNED);

        try {
            postStatus(actorId, m, key, audience);
        } catch (StorageException e) {
            log.warn("pin status not posted: conversation={}, pinned={}", key.asString(), messageId, e);
        }
        return view;
    }

    public MessageView unpin(long actorId, long messageId) {
        MessageEntity m = access.requireMessage(messageId);
        Set<Long> audience = access.requireParticipant(actorId, m);

        ReentrantLock lock = locks.lockFor(m.conversationKey().asString());
        lock.lock();
        try {
            // 锁内重读，并发取消时只有一个成功
            if (!access.requireMessage(messageId).isPinnedFlag()) {
                throw new ValidationException("message_not_pinned");
            }
            messages.unpin(messageId);
        } finally {
            lock.unlock();
        }

        MessageView view = hydrator.message(access.requireMessage(messageId));
        events.publish(audience, view, ChatEvents.MESSAGE_UNPINNED, ChatEvents.GROUP_MESSAGE_UNPINNED);
        return view;
    }

    private void postStatus(long actorId, MessageEntity pinned, ConversationKey key, Set<Long> audience) {
        ProfileSummary actor = hydrator.profiles(List.of(actorId)).get(actorId);
        String text = "📌 " + actor.displayName() + " pinned " + describe(pinned);

        MessageEntity status = SendMessageHandler.newMessage(actorId, MessageContent.text(text));
        if (key.isGroup()) {
            status.setGroupId(key.groupId());
        } else {
            status.setReceiverId(key.peerOf(actorId));
        }
        MessageEntity saved = messages.insert(status, List.of());
        events.publish(audience, hydrator.message(saved), ChatEvents.NEW_MESSAGE, ChatEvents.NEW_MESSAGE);
        log.debug("pin status posted: conversation={}, pinned={}, status={}", key.asString(), pinned.getId(), saved.getId());
    }

    static String describe(MessageEntity m) {
        if (m.hasAttachment(AttachmentKind.IMAGE)) {
            return "a photo";
        }
        if (m.hasAttachment(AttachmentKind.AUDIO)) {
            return "a voice message";
        }
        if (m.hasAttachment(AttachmentKind.VIDEO)) {
            return "a video";
        }
        if (m.hasAttachment(AttachmentKind.FILE)) {
            return "a file";
        }
        if (m.hasAttachment(AttachmentKind.LINK) || m.getLinkUrl() != null) {
            return "a link";
        }
        return "a message";
    }
}
