package com.chatsync.domain.mutation;

import com.chatsync.common.error.NotFoundException;
import com.chatsync.common.error.ValidationException;
import com.chatsync.common.time.ChatTime;
import com.chatsync.domain.dto.ReceiptPayload;
import com.chatsync.domain.entity.MessageEntity;
import com.chatsync.domain.entity.MessageMarkEntity;
import com.chatsync.domain.enums.AttachmentKind;
import com.chatsync.domain.enums.MarkType;
import com.chatsync.domain.service.ConversationAccess;
import com.chatsync.domain.store.MessageStore;
import com.chatsync.gateway.ws.ChatEvents;
import com.chatsync.gateway.ws.FanOutDispatcher;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 每用户覆盖层：已读、已听、收藏。
 *
 * <p>已读/已听幂等：重复标记不写库也不推送。单聊只推给发送者和标记者，群聊推全群。
 * 收藏是私有的，只推给本人的其它设备。</p>
 */
@Service
@RequiredArgsConstructor
public class ReceiptHandler {

    private final MessageStore messages;
    private final ConversationAccess access;
    private final FanOutDispatcher dispatcher;

    /**
     * @return 是否产生了新的已读记录（自己的消息、重复标记都返回 false）
     */
    public boolean markSeen(long actorId, long messageId) {
        MessageEntity m = access.requireMessage(messageId);
        Set<Long> audience = access.requireParticipant(actorId, m);
        if (m.getSenderId() == actorId) {
            return false;
        }
        LocalDateTime now = ChatTime.now();
        if (!messages.insertMarkIfAbsent(MessageMarkEntity.of(messageId, actorId, MarkType.SEEN, null, now))) {
            return false;
        }
        ReceiptPayload payload = new ReceiptPayload(messageId, m.getGroupId(), actorId, now);
        dispatcher.notify(receiptAudience(m, actorId, audience),
                m.isGroupMessage() ? ChatEvents.GROUP_MESSAGE_SEEN : ChatEvents.MESSAGE_SEEN_UPDATE, payload);
        return true;
    }

    public boolean markListened(long actorId, long messageId) {
        MessageEntity m = access.requireMessage(messageId);
        Set<Long> audience = access.requireParticipant(actorId, m);
        if (!m.hasAttachment(AttachmentKind.AUDIO)) {
            throw new ValidationException("not_a_voice_message");
        }
        if (m.getSenderId() == actorId) {
            return false;
        }
        LocalDateTime now = ChatTime.now();
        if (!messages.insertMarkIfAbsent(MessageMarkEntity.of(messageId, actorId, MarkType.LISTENED, null, now))) {
            return false;
        }
        ReceiptPayload payload = new ReceiptPayload(messageId, m.getGroupId(), actorId, now);
        dispatcher.notify(receiptAudience(m, actorId, audience),
                m.isGroupMessage() ? ChatEvents.GROUP_VOICE_MESSAGE_LISTENED : ChatEvents.VOICE_MESSAGE_LISTENED, payload);
        return true;
    }

    public ReceiptPayload save(long actorId, long messageId) {
        MessageEntity m = access.requireMessage(messageId);
        access.requireParticipant(actorId, m);
        LocalDateTime now = ChatTime.now();
        if (!messages.insertMarkIfAbsent(MessageMarkEntity.of(messageId, actorId, MarkType.SAVED, null, now))) {
            throw new ValidationException("already_saved");
        }
        ReceiptPayload payload = new ReceiptPayload(messageId, m.getGroupId(), actorId, now);
        dispatcher.notifyUser(actorId, ChatEvents.MESSAGE_SAVED, payload);
        return payload;
    }

    public ReceiptPayload unsave(long actorId, long messageId) {
        MessageEntity m = access.requireMessage(messageId);
        access.requireParticipant(actorId, m);
        if (!messages.deleteMark(messageId, actorId, MarkType.SAVED)) {
            throw new NotFoundException("not_saved");
        }
        ReceiptPayload payload = new ReceiptPayload(messageId, m.getGroupId(), actorId, ChatTime.now());
        dispatcher.notifyUser(actorId, ChatEvents.MESSAGE_UNSAVED, payload);
        return payload;
    }

    private static Collection<Long> receiptAudience(MessageEntity m, long actorId, Set<Long> conversationAudience) {
        if (m.isGroupMessage()) {
            return conversationAudience;
        }
        return new LinkedHashSet<>(List.of(m.getSenderId(), actorId));
    }
}
