package com.chatsync.domain.mutation;

import com.chatsync.common.error.NotFoundException;
import com.chatsync.common.error.ValidationException;
import com.chatsync.common.time.ChatTime;
import com.chatsync.domain.dto.MessageView;
import com.chatsync.domain.entity.MessageEntity;
import com.chatsync.domain.entity.MessageMarkEntity;
import com.chatsync.domain.enums.MarkType;
import com.chatsync.domain.service.ConversationAccess;
import com.chatsync.domain.service.ProfileHydrator;
import com.chatsync.domain.store.MessageStore;
import com.chatsync.gateway.ws.ChatEvents;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Set;

/**
 * 表情回应：每个用户在一条消息上最多一个，新的覆盖旧的。推送里是带全部回应的完整消息。
 */
@Service
@RequiredArgsConstructor
public class ReactionHandler {

    public static final int MAX_EMOJI_LEN = 32;

    private final MessageStore messages;
    private final ConversationAccess access;
    private final ProfileHydrator hydrator;
    private final MessageEventPublisher events;

    public MessageView add(long actorId, long messageId, String emoji) {
        if (emoji == null || emoji.isBlank()) {
            throw new ValidationException("emoji_required");
        }
        String e = emoji.strip();
        if (e.length() > MAX_EMOJI_LEN) {
            throw new ValidationException("emoji_too_long");
        }
        MessageEntity m = access.requireMessage(messageId);
        Set<Long> audience = access.requireParticipant(actorId, m);

        messages.upsertMark(MessageMarkEntity.of(messageId, actorId, MarkType.REACTION, e, ChatTime.now()));

        MessageView view = hydrator.message(access.requireMessage(messageId));
        events.publish(audience, view, ChatEvents.MESSAGE_REACTION_ADDED, ChatEvents.GROUP_MESSAGE_REACTION_ADDED);
        return view;
    }

    public MessageView remove(long actorId, long messageId) {
        MessageEntity m = access.requireMessage(messageId);
        Set<Long> audience = access.requireParticipant(actorId, m);

        if (!messages.deleteMark(messageId, actorId, MarkType.REACTION)) {
            throw new NotFoundException("reaction_not_found");
        }

        MessageView view = hydrator.message(access.requireMessage(messageId));
        events.publish(audience, view, ChatEvents.MESSAGE_REACTION_REMOVED, ChatEvents.GROUP_MESSAGE_REACTION_REMOVED);
        return view;
    }
}
