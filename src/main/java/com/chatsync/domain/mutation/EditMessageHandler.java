package com.chatsync.domain.mutation;

import com.chatsync.common.error.ValidationException;
import com.chatsync.common.time.ChatTime;
import com.chatsync.domain.dto.MessageView;
import com.chatsync.domain.entity.MessageEntity;
import com.chatsync.domain.enums.AttachmentKind;
import com.chatsync.domain.model.AttachmentRef;
import com.chatsync.domain.model.MessageContent;
import com.chatsync.domain.service.ConversationAccess;
import com.chatsync.domain.service.ProfileHydrator;
import com.chatsync.domain.store.MessageStore;
import com.chatsync.gateway.ws.ChatEvents;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Set;

/**
 * 编辑：只有发送者可以改；带附件的消息不允许改文字，图片消息可以换图。
 * 编辑标记一旦置上不会清除。
 */
@Service
@RequiredArgsConstructor
public class EditMessageHandler {

    private final MessageStore messages;
    private final ConversationAccess access;
    private final ProfileHydrator hydrator;
    private final MessageEventPublisher events;

    public MessageView editText(long actorId, long messageId, String text) {
        MessageEntity m = access.requireMessage(messageId);
        access.requireSender(actorId, m);
        if (m.hasAnyAttachment()) {
            throw new ValidationException("media_message_not_editable");
        }
        if (text == null || text.isBlank()) {
            throw new ValidationException("text_required");
        }
        MessageContent content = MessageContent.text(text);
        Set<Long> audience = access.requireParticipant(actorId, m);

        messages.updateText(messageId, content.text(), content.linkUrl(), ChatTime.now());
        return reloadAndPublish(messageId, audience);
    }

    public MessageView replaceImage(long actorId, long messageId, AttachmentRef image) {
        if (image == null || image.kind() != AttachmentKind.IMAGE) {
            throw new ValidationException("invalid_media_type");
        }
        MessageEntity m = access.requireMessage(messageId);
        access.requireSender(actorId, m);
        if (!m.hasAttachment(AttachmentKind.IMAGE)) {
            throw new ValidationException("not_an_image_message");
        }

        Set<Long> audience = access.requireParticipant(actorId, m);

        messages.replaceAttachments(messageId, AttachmentKind.IMAGE, image, ChatTime.now());
        return reloadAndPublish(messageId, audience);
    }

    private MessageView reloadAndPublish(long messageId, Set<Long> audience) {
        MessageView view = hydrator.message(access.requireMessage(messageId));
        events.publish(audience, view, ChatEvents.MESSAGE_EDITED, ChatEvents.GROUP_MESSAGE_EDITED);
        return view;
    }
}
