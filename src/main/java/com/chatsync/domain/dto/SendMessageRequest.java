package com.chatsync.domain.dto;

import com.chatsync.domain.model.MessageContent;
import com.chatsync.domain.model.MessageRefs;
import jakarta.validation.Valid;

import java.util.List;

public record SendMessageRequest(
        String text,
        @Valid List<AttachmentRequest> attachments,
        Long replyToId,
        Long forwardedFromId
) {

    public MessageContent toContent() {
        return MessageContent.of(text, attachments == null
                ? List.of()
                : attachments.stream().map(AttachmentRequest::toRef).toList());
    }

    public MessageRefs toRefs() {
        return new MessageRefs(replyToId, forwardedFromId);
    }
}
