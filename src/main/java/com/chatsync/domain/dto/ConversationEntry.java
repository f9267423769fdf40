package com.chatsync.domain.dto;

import com.chatsync.domain.model.ProfileSummary;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 会话列表中的一项。单聊带 peer，群聊带 groupId/groupName。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConversationEntry(
        String conversationId,
        String type,
        ProfileSummary peer,
        Long groupId,
        String groupName,
        MessageView lastMessage
) {
}
