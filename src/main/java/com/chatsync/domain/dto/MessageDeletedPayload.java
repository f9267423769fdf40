package com.chatsync.domain.dto;

import com.chatsync.domain.enums.DeleteType;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * messageDeleted / groupMessageDeleted 的 data。
 *
 * <p>只有被删的是会话最后一条时才带 newLastMessage / conversationDeleted：
 * 前者是删除后的新最后一条，会话已空时为 null 且 conversationDeleted=true。</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MessageDeletedPayload(
        Long messageId,
        Long groupId,
        DeleteType deleteType,
        Boolean wasLastMessage,
        MessageView newLastMessage,
        Boolean conversationDeleted
) {
}
