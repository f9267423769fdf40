package com.chatsync.domain.dto;

import com.chatsync.domain.enums.DeleteType;

/** userId 为接收方视角下的对端。 */
public record ConversationDeletedPayload(Long userId, DeleteType deleteType) {
}
