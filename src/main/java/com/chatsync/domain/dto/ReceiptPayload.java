package com.chatsync.domain.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDateTime;

/** 已读 / 已听 / 收藏 事件的 data。 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReceiptPayload(Long messageId, Long groupId, Long userId, LocalDateTime at) {
}
