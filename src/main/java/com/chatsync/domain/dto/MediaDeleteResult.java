package com.chatsync.domain.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 删除媒体的结果：内容删空时整条消息被删除（deleted=true，message 为 null）。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MediaDeleteResult(Long messageId, boolean deleted, MessageView message) {
}
