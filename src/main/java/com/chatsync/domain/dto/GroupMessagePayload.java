package com.chatsync.domain.dto;

/** 群消息类事件的 data：消息本体 + 所属群。 */
public record GroupMessagePayload(MessageView message, Long groupId) {
}
