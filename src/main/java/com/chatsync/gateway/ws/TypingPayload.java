package com.chatsync.gateway.ws;

/** typing / stopTyping 事件的 data。 */
public record TypingPayload(Long fromUserId) {
}
