package com.chatsync.domain.model;

/**
 * 新消息对其它消息的引用：回复目标、转发来源。都可以为空。
 */
public record MessageRefs(Long replyToId, Long forwardedFromId) {

    public static final MessageRefs NONE = new MessageRefs(null, null);

    public boolean isEmpty() {
        return replyToId == null && forwardedFromId == null;
    }
}
