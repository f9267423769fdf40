package com.chatsync.common.error;

/** 无权操作：非发送者、非会话成员、非群主。 */
public class ForbiddenException extends ChatException {

    public ForbiddenException(String reason) {
        super(reason, null, null);
    }
}
