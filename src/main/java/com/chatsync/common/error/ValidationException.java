package com.chatsync.common.error;

/** 输入不合法：空内容、非法参数、状态不允许（例如编辑带附件的消息）。 */
public class ValidationException extends ChatException {

    public ValidationException(String reason) {
        super(reason, null, null);
    }

    public ValidationException(String reason, String detail) {
        super(reason, detail, null);
    }
}
