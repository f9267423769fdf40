package com.chatsync.common.error;

public class NotFoundException extends ChatException {

    public NotFoundException(String reason) {
        super(reason, null, null);
    }
}
