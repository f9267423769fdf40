package com.chatsync.domain.model;

import java.time.LocalDateTime;

/** 历史翻页游标：只返回 (createdAt, id) 严格小于游标的消息。 */
public record MessageCursor(LocalDateTime createdAt, long id) {
}
