package com.chatsync.domain.dto;

import java.util.List;

/** messages 按时间正序；hasMore 表示更早的消息可能还有。 */
public record HistoryPage(List<MessageView> messages, boolean hasMore) {
}
