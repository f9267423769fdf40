package com.chatsync.domain.dto;

import java.util.List;

public record LastMessagesPage(
        List<ConversationEntry> entries,
        int page,
        int limit,
        int total,
        int totalPages,
        boolean hasMore
) {
}
