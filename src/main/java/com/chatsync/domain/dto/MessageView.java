package com.chatsync.domain.dto;

import com.chatsync.domain.model.ProfileSummary;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 对外的消息形态：所有用户引用都已解析为 {@link ProfileSummary}。
 * HTTP 响应和 WS 推送使用同一形态。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MessageView(
        Long id,
        ProfileSummary sender,
        ProfileSummary receiver,
        Long groupId,
        String text,
        String linkUrl,
        List<AttachmentView> attachments,
        boolean edited,
        LocalDateTime editedAt,
        boolean pinned,
        LocalDateTime pinnedAt,
        ProfileSummary pinnedBy,
        List<ReactionView> reactions,
        List<Long> seenBy,
        List<Long> listenedBy,
        Long replyToId,
        ForwardView forwardedFrom,
        LocalDateTime createdAt
) {

    public record ForwardView(Long messageId, ProfileSummary sender) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record AttachmentView(String kind, String url, String fileName, Long fileSize, String mimeType) {
    }

    public record ReactionView(ProfileSummary user, String emoji, LocalDateTime createdAt) {
    }
}
