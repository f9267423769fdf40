package com.chatsync.domain.dto;

import com.chatsync.domain.model.ProfileSummary;

import java.time.LocalDateTime;
import java.util.List;

/** members 不含群主。 */
public record GroupView(
        Long id,
        String name,
        String description,
        String pictureUrl,
        ProfileSummary admin,
        List<ProfileSummary> members,
        boolean onlyAdminsCanPost,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
}
