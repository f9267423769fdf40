package com.chatsync.domain.dto;

import jakarta.validation.constraints.Size;

/** 字段为 null 表示不修改。 */
public record UpdateGroupRequest(
        @Size(max = 128, message = "group_name_too_long") String name,
        @Size(max = 512, message = "description_too_long") String description,
        String pictureUrl,
        Boolean onlyAdminsCanPost
) {
}
