package com.chatsync.domain.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

public record CreateGroupRequest(
        @NotBlank(message = "group_name_required") @Size(max = 128, message = "group_name_too_long") String name,
        @Size(max = 512, message = "description_too_long") String description,
        String pictureUrl,
        @NotEmpty(message = "group_members_required") List<Long> memberIds
) {
}
