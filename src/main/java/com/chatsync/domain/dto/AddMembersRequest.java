package com.chatsync.domain.dto;

import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record AddMembersRequest(@NotEmpty(message = "user_ids_required") List<Long> userIds) {
}
