package com.chatsync.domain.dto;

import jakarta.validation.constraints.NotBlank;

public record EditMessageRequest(@NotBlank(message = "text_required") String text) {
}
