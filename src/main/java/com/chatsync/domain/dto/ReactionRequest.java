package com.chatsync.domain.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ReactionRequest(
        @NotBlank(message = "emoji_required") @Size(max = 32, message = "emoji_too_long") String emoji
) {
}
