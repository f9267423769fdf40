package com.chatsync.domain.dto;

import jakarta.validation.constraints.NotBlank;

public record ReplaceImageRequest(
        @NotBlank(message = "image_url_required") String url,
        String fileName,
        Long fileSize,
        String mimeType
) {
}
