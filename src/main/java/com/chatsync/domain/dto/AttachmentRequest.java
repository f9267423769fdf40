package com.chatsync.domain.dto;

import com.chatsync.common.error.ValidationException;
import com.chatsync.domain.enums.AttachmentKind;
import com.chatsync.domain.model.AttachmentRef;
import jakarta.validation.constraints.NotBlank;

public record AttachmentRequest(
        @NotBlank(message = "attachment_kind_required") String kind,
        @NotBlank(message = "attachment_url_required") String url,
        String fileName,
        Long fileSize,
        String mimeType
) {

    public AttachmentRef toRef() {
        AttachmentKind k = AttachmentKind.fromString(kind);
        if (k == null) {
            throw new ValidationException("invalid_attachment_kind", kind);
        }
        return new AttachmentRef(k, url, fileName, fileSize, mimeType);
    }
}
