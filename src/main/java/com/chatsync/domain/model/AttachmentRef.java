package com.chatsync.domain.model;

import com.chatsync.common.error.ValidationException;
import com.chatsync.domain.enums.AttachmentKind;

/**
 * 客户端已上传到媒体服务后带回来的附件引用。
 */
public record AttachmentRef(AttachmentKind kind, String url, String fileName, Long fileSize, String mimeType) {

    public static final int MAX_URL_LEN = 1024;

    public AttachmentRef {
        if (kind == null) {
            throw new ValidationException("invalid_attachment_kind");
        }
        if (url == null || url.isBlank()) {
            throw new ValidationException("attachment_url_required", kind.getDesc());
        }
        url = url.trim();
        if (url.length() > MAX_URL_LEN) {
            throw new ValidationException("attachment_url_too_long", kind.getDesc());
        }
        if (fileSize != null && fileSize < 0) {
            throw new ValidationException("invalid_file_size");
        }
    }

    public static AttachmentRef of(AttachmentKind kind, String url) {
        return new AttachmentRef(kind, url, null, null, null);
    }
}
