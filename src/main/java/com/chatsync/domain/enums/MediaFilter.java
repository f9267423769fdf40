package com.chatsync.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * 按类型浏览会话消息（聊天详情页的"媒体 / 文件 / 链接 / 语音"分栏）。
 *
 * <p>links 同时匹配 linkUrl 非空的文本消息。</p>
 */
@Getter
@RequiredArgsConstructor
public enum MediaFilter {

    MEDIA("media", List.of(AttachmentKind.IMAGE, AttachmentKind.VIDEO)),
    FILES("files", List.of(AttachmentKind.FILE)),
    LINKS("links", List.of(AttachmentKind.LINK)),
    VOICE("voice", List.of(AttachmentKind.AUDIO));

    private final String desc;
    private final List<AttachmentKind> kinds;

    public boolean includesTextLinks() {
        return this == LINKS;
    }

    /** 无法识别返回 null。 */
    public static MediaFilter fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String v = value.trim();
        for (MediaFilter f : values()) {
            if (f.desc.equalsIgnoreCase(v) || f.name().equalsIgnoreCase(v)) {
                return f;
            }
        }
        return null;
    }
}
