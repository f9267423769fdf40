package com.chatsync.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 附件类型（对应表字段：t_message_attachment.kind）。
 *
 * <ul>
 *   <li>1 = 图片</li>
 *   <li>2 = 语音/音频</li>
 *   <li>3 = 视频</li>
 *   <li>4 = 文件</li>
 *   <li>5 = 链接分享（客户端显式附带的链接卡片）</li>
 * </ul>
 */
@Getter
@RequiredArgsConstructor
public enum AttachmentKind {

    IMAGE(1, "image"),
    AUDIO(2, "audio"),
    VIDEO(3, "video"),
    FILE(4, "file"),
    LINK(5, "link");

    @EnumValue
    private final Integer code;

    @JsonValue
    private final String desc;

    /** 可以被"删除媒体"单独移除的类型。 */
    public boolean isMedia() {
        return this != LINK;
    }

    /**
     * 协议层字符串（"image" / "IMAGE"）转枚举，无法识别返回 null。
     */
    public static AttachmentKind fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String v = value.trim();
        for (AttachmentKind k : values()) {
            if (k.name().equalsIgnoreCase(v) || k.desc.equalsIgnoreCase(v)) {
                return k;
            }
        }
        return null;
    }
}
