package com.chatsync.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum DeleteType {

    /** 只在请求者自己的设备上隐藏，不动存储 */
    FOR_ME("forMe"),
    /** 仅发送者可用，物理删除并通知所有参与者 */
    FOR_EVERYONE("forEveryone");

    @JsonValue
    private final String desc;

    public static DeleteType fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String v = value.trim();
        for (DeleteType t : values()) {
            if (t.desc.equalsIgnoreCase(v) || t.name().equalsIgnoreCase(v)) {
                return t;
            }
        }
        return null;
    }
}
