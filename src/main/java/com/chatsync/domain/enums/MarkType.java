package com.chatsync.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 每用户覆盖层类型（对应表字段：t_message_mark.mark_type）。
 * 同一用户对同一条消息每种类型最多一条记录（唯一键保证）。
 */
@Getter
@RequiredArgsConstructor
public enum MarkType {

    SEEN(1, "seen"),
    LISTENED(2, "listened"),
    SAVED(3, "saved"),
    /** 表情回应；emoji 列有值 */
    REACTION(4, "reaction");

    @EnumValue
    private final Integer code;

    private final String desc;
}
