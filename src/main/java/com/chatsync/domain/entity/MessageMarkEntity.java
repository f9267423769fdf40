package com.chatsync.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.chatsync.domain.enums.MarkType;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@TableName("t_message_mark")
public class MessageMarkEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private Long messageId;

    private Long userId;

    private MarkType markType;

    /** 仅 REACTION 使用 */
    private String emoji;

    private LocalDateTime createdAt;

    public static MessageMarkEntity of(long messageId, long userId, MarkType type, String emoji, LocalDateTime at) {
        MessageMarkEntity m = new MessageMarkEntity();
        m.setMessageId(messageId);
        m.setUserId(userId);
        m.setMarkType(type);
        m.setEmoji(emoji);
        m.setCreatedAt(at);
        return m;
    }
}
