package com.chatsync.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.chatsync.domain.enums.AttachmentKind;
import com.chatsync.domain.enums.MarkType;
import com.chatsync.domain.model.ConversationKey;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 消息主表。附件与每用户覆盖层（已读/已听/收藏/表情）分表存储，由 store 读取时一并装配。
 *
 * <p>receiverId 与 groupId 有且只有一个非空。</p>
 */
@Data
@TableName("t_message")
public class MessageEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private Long senderId;

    /** 单聊对端；群消息为 null */
    private Long receiverId;

    /** 群 id；单聊为 null */
    private Long groupId;

    private String text;

    /** 从 text 中提取的第一个 http(s) 链接，用于链接预览 */
    private String linkUrl;

    private Boolean edited;

    private LocalDateTime editedAt;

    private Boolean pinned;

    private LocalDateTime pinnedAt;

    private Long pinnedBy;

    /** 回复的目标消息，必须在同一会话 */
    private Long replyToId;

    /** 转发来源消息；来源被删后仍保留发送者快照 */
    private Long forwardedFromId;

    private Long forwardedFromSenderId;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    @TableField(exist = false)
    private List<MessageAttachmentEntity> attachments = new ArrayList<>();

    @TableField(exist = false)
    private List<MessageMarkEntity> marks = new ArrayList<>();

    public ConversationKey conversationKey() {
        return groupId != null ? ConversationKey.group(groupId) : ConversationKey.direct(senderId, receiverId);
    }

    public boolean isGroupMessage() {
        return groupId != null;
    }

    public boolean isEditedFlag() {
        return Boolean.TRUE.equals(edited);
    }

    public boolean isPinnedFlag() {
        return Boolean.TRUE.equals(pinned);
    }

    public boolean hasAttachment(AttachmentKind kind) {
        return attachments != null && attachments.stream().anyMatch(a -> a.getKind() == kind);
    }

    public boolean hasAnyAttachment() {
        return attachments != null && !attachments.isEmpty();
    }

    public List<MessageMarkEntity> marksOf(MarkType type) {
        if (marks == null) {
            return List.of();
        }
        return marks.stream().filter(m -> m.getMarkType() == type).toList();
    }
}
