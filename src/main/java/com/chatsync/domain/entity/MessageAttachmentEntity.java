package com.chatsync.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.chatsync.domain.enums.AttachmentKind;
import lombok.Data;

@Data
@TableName("t_message_attachment")
public class MessageAttachmentEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private Long messageId;

    private AttachmentKind kind;

    /** 媒体服务返回的不透明地址，服务端不解析 */
    private String url;

    private String fileName;

    private Long fileSize;

    private String mimeType;
}
