package com.chatsync.domain.entity;

import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/** 账号服务维护的用户表，本服务只读。 */
@Data
@TableName("t_user")
public class UserEntity {

    @TableId
    private Long id;

    private String username;

    private String displayName;

    private String avatarUrl;

    private LocalDateTime createdAt;
}
