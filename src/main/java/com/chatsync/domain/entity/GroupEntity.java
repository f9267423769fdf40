package com.chatsync.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 群。群主只记在 adminId 上，不出现在成员表里（adminId ∉ memberIds）。
 */
@Data
@TableName("t_group")
public class GroupEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private String name;

    private String description;

    private String pictureUrl;

    private Long adminId;

    private Boolean onlyAdminsCanPost;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    @TableField(exist = false)
    private Set<Long> memberIds = new LinkedHashSet<>();

    public boolean isAdmin(long userId) {
        return adminId != null && adminId == userId;
    }

    public boolean isMemberOrAdmin(long userId) {
        return isAdmin(userId) || (memberIds != null && memberIds.contains(userId));
    }

    /** 推送受众：群主 + 全体成员 */
    public Set<Long> audience() {
        Set<Long> out = new LinkedHashSet<>();
        if (adminId != null) {
            out.add(adminId);
        }
        if (memberIds != null) {
            out.addAll(memberIds);
        }
        return out;
    }
}
