package com.chatsync.domain.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * 群生命周期事件的 data。userIds 为本次变动涉及的用户（新加入 / 被移除 / 退出）。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GroupEventPayload(Long groupId, GroupView group, List<Long> userIds) {
}
