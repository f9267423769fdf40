package com.chatsync.domain.model;

/**
 * 推送/接口中用户信息的唯一形态，只暴露展示需要的字段。
 */
public record ProfileSummary(Long id, String displayName, String avatarRef) {

    public static ProfileSummary unknown(long id) {
        return new ProfileSummary(id, "Unknown user", null);
    }
}
