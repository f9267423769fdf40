package com.chatsync.domain.store;

import com.chatsync.domain.model.ProfileSummary;

import java.util.Collection;
import java.util.Map;

/**
 * 用户资料查询（只读）。不存在的 id 不出现在返回结果里。
 */
public interface UserDirectory {

    Map<Long, ProfileSummary> findProfiles(Collection<Long> userIds);
}
