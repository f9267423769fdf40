package com.chatsync.domain.store.mybatis;

import com.chatsync.common.error.StorageException;
import com.chatsync.domain.cache.UserProfileCache;
import com.chatsync.domain.entity.UserEntity;
import com.chatsync.domain.mapper.UserMapper;
import com.chatsync.domain.model.ProfileSummary;
import com.chatsync.domain.store.UserDirectory;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 先查 Redis 资料缓存，未命中的再批量查库并回填。
 */
@Repository
@RequiredArgsConstructor
public class MybatisUserDirectory implements UserDirectory {

    private final UserMapper userMapper;
    private final UserProfileCache profileCache;

    @Override
    public Map<Long, ProfileSummary> findProfiles(Collection<Long> userIds) {
        if (userIds == null || userIds.isEmpty()) {
            return new HashMap<>();
        }
        List<Long> ids = userIds.stream().filter(v -> v != null && v > 0).distinct().toList();
        Map<Long, ProfileSummary> out = new HashMap<>(profileCache.getBatch(ids));

        List<Long> missing = ids.stream().filter(id -> !out.containsKey(id)).toList();
        if (missing.isEmpty()) {
            return out;
        }
        List<UserEntity> rows;
        try {
            rows = userMapper.selectBatchIds(missing);
        } catch (DataAccessException e) {
            throw new StorageException("find_profiles", e);
        }
        for (UserEntity u : rows) {
            ProfileSummary p = toSummary(u);
            out.put(u.getId(), p);
            profileCache.put(u.getId(), p);
        }
        return out;
    }

    static ProfileSummary toSummary(UserEntity u) {
        String name = u.getDisplayName() == null || u.getDisplayName().isBlank() ? u.getUsername() : u.getDisplayName();
        return new ProfileSummary(u.getId(), name, u.getAvatarUrl());
    }
}
