package com.chatsync.domain.store;

import com.chatsync.domain.entity.GroupEntity;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 群持久化边界；返回的 {@link GroupEntity} 已装配 memberIds。
 */
public interface GroupStore {

    GroupEntity insert(GroupEntity group, Collection<Long> memberIds);

    Optional<GroupEntity> findById(long groupId);

    /** 用户作为群主或成员所在的全部群。 */
    List<GroupEntity> findByUser(long userId);

    void addMembers(long groupId, Collection<Long> userIds);

    boolean removeMember(long groupId, long userId);

    void updateInfo(GroupEntity group);

    /** 在同一事务里删除群消息（含附件与覆盖层）、成员关系和群本身，返回删除的消息数。 */
    int deleteWithMessages(long groupId);
}
