package com.chatsync.domain.store.mybatis;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.baomidou.mybatisplus.core.toolkit.IdWorker;
import com.chatsync.common.error.StorageException;
import com.chatsync.common.time.ChatTime;
import com.chatsync.domain.entity.GroupEntity;
import com.chatsync.domain.entity.GroupMemberEntity;
import com.chatsync.domain.mapper.GroupMapper;
import com.chatsync.domain.mapper.GroupMemberMapper;
import com.chatsync.domain.model.ConversationKey;
import com.chatsync.domain.store.GroupStore;
import com.chatsync.domain.store.MessageStore;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

@Repository
@RequiredArgsConstructor
public class MybatisGroupStore implements GroupStore {

    private final GroupMapper groupMapper;
    private final GroupMemberMapper memberMapper;
    private final MessageStore messageStore;

    @Override
    @Transactional
    public GroupEntity insert(GroupEntity group, Collection<Long> memberIds) {
        return storage("insert_group", () -> {
            if (group.getId() == null) {
                group.setId(IdWorker.getId());
            }
            groupMapper.insert(group);
            insertMembers(group.getId(), memberIds, group.getCreatedAt());
            group.setMemberIds(new LinkedHashSet<>(memberIds));
            return group;
        });
    }

    @Override
    public Optional<GroupEntity> findById(long groupId) {
        return storage("find_group", () -> {
            GroupEntity g = groupMapper.selectById(groupId);
            if (g == null) {
                return Optional.empty();
            }
            return Optional.of(withMembers(List.of(g)).get(0));
        });
    }

    @Override
    public List<GroupEntity> findByUser(long userId) {
        return storage("find_groups_by_user", () -> {
            List<Long> memberOf = memberMapper.selectList(new LambdaQueryWrapper<GroupMemberEntity>()
                            .eq(GroupMemberEntity::getUserId, userId))
                    .stream().map(GroupMemberEntity::getGroupId).toList();
            LambdaQueryWrapper<GroupEntity> w = new LambdaQueryWrapper<GroupEntity>()
                    .eq(GroupEntity::getAdminId, userId);
            if (!memberOf.isEmpty()) {
                w.or().in(GroupEntity::getId, memberOf);
            }
            w.orderByDesc(GroupEntity::getUpdatedAt);
            return withMembers(groupMapper.selectList(w));
        });
    }

    @Override
    @Transactional
    public void addMembers(long groupId, Collection<Long> userIds) {
        storage("add_members", () -> {
            LocalDateTime now = ChatTime.now();
            insertMembers(groupId, userIds, now);
            return touch(groupId, now);
        });
    }

    @Override
    @Transactional
    public boolean removeMember(long groupId, long userId) {
        return storage("remove_member", () -> {
            int n = memberMapper.delete(new LambdaQueryWrapper<GroupMemberEntity>()
                    .eq(GroupMemberEntity::getGroupId, groupId)
                    .eq(GroupMemberEntity::getUserId, userId));
            if (n > 0) {
                touch(groupId, ChatTime.now());
            }
            return n > 0;
        });
    }

    @Override
    public void updateInfo(GroupEntity group) {
        storage("update_group", () -> groupMapper.update(null, new LambdaUpdateWrapper<GroupEntity>()
                .eq(GroupEntity::getId, group.getId())
                .set(GroupEntity::getName, group.getName())
                .set(GroupEntity::getDescription, group.getDescription())
                .set(GroupEntity::getPictureUrl, group.getPictureUrl())
                .set(GroupEntity::getOnlyAdminsCanPost, group.getOnlyAdminsCanPost())
                .set(GroupEntity::getUpdatedAt, group.getUpdatedAt())));
    }

    /**
     * 消息删除加入本事务（REQUIRED 传播），任一步失败整体回滚。
     */
    @Override
    @Transactional
    public int deleteWithMessages(long groupId) {
        int removed = messageStore.deleteConversation(ConversationKey.group(groupId));
        storage("delete_group", () -> {
            memberMapper.delete(new LambdaQueryWrapper<GroupMemberEntity>().eq(GroupMemberEntity::getGroupId, groupId));
            return groupMapper.deleteById(groupId);
        });
        return removed;
    }

    private void insertMembers(long groupId, Collection<Long> userIds, LocalDateTime joinedAt) {
        for (Long uid : userIds) {
            GroupMemberEntity m = new GroupMemberEntity();
            m.setId(IdWorker.getId());
            m.setGroupId(groupId);
            m.setUserId(uid);
            m.setJoinedAt(joinedAt);
            memberMapper.insert(m);
        }
    }

    private int touch(long groupId, LocalDateTime now) {
        return groupMapper.update(null, new LambdaUpdateWrapper<GroupEntity>()
                .eq(GroupEntity::getId, groupId)
                .set(GroupEntity::getUpdatedAt, now));
    }

    private List<GroupEntity> withMembers(List<GroupEntity> groups) {
        if (groups == null || groups.isEmpty()) {
            return new ArrayList<>();
        }
        List<Long> ids = groups.stream().map(GroupEntity::getId).toList();
        Map<Long, Set<Long>> members = new HashMap<>();
        for (GroupMemberEntity m : memberMapper.selectList(new LambdaQueryWrapper<GroupMemberEntity>()
                .in(GroupMemberEntity::getGroupId, ids)
                .orderByAsc(GroupMemberEntity::getJoinedAt))) {
            members.computeIfAbsent(m.getGroupId(), k -> new LinkedHashSet<>()).add(m.getUserId());
        }
        for (GroupEntity g : groups) {
            g.setMemberIds(members.getOrDefault(g.getId(), new LinkedHashSet<>()));
        }
        return groups;
    }

    private static <T> T storage(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new StorageException(operation, e);
        }
    }
}
