package com.chatsync.domain.mutation;

import cn.hutool.core.util.StrUtil;
import com.chatsync.common.error.ForbiddenException;
import com.chatsync.common.error.NotFoundException;
import com.chatsync.common.error.ValidationException;
import com.chatsync.common.time.ChatTime;
import com.chatsync.domain.dto.GroupEventPayload;
import com.chatsync.domain.dto.GroupView;
import com.chatsync.domain.dto.UpdateGroupRequest;
import com.chatsync.domain.entity.GroupEntity;
import com.chatsync.domain.service.ConversationAccess;
import com.chatsync.domain.service.ProfileHydrator;
import com.chatsync.domain.store.GroupStore;
import com.chatsync.domain.store.UserDirectory;
import com.chatsync.gateway.ws.ChatEvents;
import com.chatsync.gateway.ws.FanOutDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 群生命周期。群主（adminId）不在成员表中，也不能退群：要么转交（暂不支持），要么解散。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GroupHandler {

    static final int SEARCH_LIMIT = 20;

    private final GroupStore groups;
    private final UserDirectory users;
    private final ConversationAccess access;
    private final ProfileHydrator hydrator;
    private final FanOutDispatcher dispatcher;

    public GroupView create(long adminId, String name, String description, String pictureUrl, Collection<Long> memberIds) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("group_name_required");
        }
        Set<Long> members = normalizeMembers(memberIds, adminId);
        if (members.isEmpty()) {
            throw new ValidationException("group_members_required");
        }
        requireKnownUsers(members);

        LocalDateTime now = ChatTime.now();
        GroupEntity g = new GroupEntity();
        g.setName(name.strip());
        g.setDescription(description);
        g.setPictureUrl(pictureUrl);
        g.setAdminId(adminId);
        g.setOnlyAdminsCanPost(false);
        g.setCreatedAt(now);
        g.setUpdatedAt(now);
        GroupEntity saved = groups.insert(g, members);

        GroupView view = hydrator.group(saved);
        dispatcher.notify(saved.audience(), ChatEvents.GROUP_CREATED,
                new GroupEventPayload(saved.getId(), view, new ArrayList<>(members)));
        log.info("group created: id={}, admin={}, members={}", saved.getId(), adminId, members.size());
        return view;
    }

    public GroupView addMembers(long actorId, long groupId, Collection<Long> userIds) {
        GroupEntity g = access.requireGroup(groupId);
        access.requireAdmin(actorId, g);

        Set<Long> fresh = normalizeMembers(userIds, g.getAdminId());
        fresh.removeAll(g.getMemberIds());
        if (fresh.isEmpty()) {
            throw new ValidationException("already_members");
        }
        requireKnownUsers(fresh);

        groups.addMembers(groupId, fresh);

        GroupEntity updated = access.requireGroup(groupId);
        GroupView view = hydrator.group(updated);
        dispatcher.notify(updated.audience(), ChatEvents.ADDED_TO_GROUP,
                new GroupEventPayload(groupId, view, new ArrayList<>(fresh)));
        return view;
    }

    public GroupView removeMember(long actorId, long groupId, long userId) {
        GroupEntity g = access.requireGroup(groupId);
        access.requireAdmin(actorId, g);
        if (g.isAdmin(userId)) {
            throw new ValidationException("cannot_remove_admin");
        }
        Set<Long> oldAudience = g.audience();

        if (!groups.removeMember(groupId, userId)) {
            throw new NotFoundException("member_not_found");
        }

        GroupView view = hydrator.group(access.requireGroup(groupId));
        // 被移除的人也要收到，用移除前的受众
        dispatcher.notify(oldAudience, ChatEvents.REMOVED_FROM_GROUP,
                new GroupEventPayload(groupId, view, List.of(userId)));
        return view;
    }

    public GroupView updateInfo(long actorId, long groupId, UpdateGroupRequest req) {
        GroupEntity g = access.requireGroup(groupId);
        access.requireAdmin(actorId, g);

        if (req.name() != null) {
            if (req.name().isBlank()) {
                throw new ValidationException("group_name_required");
            }
            g.setName(req.name().strip());
        }
        if (req.description() != null) {
            g.setDescription(req.description());
        }
        if (req.pictureUrl() != null) {
            g.setPictureUrl(req.pictureUrl());
        }
        if (req.onlyAdminsCanPost() != null) {
            g.setOnlyAdminsCanPost(req.onlyAdminsCanPost());
        }
        g.setUpdatedAt(ChatTime.now());
        groups.updateInfo(g);

        GroupView view = hydrator.group(g);
        dispatcher.notify(g.audience(), ChatEvents.GROUP_INFO_UPDATED, new GroupEventPayload(groupId, view, null));
        return view;
    }

    /** 解散群：群消息、成员关系和群在一个事务里删除，成功后才推送。 */
    public void delete(long actorId, long groupId) {
        GroupEntity g = access.requireGroup(groupId);
        access.requireAdmin(actorId, g);
        Set<Long> audience = g.audience();

        int removed = groups.deleteWithMessages(groupId);

        dispatcher.notify(audience, ChatEvents.GROUP_DELETED, new GroupEventPayload(groupId, null, null));
        log.info("group deleted: id={}, by={}, messages={}", groupId, actorId, removed);
    }

    public void leave(long actorId, long groupId) {
        GroupEntity g = access.requireGroup(groupId);
        if (g.isAdmin(actorId)) {
            throw new ValidationException("admin_cannot_leave");
        }
        if (!g.isMemberOrAdmin(actorId)) {
            throw new ForbiddenException("not_group_member");
        }

        if (!groups.removeMember(groupId, actorId)) {
            throw new NotFoundException("member_not_found");
        }

        GroupEntity updated = access.requireGroup(groupId);
        GroupView view = hydrator.group(updated);
        dispatcher.notify(updated.audience(), ChatEvents.MEMBER_LEFT_GROUP,
                new GroupEventPayload(groupId, view, List.of(actorId)));
        dispatcher.notifyUser(actorId, ChatEvents.LEFT_GROUP, new GroupEventPayload(groupId, null, List.of(actorId)));
    }

    public List<GroupView> list(long userId) {
        return groups.findByUser(userId).stream().map(hydrator::group).toList();
    }

    /** 在自己所在的群里按名称搜索，不区分大小写。 */
    public List<GroupView> search(long userId, String query) {
        if (StrUtil.isBlank(query)) {
            throw new ValidationException("search_query_required");
        }
        String q = query.strip();
        return groups.findByUser(userId).stream()
                .filter(g -> StrUtil.containsIgnoreCase(g.getName(), q))
                .limit(SEARCH_LIMIT)
                .map(hydrator::group)
                .toList();
    }

    public GroupView get(long actorId, long groupId) {
        GroupEntity g = access.requireGroup(groupId);
        if (!g.isMemberOrAdmin(actorId)) {
            throw new ForbiddenException("not_group_member");
        }
        return hydrator.group(g);
    }

    private static Set<Long> normalizeMembers(Collection<Long> ids, long adminId) {
        Set<Long> out = new LinkedHashSet<>();
        if (ids == null) {
            return out;
        }
        for (Long id : ids) {
            if (id != null && id > 0 && id != adminId) {
                out.add(id);
            }
        }
        return out;
    }

    private void requireKnownUsers(Set<Long> ids) {
        Map<Long, ?> found = users.findProfiles(ids);
        if (found.size() < ids.size()) {
            List<Long> missing = ids.stream().filter(id -> !found.containsKey(id)).toList();
            throw new ValidationException("unknown_members", missing.toString());
        }
    }
}
