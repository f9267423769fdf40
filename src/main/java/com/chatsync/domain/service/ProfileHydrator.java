package com.chatsync.domain.service;

import com.chatsync.domain.dto.GroupView;
import com.chatsync.domain.dto.MessageView;
import com.chatsync.domain.entity.GroupEntity;
import com.chatsync.domain.entity.MessageAttachmentEntity;
import com.chatsync.domain.entity.MessageEntity;
import com.chatsync.domain.entity.MessageMarkEntity;
import com.chatsync.domain.enums.MarkType;
import com.chatsync.domain.model.ProfileSummary;
import com.chatsync.domain.store.UserDirectory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 水合：把实体里的用户 id 解析成 {@link ProfileSummary}，产出对外视图。
 *
 * <p>一批消息只查一次用户资料。查不到的用户用占位资料，不让推送失败。</p>
 */
@Component
@RequiredArgsConstructor
public class ProfileHydrator {

    private final UserDirectory users;

    public MessageView message(MessageEntity m) {
        return messages(List.of(m)).get(0);
    }

    public List<MessageView> messages(List<MessageEntity> messages) {
        if (messages == null || messages.isEmpty()) {
            return new ArrayList<>();
        }
        Set<Long> ids = new LinkedHashSet<>();
        for (MessageEntity m : messages) {
            ids.add(m.getSenderId());
            ids.add(m.getReceiverId());
            ids.add(m.getPinnedBy());
            ids.add(m.getForwardedFromSenderId());
            for (MessageMarkEntity mk : m.marksOf(MarkType.REACTION)) {
                ids.add(mk.getUserId());
            }
        }
        Map<Long, ProfileSummary> profiles = profiles(ids);

        List<MessageView> out = new ArrayList<>(messages.size());
        for (MessageEntity m : messages) {
            out.add(toView(m, profiles));
        }
        return out;
    }

    public GroupView group(GroupEntity g) {
        Set<Long> ids = new LinkedHashSet<>(g.audience());
        Map<Long, ProfileSummary> profiles = profiles(ids);
        List<ProfileSummary> members = new ArrayList<>();
        for (Long uid : g.getMemberIds()) {
            members.add(profiles.get(uid));
        }
        return new GroupView(
                g.getId(),
                g.getName(),
                g.getDescription(),
                g.getPictureUrl(),
                profiles.get(g.getAdminId()),
                members,
                Boolean.TRUE.equals(g.getOnlyAdminsCanPost()),
                g.getCreatedAt(),
                g.getUpdatedAt());
    }

    /** 结果覆盖入参里的全部非空 id，缺失的补占位。 */
    public Map<Long, ProfileSummary> profiles(Collection<Long> userIds) {
        List<Long> ids = userIds.stream().filter(v -> v != null && v > 0).distinct().toList();
        Map<Long, ProfileSummary> out = new HashMap<>(ids.isEmpty() ? Map.of() : users.findProfiles(ids));
        for (Long id : ids) {
            out.computeIfAbsent(id, ProfileSummary::unknown);
        }
        return out;
    }

    private static MessageView toView(MessageEntity m, Map<Long, ProfileSummary> profiles) {
        List<MessageView.AttachmentView> attachments = new ArrayList<>();
        for (MessageAttachmentEntity a : m.getAttachments()) {
            attachments.add(new MessageView.AttachmentView(
                    a.getKind().getDesc(), a.getUrl(), a.getFileName(), a.getFileSize(), a.getMimeType()));
        }
        List<MessageView.ReactionView> reactions = new ArrayList<>();
        for (MessageMarkEntity mk : m.marksOf(MarkType.REACTION)) {
            reactions.add(new MessageView.ReactionView(profiles.get(mk.getUserId()), mk.getEmoji(), mk.getCreatedAt()));
        }
        return new MessageView(
                m.getId(),
                profiles.get(m.getSenderId()),
                m.getReceiverId() == null ? null : profiles.get(m.getReceiverId()),
                m.getGroupId(),
                m.getText(),
                m.getLinkUrl(),
                attachments,
                m.isEditedFlag(),
                m.getEditedAt(),
                m.isPinnedFlag(),
                m.getPinnedAt(),
                m.getPinnedBy() == null ? null : profiles.get(m.getPinnedBy()),
                reactions,
                userIds(m.marksOf(MarkType.SEEN)),
                userIds(m.marksOf(MarkType.LISTENED)),
                m.getReplyToId(),
                m.getForwardedFromId() == null ? null : new MessageView.ForwardView(
                        m.getForwardedFromId(), profiles.get(m.getForwardedFromSenderId())),
                m.getCreatedAt());
    }

    private static List<Long> userIds(List<MessageMarkEntity> marks) {
        return marks.stream().map(MessageMarkEntity::getUserId).toList();
    }
}
