package com.chatsync.domain.store.mybatis;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.baomidou.mybatisplus.core.toolkit.IdWorker;
import com.chatsync.common.error.StorageException;
import com.chatsync.domain.entity.MessageAttachmentEntity;
import com.chatsync.domain.entity.MessageEntity;
import com.chatsync.domain.entity.MessageMarkEntity;
import com.chatsync.domain.enums.AttachmentKind;
import com.chatsync.domain.enums.MarkType;
import com.chatsync.domain.enums.MediaFilter;
import com.chatsync.domain.mapper.MessageAttachmentMapper;
import com.chatsync.domain.mapper.MessageMapper;
import com.chatsync.domain.mapper.MessageMarkMapper;
import com.chatsync.domain.model.AttachmentRef;
import com.chatsync.domain.model.ConversationKey;
import com.chatsync.domain.model.MessageCursor;
import com.chatsync.domain.model.MessageHead;
import com.chatsync.domain.store.MessageStore;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

@Repository
@RequiredArgsConstructor
public class MybatisMessageStore implements MessageStore {

    private final MessageMapper messageMapper;
    private final MessageAttachmentMapper attachmentMapper;
    private final MessageMarkMapper markMapper;

    @Override
    @Transactional
    public MessageEntity insert(MessageEntity message, List<AttachmentRef> attachments) {
        return storage("insert_message", () -> {
            if (message.getId() == null) {
                message.setId(IdWorker.getId());
            }
            messageMapper.insert(message);
            List<MessageAttachmentEntity> saved = new ArrayList<>();
            for (AttachmentRef ref : attachments == null ? List.<AttachmentRef>of() : attachments) {
                MessageAttachmentEntity a = toAttachment(message.getId(), ref);
                attachmentMapper.insert(a);
                saved.add(a);
            }
            message.setAttachments(saved);
            message.setMarks(new ArrayList<>());
            return message;
        });
    }

    @Override
    public Optional<MessageEntity> findById(long messageId) {
        return storage("find_message", () -> {
            MessageEntity m = messageMapper.selectById(messageId);
            if (m == null) {
                return Optional.empty();
            }
            return Optional.of(withChildren(List.of(m)).get(0));
        });
    }

    @Override
    public List<MessageEntity> findHistory(ConversationKey key, int limit, MessageCursor before) {
        return storage("find_history", () -> {
            LambdaQueryWrapper<MessageEntity> w = inConversation(key);
            if (before != null) {
                w.and(q -> q.lt(MessageEntity::getCreatedAt, before.createdAt())
                        .or(r -> r.eq(MessageEntity::getCreatedAt, before.createdAt())
                                .lt(MessageEntity::getId, before.id())));
            }
            w.orderByDesc(MessageEntity::getCreatedAt)
                    .orderByDesc(MessageEntity::getId)
                    .last("limit " + Math.max(1, limit));
            return withChildren(messageMapper.selectList(w));
        });
    }

    @Override
    public List<MessageEntity> findByKind(ConversationKey key, MediaFilter filter, int limit) {
        return storage("find_by_kind", () -> {
            // kind 编码来自枚举常量，不含外部输入
            String codes = filter.getKinds().stream()
                    .map(k -> String.valueOf(k.getCode()))
                    .collect(Collectors.joining(","));
            String withKind = "select message_id from t_message_attachment where kind in (" + codes + ")";
            LambdaQueryWrapper<MessageEntity> w = inConversation(key);
            if (filter.includesTextLinks()) {
                w.and(q -> q.inSql(MessageEntity::getId, withKind).or().isNotNull(MessageEntity::getLinkUrl));
            } else {
                w.inSql(MessageEntity::getId, withKind);
            }
            w.orderByDesc(MessageEntity::getCreatedAt)
                    .orderByDesc(MessageEntity::getId)
                    .last("limit " + Math.max(1, limit));
            return withChildren(messageMapper.selectList(w));
        });
    }

    @Override
    public Optional<MessageEntity> findLatest(ConversationKey key) {
        List<MessageEntity> rows = findHistory(key, 1, null);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public List<MessageHead> scanDirectHeads(long userId, LocalDateTime since, int capPerSide) {
        return storage("scan_direct_heads", () -> {
            int cap = Math.max(1, capPerSide);
            List<MessageHead> out = new ArrayList<>();
            messageMapper.selectSentHeads(userId, since, cap).forEach(m -> out.add(toHead(m)));
            messageMapper.selectReceivedHeads(userId, since, cap).forEach(m -> out.add(toHead(m)));
            return out;
        });
    }

    @Override
    public List<MessageHead> latestGroupHeads(Collection<Long> groupIds) {
        if (groupIds == null || groupIds.isEmpty()) {
            return List.of();
        }
        return storage("latest_group_heads", () -> {
            Map<Long, MessageHead> byGroup = new LinkedHashMap<>();
            for (MessageEntity m : messageMapper.selectLatestGroupHeads(groupIds)) {
                MessageHead h = toHead(m);
                byGroup.merge(h.groupId(), h, (a, b) -> b.isNewerThan(a) ? b : a);
            }
            return new ArrayList<>(byGroup.values());
        });
    }

    @Override
    public void updateText(long messageId, String text, String linkUrl, LocalDateTime editedAt) {
        storage("update_text", () -> messageMapper.update(null, new LambdaUpdateWrapper<MessageEntity>()
                .eq(MessageEntity::getId, messageId)
                .set(MessageEntity::getText, text)
                .set(MessageEntity::getLinkUrl, linkUrl)
                .set(MessageEntity::getEdited, true)
                .set(MessageEntity::getEditedAt, editedAt)
                .set(MessageEntity::getUpdatedAt, editedAt)));
    }

    @Override
    @Transactional
    public void replaceAttachments(long messageId, AttachmentKind kind, AttachmentRef replacement, LocalDateTime editedAt) {
        storage("replace_attachments", () -> {
            attachmentMapper.delete(new LambdaQueryWrapper<MessageAttachmentEntity>()
                    .eq(MessageAttachmentEntity::getMessageId, messageId)
                    .eq(MessageAttachmentEntity::getKind, kind));
            attachmentMapper.insert(toAttachment(messageId, replacement));
            return markEdited(messageId, editedAt);
        });
    }

    @Override
    @Transactional
    public void removeAttachments(long messageId, AttachmentKind kind, LocalDateTime editedAt) {
        storage("remove_attachments", () -> {
            attachmentMapper.delete(new LambdaQueryWrapper<MessageAttachmentEntity>()
                    .eq(MessageAttachmentEntity::getMessageId, messageId)
                    .eq(MessageAttachmentEntity::getKind, kind));
            return markEdited(messageId, editedAt);
        });
    }

    @Override
    @Transactional
    public boolean deleteById(long messageId) {
        return storage("delete_message", () -> {
            deleteChildren(List.of(messageId));
            return messageMapper.deleteById(messageId) > 0;
        });
    }

    @Override
    @Transactional
    public int deleteConversation(ConversationKey key) {
        return storage("delete_conversation", () -> {
            List<Long> ids = messageMapper.selectList(inConversation(key).select(MessageEntity::getId))
                    .stream().map(MessageEntity::getId).toList();
            if (ids.isEmpty()) {
                return 0;
            }
            deleteChildren(ids);
            return messageMapper.deleteBatchIds(ids);
        });
    }

    @Override
    @Transactional
    public void pin(long messageId, ConversationKey key, long pinnedBy, LocalDateTime pinnedAt) {
        storage("pin_message", () -> {
            LambdaUpdateWrapper<MessageEntity> unpinOthers = new LambdaUpdateWrapper<>();
            applyConversation(unpinOthers, key);
            unpinOthers.eq(MessageEntity::getPinned, true)
                    .ne(MessageEntity::getId, messageId)
                    .set(MessageEntity::getPinned, false)
                    .set(MessageEntity::getPinnedAt, null)
                    .set(MessageEntity::getPinnedBy, null);
            messageMapper.update(null, unpinOthers);

            return messageMapper.update(null, new LambdaUpdateWrapper<MessageEntity>()
                    .eq(MessageEntity::getId, messageId)
                    .set(MessageEntity::getPinned, true)
                    .set(MessageEntity::getPinnedAt, pinnedAt)
                    .set(MessageEntity::getPinnedBy, pinnedBy));
        });
    }

    @Override
    public void unpin(long messageId) {
        storage("unpin_message", () -> messageMapper.update(null, new LambdaUpdateWrapper<MessageEntity>()
                .eq(MessageEntity::getId, messageId)
                .set(MessageEntity::getPinned, false)
                .set(MessageEntity::getPinnedAt, null)
                .set(MessageEntity::getPinnedBy, null)));
    }

    @Override
    public boolean insertMarkIfAbsent(MessageMarkEntity mark) {
        return storage("insert_mark", () -> {
            if (mark.getId() == null) {
                mark.setId(IdWorker.getId());
            }
            return markMapper.insertIgnore(mark) > 0;
        });
    }

    @Override
    public void upsertMark(MessageMarkEntity mark) {
        storage("upsert_mark", () -> {
            if (mark.getId() == null) {
                mark.setId(IdWorker.getId());
            }
            return markMapper.upsert(mark);
        });
    }

    @Override
    public boolean deleteMark(long messageId, long userId, MarkType type) {
        return storage("delete_mark", () -> markMapper.delete(new LambdaQueryWrapper<MessageMarkEntity>()
                .eq(MessageMarkEntity::getMessageId, messageId)
                .eq(MessageMarkEntity::getUserId, userId)
                .eq(MessageMarkEntity::getMarkType, type)) > 0);
    }

    @Override
    public List<MessageEntity> findSaved(long userId, int limit, Long beforeMessageId) {
        return storage("find_saved", () -> {
            LambdaQueryWrapper<MessageMarkEntity> w = new LambdaQueryWrapper<MessageMarkEntity>()
                    .eq(MessageMarkEntity::getUserId, userId)
                    .eq(MessageMarkEntity::getMarkType, MarkType.SAVED);
            if (beforeMessageId != null) {
                MessageMarkEntity cursor = markMapper.selectOne(new LambdaQueryWrapper<MessageMarkEntity>()
                        .eq(MessageMarkEntity::getMessageId, beforeMessageId)
                        .eq(MessageMarkEntity::getUserId, userId)
                        .eq(MessageMarkEntity::getMarkType, MarkType.SAVED));
                if (cursor != null) {
                    w.and(q -> q.lt(MessageMarkEntity::getCreatedAt, cursor.getCreatedAt())
                            .or(r -> r.eq(MessageMarkEntity::getCreatedAt, cursor.getCreatedAt())
                                    .lt(MessageMarkEntity::getId, cursor.getId())));
                }
            }
            w.orderByDesc(MessageMarkEntity::getCreatedAt)
                    .orderByDesc(MessageMarkEntity::getId)
                    .last("limit " + Math.max(1, limit));
            List<Long> ids = markMapper.selectList(w).stream().map(MessageMarkEntity::getMessageId).toList();
            if (ids.isEmpty()) {
                return List.<MessageEntity>of();
            }
            Map<Long, MessageEntity> byId = new HashMap<>();
            for (MessageEntity m : withChildren(messageMapper.selectBatchIds(ids))) {
                byId.put(m.getId(), m);
            }
            // 保持收藏时间顺序
            List<MessageEntity> out = new ArrayList<>();
            for (Long id : ids) {
                MessageEntity m = byId.get(id);
                if (m != null) {
                    out.add(m);
                }
            }
            return out;
        });
    }

    private int markEdited(long messageId, LocalDateTime editedAt) {
        return messageMapper.update(null, new LambdaUpdateWrapper<MessageEntity>()
                .eq(MessageEntity::getId, messageId)
                .set(MessageEntity::getEdited, true)
                .set(MessageEntity::getEditedAt, editedAt)
                .set(MessageEntity::getUpdatedAt, editedAt));
    }

    private void deleteChildren(List<Long> messageIds) {
        attachmentMapper.delete(new LambdaQueryWrapper<MessageAttachmentEntity>()
                .in(MessageAttachmentEntity::getMessageId, messageIds));
        markMapper.delete(new LambdaQueryWrapper<MessageMarkEntity>()
                .in(MessageMarkEntity::getMessageId, messageIds));
    }

    private List<MessageEntity> withChildren(List<MessageEntity> messages) {
        if (messages == null || messages.isEmpty()) {
            return new ArrayList<>();
        }
        List<Long> ids = messages.stream().map(MessageEntity::getId).toList();
        Map<Long, List<MessageAttachmentEntity>> attachments = new HashMap<>();
        for (MessageAttachmentEntity a : attachmentMapper.selectList(new LambdaQueryWrapper<MessageAttachmentEntity>()
                .in(MessageAttachmentEntity::getMessageId, ids)
                .orderByAsc(MessageAttachmentEntity::getId))) {
            attachments.computeIfAbsent(a.getMessageId(), k -> new ArrayList<>()).add(a);
        }
        Map<Long, List<MessageMarkEntity>> marks = new HashMap<>();
        for (MessageMarkEntity mk : markMapper.selectList(new LambdaQueryWrapper<MessageMarkEntity>()
                .in(MessageMarkEntity::getMessageId, ids)
                .orderByAsc(MessageMarkEntity::getCreatedAt))) {
            marks.computeIfAbsent(mk.getMessageId(), k -> new ArrayList<>()).add(mk);
        }
        for (MessageEntity m : messages) {
            m.setAttachments(attachments.getOrDefault(m.getId(), new ArrayList<>()));
            m.setMarks(marks.getOrDefault(m.getId(), new ArrayList<>()));
        }
        return messages;
    }

    private static LambdaQueryWrapper<MessageEntity> inConversation(ConversationKey key) {
        LambdaQueryWrapper<MessageEntity> w = new LambdaQueryWrapper<>();
        if (key.isGroup()) {
            w.eq(MessageEntity::getGroupId, key.groupId());
        } else {
            w.and(q -> q.and(a -> a.eq(MessageEntity::getSenderId, key.lowUserId())
                            .eq(MessageEntity::getReceiverId, key.highUserId()))
                    .or(b -> b.eq(MessageEntity::getSenderId, key.highUserId())
                            .eq(MessageEntity::getReceiverId, key.lowUserId())));
        }
        return w;
    }

    private static void applyConversation(LambdaUpdateWrapper<MessageEntity> w, ConversationKey key) {
        if (key.isGroup()) {
            w.eq(MessageEntity::getGroupId, key.groupId());
        } else {
            w.and(q -> q.and(a -> a.eq(MessageEntity::getSenderId, key.lowUserId())
                            .eq(MessageEntity::getReceiverId, key.highUserId()))
                    .or(b -> b.eq(MessageEntity::getSenderId, key.highUserId())
                            .eq(MessageEntity::getReceiverId, key.lowUserId())));
        }
    }

    private static MessageAttachmentEntity toAttachment(long messageId, AttachmentRef ref) {
        MessageAttachmentEntity a = new MessageAttachmentEntity();
        a.setId(IdWorker.getId());
        a.setMessageId(messageId);
        a.setKind(ref.kind());
        a.setUrl(ref.url());
        a.setFileName(ref.fileName());
        a.setFileSize(ref.fileSize());
        a.setMimeType(ref.mimeType());
        return a;
    }

    private static MessageHead toHead(MessageEntity m) {
        return new MessageHead(m.getId(), m.getSenderId(), m.getReceiverId(), m.getGroupId(), m.getCreatedAt());
    }

    private static <T> T storage(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new StorageException(operation, e);
        }
    }
}
