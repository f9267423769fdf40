package com.chatsync.domain.store;

import com.chatsync.domain.entity.MessageEntity;
import com.chatsync.domain.entity.MessageMarkEntity;
import com.chatsync.domain.enums.AttachmentKind;
import com.chatsync.domain.enums.MarkType;
import com.chatsync.domain.enums.MediaFilter;
import com.chatsync.domain.model.AttachmentRef;
import com.chatsync.domain.model.ConversationKey;
import com.chatsync.domain.model.MessageCursor;
import com.chatsync.domain.model.MessageHead;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 消息持久化边界。
 *
 * <p>返回的 {@link MessageEntity} 都已装配附件与覆盖层；实现失败时抛
 * {@link com.chatsync.common.error.StorageException}。</p>
 */
public interface MessageStore {

    MessageEntity insert(MessageEntity message, List<AttachmentRef> attachments);

    Optional<MessageEntity> findById(long messageId);

    /**
     * 按 (createdAt, id) 倒序取会话内消息；cursor 非空时只取严格更早的。
     */
    List<MessageEntity> findHistory(ConversationKey key, int limit, MessageCursor before);

    /** 会话内带指定类型内容的消息，倒序最多 limit 条。 */
    List<MessageEntity> findByKind(ConversationKey key, MediaFilter filter, int limit);

    /** 会话内 (createdAt, id) 最大的一条；空会话返回 empty。 */
    Optional<MessageEntity> findLatest(ConversationKey key);

    /**
     * 扫描用户参与的单聊消息头（发出、收到各最多 capPerSide 条，倒序）。
     *
     * @param since 为 null 时不限时间窗口
     */
    List<MessageHead> scanDirectHeads(long userId, LocalDateTime since, int capPerSide);

    /** 每个群的最新一条消息头；没有消息的群不返回。 */
    List<MessageHead> latestGroupHeads(Collection<Long> groupIds);

    void updateText(long messageId, String text, String linkUrl, LocalDateTime editedAt);

    /** 用新附件替换该消息上某一类附件，并置编辑标记。 */
    void replaceAttachments(long messageId, AttachmentKind kind, AttachmentRef replacement, LocalDateTime editedAt);

    /** 移除某一类附件并置编辑标记。 */
    void removeAttachments(long messageId, AttachmentKind kind, LocalDateTime editedAt);

    boolean deleteById(long messageId);

    int deleteConversation(ConversationKey key);

    /** 取消会话内其它置顶，再置顶这一条；两步在同一事务内。 */
    void pin(long messageId, ConversationKey key, long pinnedBy, LocalDateTime pinnedAt);

    void unpin(long messageId);

    /** 不存在则插入，已存在返回 false（已读/已听/收藏）。 */
    boolean insertMarkIfAbsent(MessageMarkEntity mark);

    /** 插入或覆盖（表情回应：同一用户只保留最后一个）。 */
    void upsertMark(MessageMarkEntity mark);

    boolean deleteMark(long messageId, long userId, MarkType type);

    /** 用户收藏的消息，按收藏时间倒序；beforeMessageId 为上一页最后一条。 */
    List<MessageEntity> findSaved(long userId, int limit, Long beforeMessageId);
}
