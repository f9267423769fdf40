package com.chatsync.domain.service;

import com.chatsync.common.error.ValidationException;
import com.chatsync.common.time.ChatTime;
import com.chatsync.domain.config.IndexProperties;
import com.chatsync.domain.dto.ConversationEntry;
import com.chatsync.domain.dto.HistoryPage;
import com.chatsync.domain.dto.LastMessagesPage;
import com.chatsync.domain.dto.MessageView;
import com.chatsync.domain.entity.GroupEntity;
import com.chatsync.domain.entity.MessageEntity;
import com.chatsync.domain.enums.MediaFilter;
import com.chatsync.domain.model.ConversationKey;
import com.chatsync.domain.model.MessageCursor;
import com.chatsync.domain.model.MessageHead;
import com.chatsync.domain.model.ProfileSummary;
import com.chatsync.domain.store.GroupStore;
import com.chatsync.domain.store.MessageStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 会话索引：历史翻页、按类型浏览、会话列表（每个会话的最后一条）、收藏列表。只读，不推送。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationIndexService {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 100;

    private static final Comparator<MessageHead> NEWEST_FIRST = Comparator
            .comparing(MessageHead::createdAt)
            .thenComparingLong(MessageHead::id)
            .reversed();

    private final MessageStore messages;
    private final GroupStore groups;
    private final ConversationAccess access;
    private final ProfileHydrator hydrator;
    private final IndexProperties props;

    /**
     * 会话历史：倒序取 limit 条再翻转为正序返回。
     *
     * <p>beforeMessageId 找不到（或不属于该会话）时按首屏处理。</p>
     */
    public HistoryPage history(long actorId, ConversationKey key, Integer limit, Long beforeMessageId) {
        access.requireParticipant(actorId, key);
        int n = clampLimit(limit);

        MessageCursor cursor = null;
        if (beforeMessageId != null) {
            Optional<MessageEntity> anchor = messages.findById(beforeMessageId);
            if (anchor.isPresent() && key.equals(anchor.get().conversationKey())) {
                cursor = new MessageCursor(anchor.get().getCreatedAt(), anchor.get().getId());
            }
        }

        List<MessageEntity> rows = new ArrayList<>(messages.findHistory(key, n, cursor));
        boolean hasMore = rows.size() == n;
        Collections.reverse(rows);
        return new HistoryPage(hydrator.messages(rows), hasMore);
    }

    /**
     * 按类型浏览（media / files / links / voice），倒序，默认也是上限 {@value #MAX_LIMIT} 条。
     */
    public List<MessageView> byType(long actorId, ConversationKey key, String type, Integer limit) {
        MediaFilter filter = MediaFilter.fromString(type);
        if (filter == null) {
            throw new ValidationException("invalid_type", "type must be media, files, links or voice");
        }
        access.requireParticipant(actorId, key);
        int n = clampLimit(limit == null ? MAX_LIMIT : limit);
        return hydrator.messages(messages.findByKind(key, filter, n));
    }

    /**
     * 会话列表：每个单聊对端、每个所在群各一项，按最后一条消息时间倒序分页。
     *
     * <ol>
     *   <li>第一阶段：在最近窗口内按上限扫描消息头，群取每群最新一条。</li>
     *   <li>某一侧（发出/收到）扫满上限时，该侧最老一条的时间是下界，下界以下可能漏掉会话；
     *       下界之上的会话凑不满请求的页时，第二阶段去掉时间窗口、放大上限再扫一次。</li>
     *   <li>对选中的会话逐个精确查询最后一条，内容只取决于 createdAt，与插入顺序无关。</li>
     * </ol>
     *
     * <p>total 基于扫描到的会话数，扫描上限以外的老会话不计入。</p>
     */
    public LastMessagesPage lastMessages(long userId, Integer page, Integer limit) {
        int p = page == null || page < 1 ? 1 : page;
        int n = clampLimit(limit);
        int needed = p * n;

        List<GroupEntity> myGroups = groups.findByUser(userId);
        Map<Long, GroupEntity> groupById = new HashMap<>();
        for (GroupEntity g : myGroups) {
            groupById.put(g.getId(), g);
        }

        Map<ConversationKey, MessageHead> latest = new LinkedHashMap<>();
        if (!groupById.isEmpty()) {
            merge(latest, messages.latestGroupHeads(groupById.keySet()));
        }

        int cap = p == 1
                ? Math.min(n * 3, props.firstPageSampleMaxEffective())
                : Math.min(n * 2, props.nextPageSampleMaxEffective());
        LocalDateTime since = ChatTime.now().minusDays(props.recentWindowDaysEffective());
        List<MessageHead> sampled = messages.scanDirectHeads(userId, since, cap);
        merge(latest, sampled);

        int exact = countNewerThan(latest, scanFloor(userId, sampled, cap));
        if (exact < needed) {
            log.debug("last messages widening scan: userId={}, exact={}, found={}, needed={}",
                    userId, exact, latest.size(), needed);
            merge(latest, messages.scanDirectHeads(userId, null, props.widenedSampleMaxEffective()));
        }

        List<MessageHead> ordered = new ArrayList<>(latest.values());
        ordered.sort(NEWEST_FIRST);

        int total = ordered.size();
        int totalPages = (total + n - 1) / n;
        int from = Math.min((p - 1) * n, total);
        int to = Math.min(from + n, total);

        List<ConversationKey> keys = new ArrayList<>();
        List<MessageEntity> lastRows = new ArrayList<>();
        for (MessageHead head : ordered.subList(from, to)) {
            ConversationKey key = head.key();
            Optional<MessageEntity> last = messages.findLatest(key);
            if (last.isEmpty()) {
                continue;
            }
            keys.add(key);
            lastRows.add(last.get());
        }

        List<MessageView> views = hydrator.messages(lastRows);
        List<Long> peerIds = new ArrayList<>();
        for (ConversationKey key : keys) {
            if (!key.isGroup()) {
                peerIds.add(key.peerOf(userId));
            }
        }
        Map<Long, ProfileSummary> peers = hydrator.profiles(peerIds);

        List<ConversationEntry> entries = new ArrayList<>();
        for (int i = 0; i < keys.size(); i++) {
            ConversationKey key = keys.get(i);
            if (key.isGroup()) {
                GroupEntity g = groupById.get(key.groupId());
                entries.add(new ConversationEntry(key.asString(), "group", null, key.groupId(),
                        g == null ? null : g.getName(), views.get(i)));
            } else {
                entries.add(new ConversationEntry(key.asString(), "direct", peers.get(key.peerOf(userId)),
                        null, null, views.get(i)));
            }
        }
        // 精确查询可能拿到比扫描时更新的消息，按最终结果再排一次
        entries.sort(Comparator
                .comparing((ConversationEntry e) -> e.lastMessage().createdAt())
                .thenComparingLong(e -> e.lastMessage().id())
                .reversed());

        return new LastMessagesPage(entries, p, n, total, totalPages, p < totalPages);
    }

    public List<MessageView> saved(long userId, Integer limit, Long beforeMessageId) {
        return hydrator.messages(messages.findSaved(userId, clampLimit(limit), beforeMessageId));
    }

    static int clampLimit(Integer limit) {
        if (limit == null) {
            return DEFAULT_LIMIT;
        }
        return Math.max(1, Math.min(MAX_LIMIT, limit));
    }

    /** 扫满上限的一侧取其最老一条的时间，两侧取较晚者；都没扫满返回 null。 */
    static LocalDateTime scanFloor(long userId, List<MessageHead> heads, int cap) {
        List<MessageHead> sent = new ArrayList<>();
        List<MessageHead> received = new ArrayList<>();
        for (MessageHead h : heads) {
            if (h.senderId() == userId) {
                sent.add(h);
            }
            if (h.receiverId() != null && h.receiverId() == userId) {
                received.add(h);
            }
        }
        LocalDateTime a = sideFloor(sent, cap);
        LocalDateTime b = sideFloor(received, cap);
        if (a == null) {
            return b;
        }
        return b == null || a.isAfter(b) ? a : b;
    }

    private static LocalDateTime sideFloor(List<MessageHead> side, int cap) {
        if (side.size() < cap) {
            return null;
        }
        return side.stream().map(MessageHead::createdAt).min(Comparator.naturalOrder()).orElse(null);
    }

    private static int countNewerThan(Map<ConversationKey, MessageHead> latest, LocalDateTime floor) {
        if (floor == null) {
            return latest.size();
        }
        int n = 0;
        for (MessageHead h : latest.values()) {
            if (h.createdAt().isAfter(floor)) {
                n++;
            }
        }
        return n;
    }

    private static void merge(Map<ConversationKey, MessageHead> latest, List<MessageHead> heads) {
        for (MessageHead h : heads) {
            latest.merge(h.key(), h, (a, b) -> b.isNewerThan(a) ? b : a);
        }
    }
}
