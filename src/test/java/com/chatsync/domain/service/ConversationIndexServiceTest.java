package com.chatsync.domain.service;

import com.chatsync.common.error.ForbiddenException;
import com.chatsync.common.error.ValidationException;
import com.chatsync.common.time.ChatTime;
import com.chatsync.domain.dto.ConversationEntry;
import com.chatsync.domain.dto.GroupView;
import com.chatsync.domain.dto.HistoryPage;
import com.chatsync.domain.dto.LastMessagesPage;
import com.chatsync.domain.dto.MessageView;
import com.chatsync.domain.entity.MessageEntity;
import com.chatsync.domain.enums.AttachmentKind;
import com.chatsync.domain.model.AttachmentRef;
import com.chatsync.domain.model.ConversationKey;
import com.chatsync.domain.model.MessageContent;
import com.chatsync.domain.model.MessageRefs;
import com.chatsync.support.ChatTestKit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConversationIndexServiceTest {

    private ChatTestKit kit;
    private LocalDateTime now;

    @BeforeEach
    void setUp() {
        kit = new ChatTestKit().user(1, "alice").user(2, "bob").user(3, "carol").user(4, "dave");
        now = ChatTime.now();
    }

    @Test
    void history_ShouldReturnOnlyOlderThanCursorInChronologicalOrder() {
        List<MessageEntity> seeded = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            seeded.add(kit.messages.seedDirect(i % 2 == 0 ? 1 : 2, i % 2 == 0 ? 2 : 1, "m" + i, now.minusMinutes(10 - i)));
        }
        MessageEntity cursor = seeded.get(3);

        HistoryPage page = kit.index.history(1, ConversationKey.direct(1, 2), 2, cursor.getId());

        assertThat(page.messages()).extracting(MessageView::text).containsExactly("m1", "m2");
        assertThat(page.hasMore()).isTrue();
        assertThat(page.messages()).allSatisfy(m -> assertThat(m.createdAt()).isBefore(cursor.getCreatedAt()));
    }

    @Test
    void history_ShouldBreakTimestampTiesById() {
        LocalDateTime same = now.minusMinutes(1);
        MessageEntity a = kit.messages.seedDirect(1, 2, "a", same);
        MessageEntity b = kit.messages.seedDirect(2, 1, "b", same);
        kit.messages.seedDirect(1, 2, "c", same);

        HistoryPage page = kit.index.history(2, ConversationKey.direct(1, 2), 10, b.getId());

        assertThat(page.messages()).extracting(MessageView::id).containsExactly(a.getId());
        assertThat(page.hasMore()).isFalse();
    }

    @Test
    void history_ShouldIgnoreUnknownCursor() {
        kit.messages.seedDirect(1, 2, "x", now.minusMinutes(2));
        kit.messages.seedDirect(2, 1, "y", now.minusMinutes(1));

        HistoryPage page = kit.index.history(1, ConversationKey.direct(1, 2), null, 424242L);

        assertThat(page.messages()).extracting(MessageView::text).containsExactly("x", "y");
        assertThat(page.hasMore()).isFalse();
    }

    @Test
    void history_ShouldRequireParticipant() {
        assertThatThrownBy(() -> kit.index.history(3, ConversationKey.direct(1, 2), 10, null))
                .isInstanceOf(ForbiddenException.class);
    }

    @Test
    void byType_ShouldFilterByContentKindNewestFirst() {
        kit.send.sendDirect(1, 2, MessageContent.of("pic", List.of(AttachmentRef.of(AttachmentKind.IMAGE, "https://cdn/1.png"))), MessageRefs.NONE);
        kit.send.sendDirect(2, 1, MessageContent.of(null, List.of(AttachmentRef.of(AttachmentKind.AUDIO, "https://cdn/v.ogg"))), MessageRefs.NONE);
        kit.send.sendDirect(2, 1, MessageContent.text("read https://example.com/post"), MessageRefs.NONE);
        kit.send.sendDirect(1, 2, MessageContent.of("clip", List.of(AttachmentRef.of(AttachmentKind.VIDEO, "https://cdn/c.mp4"))), MessageRefs.NONE);
        kit.send.sendDirect(1, 3, MessageContent.of("other", List.of(AttachmentRef.of(AttachmentKind.IMAGE, "https://cdn/2.png"))), MessageRefs.NONE);
        ConversationKey key = ConversationKey.direct(1, 2);

        assertThat(kit.index.byType(1, key, "media", null)).extracting(MessageView::text)
                .containsExactlyInAnyOrder("clip", "pic");
        assertThat(kit.index.byType(2, key, "LINKS", null)).extracting(MessageView::text)
                .containsExactly("read https://example.com/post");
        assertThat(kit.index.byType(1, key, "voice", null)).hasSize(1);
        assertThat(kit.index.byType(1, key, "files", null)).isEmpty();
    }

    @Test
    void byType_ShouldValidateTypeAndParticipant() {
        ConversationKey key = ConversationKey.direct(1, 2);

        assertThatThrownBy(() -> kit.index.byType(1, key, "stickers", null))
                .isInstanceOf(ValidationException.class)
                .extracting(e -> ((ValidationException) e).getReason()).isEqualTo("invalid_type");
        assertThatThrownBy(() -> kit.index.byType(3, key, "media", null))
                .isInstanceOf(ForbiddenException.class);
    }

    @Test
    void clampLimit_ShouldStayWithinBounds() {
        assertThat(ConversationIndexService.clampLimit(null)).isEqualTo(50);
        assertThat(ConversationIndexService.clampLimit(0)).isEqualTo(1);
        assertThat(ConversationIndexService.clampLimit(1000)).isEqualTo(100);
    }

    @Test
    void lastMessages_ShouldPickTrueLatestRegardlessOfInsertOrder() {
        GroupView g = kit.groupHandler.create(3, "team", null, null, List.of(1L));

        // 先插新的再插旧的
        kit.messages.seedDirect(2, 1, "bob newest", now.minusMinutes(1));
        kit.messages.seedDirect(1, 2, "bob older", now.minusMinutes(30));
        kit.messages.seedGroup(3, g.id(), "group newest", now.minusMinutes(5));
        kit.messages.seedGroup(1, g.id(), "group older", now.minusMinutes(50));
        kit.messages.seedDirect(1, 4, "dave only", now.minusMinutes(10));

        LastMessagesPage page = kit.index.lastMessages(1, 1, 10);

        assertThat(page.entries()).extracting(e -> e.lastMessage().text())
                .containsExactly("bob newest", "group newest", "dave only");
        assertThat(page.total()).isEqualTo(3);
        assertThat(page.totalPages()).isEqualTo(1);
        assertThat(page.hasMore()).isFalse();

        ConversationEntry first = page.entries().get(0);
        assertThat(first.type()).isEqualTo("direct");
        assertThat(first.peer().displayName()).isEqualTo("bob");
        ConversationEntry group = page.entries().get(1);
        assertThat(group.type()).isEqualTo("group");
        assertThat(group.groupName()).isEqualTo("team");
    }

    @Test
    void lastMessages_ShouldPaginate() {
        kit.messages.seedDirect(1, 2, "b", now.minusMinutes(1));
        kit.messages.seedDirect(3, 1, "c", now.minusMinutes(2));
        kit.messages.seedDirect(1, 4, "d", now.minusMinutes(3));

        LastMessagesPage p1 = kit.index.lastMessages(1, 1, 2);
        LastMessagesPage p2 = kit.index.lastMessages(1, 2, 2);

        assertThat(p1.entries()).extracting(e -> e.lastMessage().text()).containsExactly("b", "c");
        assertThat(p1.hasMore()).isTrue();
        assertThat(p2.entries()).extracting(e -> e.lastMessage().text()).containsExactly("d");
        assertThat(p2.hasMore()).isFalse();
        assertThat(p2.totalPages()).isEqualTo(2);
    }

    @Test
    void lastMessages_ShouldWidenBeyondRecentWindow() {
        kit.messages.seedDirect(1, 2, "recent", now.minusDays(1));
        kit.messages.seedDirect(4, 1, "ancient", now.minusDays(400));

        LastMessagesPage page = kit.index.lastMessages(1, null, null);

        assertThat(page.entries()).extracting(e -> e.lastMessage().text()).containsExactly("recent", "ancient");
    }

    @Test
    void lastMessages_ShouldNotTrustConversationsBelowSaturatedScan() {
        // 第 2 页每侧只扫 2 条：发出侧被同一个会话占满，更早的 dave 会话在扫描之外
        kit.messages.seedDirect(1, 2, "a1", now.minusMinutes(3));
        kit.messages.seedDirect(1, 2, "a2", now.minusMinutes(2));
        kit.messages.seedDirect(1, 2, "a3", now.minusMinutes(1));
        kit.messages.seedDirect(3, 1, "b-old", now.minusDays(30));
        kit.messages.seedDirect(1, 4, "c-recent", now.minusDays(2));

        LastMessagesPage page = kit.index.lastMessages(1, 2, 1);

        assertThat(page.total()).isEqualTo(3);
        assertThat(page.entries()).singleElement().satisfies(e -> {
            assertThat(e.peer().id()).isEqualTo(4L);
            assertThat(e.lastMessage().text()).isEqualTo("c-recent");
        });
        assertThat(page.hasMore()).isTrue();
    }

    @Test
    void lastMessages_ShouldSkipEmptiedConversations() {
        MessageEntity only = kit.messages.seedDirect(1, 2, "gone", now.minusMinutes(1));
        kit.messages.seedDirect(1, 3, "stays", now.minusMinutes(2));
        kit.messages.deleteById(only.getId());

        LastMessagesPage page = kit.index.lastMessages(1, 1, 10);

        assertThat(page.entries()).extracting(e -> e.lastMessage().text()).containsExactly("stays");
    }

    @Test
    void saved_ShouldListNewestSaveFirst() {
        MessageEntity a = kit.messages.seedDirect(1, 2, "a", now.minusMinutes(3));
        MessageEntity b = kit.messages.seedDirect(2, 1, "b", now.minusMinutes(2));

        kit.receipts.save(1, a.getId());
        kit.receipts.save(1, b.getId());

        List<MessageView> saved = kit.index.saved(1, 10, null);
        assertThat(saved).extracting(MessageView::text).containsExactlyInAnyOrder("a", "b");
        assertThat(kit.index.saved(2, 10, null)).isEmpty();
    }
}
