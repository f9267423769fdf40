package com.chatsync.domain.mutation;

import com.chatsync.common.error.ForbiddenException;
import com.chatsync.common.error.StorageException;
import com.chatsync.common.error.ValidationException;
import com.chatsync.domain.entity.MessageEntity;
import com.chatsync.domain.enums.AttachmentKind;
import com.chatsync.domain.model.AttachmentRef;
import com.chatsync.domain.model.ConversationKey;
import com.chatsync.domain.model.MessageContent;
import com.chatsync.domain.model.MessageRefs;
import com.chatsync.domain.store.InMemoryMessageStore;
import com.chatsync.support.ChatTestKit;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PinMessageHandlerTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2024, 5, 1, 12, 0);

    private ChatTestKit kit;

    @BeforeEach
    void setUp() {
        kit = new ChatTestKit().user(1, "alice").user(2, "bob").user(3, "carol");
    }

    @Test
    void pinSecond_ShouldLeaveOnlySecondPinned() {
        MessageEntity m1 = kit.messages.seedDirect(1, 2, "one", T0);
        MessageEntity m2 = kit.messages.seedDirect(2, 1, "two", T0.plusSeconds(1));

        kit.pin.pin(1, m1.getId());
        kit.pin.pin(2, m2.getId());

        assertThat(kit.messages.findById(m1.getId()).orElseThrow().isPinnedFlag()).isFalse();
        MessageEntity pinned = kit.messages.findById(m2.getId()).orElseThrow();
        assertThat(pinned.isPinnedFlag()).isTrue();
        assertThat(pinned.getPinnedBy()).isEqualTo(2L);
    }

    @Test
    void pin_ShouldEmitPinnedEventThenStatusMessage() {
        MessageEntity m = kit.messages.seedDirect(1, 2, "remember this", T0);
        EmbeddedChannel bob = kit.connect(2);

        var view = kit.pin.pin(1, m.getId());

        assertThat(view.pinned()).isTrue();
        assertThat(view.pinnedBy().displayName()).isEqualTo("alice");
        assertThat(kit.eventNames(bob)).containsExactly("messagePinned", "newMessage");

        List<MessageEntity> history = kit.messages.findHistory(ConversationKey.direct(1, 2), 10, null);
        assertThat(history.get(0).getText()).isEqualTo("📌 alice pinned a message");
    }

    @Test
    void pin_ShouldDescribeAttachmentKind() {
        MessageEntity m = new MessageEntity();
        m.setAttachments(List.of());
        assertThat(PinMessageHandler.describe(m)).isEqualTo("a message");

        var withAudio = kit.send.sendDirect(1, 2, MessageContent.of(null,
                List.of(AttachmentRef.of(AttachmentKind.AUDIO, "https://cdn/a.ogg"))), MessageRefs.NONE);
        assertThat(PinMessageHandler.describe(kit.messages.findById(withAudio.id()).orElseThrow()))
                .isEqualTo("a voice message");
    }

    @Test
    void pin_ShouldRequireParticipant() {
        MessageEntity m = kit.messages.seedDirect(1, 2, "private", T0);

        assertThatThrownBy(() -> kit.pin.pin(3, m.getId()))
                .isInstanceOf(ForbiddenException.class)
                .hasMessage("not_conversation_member");
    }

    @Test
    void unpin_ShouldFailWhenNotPinned() {
        MessageEntity m = kit.messages.seedDirect(1, 2, "x", T0);

        assertThatThrownBy(() -> kit.pin.unpin(1, m.getId()))
                .isInstanceOf(ValidationException.class)
                .hasMessage("message_not_pinned");
    }

    @Test
    void unpin_ShouldClearPinAndNotify() {
        MessageEntity m = kit.messages.seedDirect(1, 2, "x", T0);
        kit.pin.pin(1, m.getId());
        EmbeddedChannel bob = kit.connect(2);

        var view = kit.pin.unpin(2, m.getId());

        assertThat(view.pinned()).isFalse();
        assertThat(view.pinnedBy()).isNull();
        assertThat(kit.eventNames(bob)).containsExactly("messageUnpinned");
    }

    @Test
    void pin_ShouldSucceedWhenStatusMessageCannotBeStored() {
        MessageEntity m = kit.messages.seedDirect(1, 2, "keep", T0);
        EmbeddedChannel bob = kit.connect(2);
        kit.messages.failInsertsWith(new StorageException("insert_message", new IllegalStateException("db down")));

        var view = kit.pin.pin(1, m.getId());

        assertThat(view.pinned()).isTrue();
        assertThat(kit.messages.findById(m.getId()).orElseThrow().isPinnedFlag()).isTrue();
        assertThat(kit.eventNames(bob)).containsExactly("messagePinned");
    }

    @Test
    void concurrentPins_ShouldLeaveExactlyOnePinned() throws Exception {
        SteppedPinStore store = new SteppedPinStore();
        ChatTestKit racing = new ChatTestKit(store).user(1, "alice").user(2, "bob");
        MessageEntity m1 = store.seedDirect(1, 2, "one", T0);
        MessageEntity m2 = store.seedDirect(2, 1, "two", T0.plusSeconds(1));

        List<Future<?>> results = runTogether(
                () -> racing.pin.pin(1, m1.getId()),
                () -> racing.pin.pin(2, m2.getId()));
        for (Future<?> f : results) {
            f.get(5, TimeUnit.SECONDS);
        }

        assertThat(store.pinnedCount(ConversationKey.direct(1, 2))).isEqualTo(1);
    }

    @Test
    void concurrentUnpins_ShouldLetOnlyOneSucceed() throws Exception {
        SteppedUnpinStore store = new SteppedUnpinStore();
        ChatTestKit racing = new ChatTestKit(store).user(1, "alice").user(2, "bob");
        MessageEntity m = store.seedDirect(1, 2, "x", T0);
        racing.pin.pin(1, m.getId());

        List<Future<?>> results = runTogether(
                () -> racing.pin.unpin(1, m.getId()),
                () -> racing.pin.unpin(2, m.getId()));

        int ok = 0;
        List<Throwable> failures = new ArrayList<>();
        for (Future<?> f : results) {
            try {
                f.get(5, TimeUnit.SECONDS);
                ok++;
            } catch (ExecutionException e) {
                failures.add(e.getCause());
            }
        }
        assertThat(ok).isEqualTo(1);
        assertThat(failures).singleElement()
                .isInstanceOf(ValidationException.class)
                .extracting(Throwable::getMessage).isEqualTo("message_not_pinned");
    }

    private static List<Future<?>> runTogether(Runnable a, Runnable b) throws InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> out = new ArrayList<>();
            for (Runnable r : List.of(a, b)) {
                out.add(pool.submit(() -> {
                    start.await();
                    r.run();
                    return null;
                }));
            }
            start.countDown();
            return out;
        } finally {
            pool.shutdown();
            assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        }
    }

    /** 把"取消旧置顶"和"置顶新消息"拆成两步，中间等另一个线程跟上；没有会话锁时两条都会被置顶。 */
    static class SteppedPinStore extends InMemoryMessageStore {

        private final CountDownLatch bothCleared = new CountDownLatch(2);

        @Override
        public void pin(long messageId, ConversationKey key, long pinnedBy, LocalDateTime pinnedAt) {
            clearPins(key, messageId);
            bothCleared.countDown();
            try {
                bothCleared.await(300, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            markPinned(messageId, pinnedBy, pinnedAt);
        }
    }

    /** 取消置顶前等另一个线程跟上；锁外做的状态检查会让两个请求都通过。 */
    static class SteppedUnpinStore extends InMemoryMessageStore {

        private final CountDownLatch bothArrived = new CountDownLatch(2);

        @Override
        public void unpin(long messageId) {
            bothArrived.countDown();
            try {
                bothArrived.await(300, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            super.unpin(messageId);
        }
    }
}
