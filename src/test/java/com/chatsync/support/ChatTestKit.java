package com.chatsync.support;

import com.chatsync.domain.config.IndexProperties;
import com.chatsync.domain.mutation.DeleteMessageHandler;
import com.chatsync.domain.mutation.EditMessageHandler;
import com.chatsync.domain.mutation.GroupHandler;
import com.chatsync.domain.mutation.MessageEventPublisher;
import com.chatsync.domain.mutation.PinMessageHandler;
import com.chatsync.domain.mutation.ReactionHandler;
import com.chatsync.domain.mutation.ReceiptHandler;
import com.chatsync.domain.mutation.SendMessageHandler;
import com.chatsync.domain.service.ConversationAccess;
import com.chatsync.domain.service.ConversationIndexService;
import com.chatsync.domain.service.ConversationLocks;
import com.chatsync.domain.service.ProfileHydrator;
import com.chatsync.domain.store.InMemoryGroupStore;
import com.chatsync.domain.store.InMemoryMessageStore;
import com.chatsync.domain.store.InMemoryUserDirectory;
import com.chatsync.gateway.session.PresenceRegistry;
import com.chatsync.gateway.ws.FanOutDispatcher;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;

import java.util.ArrayList;
import java.util.List;

/**
 * 组装一套完整的处理链：内存存储 + 真实在线表/分发器，客户端连接用 EmbeddedChannel 模拟。
 */
public class ChatTestKit {

    public final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    public final InMemoryMessageStore messages;
    public final InMemoryGroupStore groups;
    public final InMemoryUserDirectory users = new InMemoryUserDirectory();

    public final PresenceRegistry presence = new PresenceRegistry();
    public final FanOutDispatcher dispatcher = new FanOutDispatcher(presence, objectMapper);

    public final ConversationAccess access;
    public final ProfileHydrator hydrator = new ProfileHydrator(users);
    public final ConversationLocks locks = new ConversationLocks();
    public final MessageEventPublisher events = new MessageEventPublisher(dispatcher);

    public final SendMessageHandler send;
    public final EditMessageHandler edit;
    public final DeleteMessageHandler delete;
    public final PinMessageHandler pin;
    public final ReactionHandler reactions;
    public final ReceiptHandler receipts;
    public final GroupHandler groupHandler;
    public final ConversationIndexService index;

    public ChatTestKit() {
        this(new InMemoryMessageStore());
    }

    /** 传入子类化的消息存储，用于注入延迟或失败。 */
    public ChatTestKit(InMemoryMessageStore messages) {
        this.messages = messages;
        this.groups = new InMemoryGroupStore(messages);
        this.access = new ConversationAccess(messages, groups);
        this.send = new SendMessageHandler(messages, users, access, hydrator, events);
        this.edit = new EditMessageHandler(messages, access, hydrator, events);
        this.delete = new DeleteMessageHandler(messages, access, hydrator, dispatcher, events);
        this.pin = new PinMessageHandler(messages, access, locks, hydrator, events);
        this.reactions = new ReactionHandler(messages, access, hydrator, events);
        this.receipts = new ReceiptHandler(messages, access, dispatcher);
        this.groupHandler = new GroupHandler(groups, users, access, hydrator, dispatcher);
        this.index = new ConversationIndexService(messages, groups, access, hydrator,
                new IndexProperties(null, null, null, null));
    }

    public ChatTestKit user(long id, String displayName) {
        users.add(id, displayName);
        return this;
    }

    public EmbeddedChannel connect(long userId) {
        EmbeddedChannel ch = new EmbeddedChannel();
        presence.register(userId, ch);
        return ch;
    }

    /** 执行排队中的写任务，取出该连接收到的全部帧。 */
    public List<JsonNode> drain(EmbeddedChannel ch) {
        ch.runPendingTasks();
        List<JsonNode> out = new ArrayList<>();
        Object o;
        while ((o = ch.readOutbound()) != null) {
            TextWebSocketFrame frame = (TextWebSocketFrame) o;
            try {
                out.add(objectMapper.readTree(frame.text()));
            } catch (Exception e) {
                throw new IllegalStateException("bad frame: " + frame.text(), e);
            } finally {
                frame.release();
            }
        }
        return out;
    }

    public List<String> eventNames(EmbeddedChannel ch) {
        return drain(ch).stream().map(n -> n.path("event").asText()).toList();
    }
}
