package com.chatsync.gateway.ws;

import com.chatsync.gateway.session.PresenceRegistry;
import com.chatsync.support.ChatTestKit;
import com.fasterxml.jackson.databind.JsonNode;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FanOutDispatcherTest {

    @Test
    void notify_ShouldWriteToEveryConnectionOfEveryOnlineUser() {
        ChatTestKit kit = new ChatTestKit();
        EmbeddedChannel a1 = kit.connect(1);
        EmbeddedChannel a2 = kit.connect(1);
        EmbeddedChannel b = kit.connect(2);

        int delivered = kit.dispatcher.notify(List.of(1L, 2L, 3L), "ping", Map.of("k", "v"));

        assertThat(delivered).isEqualTo(3);
        for (EmbeddedChannel ch : List.of(a1, a2, b)) {
            List<JsonNode> frames = kit.drain(ch);
            assertThat(frames).hasSize(1);
            assertThat(frames.get(0).path("event").asText()).isEqualTo("ping");
            assertThat(frames.get(0).path("data").path("k").asText()).isEqualTo("v");
            assertThat(frames.get(0).path("ts").asLong()).isPositive();
        }
    }

    @Test
    void notify_ShouldDeduplicateAudience() {
        ChatTestKit kit = new ChatTestKit();
        EmbeddedChannel a = kit.connect(1);

        assertThat(kit.dispatcher.notify(List.of(1L, 1L, 1L), "x", Map.of())).isEqualTo(1);
        assertThat(kit.drain(a)).hasSize(1);
    }

    @Test
    void closedConnection_ShouldBeSkippedWithoutAffectingOthers() {
        ChatTestKit kit = new ChatTestKit();
        EmbeddedChannel dead = kit.connect(1);
        EmbeddedChannel alive = kit.connect(1);
        dead.close();

        int delivered = kit.dispatcher.notifyUser(1, "x", Map.of());

        assertThat(delivered).isEqualTo(1);
        assertThat(kit.drain(alive)).hasSize(1);
    }

    @Test
    void emptyAudience_ShouldDeliverNothing() {
        ChatTestKit kit = new ChatTestKit();
        kit.connect(1);

        assertThat(kit.dispatcher.notify(List.of(), "x", Map.of())).isZero();
        assertThat(kit.dispatcher.notify(null, "x", Map.of())).isZero();
    }

    @Test
    void broadcast_ShouldReachAllConnections() {
        ChatTestKit kit = new ChatTestKit();
        EmbeddedChannel a = kit.connect(1);
        EmbeddedChannel b = kit.connect(2);

        assertThat(kit.dispatcher.broadcast("hello", List.of())).isEqualTo(2);
        assertThat(kit.eventNames(a)).containsExactly("hello");
        assertThat(kit.eventNames(b)).containsExactly("hello");
    }

    @Test
    void send_ShouldWriteSingleEnvelope() {
        ChatTestKit kit = new ChatTestKit();
        EmbeddedChannel ch = new EmbeddedChannel();
        ch.attr(PresenceRegistry.ATTR_USER_ID).set(5L);

        assertThat(kit.dispatcher.send(ch, WsEnvelope.error("bad_json", null))).isTrue();
        JsonNode f = kit.drain(ch).get(0);
        assertThat(f.path("type").asText()).isEqualTo("ERROR");
        assertThat(f.path("reason").asText()).isEqualTo("bad_json");
        assertThat(f.has("event")).isFalse();
    }
}
