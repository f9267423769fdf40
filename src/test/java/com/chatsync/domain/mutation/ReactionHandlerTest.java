package com.chatsync.domain.mutation;

import com.chatsync.common.error.NotFoundException;
import com.chatsync.common.error.ValidationException;
import com.chatsync.domain.dto.GroupView;
import com.chatsync.domain.dto.MessageView;
import com.chatsync.domain.entity.MessageEntity;
import com.chatsync.domain.model.MessageContent;
import com.chatsync.domain.model.MessageRefs;
import com.chatsync.support.ChatTestKit;
import com.fasterxml.jackson.databind.JsonNode;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReactionHandlerTest {

    private ChatTestKit kit;

    @BeforeEach
    void setUp() {
        kit = new ChatTestKit().user(1, "alice").user(2, "bob").user(3, "carol");
    }

    @Test
    void secondReaction_ShouldReplaceFirst() {
        MessageEntity m = kit.messages.seedDirect(1, 2, "nice", LocalDateTime.of(2024, 1, 1, 0, 0));

        kit.reactions.add(2, m.getId(), "👍");
        MessageView view = kit.reactions.add(2, m.getId(), "❤️");

        assertThat(view.reactions()).hasSize(1);
        assertThat(view.reactions().get(0).emoji()).isEqualTo("❤️");
        assertThat(view.reactions().get(0).user().displayName()).isEqualTo("bob");
    }

    @Test
    void reactions_FromDifferentUsersShouldCoexist() {
        MessageEntity m = kit.messages.seedDirect(1, 2, "nice", LocalDateTime.of(2024, 1, 1, 0, 0));

        kit.reactions.add(1, m.getId(), "😂");
        MessageView view = kit.reactions.add(2, m.getId(), "👍");

        assertThat(view.reactions()).extracting(MessageView.ReactionView::emoji).containsExactlyInAnyOrder("😂", "👍");
    }

    @Test
    void remove_ShouldFailWhenNoReaction() {
        MessageEntity m = kit.messages.seedDirect(1, 2, "x", LocalDateTime.of(2024, 1, 1, 0, 0));

        assertThatThrownBy(() -> kit.reactions.remove(2, m.getId()))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("reaction_not_found");
    }

    @Test
    void add_ShouldRejectBlankEmoji() {
        MessageEntity m = kit.messages.seedDirect(1, 2, "x", LocalDateTime.of(2024, 1, 1, 0, 0));

        assertThatThrownBy(() -> kit.reactions.add(2, m.getId(), " "))
                .isInstanceOf(ValidationException.class)
                .hasMessage("emoji_required");
    }

    @Test
    void groupReaction_ShouldReachOnlyGroupAudience() {
        GroupView g = kit.groupHandler.create(1, "team", null, null, List.of(2L));
        MessageView sent = kit.send.sendGroup(1, g.id(), MessageContent.text("vote"), MessageRefs.NONE);
        EmbeddedChannel bob = kit.connect(2);
        EmbeddedChannel carol = kit.connect(3);

        kit.reactions.add(2, sent.id(), "✅");
        kit.reactions.remove(2, sent.id());

        List<JsonNode> frames = kit.drain(bob);
        assertThat(frames).extracting(f -> f.path("event").asText())
                .containsExactly("groupMessageReactionAdded", "groupMessageReactionRemoved");
        assertThat(frames.get(0).path("data").path("message").path("reactions").get(0).path("emoji").asText()).isEqualTo("✅");
        assertThat(kit.drain(carol)).isEmpty();
    }
}
