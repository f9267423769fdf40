package com.chatsync.domain.model;

import com.chatsync.common.error.ValidationException;
import com.chatsync.domain.enums.AttachmentKind;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MessageContentTest {

    @Test
    void of_ShouldStripTextAndTreatBlankAsAbsent() {
        MessageContent c = MessageContent.of("   ", List.of(AttachmentRef.of(AttachmentKind.IMAGE, " https://cdn/x.png ")));

        assertThat(c.text()).isNull();
        assertThat(c.attachments()).hasSize(1);
        assertThat(c.attachments().get(0).url()).isEqualTo("https://cdn/x.png");
        assertThat(MessageContent.text("  hi  ").text()).isEqualTo("hi");
    }

    @Test
    void of_ShouldRejectEmptyMessage() {
        assertThatThrownBy(() -> MessageContent.of(null, null))
                .isInstanceOf(ValidationException.class)
                .extracting("reason").isEqualTo("empty_message");
        assertThatThrownBy(() -> MessageContent.text(" \n "))
                .isInstanceOf(ValidationException.class)
                .extracting("reason").isEqualTo("empty_message");
    }

    @Test
    void of_ShouldEnforceLimits() {
        assertThat(MessageContent.text("a".repeat(MessageContent.MAX_TEXT_LEN)).text()).hasSize(MessageContent.MAX_TEXT_LEN);
        assertThatThrownBy(() -> MessageContent.text("a".repeat(MessageContent.MAX_TEXT_LEN + 1)))
                .extracting("reason").isEqualTo("text_too_long");

        List<AttachmentRef> many = Collections.nCopies(MessageContent.MAX_ATTACHMENTS + 1,
                AttachmentRef.of(AttachmentKind.FILE, "https://cdn/f.bin"));
        assertThatThrownBy(() -> MessageContent.of("hi", many))
                .extracting("reason").isEqualTo("too_many_attachments");
    }

    @Test
    void attachmentRef_ShouldRequireKindAndUrl() {
        assertThatThrownBy(() -> AttachmentRef.of(null, "https://cdn/x.png"))
                .extracting("reason").isEqualTo("invalid_attachment_kind");
        assertThatThrownBy(() -> AttachmentRef.of(AttachmentKind.AUDIO, " "))
                .extracting("reason").isEqualTo("attachment_url_required");
        assertThatThrownBy(() -> new AttachmentRef(AttachmentKind.FILE, "https://cdn/f", "f", -1L, null))
                .extracting("reason").isEqualTo("invalid_file_size");
    }

    @Test
    void extractLink_ShouldReturnFirstUrl() {
        assertThat(MessageContent.extractLink("see https://a.example/x?y=1 and http://b.example"))
                .isEqualTo("https://a.example/x?y=1");
        assertThat(MessageContent.extractLink("no link here")).isNull();
        assertThat(MessageContent.extractLink(null)).isNull();
        assertThat(MessageContent.text("go to http://c.example/page").linkUrl()).isEqualTo("http://c.example/page");
    }
}
