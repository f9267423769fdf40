package com.chatsync.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class JacksonConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(JacksonAutoConfiguration.class))
            .withUserConfiguration(JacksonConfig.class);

    @Test
    void idLongFieldsSerializedAsStringButNonIdLongFieldsRemainNumber() {
        contextRunner.run(ctx -> {
            ObjectMapper objectMapper = ctx.getBean(ObjectMapper.class);

            String json = objectMapper.writeValueAsString(
                    new Payload(123L, 100L, 2004874454540382209L, 9007199254740992L, 4096L, List.of(1L, 2L)));
            JsonNode node = objectMapper.readTree(json);

            assertThat(node.get("id").isTextual()).isTrue();
            assertThat(node.get("total").isNumber()).isTrue();
            assertThat(node.get("receiverId").isTextual()).isTrue();
            assertThat(node.get("pinnedBy").isTextual()).isTrue();
            assertThat(node.get("fileSize").isNumber()).isTrue();
            assertThat(node.get("memberIds").get(0).isTextual()).isTrue();
            assertThat(node.get("memberIds").get(1).asText()).isEqualTo("2");
        });
    }

    @Test
    void isIdProperty_ShouldMatchIdLikeNames() {
        assertThat(IdLongJsonSerializer.isIdProperty("id")).isTrue();
        assertThat(IdLongJsonSerializer.isIdProperty("groupId")).isTrue();
        assertThat(IdLongJsonSerializer.isIdProperty("seenBy")).isTrue();
        assertThat(IdLongJsonSerializer.isIdProperty("retryAfter")).isFalse();
        assertThat(IdLongJsonSerializer.isIdProperty("")).isFalse();
    }

    record Payload(long id, long total, long receiverId, long pinnedBy, long fileSize, List<Long> memberIds) {
    }
}
