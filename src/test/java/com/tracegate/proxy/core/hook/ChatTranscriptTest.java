package com.tracegate.proxy.core.hook;

import com.fasterxml.jackson.databind.JsonNode;
import com.tracegate.proxy.core.exceptions.JsonDecodeException;
import com.tracegate.proxy.core.utils.JsonSupport;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChatTranscriptTest {

    private static JsonNode parse(String json) throws Exception {
        return JsonSupport.mapper().readTree(json);
    }

    @Test
    void decodeMessages_keepsTextTurns() throws Exception {
        List<ChatTranscript.Message> messages = ChatTranscript.decodeMessages(parse(
                "{\"messages\":[{\"role\":\"system\",\"content\":\"be brief\"},"
                        + "{\"role\":\"user\",\"content\":[{\"type\":\"image_url\"}]},"
                        + "{\"role\":\"user\",\"content\":\"hi\"}]}"));

        assertThat(messages).containsExactly(
                new ChatTranscript.Message("system", "be brief"),
                new ChatTranscript.Message("user", "hi"));
    }

    @Test
    void decodeMessages_rejectsNonChatBodies() throws Exception {
        JsonNode array = parse("[1,2]");
        JsonNode noMessages = parse("{\"prompt\":\"x\"}");
        JsonNode badElement = parse("{\"messages\":[\"text\"]}");

        assertThatThrownBy(() -> ChatTranscript.decodeMessages(array)).isInstanceOf(JsonDecodeException.class);
        assertThatThrownBy(() -> ChatTranscript.decodeMessages(noMessages)).isInstanceOf(JsonDecodeException.class);
        assertThatThrownBy(() -> ChatTranscript.decodeMessages(badElement)).isInstanceOf(JsonDecodeException.class);
    }

    @Test
    void render_writesRoleLines() {
        String text = ChatTranscript.render(List.of(
                new ChatTranscript.Message("user", "hello"),
                new ChatTranscript.Message("assistant", "hi there")));

        assertThat(text).isEqualTo("user: hello\nassistant: hi there\n");
    }

    @Test
    void truncate_keepsHeadAndTail() {
        String longText = "a".repeat(1500) + "b".repeat(1500);

        String shortened = ChatTranscript.truncate(longText);

        assertThat(shortened).hasSize(ChatTranscript.KEEP_LENGTH * 2 + ChatTranscript.ELISION.length());
        assertThat(shortened).startsWith("a".repeat(1000) + ChatTranscript.ELISION).endsWith("b".repeat(1000));
        assertThat(ChatTranscript.truncate("x".repeat(2000))).hasSize(2000);
    }
}
