package io.assistify.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ToolCallTest {

    @Test
    void shouldDefaultBlankArgumentsToEmptyObject() {
        ToolCall call = new ToolCall(null, "list_orders", " ");

        assertThat(call.id()).isEmpty();
        assertThat(call.arguments()).isEqualTo("{}");
        assertThat(call.argumentMap()).isEmpty();
    }

    @Test
    void shouldEncodeArgumentsAsJsonObject() {
        ToolCall call = ToolCall.of("call_1", "update_setting", Map.of("settingId", "currency"));

        assertThat(call.arguments()).isEqualTo("{\"settingId\":\"currency\"}");
        assertThat(call.argumentMap()).containsEntry("settingId", "currency");
    }

    @Test
    void shouldRejectNonObjectArguments() {
        assertThatThrownBy(() -> new ToolCall("call_1", "x", "[1,2]").argumentMap())
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ToolCall.decode("{oops"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldExposeConversationHelpers() {
        ChatMessage assistant = ChatMessage.assistantWithToolCalls("", List.of(new ToolCall("c", "t", "{}")));

        assertThat(assistant.hasToolCalls()).isTrue();
        assertThat(ChatMessage.user(null).content()).isEmpty();
        assertThat(new Usage(1, 2, 3).plus(new Usage(4, 5, 9))).isEqualTo(new Usage(5, 7, 12));
    }
}
