package io.assistify.core.provider;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.assistify.core.error.ErrorCode;
import io.assistify.core.error.Outcome;
import io.assistify.core.model.ChatMessage;
import io.assistify.core.model.ChatOptions;
import io.assistify.core.model.ChatResult;
import io.assistify.core.model.ToolCall;
import io.assistify.core.usage.FileUsageStore;
import io.assistify.core.usage.UsageLedger;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AnthropicProviderTest {
    private static final ObjectMapper JSON = new ObjectMapper();

    private MockWebServer server;
    private UsageLedger ledger;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        ledger = new UsageLedger(new FileUsageStore(tempDir.resolve("usage.json")), Clock.systemUTC());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldMoveSystemContentToSeparateFieldAndSumUsage() throws Exception {
        server.enqueue(jsonResponse("""
            {
              "model": "claude-3-5-sonnet-20241022",
              "content": [{"type": "text", "text": "Hi! How can I help?"}],
              "usage": {"input_tokens": 10, "output_tokens": 7}
            }
            """));

        Outcome<ChatResult> outcome = provider("sk-ant").chat(
            List.of(ChatMessage.system("You manage a store."), ChatMessage.user("hello")),
            ChatOptions.defaults()
        );

        assertThat(outcome.ok()).isTrue();
        assertThat(outcome.value().content()).isEqualTo("Hi! How can I help?");
        assertThat(outcome.value().usage().promptTokens()).isEqualTo(10);
        assertThat(outcome.value().usage().completionTokens()).isEqualTo(7);
        assertThat(outcome.value().usage().totalTokens()).isEqualTo(17);
        assertThat(ledger.today("anthropic").totalTokens()).isEqualTo(17);

        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1/messages");
        assertThat(request.getHeader("x-api-key")).isEqualTo("sk-ant");
        assertThat(request.getHeader("anthropic-version")).isEqualTo("2023-06-01");
        assertThat(request.getHeader("Authorization")).isNull();

        JsonNode body = JSON.readTree(request.getBody().readUtf8());
        assertThat(body.path("system").asText()).isEqualTo("You manage a store.");
        assertThat(body.path("messages").size()).isEqualTo(1);
        assertThat(body.path("messages").path(0).path("role").asText()).isEqualTo("user");
        assertThat(body.path("max_tokens").asInt()).isEqualTo(2048);
    }

    @Test
    void shouldOmitSystemFieldWhenThereIsNoSystemContent() throws Exception {
        server.enqueue(jsonResponse("{\"content\": [{\"type\": \"text\", \"text\": \"ok\"}]}"));

        provider("sk-ant").chat(List.of(ChatMessage.user("hello")), ChatOptions.defaults());

        JsonNode body = JSON.readTree(server.takeRequest().getBody().readUtf8());
        assertThat(body.has("system")).isFalse();
    }

    @Test
    void shouldParseToolUseBlocksAndAcceptOpenAiShapedTools() throws Exception {
        server.enqueue(jsonResponse("""
            {
              "content": [
                {"type": "text", "text": "Let me check."},
                {"type": "tool_use", "id": "toolu_01", "name": "get_setting", "input": {"settingId": "currency"}},
                {"type": "tool_use", "id": "toolu_02", "name": "get_setting", "input": {"settingId": "timezone"}}
              ],
              "usage": {"input_tokens": 30, "output_tokens": 12}
            }
            """));

        List<Map<String, Object>> tools = List.of(Map.of(
            "type", "function",
            "function", Map.of("name", "get_setting", "description", "Read a setting")
        ));
        Outcome<ChatResult> outcome = provider("sk-ant")
            .chatWithTools(List.of(ChatMessage.user("what currency and timezone?")), tools, ChatOptions.defaults());

        assertThat(outcome.value().kind()).isEqualTo(ChatResult.Kind.TOOL_CALLS);
        assertThat(outcome.value().content()).isEqualTo("Let me check.");
        assertThat(outcome.value().toolCalls()).extracting(ToolCall::id).containsExactly("toolu_01", "toolu_02");
        assertThat(outcome.value().toolCalls().get(0).argumentMap()).containsEntry("settingId", "currency");

        JsonNode tool = JSON.readTree(server.takeRequest().getBody().readUtf8()).path("tools").path(0);
        assertThat(tool.path("name").asText()).isEqualTo("get_setting");
        assertThat(tool.path("input_schema").path("type").asText()).isEqualTo("object");
        assertThat(tool.path("input_schema").path("properties").isObject()).isTrue();
        assertThat(tool.has("function")).isFalse();
    }

    @Test
    void shouldReplayToolUseAndGroupToolResultsIntoOneUserTurn() throws Exception {
        server.enqueue(jsonResponse("{\"content\": [{\"type\": \"text\", \"text\": \"EUR and UTC.\"}]}"));

        List<ToolCall> calls = List.of(
            new ToolCall("toolu_01", "get_setting", "{\"settingId\":\"currency\"}"),
            new ToolCall("toolu_02", "get_setting", "{\"settingId\":\"timezone\"}")
        );
        List<ChatMessage> conversation = List.of(
            ChatMessage.user("what currency and timezone?"),
            ChatMessage.assistantWithToolCalls("Let me check.", calls),
            ChatMessage.tool("{\"value\":\"EUR\"}", "toolu_01", "get_setting"),
            ChatMessage.tool("{\"value\":\"UTC\"}", "toolu_02", "get_setting")
        );

        Outcome<ChatResult> outcome = provider("sk-ant").chatWithTools(conversation, List.of(), ChatOptions.defaults());
        assertThat(outcome.value().content()).isEqualTo("EUR and UTC.");

        JsonNode messages = JSON.readTree(server.takeRequest().getBody().readUtf8()).path("messages");
        assertThat(messages.size()).isEqualTo(3);

        JsonNode assistant = messages.path(1);
        assertThat(assistant.path("role").asText()).isEqualTo("assistant");
        assertThat(assistant.path("content").path(0).path("type").asText()).isEqualTo("text");
        assertThat(assistant.path("content").path(1).path("type").asText()).isEqualTo("tool_use");
        assertThat(assistant.path("content").path(1).path("id").asText()).isEqualTo("toolu_01");
        assertThat(assistant.path("content").path(1).path("input").path("settingId").asText()).isEqualTo("currency");

        JsonNode results = messages.path(2);
        assertThat(results.path("role").asText()).isEqualTo("user");
        assertThat(results.path("content").size()).isEqualTo(2);
        assertThat(results.path("content").path(0).path("type").asText()).isEqualTo("tool_result");
        assertThat(results.path("content").path(0).path("tool_use_id").asText()).isEqualTo("toolu_01");
        assertThat(results.path("content").path(1).path("tool_use_id").asText()).isEqualTo("toolu_02");
    }

    @Test
    void shouldMapErrorEnvelope() {
        server.enqueue(new MockResponse()
            .setResponseCode(400)
            .setBody("{\"type\": \"error\", \"error\": {\"type\": \"invalid_request_error\", \"message\": \"max_tokens: too large\"}}"));

        Outcome<ChatResult> outcome = provider("sk-ant").chat(List.of(ChatMessage.user("hi")), ChatOptions.defaults());

        assertThat(outcome.error().code()).isEqualTo(ErrorCode.API_ERROR);
        assertThat(outcome.error().statusCode()).isEqualTo(400);
        assertThat(outcome.error().message()).isEqualTo("max_tokens: too large");
    }

    @Test
    void shouldRejectToolUseWithoutName() {
        server.enqueue(jsonResponse("""
            {"content": [{"type": "tool_use", "id": "toolu_01", "input": {"settingId": "currency"}}]}
            """));

        Outcome<ChatResult> outcome = provider("sk-ant").chatWithTools(
            List.of(ChatMessage.user("reset the currency")),
            List.of(),
            ChatOptions.defaults()
        );

        assertThat(outcome.ok()).isFalse();
        assertThat(outcome.error().code()).isEqualTo(ErrorCode.INVALID_RESPONSE);
    }

    @Test
    void shouldRejectReplyWithoutTextForPlainChat() {
        server.enqueue(jsonResponse("{\"content\": []}"));

        Outcome<ChatResult> outcome = provider("sk-ant").chat(List.of(ChatMessage.user("hi")), ChatOptions.defaults());

        assertThat(outcome.error().code()).isEqualTo(ErrorCode.INVALID_RESPONSE);
    }

    @Test
    void shouldReportConfiguredStateAndContextWindow() {
        AnthropicProvider unconfigured = provider("");

        assertThat(unconfigured.configured()).isFalse();
        assertThat(unconfigured.validateCredential()).hasValueSatisfying(error ->
            assertThat(error.code()).isEqualTo(ErrorCode.NOT_CONFIGURED));
        assertThat(unconfigured.maxContextLength("claude-opus-4-20250514")).isEqualTo(200_000);
        assertThat(unconfigured.maxContextLength("claude-unknown")).isEqualTo(200_000);
        assertThat(server.getRequestCount()).isZero();
    }

    private AnthropicProvider provider(String credential) {
        return new AnthropicProvider(
            ProviderCatalog.anthropic().withBaseUrl(server.url("/v1").toString()).withCredential(credential),
            new ProviderHttp(),
            ledger
        );
    }

    private MockResponse jsonResponse(String body) {
        return new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody(body);
    }
}
