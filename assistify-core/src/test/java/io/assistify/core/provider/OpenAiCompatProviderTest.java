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
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class OpenAiCompatProviderTest {
    private static final ObjectMapper JSON = new ObjectMapper();

    private MockWebServer server;
    private UsageLedger ledger;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        ledger = new UsageLedger(
            new FileUsageStore(tempDir.resolve("usage.json")),
            Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC)
        );
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldSendSingleLeadingSystemMessageAndParseContent() throws Exception {
        server.enqueue(jsonResponse("""
            {
              "model": "gpt-4o-2024-08-06",
              "choices": [{"message": {"role": "assistant", "content": "Hello there"}}],
              "usage": {"prompt_tokens": 12, "completion_tokens": 3, "total_tokens": 15}
            }
            """));

        OpenAiCompatProvider provider = provider(ProviderCatalog.openAi(), "sk-test");
        Outcome<ChatResult> outcome = provider.chat(
            List.of(ChatMessage.system("Be brief."), ChatMessage.user("hi")),
            ChatOptions.defaults().withSystemPrompt("You help store admins.")
        );

        assertThat(outcome.ok()).isTrue();
        assertThat(outcome.value().kind()).isEqualTo(ChatResult.Kind.CONTENT);
        assertThat(outcome.value().content()).isEqualTo("Hello there");
        assertThat(outcome.value().usage().totalTokens()).isEqualTo(15);
        assertThat(outcome.value().model()).isEqualTo("gpt-4o-2024-08-06");

        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1/chat/completions");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer sk-test");

        JsonNode body = JSON.readTree(request.getBody().readUtf8());
        assertThat(body.path("model").asText()).isEqualTo("gpt-4o");
        assertThat(body.path("max_tokens").asInt()).isEqualTo(2048);
        assertThat(body.path("temperature").asDouble()).isEqualTo(0.7);
        assertThat(body.has("tools")).isFalse();
        JsonNode messages = body.path("messages");
        assertThat(messages.size()).isEqualTo(2);
        assertThat(messages.path(0).path("role").asText()).isEqualTo("system");
        assertThat(messages.path(0).path("content").asText()).isEqualTo("You help store admins.\n\nBe brief.");
        assertThat(messages.path(1).path("role").asText()).isEqualTo("user");
    }

    @Test
    void shouldReturnToolCallsAndReplayThemInOpenAiFormat() throws Exception {
        server.enqueue(jsonResponse("""
            {
              "choices": [{"message": {"role": "assistant", "content": null, "tool_calls": [
                {"id": "call_1", "type": "function",
                 "function": {"name": "update_setting", "arguments": "{\\"settingId\\":\\"enable_guest_checkout\\",\\"value\\":\\"no\\"}"}}
              ]}}],
              "usage": {"prompt_tokens": 40, "completion_tokens": 9, "total_tokens": 49}
            }
            """));
        server.enqueue(jsonResponse("""
            {"choices": [{"message": {"role": "assistant", "content": "Guest checkout is now disabled."}}]}
            """));

        OpenAiCompatProvider provider = provider(ProviderCatalog.openAi(), "sk-test");
        List<Map<String, Object>> tools = List.of(Map.of(
            "type", "function",
            "function", Map.of(
                "name", "update_setting",
                "description", "Change a store setting",
                "parameters", Map.of("type", "object", "properties", Map.of("settingId", Map.of("type", "string")))
            )
        ));

        List<ChatMessage> conversation = List.of(ChatMessage.user("Disable guest checkout"));
        Outcome<ChatResult> first = provider.chatWithTools(conversation, tools, ChatOptions.defaults());

        assertThat(first.ok()).isTrue();
        assertThat(first.value().requestsTools()).isTrue();
        ToolCall call = first.value().toolCalls().get(0);
        assertThat(call.id()).isEqualTo("call_1");
        assertThat(call.name()).isEqualTo("update_setting");
        assertThat(call.argumentMap()).containsEntry("settingId", "enable_guest_checkout").containsEntry("value", "no");

        List<ChatMessage> followUp = List.of(
            ChatMessage.user("Disable guest checkout"),
            ChatMessage.assistantWithToolCalls("", List.of(call)),
            ChatMessage.tool("{\"success\":true}", "call_1", "update_setting")
        );
        Outcome<ChatResult> second = provider.chatWithTools(followUp, tools, ChatOptions.defaults());
        assertThat(second.value().content()).isEqualTo("Guest checkout is now disabled.");

        JsonNode firstBody = JSON.readTree(server.takeRequest().getBody().readUtf8());
        assertThat(firstBody.path("tool_choice").asText()).isEqualTo("auto");
        assertThat(firstBody.path("tools").path(0).path("function").path("name").asText()).isEqualTo("update_setting");

        JsonNode messages = JSON.readTree(server.takeRequest().getBody().readUtf8()).path("messages");
        assertThat(messages.path(1).path("tool_calls").path(0).path("id").asText()).isEqualTo("call_1");
        assertThat(messages.path(1).path("tool_calls").path(0).path("function").path("arguments").isTextual()).isTrue();
        assertThat(messages.path(2).path("role").asText()).isEqualTo("tool");
        assertThat(messages.path(2).path("tool_call_id").asText()).isEqualTo("call_1");
    }

    @Test
    void shouldMapHttpErrorToApiErrorWithVendorMessage() {
        server.enqueue(new MockResponse()
            .setResponseCode(401)
            .setHeader("Content-Type", "application/json")
            .setBody("{\"error\": {\"message\": \"Incorrect API key provided\", \"type\": \"invalid_request_error\"}}"));

        Outcome<ChatResult> outcome = provider(ProviderCatalog.openAi(), "sk-bad")
            .chat(List.of(ChatMessage.user("hi")), ChatOptions.defaults());

        assertThat(outcome.ok()).isFalse();
        assertThat(outcome.error().code()).isEqualTo(ErrorCode.API_ERROR);
        assertThat(outcome.error().statusCode()).isEqualTo(401);
        assertThat(outcome.error().message()).isEqualTo("Incorrect API key provided");
        assertThat(outcome.error().rawBody()).contains("invalid_request_error");
    }

    @Test
    void shouldFallBackToStatusMessageWhenErrorBodyIsNotJson() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("upstream unavailable"));

        Outcome<ChatResult> outcome = provider(ProviderCatalog.deepSeek(), "sk-ds")
            .chat(List.of(ChatMessage.user("hi")), ChatOptions.defaults());

        assertThat(outcome.error().code()).isEqualTo(ErrorCode.API_ERROR);
        assertThat(outcome.error().message()).isEqualTo("API request failed with status code 503.");
    }

    @Test
    void shouldReportInvalidResponseWhenChoicesAreMissing() {
        server.enqueue(jsonResponse("{\"id\": \"x\"}"));

        Outcome<ChatResult> outcome = provider(ProviderCatalog.xai(), "xai-key")
            .chat(List.of(ChatMessage.user("hi")), ChatOptions.defaults());

        assertThat(outcome.error().code()).isEqualTo(ErrorCode.INVALID_RESPONSE);
    }

    @Test
    void shouldReportTransportFailureWithZeroStatus() throws Exception {
        MockWebServer stopped = new MockWebServer();
        stopped.start();
        String baseUrl = stopped.url("/v1").toString();
        stopped.shutdown();

        OpenAiCompatProvider provider = new OpenAiCompatProvider(
            ProviderCatalog.openAi().withBaseUrl(baseUrl).withCredential("sk-test"),
            new ProviderHttp(),
            ledger
        );
        Outcome<ChatResult> outcome = provider.chat(List.of(ChatMessage.user("hi")), ChatOptions.defaults());

        assertThat(outcome.error().code()).isEqualTo(ErrorCode.API_ERROR);
        assertThat(outcome.error().statusCode()).isZero();
    }

    @Test
    void shouldNotCallVendorWithoutCredential() {
        Outcome<ChatResult> outcome = provider(ProviderCatalog.openAi(), " ")
            .chat(List.of(ChatMessage.user("hi")), ChatOptions.defaults());

        assertThat(outcome.error().code()).isEqualTo(ErrorCode.NOT_CONFIGURED);
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void shouldAccumulateUsageForEverySuccessfulCall() throws Exception {
        server.enqueue(jsonResponse("""
            {"choices": [{"message": {"content": "a"}}], "usage": {"prompt_tokens": 10, "completion_tokens": 2, "total_tokens": 12}}
            """));
        server.enqueue(jsonResponse("""
            {"choices": [{"message": {"content": "b"}}], "usage": {"prompt_tokens": 5, "completion_tokens": 1, "total_tokens": 6}}
            """));
        server.enqueue(new MockResponse().setResponseCode(500).setBody("{}"));

        OpenAiCompatProvider provider = provider(ProviderCatalog.xai(), "xai-key");
        provider.chat(List.of(ChatMessage.user("one")), ChatOptions.defaults());
        provider.chat(List.of(ChatMessage.user("two")), ChatOptions.defaults());
        provider.chat(List.of(ChatMessage.user("three")), ChatOptions.defaults());

        var entry = ledger.today("xai");
        assertThat(entry.promptTokens()).isEqualTo(15);
        assertThat(entry.completionTokens()).isEqualTo(3);
        assertThat(entry.totalTokens()).isEqualTo(18);
        assertThat(entry.requestCount()).isEqualTo(2);
    }

    @Test
    void shouldUseCatalogDefaultsForModelAndContextLength() {
        OpenAiCompatProvider provider = provider(ProviderCatalog.deepSeek(), "sk-ds");

        assertThat(provider.maxContextLength(null)).isEqualTo(64_000);
        assertThat(provider.maxContextLength("deepseek-reasoner")).isEqualTo(64_000);
        assertThat(provider.availableModels()).containsKeys("deepseek-chat", "deepseek-reasoner", "deepseek-coder");
        assertThat(provider.countTokens("twelve chars")).isEqualTo(3);
        assertThat(provider.countTokens("")).isZero();
    }

    private OpenAiCompatProvider provider(ProviderConfig template, String credential) {
        return new OpenAiCompatProvider(
            template.withBaseUrl(server.url("/v1").toString()).withCredential(credential),
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
