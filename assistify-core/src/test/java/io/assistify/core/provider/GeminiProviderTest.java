package io.assistify.core.provider;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.assistify.core.error.ErrorCode;
import io.assistify.core.error.Outcome;
import io.assistify.core.model.ChatMessage;
import io.assistify.core.model.ChatOptions;
import io.assistify.core.model.ChatResult;
import io.assistify.core.model.MessageRole;
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

class GeminiProviderTest {
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
    void shouldSendKeyAsQueryParameterAndSystemAsInstruction() throws Exception {
        server.enqueue(jsonResponse("""
            {
              "candidates": [{"content": {"role": "model", "parts": [{"text": "Hello "}, {"text": "admin"}]}}],
              "usageMetadata": {"promptTokenCount": 8, "candidatesTokenCount": 2, "totalTokenCount": 10},
              "modelVersion": "gemini-2.5-flash"
            }
            """));

        Outcome<ChatResult> outcome = provider("g-key").chat(
            List.of(
                ChatMessage.system("You manage a store."),
                ChatMessage.user("hi"),
                ChatMessage.assistant("Hello!"),
                ChatMessage.user("who am I?")
            ),
            ChatOptions.defaults()
        );

        assertThat(outcome.ok()).isTrue();
        assertThat(outcome.value().content()).isEqualTo("Hello admin");
        assertThat(outcome.value().usage().totalTokens()).isEqualTo(10);

        RecordedRequest request = server.takeRequest();
        assertThat(request.getRequestUrl().encodedPath()).isEqualTo("/v1beta/models/gemini-2.5-flash:generateContent");
        assertThat(request.getRequestUrl().queryParameter("key")).isEqualTo("g-key");
        assertThat(request.getHeader("Authorization")).isNull();
        assertThat(request.getHeader("x-api-key")).isNull();

        JsonNode body = JSON.readTree(request.getBody().readUtf8());
        assertThat(body.path("systemInstruction").path("parts").path(0).path("text").asText()).isEqualTo("You manage a store.");
        JsonNode contents = body.path("contents");
        assertThat(contents.size()).isEqualTo(3);
        assertThat(contents.path(0).path("role").asText()).isEqualTo("user");
        assertThat(contents.path(1).path("role").asText()).isEqualTo("model");
        assertThat(contents.path(1).path("parts").path(0).path("text").asText()).isEqualTo("Hello!");
        assertThat(body.path("generationConfig").path("maxOutputTokens").asInt()).isEqualTo(2048);
    }

    @Test
    void shouldGenerateCallIdsForFunctionCalls() throws Exception {
        server.enqueue(jsonResponse("""
            {
              "candidates": [{"content": {"role": "model", "parts": [
                {"functionCall": {"name": "update_setting", "args": {"settingId": "enable_guest_checkout", "value": "no"}}}
              ]}}]
            }
            """));

        List<Map<String, Object>> tools = List.of(
            Map.of("type", "function", "function", Map.of(
                "name", "update_setting",
                "description", "Change a setting",
                "parameters", Map.of("type", "object", "properties", Map.of("settingId", Map.of("type", "string")))
            )),
            Map.of("type", "function", "function", Map.of(
                "name", "list_settings",
                "description", "List settings",
                "parameters", Map.of()
            ))
        );
        Outcome<ChatResult> outcome = provider("g-key")
            .chatWithTools(List.of(ChatMessage.user("disable guest checkout")), tools, ChatOptions.defaults());

        assertThat(outcome.value().requestsTools()).isTrue();
        ToolCall call = outcome.value().toolCalls().get(0);
        assertThat(call.id()).startsWith("call_").hasSize(29);
        assertThat(call.name()).isEqualTo("update_setting");
        assertThat(call.argumentMap()).containsEntry("value", "no");

        JsonNode declarations = JSON.readTree(server.takeRequest().getBody().readUtf8())
            .path("tools").path(0).path("function_declarations");
        assertThat(declarations.size()).isEqualTo(2);
        assertThat(declarations.path(0).path("name").asText()).isEqualTo("update_setting");
        JsonNode emptyParameters = declarations.path(1).path("parameters");
        assertThat(emptyParameters.isObject()).isTrue();
        assertThat(emptyParameters.path("properties").isObject()).isTrue();
        assertThat(emptyParameters.path("properties").size()).isZero();
    }

    @Test
    void shouldReplayCallsAsModelPartsAndResultsAsFunctionResponses() throws Exception {
        server.enqueue(jsonResponse("""
            {"candidates": [{"content": {"role": "model", "parts": [{"text": "Done."}]}}]}
            """));

        ToolCall call = new ToolCall("call_abc", "update_setting", "{\"settingId\":\"enable_guest_checkout\",\"value\":\"no\"}");
        List<ChatMessage> conversation = List.of(
            ChatMessage.user("disable guest checkout"),
            ChatMessage.assistantWithToolCalls("", List.of(call)),
            new ChatMessage(MessageRole.TOOL, "{\"success\":true}", "call_abc", null, List.of())
        );

        Outcome<ChatResult> outcome = provider("g-key").chatWithTools(conversation, List.of(), ChatOptions.defaults());
        assertThat(outcome.value().content()).isEqualTo("Done.");

        JsonNode contents = JSON.readTree(server.takeRequest().getBody().readUtf8()).path("contents");
        JsonNode modelTurn = contents.path(1);
        assertThat(modelTurn.path("role").asText()).isEqualTo("model");
        assertThat(modelTurn.path("parts").size()).isEqualTo(1);
        assertThat(modelTurn.path("parts").path(0).path("functionCall").path("name").asText()).isEqualTo("update_setting");
        assertThat(modelTurn.path("parts").path(0).path("functionCall").path("args").path("value").asText()).isEqualTo("no");

        JsonNode functionTurn = contents.path(2);
        assertThat(functionTurn.path("role").asText()).isEqualTo("function");
        JsonNode response = functionTurn.path("parts").path(0).path("functionResponse");
        assertThat(response.path("name").asText()).isEqualTo("update_setting");
        assertThat(response.path("response").path("result").asText()).isEqualTo("{\"success\":true}");
    }

    @Test
    void shouldRejectFunctionCallWithoutName() {
        server.enqueue(jsonResponse("""
            {"candidates": [{"content": {"role": "model", "parts": [{"functionCall": {"args": {"settingId": "currency"}}}]}}]}
            """));

        Outcome<ChatResult> outcome = provider("g-key").chatWithTools(
            List.of(ChatMessage.user("reset the currency")),
            List.of(),
            ChatOptions.defaults()
        );

        assertThat(outcome.ok()).isFalse();
        assertThat(outcome.error().code()).isEqualTo(ErrorCode.INVALID_RESPONSE);
    }

    @Test
    void shouldReportBlockedCandidateAsInvalidResponse() {
        server.enqueue(jsonResponse("{\"candidates\": [{\"finishReason\": \"SAFETY\"}]}"));

        Outcome<ChatResult> outcome = provider("g-key").chat(List.of(ChatMessage.user("hi")), ChatOptions.defaults());

        assertThat(outcome.error().code()).isEqualTo(ErrorCode.INVALID_RESPONSE);
        assertThat(outcome.error().message()).contains("SAFETY");
    }

    @Test
    void shouldMapApiKeyErrors() {
        server.enqueue(new MockResponse()
            .setResponseCode(400)
            .setBody("{\"error\": {\"code\": 400, \"message\": \"API key not valid.\", \"status\": \"INVALID_ARGUMENT\"}}"));

        Outcome<ChatResult> outcome = provider("bad").chat(List.of(ChatMessage.user("hi")), ChatOptions.defaults());

        assertThat(outcome.error().code()).isEqualTo(ErrorCode.API_ERROR);
        assertThat(outcome.error().message()).isEqualTo("API key not valid.");
    }

    @Test
    void shouldUseLongContextTableForGemini() {
        GeminiProvider provider = provider("g-key");

        assertThat(provider.maxContextLength("gemini-1.5-pro")).isEqualTo(2_097_152);
        assertThat(provider.maxContextLength(null)).isEqualTo(1_048_576);
        assertThat(provider.maxContextLength("gemini-unknown")).isEqualTo(1_048_576);
    }

    private GeminiProvider provider(String credential) {
        return new GeminiProvider(
            ProviderCatalog.google().withBaseUrl(server.url("/v1beta").toString()).withCredential(credential),
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
