package io.assistify.core.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.assistify.core.error.AssistifyError;
import io.assistify.core.error.ErrorCode;
import io.assistify.core.error.Outcome;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ProviderHttp {
    private static final Logger LOG = LoggerFactory.getLogger(ProviderHttp.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient client;
    private final ObjectMapper mapper;

    public ProviderHttp() {
        this(new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(20))
            .writeTimeout(Duration.ofSeconds(20))
            .build(), new ObjectMapper());
    }

    public ProviderHttp(OkHttpClient client, ObjectMapper mapper) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public Outcome<JsonNode> postJson(HttpUrl url, Map<String, String> headers, Map<String, Object> payload, int timeoutSeconds) {
        String json;
        try {
            json = mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            return Outcome.failure(AssistifyError.api("Could not encode request: " + e.getOriginalMessage(), 0, ""));
        }

        Request.Builder builder = new Request.Builder()
            .url(url)
            .post(RequestBody.create(json, JSON))
            .header("Content-Type", "application/json")
            .header("Accept", "application/json");
        for (Map.Entry<String, String> header : headers.entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }

        Duration timeout = Duration.ofSeconds(Math.max(1, timeoutSeconds));
        OkHttpClient callClient = client.newBuilder()
            .callTimeout(timeout)
            .readTimeout(timeout)
            .build();

        try (Response response = callClient.newCall(builder.build()).execute()) {
            String raw = response.body() == null ? "" : response.body().string();
            if (!response.isSuccessful()) {
                LOG.debug("Provider call to {} returned HTTP {}", url.host(), response.code());
                return Outcome.failure(AssistifyError.api(errorMessage(raw, response.code()), response.code(), raw));
            }
            return parse(raw);
        } catch (IOException e) {
            LOG.warn("Provider call to {} failed: {}", url.host(), e.toString());
            String reason = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            return Outcome.failure(AssistifyError.api("Request failed: " + reason, 0, ""));
        }
    }

    private Outcome<JsonNode> parse(String raw) {
        try {
            JsonNode root = mapper.readTree(raw);
            if (root == null || !root.isObject()) {
                return Outcome.failure(new AssistifyError(ErrorCode.INVALID_RESPONSE, "Provider returned a non-object JSON body.", 0, raw));
            }
            return Outcome.success(root);
        } catch (JsonProcessingException e) {
            return Outcome.failure(new AssistifyError(ErrorCode.INVALID_RESPONSE, "Provider returned malformed JSON.", 0, raw));
        }
    }

    private String errorMessage(String raw, int status) {
        String fallback = "API request failed with status code " + status + ".";
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            JsonNode error = mapper.readTree(raw).path("error");
            if (error.isTextual() && !error.asText().isBlank()) {
                return error.asText();
            }
            String message = error.path("message").asText("");
            return message.isBlank() ? fallback : message;
        } catch (JsonProcessingException e) {
            return fallback;
        }
    }
}
