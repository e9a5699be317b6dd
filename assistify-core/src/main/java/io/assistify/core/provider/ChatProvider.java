package io.assistify.core.provider;

import io.assistify.core.error.AssistifyError;
import io.assistify.core.error.ErrorCode;
import io.assistify.core.error.Outcome;
import io.assistify.core.model.ChatMessage;
import io.assistify.core.model.ChatOptions;
import io.assistify.core.model.ChatResult;
import io.assistify.core.tool.ToolFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface ChatProvider {
    String id();

    String displayName();

    ProviderConfig config();

    default boolean configured() {
        return config().configured();
    }

    ToolFormat toolFormat();

    Outcome<ChatResult> chat(List<ChatMessage> messages, ChatOptions options);

    Outcome<ChatResult> chatWithTools(List<ChatMessage> messages, List<Map<String, Object>> tools, ChatOptions options);

    default Optional<AssistifyError> validateCredential() {
        if (!configured()) {
            return Optional.of(AssistifyError.of(ErrorCode.NOT_CONFIGURED, displayName() + " API key is not configured."));
        }
        Outcome<ChatResult> outcome = chat(List.of(ChatMessage.user("Hello")), ChatOptions.defaults().withMaxTokens(10));
        return outcome.ok() ? Optional.empty() : Optional.of(outcome.error());
    }

    default int maxContextLength(String modelId) {
        return config().contextLength(modelId);
    }

    default Map<String, ModelInfo> availableModels() {
        return config().modelCatalog();
    }

    // roughly four characters per token
    default int countTokens(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (int) Math.ceil(text.length() / 4.0);
    }
}
