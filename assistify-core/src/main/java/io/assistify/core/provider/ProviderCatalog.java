package io.assistify.core.provider;

import io.assistify.core.usage.UsageLedger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import okhttp3.HttpUrl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ProviderCatalog {
    private static final Logger LOG = LoggerFactory.getLogger(ProviderCatalog.class);
    public static final String OPENAI = "openai";
    public static final String ANTHROPIC = "anthropic";
    public static final String GOOGLE = "google";
    public static final String XAI = "xai";
    public static final String DEEPSEEK = "deepseek";

    private static final List<ProviderConfig> BUILT_IN = List.of(
        openAi(),
        anthropic(),
        google(),
        xai(),
        deepSeek()
    );

    private ProviderCatalog() {
    }

    public static List<ProviderConfig> builtIn() {
        return BUILT_IN;
    }

    public static Optional<ProviderConfig> find(String providerId) {
        return BUILT_IN.stream().filter(config -> config.id().equals(providerId)).findFirst();
    }

    public static void registerDefaults(
        ProviderFactory factory,
        ProviderHttp http,
        UsageLedger ledger,
        Map<String, String> baseUrls
    ) {
        Map<String, String> overrides = baseUrls == null ? Map.of() : baseUrls;
        for (ProviderConfig template : BUILT_IN) {
            ProviderConfig base = template.withBaseUrl(checkedOverride(template, overrides.get(template.id())));
            AdapterFactory adapterFactory = switch (template.id()) {
                case ANTHROPIC -> credential -> new AnthropicProvider(base.withCredential(credential), http, ledger);
                case GOOGLE -> credential -> new GeminiProvider(base.withCredential(credential), http, ledger);
                default -> credential -> new OpenAiCompatProvider(base.withCredential(credential), http, ledger);
            };
            factory.registerProvider(template.id(), adapterFactory);
        }
    }

    private static String checkedOverride(ProviderConfig template, String override) {
        if (override == null || override.isBlank()) {
            return null;
        }
        if (HttpUrl.parse(override.trim()) == null) {
            LOG.warn("Ignoring apiBase override for {}: '{}' is not an http(s) URL, using {}",
                template.id(), override, template.baseUrl());
            return null;
        }
        return override;
    }

    static ProviderConfig openAi() {
        Map<String, ModelInfo> models = new LinkedHashMap<>();
        models.put("gpt-5.1", new ModelInfo("GPT-5.1", 1_048_576, "Latest flagship model"));
        models.put("gpt-5", new ModelInfo("GPT-5", 256_000, "Flagship reasoning model"));
        models.put("gpt-5-pro", new ModelInfo("GPT-5 Pro", 256_000, "Extended reasoning"));
        models.put("gpt-5-mini", new ModelInfo("GPT-5 Mini", 256_000, "Fast and affordable GPT-5"));
        models.put("gpt-5-nano", new ModelInfo("GPT-5 Nano", 128_000, "Smallest GPT-5 variant"));
        models.put("gpt-4.1", new ModelInfo("GPT-4.1", 1_048_576, "Long-context GPT-4 series model"));
        models.put("gpt-4o", new ModelInfo("GPT-4o", 128_000, "Multimodal flagship"));
        models.put("gpt-4o-mini", new ModelInfo("GPT-4o Mini", 128_000, "Small multimodal model"));
        models.put("o3-mini", new ModelInfo("o3-mini", 200_000, "Compact reasoning model"));
        models.put("o1", new ModelInfo("o1", 200_000, "Reasoning model"));
        models.put("o1-mini", new ModelInfo("o1-mini", 128_000, "Small reasoning model"));
        models.put("o1-pro", new ModelInfo("o1-pro", 200_000, "Reasoning model with more compute"));
        return new ProviderConfig(OPENAI, "OpenAI", "https://api.openai.com/v1", "", "gpt-4o", models, 8_192);
    }

    static ProviderConfig anthropic() {
        Map<String, ModelInfo> models = new LinkedHashMap<>();
        models.put("claude-sonnet-4-20250514", new ModelInfo("Claude Sonnet 4", 200_000, "Balanced performance"));
        models.put("claude-opus-4-20250514", new ModelInfo("Claude Opus 4", 200_000, "Most capable model"));
        models.put("claude-3-7-sonnet-20250219", new ModelInfo("Claude 3.7 Sonnet", 200_000, "Hybrid reasoning"));
        models.put("claude-3-5-sonnet-20241022", new ModelInfo("Claude 3.5 Sonnet", 200_000, "Fast and capable"));
        models.put("claude-3-5-haiku-20241022", new ModelInfo("Claude 3.5 Haiku", 200_000, "Fastest model"));
        models.put("claude-3-opus-20240229", new ModelInfo("Claude 3 Opus", 200_000, "Previous generation flagship"));
        models.put("claude-3-sonnet-20240229", new ModelInfo("Claude 3 Sonnet", 200_000, "Previous generation"));
        models.put("claude-3-haiku-20240307", new ModelInfo("Claude 3 Haiku", 200_000, "Previous generation, fast"));
        return new ProviderConfig(
            ANTHROPIC,
            "Anthropic",
            "https://api.anthropic.com/v1",
            "",
            "claude-3-5-sonnet-20241022",
            models,
            200_000
        );
    }

    static ProviderConfig google() {
        Map<String, ModelInfo> models = new LinkedHashMap<>();
        models.put("gemini-3-pro-preview", new ModelInfo("Gemini 3 Pro (Preview)", 1_048_576, "Preview of the next Pro model"));
        models.put("gemini-2.5-pro", new ModelInfo("Gemini 2.5 Pro", 1_048_576, "Most capable 2.5 model"));
        models.put("gemini-2.5-flash", new ModelInfo("Gemini 2.5 Flash", 1_048_576, "Fast and versatile"));
        models.put("gemini-2.5-flash-lite", new ModelInfo("Gemini 2.5 Flash-Lite", 1_048_576, "Cost efficient"));
        models.put("gemini-2.0-flash", new ModelInfo("Gemini 2.0 Flash", 1_048_576, "Previous generation flash"));
        models.put("gemini-2.0-flash-lite", new ModelInfo("Gemini 2.0 Flash-Lite", 1_048_576, "Previous generation lite"));
        models.put("gemini-1.5-pro", new ModelInfo("Gemini 1.5 Pro", 2_097_152, "Long context"));
        models.put("gemini-1.5-flash", new ModelInfo("Gemini 1.5 Flash", 1_048_576, "Legacy fast model"));
        return new ProviderConfig(
            GOOGLE,
            "Google Gemini",
            "https://generativelanguage.googleapis.com/v1beta",
            "",
            "gemini-2.5-flash",
            models,
            1_048_576
        );
    }

    static ProviderConfig xai() {
        Map<String, ModelInfo> models = new LinkedHashMap<>();
        models.put("grok-4-0709", new ModelInfo("Grok 4", 256_000, "Flagship reasoning model"));
        models.put("grok-4-fast-reasoning", new ModelInfo("Grok 4 Fast Reasoning", 2_000_000, "Fast model with reasoning"));
        models.put("grok-4-fast-non-reasoning", new ModelInfo("Grok 4 Fast", 2_000_000, "Fast model without reasoning"));
        models.put("grok-4-1-fast-reasoning", new ModelInfo("Grok 4.1 Fast Reasoning", 2_000_000, "Fast 4.1 model with reasoning"));
        models.put("grok-4-1-fast-non-reasoning", new ModelInfo("Grok 4.1 Fast", 2_000_000, "Fast 4.1 model without reasoning"));
        models.put("grok-code-fast-1", new ModelInfo("Grok Code Fast", 256_000, "Agentic coding model"));
        models.put("grok-3", new ModelInfo("Grok 3", 131_072, "Previous generation"));
        models.put("grok-3-mini", new ModelInfo("Grok 3 Mini", 131_072, "Small previous generation"));
        models.put("grok-2-vision-1212", new ModelInfo("Grok 2 Vision", 32_768, "Image understanding"));
        return new ProviderConfig(XAI, "xAI (Grok)", "https://api.x.ai/v1", "", "grok-4-fast-non-reasoning", models, 131_072);
    }

    static ProviderConfig deepSeek() {
        Map<String, ModelInfo> models = new LinkedHashMap<>();
        models.put("deepseek-chat", new ModelInfo("DeepSeek-V3", 64_000, "General chat model"));
        models.put("deepseek-reasoner", new ModelInfo("DeepSeek-R1", 64_000, "Reasoning model"));
        models.put("deepseek-coder", new ModelInfo("DeepSeek Coder", 64_000, "Code model"));
        return new ProviderConfig(DEEPSEEK, "DeepSeek", "https://api.deepseek.com/v1", "", "deepseek-chat", models, 64_000);
    }
}
