package io.assistify.core.provider;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record ProviderConfig(
    String id,
    String displayName,
    String baseUrl,
    String credential,
    String defaultModel,
    Map<String, ModelInfo> modelCatalog,
    int defaultContextLength
) {

    public ProviderConfig {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        Objects.requireNonNull(defaultModel, "defaultModel must not be null");
        displayName = displayName == null || displayName.isBlank() ? id : displayName;
        credential = credential == null ? "" : credential.trim();
        modelCatalog = modelCatalog == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(modelCatalog));
        defaultContextLength = Math.max(1, defaultContextLength);
    }

    public boolean configured() {
        return !credential.isBlank();
    }

    public String resolveModel(String requested) {
        return requested == null || requested.isBlank() ? defaultModel : requested.trim();
    }

    public int contextLength(String modelId) {
        ModelInfo info = modelCatalog.get(resolveModel(modelId));
        return info == null ? defaultContextLength : info.contextLength();
    }

    public ProviderConfig withCredential(String value) {
        return new ProviderConfig(id, displayName, baseUrl, value, defaultModel, modelCatalog, defaultContextLength);
    }

    public ProviderConfig withBaseUrl(String value) {
        if (value == null || value.isBlank()) {
            return this;
        }
        return new ProviderConfig(id, displayName, value.trim(), credential, defaultModel, modelCatalog, defaultContextLength);
    }

    @Override
    public String toString() {
        return "ProviderConfig[id=" + id
            + ", baseUrl=" + baseUrl
            + ", defaultModel=" + defaultModel
            + ", configured=" + configured() + "]";
    }
}
