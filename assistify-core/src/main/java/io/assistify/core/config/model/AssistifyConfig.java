package io.assistify.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AssistifyConfig(
    AssistantDefaults assistant,
    Map<String, ProviderEndpoint> providers,
    StorageConfig storage,
    SecurityConfig security
) {

    public AssistifyConfig {
        assistant = assistant == null ? AssistantDefaults.defaults() : assistant;
        providers = providers == null ? Map.of() : Map.copyOf(providers);
        storage = storage == null ? StorageConfig.defaults() : storage;
        security = security == null ? SecurityConfig.defaults() : security;
    }

    public static AssistifyConfig defaults() {
        return new AssistifyConfig(
            AssistantDefaults.defaults(),
            Map.of(),
            StorageConfig.defaults(),
            SecurityConfig.defaults()
        );
    }

    public Map<String, String> baseUrlOverrides() {
        Map<String, String> overrides = new LinkedHashMap<>();
        providers.forEach((id, endpoint) -> {
            if (endpoint != null && endpoint.overridden()) {
                overrides.put(id, endpoint.apiBase().trim());
            }
        });
        return overrides;
    }

    public AssistifyConfig withSecurity(SecurityConfig value) {
        return new AssistifyConfig(assistant, providers, storage, value);
    }
}
