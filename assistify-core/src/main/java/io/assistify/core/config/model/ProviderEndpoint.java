package io.assistify.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderEndpoint(@JsonAlias({"api_base"}) String apiBase) {

    public boolean overridden() {
        return apiBase != null && !apiBase.isBlank();
    }
}
