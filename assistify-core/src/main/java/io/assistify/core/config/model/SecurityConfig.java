package io.assistify.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SecurityConfig(@JsonAlias({"credential_secret"}) String credentialSecret) {

    public static SecurityConfig defaults() {
        return new SecurityConfig("");
    }

    public boolean hasSecret() {
        return credentialSecret != null && !credentialSecret.isBlank();
    }
}
