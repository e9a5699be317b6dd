package io.assistify.core.provider;

public record ProviderInfo(String id, String displayName, boolean configured) {
}
