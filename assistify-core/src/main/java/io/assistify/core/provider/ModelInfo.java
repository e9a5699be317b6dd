package io.assistify.core.provider;

public record ModelInfo(String displayName, int contextLength, String description) {

    public ModelInfo {
        displayName = displayName == null ? "" : displayName;
        description = description == null ? "" : description;
    }
}
