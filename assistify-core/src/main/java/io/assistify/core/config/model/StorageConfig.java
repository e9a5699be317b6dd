package io.assistify.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StorageConfig(@JsonAlias({"data_dir"}) String dataDir) {

    public static StorageConfig defaults() {
        return new StorageConfig("~/.assistify/data");
    }
}
