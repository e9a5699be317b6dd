package io.assistify.core.config;

import java.nio.file.Path;

public final class ConfigPaths {

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        return Path.of(System.getProperty("user.home"), ".assistify", "config.json");
    }

    public static Path resolveDataDir(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return Path.of(System.getProperty("user.home"), ".assistify", "data");
        }
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }

    public static Path settingsFile(Path dataDir) {
        return dataDir.resolve("settings.json");
    }

    public static Path usageFile(Path dataDir) {
        return dataDir.resolve("usage.json");
    }

    public static Path auditFile(Path dataDir) {
        return dataDir.resolve("audit-events.jsonl");
    }
}
