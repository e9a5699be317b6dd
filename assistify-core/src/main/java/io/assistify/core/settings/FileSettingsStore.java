package io.assistify.core.settings;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

public final class FileSettingsStore implements SettingsStore {
    private static final TypeReference<TreeMap<String, String>> MAP_TYPE = new TypeReference<>() {};

    private final Path path;
    private final ObjectMapper mapper;

    public FileSettingsStore(Path path) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.mapper = new ObjectMapper();
    }

    @Override
    public synchronized String get(String key, String defaultValue) throws IOException {
        String value = load().get(key);
        return value == null ? defaultValue : value;
    }

    @Override
    public synchronized void set(String key, String value) throws IOException {
        Objects.requireNonNull(key, "key must not be null");
        Map<String, String> settings = load();
        settings.put(key, value == null ? "" : value);
        save(settings);
    }

    @Override
    public synchronized boolean remove(String key) throws IOException {
        Map<String, String> settings = load();
        if (settings.remove(key) == null) {
            return false;
        }
        save(settings);
        return true;
    }

    @Override
    public synchronized Map<String, String> all() throws IOException {
        return Map.copyOf(load());
    }

    private TreeMap<String, String> load() throws IOException {
        if (!Files.exists(path)) {
            return new TreeMap<>();
        }
        String raw = Files.readString(path);
        if (raw.isBlank()) {
            return new TreeMap<>();
        }
        TreeMap<String, String> settings = mapper.readValue(raw, MAP_TYPE);
        return settings == null ? new TreeMap<>() : settings;
    }

    private void save(Map<String, String> settings) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(settings);
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, json + System.lineSeparator());
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
