package io.assistify.core.usage;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

public final class FileUsageStore implements UsageStore {
    private final Path path;
    private final ObjectMapper mapper;

    public FileUsageStore(Path path) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.mapper = new ObjectMapper();
    }

    @Override
    public synchronized UsageState load() throws IOException {
        if (!Files.exists(path)) {
            return UsageState.empty();
        }
        String raw = Files.readString(path);
        if (raw.isBlank()) {
            return UsageState.empty();
        }
        return mapper.readValue(raw, UsageState.class);
    }

    @Override
    public synchronized void save(UsageState state) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(state);
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, json + System.lineSeparator());
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
