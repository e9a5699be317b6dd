package io.assistify.core.settings;

import java.io.IOException;
import java.util.Map;

public interface SettingsStore {
    String get(String key, String defaultValue) throws IOException;

    void set(String key, String value) throws IOException;

    boolean remove(String key) throws IOException;

    Map<String, String> all() throws IOException;
}
