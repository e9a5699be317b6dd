package io.assistify.core.tool.impl;

import io.assistify.core.settings.SettingsKeys;
import io.assistify.core.settings.SettingsStore;
import io.assistify.core.tool.ToolDefinition;
import io.assistify.core.tool.ToolRegistry;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class StoreSettingsTools {
    public static final String CATEGORY = "settings";

    private final SettingsStore settings;

    public StoreSettingsTools(SettingsStore settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    public void registerAll(ToolRegistry registry) {
        registry.register(new ToolDefinition(
            "get_setting",
            "Read the current value of a store setting, e.g. enable_guest_checkout.",
            schema(Map.of("settingId", property("string", "Identifier of the setting"))),
            this::getSetting,
            false,
            CATEGORY
        ));
        registry.register(new ToolDefinition(
            "update_setting",
            "Change a store setting to a new value.",
            schema(Map.of(
                "settingId", property("string", "Identifier of the setting"),
                "value", property("string", "New value, e.g. yes or no")
            ), "settingId", "value"),
            this::updateSetting,
            false,
            CATEGORY
        ));
        registry.register(new ToolDefinition(
            "reset_setting",
            "Remove a store setting so the store falls back to its default behaviour.",
            schema(Map.of("settingId", property("string", "Identifier of the setting"))),
            this::resetSetting,
            true,
            CATEGORY
        ));
    }

    Map<String, Object> getSetting(Map<String, Object> arguments) throws Exception {
        String settingId = settingId(arguments);
        String value = settings.get(SettingsKeys.storeSettingKey(settingId), null);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", true);
        result.put("settingId", settingId);
        result.put("value", value);
        result.put("exists", value != null);
        return result;
    }

    Map<String, Object> updateSetting(Map<String, Object> arguments) throws Exception {
        String settingId = settingId(arguments);
        String value = String.valueOf(arguments.get("value"));
        String key = SettingsKeys.storeSettingKey(settingId);
        String previous = settings.get(key, null);
        settings.set(key, value);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", true);
        result.put("message", "Setting " + settingId + " updated to " + value + ".");
        result.put("settingId", settingId);
        result.put("value", value);
        result.put("previous", previous);
        return result;
    }

    Map<String, Object> resetSetting(Map<String, Object> arguments) throws Exception {
        String settingId = settingId(arguments);
        boolean removed = settings.remove(SettingsKeys.storeSettingKey(settingId));
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", true);
        result.put("settingId", settingId);
        result.put("removed", removed);
        return result;
    }

    private String settingId(Map<String, Object> arguments) {
        Object raw = arguments.get("settingId");
        if (raw == null || String.valueOf(raw).isBlank()) {
            throw new IllegalArgumentException("settingId is required");
        }
        return String.valueOf(raw).trim();
    }

    private static Map<String, Object> schema(Map<String, Object> properties, String... required) {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", required.length == 0 ? List.of("settingId") : List.of(required));
        return schema;
    }

    private static Map<String, Object> property(String type, String description) {
        return Map.of("type", type, "description", description);
    }
}
