package io.assistify.core.settings;

import java.util.Locale;

public final class SettingsKeys {
    public static final String SELECTED_PROVIDER = "assistify_ai_provider";
    public static final String SELECTED_MODEL = "assistify_ai_model";
    public static final String STORE_PREFIX = "store_";

    private SettingsKeys() {
    }

    public static String credentialKey(String providerId) {
        return "assistify_" + providerId.trim().toLowerCase(Locale.ROOT) + "_api_key";
    }

    public static String storeSettingKey(String settingId) {
        return STORE_PREFIX + settingId.trim();
    }
}
