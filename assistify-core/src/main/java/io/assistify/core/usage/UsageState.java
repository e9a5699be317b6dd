package io.assistify.core.usage;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

@JsonIgnoreProperties(ignoreUnknown = true)
public record UsageState(Map<String, Map<String, UsageEntry>> providers) {

    public UsageState {
        Map<String, Map<String, UsageEntry>> copy = new LinkedHashMap<>();
        if (providers != null) {
            providers.forEach((provider, days) -> copy.put(provider, days == null ? Map.of() : Map.copyOf(days)));
        }
        providers = Map.copyOf(copy);
    }

    public static UsageState empty() {
        return new UsageState(Map.of());
    }

    public Map<String, UsageEntry> days(String providerId) {
        return providers.getOrDefault(providerId, Map.of());
    }

    public UsageState with(String providerId, String day, UsageEntry entry) {
        Map<String, Map<String, UsageEntry>> updated = new LinkedHashMap<>(providers);
        Map<String, UsageEntry> providerDays = new TreeMap<>(days(providerId));
        providerDays.put(day, entry);
        updated.put(providerId, providerDays);
        return new UsageState(updated);
    }
}
