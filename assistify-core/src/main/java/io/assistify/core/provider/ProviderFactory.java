package io.assistify.core.provider;

import io.assistify.core.error.AssistifyError;
import io.assistify.core.error.ErrorCode;
import io.assistify.core.error.Outcome;
import io.assistify.core.settings.SettingsKeys;
import io.assistify.core.settings.SettingsStore;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ProviderFactory {
    private static final Logger LOG = LoggerFactory.getLogger(ProviderFactory.class);
    public static final String DEFAULT_PROVIDER = ProviderCatalog.OPENAI;

    private final Map<String, AdapterFactory> factories = new ConcurrentHashMap<>();
    private final List<String> registrationOrder = new CopyOnWriteArrayList<>();
    private final ProviderCache cache;
    private final SettingsStore settings;
    private final CredentialObfuscator obfuscator;
    private final String fallbackProviderId;

    public ProviderFactory(ProviderCache cache, SettingsStore settings, CredentialObfuscator obfuscator) {
        this(cache, settings, obfuscator, DEFAULT_PROVIDER);
    }

    public ProviderFactory(
        ProviderCache cache,
        SettingsStore settings,
        CredentialObfuscator obfuscator,
        String fallbackProviderId
    ) {
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.obfuscator = Objects.requireNonNull(obfuscator, "obfuscator must not be null");
        String fallback = normalize(fallbackProviderId);
        this.fallbackProviderId = fallback.isEmpty() ? DEFAULT_PROVIDER : fallback;
    }

    public boolean registerProvider(String providerId, AdapterFactory factory) {
        Objects.requireNonNull(factory, "factory must not be null");
        String id = normalize(providerId);
        if (id.isBlank()) {
            throw new IllegalArgumentException("providerId must not be blank");
        }
        if (factories.putIfAbsent(id, factory) != null) {
            LOG.debug("Provider {} already registered, keeping the existing factory", id);
            return false;
        }
        registrationOrder.add(id);
        return true;
    }

    public boolean isRegistered(String providerId) {
        return factories.containsKey(normalize(providerId));
    }

    public List<String> providerIds() {
        return List.copyOf(registrationOrder);
    }

    public Outcome<ChatProvider> create(String providerId, String credential) {
        String id = normalize(providerId);
        AdapterFactory factory = factories.get(id);
        if (factory == null) {
            return Outcome.failure(ErrorCode.INVALID_PROVIDER, "Unknown AI provider: " + providerId);
        }
        String key = credential == null ? "" : credential.trim();
        try {
            return Outcome.success(cache.computeIfAbsent(id, key, () -> {
                LOG.debug("Creating adapter for provider {}", id);
                return factory.create(key);
            }));
        } catch (RuntimeException e) {
            LOG.warn("Could not create adapter for provider {}: {}", id, e.getMessage());
            return Outcome.failure(ErrorCode.NOT_CONFIGURED, "AI provider " + id + " is misconfigured: " + e.getMessage());
        }
    }

    public Outcome<ChatProvider> getConfiguredProvider() {
        try {
            String id = selectedProviderId();
            return create(id, credentialFor(id));
        } catch (IOException e) {
            LOG.warn("Could not read provider settings: {}", e.getMessage());
            return Outcome.failure(ErrorCode.NOT_CONFIGURED, "Could not read provider settings: " + e.getMessage());
        }
    }

    public String selectedProviderId() throws IOException {
        return normalize(settings.get(SettingsKeys.SELECTED_PROVIDER, fallbackProviderId));
    }

    public boolean selectProvider(String providerId) throws IOException {
        String id = normalize(providerId);
        if (!factories.containsKey(id)) {
            return false;
        }
        settings.set(SettingsKeys.SELECTED_PROVIDER, id);
        return true;
    }

    public void saveCredential(String providerId, String credential) throws IOException {
        String id = normalize(providerId);
        String value = credential == null ? "" : credential.trim();
        if (value.isEmpty()) {
            settings.remove(SettingsKeys.credentialKey(id));
            return;
        }
        settings.set(SettingsKeys.credentialKey(id), obfuscator.obfuscate(value));
    }

    public String credentialFor(String providerId) throws IOException {
        String stored = settings.get(SettingsKeys.credentialKey(normalize(providerId)), "");
        try {
            return obfuscator.reveal(stored);
        } catch (IllegalArgumentException e) {
            LOG.warn("Stored credential for {} is not readable; treating provider as unconfigured", providerId);
            return "";
        }
    }

    public List<ProviderInfo> availableProviders() throws IOException {
        List<ProviderInfo> providers = new ArrayList<>();
        for (String id : registrationOrder) {
            Outcome<ChatProvider> provider = create(id, credentialFor(id));
            if (provider.ok()) {
                providers.add(new ProviderInfo(id, provider.value().displayName(), provider.value().configured()));
            } else {
                String name = ProviderCatalog.find(id).map(ProviderConfig::displayName).orElse(id);
                providers.add(new ProviderInfo(id, name, false));
            }
        }
        return providers;
    }

    /**
     * Sends a minimal request with the given key. The adapter is built outside the cache, so rejected keys are not
     * retained.
     */
    public Optional<AssistifyError> validateCredential(String providerId, String credential) {
        String id = normalize(providerId);
        AdapterFactory factory = factories.get(id);
        if (factory == null) {
            return Optional.of(AssistifyError.of(ErrorCode.INVALID_PROVIDER, "Unknown AI provider: " + providerId));
        }
        ChatProvider provider;
        try {
            provider = factory.create(credential == null ? "" : credential.trim());
        } catch (RuntimeException e) {
            LOG.warn("Could not create adapter for provider {}: {}", id, e.getMessage());
            return Optional.of(AssistifyError.of(ErrorCode.NOT_CONFIGURED, "AI provider " + id + " is misconfigured: " + e.getMessage()));
        }
        return provider.validateCredential();
    }

    private String normalize(String providerId) {
        return providerId == null ? "" : providerId.trim().toLowerCase(Locale.ROOT);
    }
}
