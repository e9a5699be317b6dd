package io.assistify.core.provider;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

public final class ProviderCache {
    private final Map<String, ChatProvider> instances = new ConcurrentHashMap<>();

    public ChatProvider computeIfAbsent(String providerId, String credential, Supplier<ChatProvider> loader) {
        return instances.computeIfAbsent(key(providerId, credential), ignored -> loader.get());
    }

    public boolean contains(String providerId, String credential) {
        return instances.containsKey(key(providerId, credential));
    }

    public int size() {
        return instances.size();
    }

    public void clear() {
        instances.clear();
    }

    static String key(String providerId, String credential) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((credential == null ? "" : credential).getBytes(StandardCharsets.UTF_8));
            return providerId + "_" + HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
