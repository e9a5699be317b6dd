package io.assistify.core.provider;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Objects;

/**
 * Reversible XOR + Base64 masking for stored API keys. This keeps keys out of plain sight in the settings
 * file; it is not encryption and anyone holding the secret can reverse it.
 */
public final class CredentialObfuscator {
    private final byte[] secret;

    public CredentialObfuscator(String secret) {
        Objects.requireNonNull(secret, "secret must not be null");
        if (secret.isEmpty()) {
            throw new IllegalArgumentException("secret must not be empty");
        }
        this.secret = secret.getBytes(StandardCharsets.UTF_8);
    }

    public String obfuscate(String plain) {
        if (plain == null || plain.isEmpty()) {
            return "";
        }
        return Base64.getEncoder().encodeToString(xor(plain.getBytes(StandardCharsets.UTF_8)));
    }

    public String reveal(String masked) {
        if (masked == null || masked.isEmpty()) {
            return "";
        }
        return new String(xor(Base64.getDecoder().decode(masked)), StandardCharsets.UTF_8);
    }

    private byte[] xor(byte[] input) {
        byte[] output = new byte[input.length];
        for (int i = 0; i < input.length; i++) {
            output[i] = (byte) (input[i] ^ secret[i % secret.length]);
        }
        return output;
    }
}
