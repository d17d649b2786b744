package com.orgauth.security;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * Immutable signing configuration for {@link TokenCodec}.
 *
 * <p>Validated on construction so that a weak key is rejected when configuration is loaded, not
 * when the first request arrives. The secret must carry at least 32 bytes, and at least as many
 * bytes as the HMAC algorithm's output (48 for HS384, 64 for HS512).
 *
 * @param algorithm HMAC algorithm identifier written to the token header
 * @param secret shared signing secret, UTF-8 encoded into key bytes
 * @param defaultTtl lifetime used by {@link TokenCodec#issue(TokenClaims)}
 */
public record TokenSigningConfig(String algorithm, String secret, Duration defaultTtl) {

    /** Minimum key length in bytes regardless of algorithm. */
    public static final int MINIMUM_KEY_BYTES = 32;

    private static final Map<String, Integer> ALGORITHM_KEY_BYTES =
            Map.of("HS256", 32, "HS384", 48, "HS512", 64);

    public TokenSigningConfig {
        if (algorithm == null || !ALGORITHM_KEY_BYTES.containsKey(algorithm)) {
            throw new IllegalArgumentException(
                    "Unsupported token algorithm '%s', expected one of %s"
                            .formatted(algorithm, ALGORITHM_KEY_BYTES.keySet()));
        }
        if (secret == null) {
            throw new IllegalArgumentException("Token signing secret must be configured");
        }
        int required = requiredKeyBytes(algorithm);
        int actual = secret.getBytes(StandardCharsets.UTF_8).length;
        if (actual < required) {
            throw new IllegalArgumentException(
                    "Token signing secret is %d bytes; %s requires at least %d"
                            .formatted(actual, algorithm, required));
        }
        if (defaultTtl == null || defaultTtl.compareTo(Duration.ofSeconds(1)) < 0) {
            throw new IllegalArgumentException("Token TTL must be at least one second");
        }
    }

    /** Key bytes required for the given algorithm (never less than {@link #MINIMUM_KEY_BYTES}). */
    public static int requiredKeyBytes(String algorithm) {
        return Math.max(MINIMUM_KEY_BYTES, ALGORITHM_KEY_BYTES.getOrDefault(algorithm, 0));
    }

    byte[] keyBytes() {
        return secret.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "TokenSigningConfig[algorithm=%s, secret=[REDACTED], defaultTtl=%s]"
                .formatted(algorithm, defaultTtl);
    }
}
