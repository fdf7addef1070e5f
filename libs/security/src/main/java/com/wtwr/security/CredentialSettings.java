package com.wtwr.security;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Immutable signing configuration, loaded once at startup and injected into the issuer and the
 * verifier.
 *
 * @param secret   HMAC-SHA256 secret; at least {@value #MIN_SECRET_BYTES} bytes in UTF-8
 * @param tokenTtl lifetime of issued credentials; positive
 */
public record CredentialSettings(String secret, Duration tokenTtl) {

    public static final int MIN_SECRET_BYTES = 32;

    public static final Duration DEFAULT_TOKEN_TTL = Duration.ofDays(7);

    public CredentialSettings {
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalArgumentException(
                    "secret must be at least " + MIN_SECRET_BYTES + " bytes for HS256");
        }
        if (tokenTtl == null) {
            tokenTtl = DEFAULT_TOKEN_TTL;
        }
        if (tokenTtl.isZero() || tokenTtl.isNegative()) {
            throw new IllegalArgumentException("tokenTtl must be positive");
        }
    }

    byte[] secretBytes() {
        return secret.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "CredentialSettings[secret=[REDACTED], tokenTtl=" + tokenTtl + "]";
    }
}
