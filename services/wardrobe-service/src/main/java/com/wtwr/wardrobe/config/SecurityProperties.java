package com.wtwr.wardrobe.config;

import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

/**
 * Credential and route-protection settings, bound from {@code wtwr.security.*}. Loaded once at
 * startup; the secret is handed to the verifier and issuer and never read again.
 *
 * @param jwtSecret           HMAC signing secret, at least 32 bytes. Required.
 * @param tokenTtl            lifetime of issued credentials, 7 days when unset
 * @param publicRoutes        routes served without a credential, as {@code "METHOD /ant/path"}
 * @param bodyCredentialLimit largest JSON body searched for a {@code token} field, 64KB when
 *                            unset; bigger bodies carry no credential
 */
@ConfigurationProperties(prefix = "wtwr.security")
@Validated
public record SecurityProperties(
        @NotBlank String jwtSecret, Duration tokenTtl, List<String> publicRoutes, DataSize bodyCredentialLimit) {

    public static final List<String> DEFAULT_PUBLIC_ROUTES =
            List.of("POST /signin", "POST /signup", "GET /items", "GET /actuator/**");

    public static final DataSize DEFAULT_BODY_CREDENTIAL_LIMIT = DataSize.ofKilobytes(64);

    public SecurityProperties {
        if (tokenTtl == null) {
            tokenTtl = Duration.ofDays(7);
        }
        publicRoutes = publicRoutes == null || publicRoutes.isEmpty() ? DEFAULT_PUBLIC_ROUTES : List.copyOf(publicRoutes);
        if (bodyCredentialLimit == null) {
            bodyCredentialLimit = DEFAULT_BODY_CREDENTIAL_LIMIT;
        }
        if (bodyCredentialLimit.isNegative()) {
            throw new IllegalArgumentException("bodyCredentialLimit must not be negative");
        }
    }

    @Override
    public String toString() {
        return "SecurityProperties[jwtSecret=[REDACTED], tokenTtl=" + tokenTtl + ", publicRoutes=" + publicRoutes
                + ", bodyCredentialLimit=" + bodyCredentialLimit + "]";
    }
}
