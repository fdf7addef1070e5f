package com.wtwr.security;

import java.time.Instant;
import java.util.Map;

/**
 * The authenticated caller, derived from a verified credential and attached to the request for
 * the rest of its processing.
 *
 * @param subject   account identifier from the {@code sub} claim; never blank
 * @param issuedAt  issuance time, null if the credential carried none
 * @param expiresAt expiry time; always in the future at verification time
 * @param claims    every claim of the credential, unmodifiable
 */
public record CallerIdentity(String subject, Instant issuedAt, Instant expiresAt, Map<String, Object> claims) {

    /** Request attribute under which the authentication filter publishes the identity. */
    public static final String REQUEST_ATTRIBUTE = CallerIdentity.class.getName();

    public CallerIdentity {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject must not be null or blank");
        }
        if (expiresAt == null) {
            throw new IllegalArgumentException("expiresAt must not be null");
        }
        claims = claims == null ? Map.of() : Map.copyOf(claims);
    }
}
