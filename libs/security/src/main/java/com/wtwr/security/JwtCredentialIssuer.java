package com.wtwr.security;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.Map;
import javax.crypto.SecretKey;

/**
 * Mints HS256-signed JWTs whose {@code sub} is the account identifier, stamped with
 * {@code iat} and {@code exp = iat + tokenTtl}.
 */
public class JwtCredentialIssuer {

    private final SecretKey key;
    private final CredentialSettings settings;
    private final Clock clock;

    public JwtCredentialIssuer(CredentialSettings settings) {
        this(settings, Clock.systemUTC());
    }

    public JwtCredentialIssuer(CredentialSettings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
        this.key = Keys.hmacShaKeyFor(settings.secretBytes());
    }

    public String issue(String subject) {
        return issue(subject, Map.of());
    }

    /**
     * @param subject account identifier; must not be blank
     * @param claims  extra claims; registered claim names are overwritten by the issuer
     */
    public String issue(String subject, Map<String, ?> claims) {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject must not be null or blank");
        }
        Instant now = clock.instant();
        return Jwts.builder()
                .claims(claims)
                .subject(subject)
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(settings.tokenTtl())))
                .signWith(key, Jwts.SIG.HS256)
                .compact();
    }
}
