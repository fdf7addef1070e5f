package com.wtwr.security;

import com.wtwr.common.ApiError;
import com.wtwr.common.Result;
import com.wtwr.observability.SensitiveDataRedactor;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies HS256-signed JWTs.
 * <p>
 * A credential is accepted only if its signature validates against the configured secret, it
 * carries a non-blank {@code sub} claim and an {@code exp} claim, and the current time is
 * strictly before {@code exp}. The caller always sees {@code Unauthorized}; the precise reason is
 * logged at DEBUG with a masked token.
 */
public class JwtCredentialVerifier implements CredentialVerifier {

    private static final Logger log = LoggerFactory.getLogger(JwtCredentialVerifier.class);

    private final JwtParser parser;
    private final Clock clock;

    public JwtCredentialVerifier(CredentialSettings settings) {
        this(settings, Clock.systemUTC());
    }

    public JwtCredentialVerifier(CredentialSettings settings, Clock clock) {
        this.clock = clock;
        this.parser = Jwts.parser()
                .verifyWith(Keys.hmacShaKeyFor(settings.secretBytes()))
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    @Override
    public Result<CallerIdentity> verify(String credential) {
        if (credential == null || credential.isBlank()) {
            return reject("empty credential", credential);
        }

        Claims claims;
        try {
            claims = parser.parseSignedClaims(credential).getPayload();
        } catch (ExpiredJwtException e) {
            return reject("expired", credential);
        } catch (JwtException | IllegalArgumentException e) {
            return reject(e.getClass().getSimpleName() + ": " + e.getMessage(), credential);
        }

        String subject = claims.getSubject();
        if (subject == null || subject.isBlank()) {
            return reject("missing sub claim", credential);
        }
        Date expiration = claims.getExpiration();
        if (expiration == null) {
            return reject("missing exp claim", credential);
        }
        Instant expiresAt = expiration.toInstant();
        // exp is exclusive: a credential is dead at its expiry instant
        if (!clock.instant().isBefore(expiresAt)) {
            return reject("expired", credential);
        }

        Date issuedAt = claims.getIssuedAt();
        return Result.ok(new CallerIdentity(
                subject, issuedAt == null ? null : issuedAt.toInstant(), expiresAt, claims));
    }

    private Result<CallerIdentity> reject(String reason, String credential) {
        log.debug("Credential rejected: reason={} token={}", reason, SensitiveDataRedactor.mask(credential));
        return Result.err(ApiError.unauthorized(null));
    }
}
