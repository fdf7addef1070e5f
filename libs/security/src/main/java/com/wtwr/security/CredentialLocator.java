package com.wtwr.security;

import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Finds the candidate credential of a request.
 * <p>
 * Lookup order is the {@code Authorization} bearer header, then the {@value #FIELD} query
 * parameter, then the {@value #FIELD} body field; the first non-empty candidate wins. The body
 * is supplied lazily and only read when neither the header nor the query parameter yields one.
 */
public final class CredentialLocator {

    /** Query parameter and body field name. */
    public static final String FIELD = "token";

    private CredentialLocator() {
        // utility class
    }

    /**
     * A credential together with where it came from.
     */
    public record LocatedCredential(String token, CredentialSource source) {}

    public static Optional<LocatedCredential> locate(
            String authorizationHeader, String queryToken, Supplier<? extends Map<String, ?>> body) {
        Optional<String> fromHeader = BearerTokenExtractor.extract(authorizationHeader);
        if (fromHeader.isPresent()) {
            return Optional.of(new LocatedCredential(fromHeader.get(), CredentialSource.HEADER));
        }
        if (queryToken != null && !queryToken.isBlank()) {
            return Optional.of(new LocatedCredential(queryToken.strip(), CredentialSource.QUERY));
        }
        Map<String, ?> fields = body == null ? null : body.get();
        if (fields != null && fields.get(FIELD) instanceof String bodyToken && !bodyToken.isBlank()) {
            return Optional.of(new LocatedCredential(bodyToken.strip(), CredentialSource.BODY));
        }
        return Optional.empty();
    }
}
