package com.wtwr.wardrobe.infrastructure.web;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wtwr.common.ApiError;
import com.wtwr.common.Result;
import com.wtwr.observability.CorrelationContextHolder;
import com.wtwr.observability.MetricFactory;
import com.wtwr.security.CallerIdentity;
import com.wtwr.security.CredentialLocator;
import com.wtwr.security.CredentialLocator.LocatedCredential;
import com.wtwr.security.CredentialVerifier;
import com.wtwr.wardrobe.config.SecurityProperties;
import io.micrometer.core.instrument.Timer;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

/**
 * Authenticates every request to a protected route.
 *
 * <p>The credential is taken from the first source that has one: the
 * {@code Authorization: Bearer} header, the {@code token} query parameter, then the {@code token}
 * field of a JSON body. No credential means {@code Unauthorized} "Authorization required" without
 * consulting the verifier. A credential the verifier rejects is answered with the verifier's
 * error. On success the {@link CallerIdentity} is stored under
 * {@link CallerIdentity#REQUEST_ATTRIBUTE} and the chain continues with a body-caching request,
 * so the handler still sees the full body.
 *
 * <p>Only a body of at most {@link SecurityProperties#bodyCredentialLimit()} is searched for a
 * credential; a larger one counts as carrying none. A {@code token} query value with a malformed
 * percent-escape is handed to the verifier undecoded, which rejects it. Any other fault while
 * locating or verifying the credential is classified by the {@link ErrorDispatcher}.
 *
 * <p>Requests matching {@link PublicRoutes} and CORS preflights are not filtered.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class AuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(AuthenticationFilter.class);

    public static final String MISSING_CREDENTIAL = "Authorization required";

    static final String VERIFY_TIMER = "wtwr.credential.verify";

    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {};

    private final CredentialVerifier verifier;
    private final PublicRoutes publicRoutes;
    private final ErrorDispatcher dispatcher;
    private final ObjectMapper objectMapper;
    private final MetricFactory metrics;
    private final int bodyCredentialLimit;

    public AuthenticationFilter(
            CredentialVerifier verifier,
            PublicRoutes publicRoutes,
            ErrorDispatcher dispatcher,
            ObjectMapper objectMapper,
            MetricFactory metrics,
            SecurityProperties properties) {
        this.verifier = verifier;
        this.publicRoutes = publicRoutes;
        this.dispatcher = dispatcher;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.bodyCredentialLimit = (int) Math.min(Integer.MAX_VALUE - 1, properties.bodyCredentialLimit().toBytes());
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (HttpMethod.OPTIONS.matches(request.getMethod())) {
            return true;
        }
        return publicRoutes.matches(request.getMethod(), pathWithinApplication(request));
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        CachedBodyHttpServletRequest cached = new CachedBodyHttpServletRequest(request, bodyCredentialLimit);
        Optional<LocatedCredential> located;
        Result<CallerIdentity> verified;
        try {
            located = CredentialLocator.locate(
                    request.getHeader(HttpHeaders.AUTHORIZATION), queryToken(request), () -> jsonBody(cached));
            if (located.isEmpty()) {
                reject(ApiError.unauthorized(MISSING_CREDENTIAL), cached, response);
                return;
            }
            verified = verify(located.get().token());
        } catch (RuntimeException e) {
            dispatcher.write(dispatcher.resolve(e), cached, response);
            return;
        }

        if (verified.isErr()) {
            reject(verified.error().withContext("source", located.get().source().name().toLowerCase(Locale.ROOT)),
                    cached, response);
            return;
        }

        CallerIdentity identity = verified.value();
        cached.setAttribute(CallerIdentity.REQUEST_ATTRIBUTE, identity);
        CorrelationContextHolder.update(context -> context.withUserId(identity.subject()));
        log.debug("Authenticated subject={} via {}", identity.subject(), located.get().source());

        filterChain.doFilter(cached, response);
    }

    private Result<CallerIdentity> verify(String token) {
        Timer.Sample sample = Timer.start(metrics.registry());
        Result<CallerIdentity> verified = verifier.verify(token);
        sample.stop(metrics.timer(VERIFY_TIMER, "Credential verification latency",
                "outcome", verified.isOk() ? "accepted" : "rejected"));
        return verified;
    }

    private void reject(ApiError error, HttpServletRequest request, HttpServletResponse response) throws IOException {
        response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        dispatcher.write(error, request, response);
    }

    /** Reads {@code token} from the raw query string; never touches form parameters in the body. */
    static String queryToken(HttpServletRequest request) {
        String query = request.getQueryString();
        if (query == null || query.isEmpty()) {
            return null;
        }
        String raw = UriComponentsBuilder.newInstance().query(query).build()
                .getQueryParams().getFirst(CredentialLocator.FIELD);
        if (raw == null) {
            return null;
        }
        try {
            return UriUtils.decode(raw, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            log.debug("Undecodable token query value: {}", e.getMessage());
            return raw;
        }
    }

    private Map<String, Object> jsonBody(CachedBodyHttpServletRequest request) {
        if (!isJson(request.getContentType())) {
            return Map.of();
        }
        try {
            Optional<byte[]> peeked = request.peekBody();
            if (peeked.isEmpty()) {
                log.debug("Body exceeds {} bytes, skipping body credential", bodyCredentialLimit);
                return Map.of();
            }
            byte[] body = peeked.get();
            if (body.length == 0) {
                return Map.of();
            }
            Map<String, Object> fields = objectMapper.readValue(body, JSON_OBJECT);
            return fields == null ? Map.of() : fields;
        } catch (IOException e) {
            // the handler reports the unreadable body; here it only means no body credential
            log.debug("Body is not a JSON object, skipping body credential: {}", e.getMessage());
            return Map.of();
        }
    }

    private static boolean isJson(String contentType) {
        if (contentType == null) {
            return false;
        }
        try {
            return MediaType.APPLICATION_JSON.isCompatibleWith(MediaType.parseMediaType(contentType));
        } catch (InvalidMediaTypeException e) {
            return false;
        }
    }

    static String pathWithinApplication(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
            return uri.substring(contextPath.length());
        }
        return uri;
    }
}
