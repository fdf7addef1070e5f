package com.wtwr.wardrobe.infrastructure.web;

import java.util.List;
import java.util.Locale;
import org.springframework.util.AntPathMatcher;

/**
 * Routes reachable without a credential. Each entry is {@code "METHOD /ant/path"} or a bare
 * {@code "/ant/path"} matching any method. Everything not listed is protected.
 */
public final class PublicRoutes {

    private static final AntPathMatcher MATCHER = new AntPathMatcher();

    private final List<Route> routes;

    public PublicRoutes(List<String> specs) {
        this.routes = specs == null ? List.of() : specs.stream().map(PublicRoutes::parse).toList();
    }

    public boolean matches(String method, String path) {
        if (method == null || path == null) {
            return false;
        }
        String upper = method.toUpperCase(Locale.ROOT);
        return routes.stream().anyMatch(route ->
                (route.method() == null || route.method().equals(upper)) && MATCHER.match(route.pattern(), path));
    }

    public List<String> describe() {
        return routes.stream()
                .map(route -> route.method() == null ? route.pattern() : route.method() + " " + route.pattern())
                .toList();
    }

    private static Route parse(String spec) {
        if (spec == null || spec.isBlank()) {
            throw new IllegalArgumentException("public route must not be blank");
        }
        String[] parts = spec.strip().split("\\s+");
        if (parts.length == 1 && parts[0].startsWith("/")) {
            return new Route(null, parts[0]);
        }
        if (parts.length == 2 && parts[1].startsWith("/")) {
            return new Route(parts[0].toUpperCase(Locale.ROOT), parts[1]);
        }
        throw new IllegalArgumentException("public route must look like 'METHOD /path': " + spec);
    }

    private record Route(String method, String pattern) {}
}
