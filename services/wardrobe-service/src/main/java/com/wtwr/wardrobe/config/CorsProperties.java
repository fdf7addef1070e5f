package com.wtwr.wardrobe.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Cross-origin settings, bound from {@code wtwr.cors.*}.
 *
 * @param allowedOrigins front-end origins allowed to call the API
 */
@ConfigurationProperties(prefix = "wtwr.cors")
public record CorsProperties(List<String> allowedOrigins) {

    public CorsProperties {
        allowedOrigins = allowedOrigins == null || allowedOrigins.isEmpty()
                ? List.of("http://localhost:3000")
                : List.copyOf(allowedOrigins);
    }
}
