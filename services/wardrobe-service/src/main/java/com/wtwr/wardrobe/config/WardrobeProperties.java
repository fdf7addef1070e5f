package com.wtwr.wardrobe.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service identity, bound from {@code wtwr.service.*}.
 *
 * <pre>
 * wtwr:
 *   service:
 *     name: wardrobe-service
 *     environment: production
 * </pre>
 *
 * @param name        service name, used as the {@code service} metric tag. Required.
 * @param environment deployment environment, {@code development} when unset
 */
@ConfigurationProperties(prefix = "wtwr.service")
@Validated
public record WardrobeProperties(@NotBlank String name, String environment) {

    public WardrobeProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
    }
}
