package com.wtwr.wardrobe.config;

import com.wtwr.security.CredentialSettings;
import com.wtwr.security.CredentialVerifier;
import com.wtwr.security.JwtCredentialIssuer;
import com.wtwr.security.JwtCredentialVerifier;
import com.wtwr.wardrobe.infrastructure.web.PublicRoutes;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

/** Credential verification and issuance, password hashing, and the public route list. */
@Configuration
public class SecurityConfig {

    private static final Logger log = LoggerFactory.getLogger(SecurityConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Fails startup when the secret is shorter than {@link CredentialSettings#MIN_SECRET_BYTES}. */
    @Bean
    public CredentialSettings credentialSettings(SecurityProperties properties) {
        return new CredentialSettings(properties.jwtSecret(), properties.tokenTtl());
    }

    @Bean
    public CredentialVerifier credentialVerifier(CredentialSettings settings, Clock clock) {
        return new JwtCredentialVerifier(settings, clock);
    }

    @Bean
    public JwtCredentialIssuer credentialIssuer(CredentialSettings settings, Clock clock) {
        return new JwtCredentialIssuer(settings, clock);
    }

    @Bean
    public PublicRoutes publicRoutes(SecurityProperties properties) {
        PublicRoutes routes = new PublicRoutes(properties.publicRoutes());
        log.info("Public routes (no credential required): {}", routes.describe());
        return routes;
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }
}
