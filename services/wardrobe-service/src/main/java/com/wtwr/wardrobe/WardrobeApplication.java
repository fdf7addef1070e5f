package com.wtwr.wardrobe;

import com.wtwr.wardrobe.config.CorsProperties;
import com.wtwr.wardrobe.config.SecurityProperties;
import com.wtwr.wardrobe.config.WardrobeProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * What To Wear API: user accounts and clothing items behind a credential check, request
 * validation and a single error dispatcher.
 *
 * <p>Request flow: {@code CorrelationIdFilter} → {@code AuthenticationFilter} (protected routes)
 * → controller → {@code RequestPipeline} (validate, handle) → response or
 * {@code ErrorDispatcher}.
 */
@SpringBootApplication
@EnableConfigurationProperties({WardrobeProperties.class, SecurityProperties.class, CorsProperties.class})
public class WardrobeApplication {

    private static final Logger log = LoggerFactory.getLogger(WardrobeApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(WardrobeApplication.class, args);
        log.info("Wardrobe service started");
    }
}
