package com.wtwr.wardrobe.config;

import com.wtwr.observability.MetricFactory;
import com.wtwr.observability.SensitiveDataRedactor;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ObservabilityConfig {

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, WardrobeProperties properties) {
        return new MetricFactory(registry, properties.name());
    }

    @Bean
    public SensitiveDataRedactor sensitiveDataRedactor() {
        return new SensitiveDataRedactor();
    }
}
