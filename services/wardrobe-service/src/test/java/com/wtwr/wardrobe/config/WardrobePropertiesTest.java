package com.wtwr.wardrobe.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("WardrobeProperties")
class WardrobePropertiesTest {

    @Test
    @DisplayName("accepts valid properties")
    void acceptsValidProperties() {
        var props = new WardrobeProperties("wardrobe-service", "production");
        assertThat(props.name()).isEqualTo("wardrobe-service");
        assertThat(props.environment()).isEqualTo("production");
    }

    @Test
    @DisplayName("defaults environment to 'development' when null or blank")
    void defaultsEnvironment() {
        assertThat(new WardrobeProperties("wardrobe-service", null).environment()).isEqualTo("development");
        assertThat(new WardrobeProperties("wardrobe-service", " ").environment()).isEqualTo("development");
    }
}
