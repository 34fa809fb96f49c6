package com.agentverse.authz.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ServiceProperties")
class ServicePropertiesTest {

    @Test
    @DisplayName("accepts valid properties")
    void acceptsValidProperties() {
        var props = new ServiceProperties("authz-service", "production", "Authorization");

        assertThat(props.name()).isEqualTo("authz-service");
        assertThat(props.environment()).isEqualTo("production");
        assertThat(props.description()).isEqualTo("Authorization");
    }

    @Test
    @DisplayName("defaults environment to 'development' when null or blank")
    void defaultsEnvironment() {
        assertThat(new ServiceProperties("authz-service", null, null).environment()).isEqualTo("development");
        assertThat(new ServiceProperties("authz-service", " ", null).environment()).isEqualTo("development");
    }
}
