package com.agentverse.authz.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Identity of the running service, bound from {@code agentverse.service.*}.
 *
 * <pre>
 * agentverse:
 *   service:
 *     name: authz-service
 *     environment: production
 *     description: Group, membership and agent authorization
 * </pre>
 *
 * @param name Service name used for logging, metrics, and tracing. Required.
 * @param environment Deployment environment (development, staging, production).
 * @param description Human-readable service description for /api/v1/info.
 */
@ConfigurationProperties(prefix = "agentverse.service")
@Validated
public record ServiceProperties(@NotBlank String name, String environment, String description) {

    public ServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
    }
}
