package com.atrium.portfolio.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service identity, bound from {@code atrium.service.*}.
 *
 * <pre>
 * atrium:
 *   service:
 *     name: portfolio-service
 *     environment: production
 *     description: Multi-tenant project portfolio API
 * </pre>
 *
 * @param name Service name used for logging and metrics. Required.
 * @param environment Deployment environment (development, staging, production).
 * @param description Human-readable description shown by {@code /api/v1/info}.
 */
@ConfigurationProperties(prefix = "atrium.service")
@Validated
public record AtriumProperties(@NotBlank String name, String environment, String description) {

    /** Applies defaults before Bean Validation runs. */
    public AtriumProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
    }
}
