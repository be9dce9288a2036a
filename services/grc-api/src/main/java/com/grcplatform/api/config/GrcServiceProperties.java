package com.grcplatform.api.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service identity, bound from {@code grc.service.*}.
 *
 * @param name        service name used in logs, metric tags and the info endpoint
 * @param environment deployment environment, defaults to {@code development}
 * @param description free text shown by the info endpoint
 */
@ConfigurationProperties(prefix = "grc.service")
@Validated
public record GrcServiceProperties(@NotBlank String name, String environment, String description) {

    public GrcServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (description == null) {
            description = "";
        }
    }
}
