package com.supplytrace.ledger.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration for the ledger service, bound from {@code supplytrace.ledger.*}.
 *
 * <pre>
 * supplytrace:
 *   ledger:
 *     name: ledger-service
 *     environment: production
 *     description: Supply chain product ledger
 *     admin-identity: "0x5b38da6a701c568545dcfcb03fcb875f56beddc4"
 * </pre>
 *
 * <p>Invalid config fails the startup.
 *
 * @param name Service name used for logging, metrics and event producer names. Required.
 * @param environment Deployment environment (development, staging, production).
 * @param description Human-readable service description for /api/v1/info.
 * @param adminIdentity Identity that receives the ADMIN role when the ledger starts. Required.
 */
@ConfigurationProperties(prefix = "supplytrace.ledger")
@Validated
public record LedgerServiceProperties(
        @NotBlank String name, String environment, String description, @NotBlank String adminIdentity) {

    /** Applies defaults for optional fields before Bean Validation runs. */
    public LedgerServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (description == null) {
            description = "";
        }
    }
}
