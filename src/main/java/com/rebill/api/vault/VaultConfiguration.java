package com.rebill.api.vault;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties used by various components in the vault package.
 */
@Validated
@ConfigurationProperties("app.vault")
@Data
class VaultConfiguration {

    @NotBlank
    private final String cleanupSchedule;

    /**
     * TTL of cached vault statistics and per-customer payment method lists. Writes to a customer's
     * vault evict that customer's entries earlier.
     */
    @NotNull
    private final Duration cacheTtl;

    /**
     * Upper bound of cached per-customer payment method lists.
     */
    @Min(1)
    private final long cacheMaxSize;
}
