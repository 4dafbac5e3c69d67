package com.rebill.api.subscription;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Configuration properties used by various components in the subscription package.
 */
@Validated
@ConfigurationProperties("app.subscriptions")
@Data
class SubscriptionConfiguration {

    /**
     * Upper bound of a subscription's amount, inclusive.
     */
    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    private final BigDecimal maxAmount;

    @NotBlank
    private final String billingSchedule;

    /**
     * TTL of cached subscription statistics. Creating or cancelling a subscription evicts them
     * earlier.
     */
    @NotNull
    private final Duration cacheTtl;
}
