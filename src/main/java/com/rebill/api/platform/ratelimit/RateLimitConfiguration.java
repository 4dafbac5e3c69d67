package com.rebill.api.platform.ratelimit;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties of the HTTP request rate limiter.
 */
@Validated
@ConfigurationProperties("app.rate-limit")
@Data
class RateLimitConfiguration {

    @Min(1)
    private final int maxRequests;

    @NotNull
    private final Duration window;

    @Min(1)
    private final long maxTrackedIdentities;
}
