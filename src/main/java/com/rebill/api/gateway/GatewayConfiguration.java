package com.rebill.api.gateway;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties used by various components in the gateway package.
 */
@Validated
@ConfigurationProperties("app.gateway")
@Data
class GatewayConfiguration {

    @NotBlank
    private final String apiKey;

    @NotBlank
    private final String threeStepUrl;

    @NotNull
    private final Duration connectTimeout;

    @NotNull
    private final Duration readTimeout;
}
