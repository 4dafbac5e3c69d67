package com.rebill.api.gateway;

import com.rebill.api.gateway.entities.PaymentTransactionRepository;
import com.rebill.api.platform.validation.InputValidator;
import lombok.NonNull;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * Spring Beans used by the gateway package.
 */
@Configuration
class GatewayBeans {

    static final String REST_TEMPLATE = "gatewayRestTemplate";

    @NonNull
    @Bean(name = REST_TEMPLATE)
    RestTemplate gatewayRestTemplate(@NonNull RestTemplateBuilder builder, @NonNull GatewayConfiguration config) {
        return builder
            .setConnectTimeout(config.getConnectTimeout())
            .setReadTimeout(config.getReadTimeout())
            .build();
    }

    @NonNull
    @Bean
    GatewayClient gatewayClient(
        @NonNull GatewayConfiguration config,
        @NonNull @Qualifier(REST_TEMPLATE) RestTemplate restTemplate,
        @NonNull PaymentTransactionRepository transactionRepository,
        @NonNull InputValidator inputValidator
    ) {
        return new NmiGatewayClient(
            restTemplate,
            config.getApiKey(),
            config.getThreeStepUrl(),
            transactionRepository,
            inputValidator);
    }
}
