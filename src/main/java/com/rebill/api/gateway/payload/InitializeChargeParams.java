package com.rebill.api.gateway.payload;

import com.rebill.api.platform.validation.annotations.CurrencyCode;
import com.rebill.api.platform.validation.annotations.HttpUrl;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "InitializeChargeParams")
public class InitializeChargeParams {

    @Schema(required = true, description = "amount to charge")
    @NotNull
    @DecimalMin(value = "0", inclusive = false, message = "must be greater than 0")
    private BigDecimal amount;

    @Schema(required = true, description = "ISO 4217 currency code", example = "USD")
    @CurrencyCode
    private String currency;

    @Schema(required = true, description = "url where the hosted payment form redirects after card entry")
    @NotBlank
    @HttpUrl
    private String redirectUrl;

    @Schema(description = "billing address fields, e.g. first-name, address1, postal")
    private Map<String, String> billing;

    @Schema(description = "shipping address fields, e.g. first-name, address1, postal")
    private Map<String, String> shipping;
}
