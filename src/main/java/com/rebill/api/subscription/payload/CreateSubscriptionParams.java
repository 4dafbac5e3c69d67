package com.rebill.api.subscription.payload;

import com.rebill.api.platform.validation.annotations.CurrencyCode;
import com.rebill.api.platform.validation.annotations.CustomerId;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "CreateSubscriptionParams")
public class CreateSubscriptionParams {

    @Schema(required = true, description = "customer id known to the payment gateway", example = "cust_123")
    @CustomerId
    private String customerId;

    @Schema(required = true, description = "amount charged every billing cycle", example = "29.99")
    @NotNull
    @DecimalMin(value = "0", inclusive = false, message = "must be greater than 0")
    @Digits(integer = 10, fraction = 2)
    private BigDecimal amount;

    @Schema(required = true, description = "ISO 4217 currency code", example = "USD")
    @CurrencyCode
    private String currency;

    @Schema(required = true, allowableValues = {"daily", "weekly", "monthly", "yearly"})
    @NotBlank
    @Pattern(regexp = "(?i)daily|weekly|monthly|yearly", message = "must be one of daily, weekly, monthly or yearly")
    private String frequency;

    @Schema(description = "opaque caller data stored with the subscription")
    private Map<String, Object> metadata;
}
