package com.rebill.api.gateway.payload;

import com.rebill.api.platform.validation.annotations.CurrencyCode;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Inputs of a token based charge against a customer stored at the processor.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CustomerChargeParams {

    @NotBlank
    private String customerRef;

    @NotNull
    @DecimalMin(value = "0", inclusive = false, message = "must be greater than 0")
    private BigDecimal amount;

    @CurrencyCode
    private String currency;
}
