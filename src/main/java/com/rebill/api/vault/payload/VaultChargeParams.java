package com.rebill.api.vault.payload;

import com.rebill.api.platform.validation.annotations.CurrencyCode;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "VaultChargeParams")
public class VaultChargeParams {

    @Schema(required = true, example = "19.99")
    @NotNull
    @DecimalMin(value = "0", inclusive = false, message = "must be greater than 0")
    private BigDecimal amount;

    @Schema(required = true, example = "USD")
    @CurrencyCode
    private String currency;

    @Schema(description = "caller data forwarded to the gateway with the charge")
    private Map<String, Object> metadata;
}
