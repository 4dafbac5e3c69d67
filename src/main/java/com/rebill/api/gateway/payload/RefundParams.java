package com.rebill.api.gateway.payload;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "RefundParams")
public class RefundParams {

    @Schema(required = true, description = "gateway transaction id of the charge to refund")
    @NotBlank
    @Size(min = 5, max = 100)
    @Pattern(regexp = "^[a-zA-Z0-9_-]*$", message = "contains invalid characters")
    private String transactionId;

    @Schema(required = true, description = "amount to refund")
    @NotNull
    @DecimalMin(value = "0", inclusive = false, message = "must be greater than 0")
    private BigDecimal amount;
}
