package com.rebill.api.gateway.payload;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "RefundRequest")
public class RefundRequest {

    @Schema(required = true, description = "amount to refund. it may be lower than the charged amount")
    @NotNull
    @DecimalMin(value = "0", inclusive = false, message = "must be greater than 0")
    private BigDecimal amount;
}
