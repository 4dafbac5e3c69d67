package com.rebill.api.vault.payload;

import com.rebill.api.platform.validation.annotations.CustomerId;
import com.rebill.api.vault.models.PaymentMethodDetails;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "StorePaymentMethodParams")
public class StorePaymentMethodParams {

    @Schema(required = true, example = "cust_123")
    @CustomerId
    private String customerId;

    @Schema(required = true, description = "customer id assigned by the gateway")
    @NotBlank
    @Size(max = 255)
    private String gatewayCustomerId;

    @Schema(required = true, description = "gateway issued token of the payment method")
    @NotBlank
    @Size(max = 255)
    private String paymentMethodToken;

    @Valid
    private PaymentMethodDetails details;
}
