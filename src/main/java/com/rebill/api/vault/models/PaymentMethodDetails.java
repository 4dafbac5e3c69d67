package com.rebill.api.vault.models;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Optional descriptive fields of a payment method, as returned by the gateway when it tokenized
 * the method.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "PaymentMethodDetails")
public class PaymentMethodDetails {

    @Schema(allowableValues = {"credit_card", "debit_card", "bank_account", "other"}, defaultValue = "credit_card")
    @Pattern(regexp = "(?i)credit_card|debit_card|bank_account|other",
        message = "must be one of credit_card, debit_card, bank_account or other")
    private String type;

    @Schema(description = "last 4 digits of the card or account number", example = "1234")
    @Pattern(regexp = "^\\d{4}$", message = "must be 4 digits")
    private String last4;

    @Schema(example = "visa")
    @Size(max = 50)
    private String brand;

    @Schema(example = "12")
    @Min(1)
    @Max(12)
    private Integer expiryMonth;

    @Schema(example = "2027")
    @Min(1000)
    @Max(9999)
    private Integer expiryYear;

    @Size(max = 255)
    private String billingName;

    private Map<String, Object> billingAddress;

    private Map<String, Object> metadata;
}
