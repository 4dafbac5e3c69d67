package com.rebill.api.vault.payload;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.rebill.api.vault.entities.PaymentVaultEntry;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Data;
import lombok.NonNull;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * Public view of a vault entry. It never exposes the payment method token.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(name = "PaymentMethod")
public class PaymentMethodResponse {

    @Schema(required = true, description = "id of the vault entry")
    @NonNull
    private UUID id;

    @Schema(required = true)
    @NonNull
    private String customerId;

    @Schema(required = true, allowableValues = {"credit_card", "debit_card", "bank_account", "other"})
    @NonNull
    private String type;

    @Schema(required = true, example = "**** **** **** 1234")
    @NonNull
    private String maskedCardNumber;

    private String cardBrand;

    private String expiryMonth;

    private String expiryYear;

    private String billingName;

    private Map<String, Object> billingAddress;

    @Schema(required = true)
    private Boolean isDefault;

    @Schema(required = true)
    private Boolean isActive;

    @Schema(required = true)
    private Boolean isExpired;

    @Schema(required = true)
    @NonNull
    private OffsetDateTime createdAt;

    private OffsetDateTime lastUsedAt;

    @NonNull
    public static PaymentMethodResponse from(@NonNull PaymentVaultEntry entry, @NonNull LocalDate today) {
        return PaymentMethodResponse.builder()
            .id(entry.getUuid())
            .customerId(entry.getCustomerId())
            .type(entry.getPaymentMethodType().toValue())
            .maskedCardNumber(entry.getMaskedCardNumber())
            .cardBrand(entry.getCardBrand())
            .expiryMonth(entry.getExpiryMonth())
            .expiryYear(entry.getExpiryYear())
            .billingName(entry.getBillingName())
            .billingAddress(entry.getBillingAddress())
            .isDefault(entry.isDefault())
            .isActive(entry.isActive())
            .isExpired(entry.isExpired(today))
            .createdAt(entry.getCreatedAt())
            .lastUsedAt(entry.getLastUsedAt())
            .build();
    }
}
