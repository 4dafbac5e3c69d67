package com.rebill.api.gateway.payload;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.rebill.api.gateway.entities.PaymentTransaction;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Data;
import lombok.NonNull;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.Locale;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(name = "Transaction")
public class TransactionResponse {

    @Schema(required = true, description = "gateway assigned transaction id")
    @NonNull
    private String transactionId;

    @Schema(description = "transaction id of the refunded charge. only present for refunds")
    private String originalTransactionId;

    @Schema(required = true)
    @NonNull
    private BigDecimal amount;

    @Schema(required = true)
    @NonNull
    private String currency;

    @Schema(required = true, allowableValues = {"approved", "refunded", "partially_refunded"})
    @NonNull
    private String status;

    @Schema(description = "last 4 digits of the card, if the gateway exposed them")
    private String last4Digits;

    @Schema(required = true)
    @NonNull
    private OffsetDateTime createdAt;

    @NonNull
    public static TransactionResponse from(@NonNull PaymentTransaction transaction) {
        return TransactionResponse.builder()
            .transactionId(transaction.getTransactionId())
            .originalTransactionId(transaction.getOriginalTransactionId())
            .amount(transaction.getAmount())
            .currency(transaction.getCurrencyCode())
            .status(transaction.getPaymentStatus().name().toLowerCase(Locale.ROOT))
            .last4Digits(transaction.getLast4Digits())
            .createdAt(transaction.getCreatedAt())
            .build();
    }
}
