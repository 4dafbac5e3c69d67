package com.rebill.api.subscription.payload;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.rebill.api.subscription.entities.Subscription;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Data;
import lombok.NonNull;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(name = "Subscription")
public class SubscriptionResponse {

    @Schema(required = true, description = "id of the subscription")
    @NonNull
    private UUID id;

    @Schema(required = true)
    @NonNull
    private String customerId;

    @Schema(required = true)
    @NonNull
    private BigDecimal amount;

    @Schema(required = true)
    @NonNull
    private String currency;

    @Schema(required = true, allowableValues = {"active", "cancelled"})
    @NonNull
    private String status;

    @Schema(required = true, allowableValues = {"daily", "weekly", "monthly", "yearly"})
    @NonNull
    private String frequency;

    @Schema(required = true, description = "number of successful charges")
    private int billingCycle;

    @Schema(required = true)
    @NonNull
    private OffsetDateTime createdAt;

    @Schema(description = "next billing date. only present for active subscriptions")
    private OffsetDateTime nextBillingAt;

    @Schema(description = "date of the last successful charge")
    private OffsetDateTime lastBillingAt;

    @Schema(description = "cancellation date. only present for cancelled subscriptions")
    private OffsetDateTime cancelledAt;

    private Map<String, Object> metadata;

    @NonNull
    public static SubscriptionResponse from(@NonNull Subscription subscription) {
        return SubscriptionResponse.builder()
            .id(subscription.getUuid())
            .customerId(subscription.getCustomerId())
            .amount(subscription.getAmount())
            .currency(subscription.getCurrency())
            .status(subscription.getStatus().name().toLowerCase(Locale.ROOT))
            .frequency(subscription.getFrequency().toValue())
            .billingCycle(subscription.getBillingCycle())
            .createdAt(subscription.getCreatedAt())
            .nextBillingAt(subscription.isActive() ? subscription.getNextBillingAt() : null)
            .lastBillingAt(subscription.getLastBillingAt())
            .cancelledAt(subscription.getCancelledAt())
            .metadata(subscription.getMetadata())
            .build();
    }
}
