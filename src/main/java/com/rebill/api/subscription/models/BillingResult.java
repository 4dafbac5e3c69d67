package com.rebill.api.subscription.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.rebill.api.gateway.GatewayResult;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Data;
import lombok.NonNull;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Outcome of a single subscription charge attempt.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(name = "BillingResult")
public class BillingResult {

    @NonNull
    private final UUID subscriptionId;

    private final String customerId;

    @NonNull
    private final GatewayResult.Status status;

    /**
     * Billing cycle of the subscription after the attempt.
     */
    private final int billingCycle;

    private final OffsetDateTime nextBillingAt;

    private final String transactionId;

    private final String code;

    private final String message;

    public boolean isSuccessful() {
        return status == GatewayResult.Status.SUCCESS;
    }
}
