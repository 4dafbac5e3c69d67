package com.rebill.api.subscription.models;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
@Schema(name = "SubscriptionStatistics")
public class SubscriptionStatistics {

    private final long total;
    private final long active;
    private final long cancelled;
}
