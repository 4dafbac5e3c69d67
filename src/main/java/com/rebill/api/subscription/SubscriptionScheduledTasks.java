package com.rebill.api.subscription;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Collection of scheduled tasks for {@link SubscriptionService}.
 */
@Component
@Slf4j
class SubscriptionScheduledTasks {

    private final SubscriptionService subscriptionService;
    private final Clock clock;

    @Autowired
    SubscriptionScheduledTasks(@NonNull SubscriptionService subscriptionService, @NonNull Clock clock) {
        this.subscriptionService = subscriptionService;
        this.clock = clock;
    }

    @Scheduled(cron = "${app.subscriptions.billing-schedule}")
    void processDueBilling() {
        log.info("performing due subscription billing");
        subscriptionService.processDue(OffsetDateTime.now(clock));
    }
}
