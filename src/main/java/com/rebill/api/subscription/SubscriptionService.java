package com.rebill.api.subscription;

import com.rebill.api.gateway.GatewayClient;
import com.rebill.api.gateway.GatewayResult;
import com.rebill.api.platform.exceptions.BillingException;
import com.rebill.api.platform.exceptions.ValidationException;
import com.rebill.api.platform.validation.CustomerIdParams;
import com.rebill.api.platform.validation.InputValidator;
import com.rebill.api.subscription.entities.Subscription;
import com.rebill.api.subscription.entities.SubscriptionRepository;
import com.rebill.api.subscription.exceptions.InvalidFrequencyException;
import com.rebill.api.subscription.models.BillingResult;
import com.rebill.api.subscription.models.SubscriptionStatistics;
import com.rebill.api.subscription.payload.CreateSubscriptionParams;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.cache.Cache;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static com.rebill.api.platform.validation.InputValidator.addViolation;

/**
 * Manages subscriptions and charges the ones that are due. Charging a subscription advances its
 * billing cycle only after the gateway reports a success.
 */
@Service
@Slf4j
class SubscriptionService {

    static final String NOT_ACTIVE_CODE = "SUBSCRIPTION_NOT_ACTIVE";
    static final String NOT_ACTIVE_MESSAGE = "not active";
    static final String INTERNAL_ERROR_CODE = "INTERNAL_ERROR";
    static final String CONCURRENT_UPDATE_CODE = "CONCURRENT_UPDATE";
    static final String STATISTICS_CACHE_KEY = "statistics";

    private final SubscriptionConfiguration config;
    private final SubscriptionRepository subscriptionRepository;
    private final GatewayClient gatewayClient;
    private final InputValidator inputValidator;
    private final Clock clock;
    private final Cache cache;

    @Autowired
    SubscriptionService(
        @NonNull SubscriptionConfiguration config,
        @NonNull SubscriptionRepository subscriptionRepository,
        @NonNull GatewayClient gatewayClient,
        @NonNull InputValidator inputValidator,
        @NonNull Clock clock,
        @NonNull @Qualifier(SubscriptionBeans.CACHE_NAME) Cache cache
    ) {
        this.config = config;
        this.subscriptionRepository = subscriptionRepository;
        this.gatewayClient = gatewayClient;
        this.inputValidator = inputValidator;
        this.clock = clock;
        this.cache = cache;
    }

    /**
     * Creates an active subscription whose first charge is due one interval from now.
     *
     * @param frequency case-insensitive {@code daily}, {@code weekly}, {@code monthly} or
     *                  {@code yearly}.
     * @return the persisted subscription.
     * @throws ValidationException listing every invalid input.
     */
    @NonNull
    Subscription createSubscription(
        String customerId,
        BigDecimal amount,
        String currency,
        String frequency,
        Map<String, Object> metadata
    ) throws ValidationException {
        val violations = inputValidator.violationsOf(new CreateSubscriptionParams(customerId, amount, currency, frequency, metadata));
        if (amount != null && amount.compareTo(config.getMaxAmount()) > 0) {
            addViolation(violations, "amount", "must not exceed " + config.getMaxAmount().toPlainString());
        }

        inputValidator.requireNoViolations(violations);
        val billingFrequency = Subscription.Frequency.fromValue(frequency)
            .orElseThrow(() -> new InvalidFrequencyException("unknown billing frequency: " + frequency));

        // timestamp columns keep microseconds.
        val now = OffsetDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
        val subscription = subscriptionRepository.save(
            Subscription.builder()
                .customerId(customerId)
                .amount(amount.setScale(2, RoundingMode.UNNECESSARY))
                .currency(currency)
                .frequency(billingFrequency)
                .createdAt(now)
                .nextBillingAt(billingFrequency.next(now))
                .metadata(metadata)
                .build());

        cache.evictIfPresent(STATISTICS_CACHE_KEY);
        log.info("created {} subscription '{}' for customer '{}'", billingFrequency.toValue(), subscription.getUuid(), customerId);
        return subscription;
    }

    /**
     * Cancels an active subscription. Cancellation is final.
     *
     * @return {@literal false} if the subscription doesn't exist or was already cancelled.
     */
    boolean cancelSubscription(@NonNull UUID subscriptionId) {
        val updated = subscriptionRepository.cancel(subscriptionId, OffsetDateTime.now(clock));
        if (updated == 0) {
            log.debug("subscription '{}' is missing or already cancelled", subscriptionId);
            return false;
        }

        cache.evictIfPresent(STATISTICS_CACHE_KEY);
        log.info("cancelled subscription '{}'", subscriptionId);
        return true;
    }

    @NonNull
    Optional<Subscription> getSubscription(@NonNull UUID subscriptionId) {
        return subscriptionRepository.findByUuid(subscriptionId);
    }

    /**
     * @return the customer's active subscriptions, newest first.
     * @throws ValidationException if the customer id is not valid.
     */
    @NonNull
    List<Subscription> listCustomerSubscriptions(String customerId) throws ValidationException {
        inputValidator.validate(new CustomerIdParams(customerId));
        return subscriptionRepository.findAllByCustomerId(customerId, Subscription.Status.ACTIVE);
    }

    /**
     * Charges every active subscription that is due at {@code asOf}, the earliest first. A failure
     * of one subscription never prevents charging the others; it is reported in that
     * subscription's result.
     *
     * @return one result for each due subscription, in processing order.
     * @throws org.springframework.dao.DataAccessException if the due subscriptions could not be
     *                                                     loaded.
     */
    @NonNull
    List<BillingResult> processDue(@NonNull OffsetDateTime asOf) {
        val due = subscriptionRepository.findAllDueForBilling(asOf);
        log.info("processing {} subscriptions due at {}", due.size(), asOf);
        val results = new ArrayList<BillingResult>(due.size());
        for (val subscription : due) {
            try {
                results.add(processOne(subscription));
            } catch (RuntimeException e) {
                log.error("failed to process subscription '{}'", subscription.getUuid(), e);
                results.add(failedResult(subscription, INTERNAL_ERROR_CODE, e.getMessage()));
            }
        }

        val succeeded = results.stream().filter(BillingResult::isSuccessful).count();
        log.info("processed {} due subscriptions: {} succeeded, {} failed", results.size(), succeeded, results.size() - succeeded);
        return results;
    }

    /**
     * Charges a single subscription for its next billing cycle. It re-reads the subscription
     * first and refuses to charge one that is no longer active.
     */
    @NonNull
    BillingResult processOne(@NonNull Subscription subscription) {
        val current = subscription.getId() == null
            ? Optional.<Subscription>empty()
            : subscriptionRepository.findById(subscription.getId());

        if (current.isEmpty() || !current.get().isActive()) {
            log.debug("skipping subscription '{}' since it is not active", subscription.getUuid());
            return BillingResult.builder()
                .subscriptionId(subscription.getUuid())
                .customerId(subscription.getCustomerId())
                .status(GatewayResult.Status.ERROR)
                .billingCycle(current.map(Subscription::getBillingCycle).orElse(subscription.getBillingCycle()))
                .code(NOT_ACTIVE_CODE)
                .message(NOT_ACTIVE_MESSAGE)
                .build();
        }

        val s = current.get();
        final Map<String, Object> metadata = new HashMap<>();
        metadata.put(GatewayClient.METADATA_SUBSCRIPTION_ID, s.getUuid().toString());
        metadata.put(GatewayClient.METADATA_BILLING_CYCLE, s.getBillingCycle() + 1);

        final GatewayResult result;
        try {
            result = gatewayClient.chargeCustomer(s.getCustomerId(), s.getAmount(), s.getCurrency(), metadata);
        } catch (BillingException e) {
            log.warn("failed to charge subscription '{}' for cycle {}", s.getUuid(), s.getBillingCycle() + 1, e);
            return failedResult(s, e.getErrorCode(), e.getMessage());
        }

        if (!result.isSuccessful()) {
            log.info("charging subscription '{}' for cycle {} was {}: {}", s.getUuid(), s.getBillingCycle() + 1,
                result.getStatus(), result.getMessage());

            return BillingResult.builder()
                .subscriptionId(s.getUuid())
                .customerId(s.getCustomerId())
                .status(result.getStatus())
                .billingCycle(s.getBillingCycle())
                .nextBillingAt(s.getNextBillingAt())
                .transactionId(result.getTransactionId())
                .code(result.getCode())
                .message(result.getMessage())
                .build();
        }

        val now = OffsetDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
        // charges made ahead of their due date, e.g. with a future 'asOf', count from the due date.
        val base = s.getNextBillingAt() != null && s.getNextBillingAt().isAfter(now) ? s.getNextBillingAt() : now;
        val nextBillingAt = s.billingDateAfter(base);
        val updated = subscriptionRepository.advanceBillingCycle(s.getId(), s.getBillingCycle(), now, nextBillingAt);
        if (updated == 0) {
            // the charge went through, but the row changed underneath; it must be reconciled manually.
            log.error("charged subscription '{}' with transaction '{}', but it was modified concurrently",
                s.getUuid(), result.getTransactionId());

            return BillingResult.builder()
                .subscriptionId(s.getUuid())
                .customerId(s.getCustomerId())
                .status(GatewayResult.Status.ERROR)
                .billingCycle(s.getBillingCycle())
                .nextBillingAt(s.getNextBillingAt())
                .transactionId(result.getTransactionId())
                .code(CONCURRENT_UPDATE_CODE)
                .message("subscription was modified while it was being charged")
                .build();
        }

        log.info("charged subscription '{}' for cycle {} with transaction '{}'", s.getUuid(), s.getBillingCycle() + 1,
            result.getTransactionId());

        return BillingResult.builder()
            .subscriptionId(s.getUuid())
            .customerId(s.getCustomerId())
            .status(GatewayResult.Status.SUCCESS)
            .billingCycle(s.getBillingCycle() + 1)
            .nextBillingAt(nextBillingAt)
            .transactionId(result.getTransactionId())
            .code(result.getCode())
            .message(result.getMessage())
            .build();
    }

    /**
     * @return subscription counts by status. They are cached until a subscription is created or
     * cancelled through this service, or until the cache TTL expires.
     */
    @NonNull
    @Cacheable(cacheNames = SubscriptionBeans.CACHE_NAME, key = "'" + STATISTICS_CACHE_KEY + "'")
    public SubscriptionStatistics getStatistics() {
        return new SubscriptionStatistics(
            subscriptionRepository.count(),
            subscriptionRepository.countByStatus(Subscription.Status.ACTIVE),
            subscriptionRepository.countByStatus(Subscription.Status.CANCELLED));
    }

    @NonNull
    private static BillingResult failedResult(@NonNull Subscription s, @NonNull String code, String message) {
        return BillingResult.builder()
            .subscriptionId(s.getUuid())
            .customerId(s.getCustomerId())
            .status(GatewayResult.Status.ERROR)
            .billingCycle(s.getBillingCycle())
            .nextBillingAt(s.getNextBillingAt())
            .code(code)
            .message(message)
            .build();
    }
}
