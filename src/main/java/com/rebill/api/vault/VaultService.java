package com.rebill.api.vault;

import com.rebill.api.gateway.GatewayClient;
import com.rebill.api.gateway.GatewayResult;
import com.rebill.api.platform.exceptions.BillingException;
import com.rebill.api.platform.exceptions.ValidationException;
import com.rebill.api.platform.validation.CustomerIdParams;
import com.rebill.api.platform.validation.InputValidator;
import com.rebill.api.vault.entities.PaymentVaultEntry;
import com.rebill.api.vault.entities.PaymentVaultEntryRepository;
import com.rebill.api.vault.exceptions.PaymentMethodExpiredException;
import com.rebill.api.vault.exceptions.PaymentProcessingException;
import com.rebill.api.vault.exceptions.VaultNotFoundException;
import com.rebill.api.vault.models.PaymentMethodDetails;
import com.rebill.api.vault.models.VaultStatistics;
import com.rebill.api.vault.payload.StorePaymentMethodParams;
import com.rebill.api.vault.payload.VaultChargeParams;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.cache.Cache;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Stores reusable payment method tokens and charges them. A customer's first stored payment
 * method becomes the default; the default moves to the newest remaining method when it is
 * deactivated.
 */
@Service
@Slf4j
class VaultService {

    static final String STATISTICS_CACHE_KEY = "statistics";
    static final String ACTIVE_METHODS_CACHE_KEY_PREFIX = "activeMethods:";

    private final PaymentVaultEntryRepository vaultRepository;
    private final GatewayClient gatewayClient;
    private final InputValidator inputValidator;
    private final Clock clock;
    private final Cache cache;

    @Autowired
    VaultService(
        @NonNull PaymentVaultEntryRepository vaultRepository,
        @NonNull GatewayClient gatewayClient,
        @NonNull InputValidator inputValidator,
        @NonNull Clock clock,
        @NonNull @Qualifier(VaultBeans.CACHE_NAME) Cache cache
    ) {
        this.vaultRepository = vaultRepository;
        this.gatewayClient = gatewayClient;
        this.inputValidator = inputValidator;
        this.clock = clock;
        this.cache = cache;
    }

    /**
     * Stores a gateway issued payment method token. The entry becomes the customer's default if
     * the customer has no active default yet.
     *
     * @param details optional descriptive fields of the payment method.
     * @return the stored entry with its final default flag.
     * @throws ValidationException listing every invalid input.
     */
    @NonNull
    PaymentVaultEntry storePaymentMethod(
        String customerId,
        String gatewayCustomerId,
        String paymentMethodToken,
        PaymentMethodDetails details
    ) throws ValidationException {
        inputValidator.validate(new StorePaymentMethodParams(customerId, gatewayCustomerId, paymentMethodToken, details));
        val d = details != null ? details : new PaymentMethodDetails();
        // timestamp columns keep microseconds.
        val now = OffsetDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
        val entry = vaultRepository.save(
            PaymentVaultEntry.builder()
                .customerId(customerId)
                .gatewayCustomerId(gatewayCustomerId)
                .paymentMethodToken(paymentMethodToken)
                .paymentMethodType(PaymentVaultEntry.PaymentMethodType.fromValue(d.getType())
                    .orElse(PaymentVaultEntry.PaymentMethodType.CREDIT_CARD))
                .last4Digits(d.getLast4())
                .cardBrand(d.getBrand())
                .expiryMonth(d.getExpiryMonth() != null ? String.format("%02d", d.getExpiryMonth()) : null)
                .expiryYear(d.getExpiryYear() != null ? String.valueOf(d.getExpiryYear()) : null)
                .billingName(d.getBillingName())
                .billingAddress(d.getBillingAddress())
                .metadata(d.getMetadata())
                .createdAt(now)
                .updatedAt(now)
                .build());

        try {
            entry.setDefault(vaultRepository.claimDefaultIfNone(entry.getId(), now) > 0);
        } catch (DataIntegrityViolationException e) {
            // a concurrent store for the same customer claimed the default first.
            log.info("payment method '{}' lost the default claim for customer '{}'", entry.getUuid(), customerId, e);
            entry.setDefault(false);
        }

        evictCustomer(customerId);
        cache.evictIfPresent(STATISTICS_CACHE_KEY);

        log.info("stored {} payment method '{}' for customer '{}' (default: {})",
            entry.getPaymentMethodType().toValue(), entry.getUuid(), customerId, entry.isDefault());

        return entry;
    }

    /**
     * @return the customer's active payment methods, the default first and the rest newest first.
     * The list is cached until the customer's vault changes through this service.
     * @throws ValidationException if the customer id is not valid.
     */
    @NonNull
    @Cacheable(cacheNames = VaultBeans.CACHE_NAME, key = "'" + ACTIVE_METHODS_CACHE_KEY_PREFIX + "' + #customerId")
    public List<PaymentVaultEntry> listActive(String customerId) throws ValidationException {
        inputValidator.validate(new CustomerIdParams(customerId));
        return vaultRepository.findAllActiveByCustomerId(customerId);
    }

    @NonNull
    Optional<PaymentVaultEntry> getDefault(String customerId) throws ValidationException {
        inputValidator.validate(new CustomerIdParams(customerId));
        return vaultRepository.findDefaultByCustomerId(customerId);
    }

    @NonNull
    Optional<PaymentVaultEntry> getPaymentMethod(@NonNull UUID vaultId) {
        return vaultRepository.findByUuid(vaultId);
    }

    /**
     * Makes an active payment method its customer's default.
     *
     * @return {@literal false} if the payment method doesn't exist or is inactive.
     */
    boolean setDefault(@NonNull UUID vaultId) {
        val entry = vaultRepository.findByUuid(vaultId).filter(PaymentVaultEntry::isActive);
        if (entry.isEmpty()) {
            return false;
        }

        val updated = vaultRepository.reassignDefault(entry.get().getCustomerId(), entry.get().getId(), OffsetDateTime.now(clock));
        if (updated == 0) {
            // deactivated after the look-up.
            return false;
        }

        evictCustomer(entry.get().getCustomerId());
        log.info("payment method '{}' is now the default for customer '{}'", vaultId, entry.get().getCustomerId());
        return true;
    }

    /**
     * Deactivates a payment method. If it was the default, the customer's newest remaining active
     * payment method becomes the default.
     *
     * @return {@literal false} if the payment method doesn't exist or is already inactive.
     */
    boolean deactivate(@NonNull UUID vaultId) {
        val entry = vaultRepository.findByUuid(vaultId).filter(PaymentVaultEntry::isActive);
        if (entry.isEmpty() || !vaultRepository.deactivateAndHandOffDefault(entry.get(), OffsetDateTime.now(clock))) {
            return false;
        }

        evictCustomer(entry.get().getCustomerId());
        cache.evictIfPresent(STATISTICS_CACHE_KEY);
        log.info("deactivated payment method '{}' of customer '{}'", vaultId, entry.get().getCustomerId());
        return true;
    }

    /**
     * Charges a stored payment method. Missing, inactive and expired payment methods are rejected
     * before contacting the gateway.
     *
     * @return the gateway's result. Declines are results, not exceptions.
     * @throws ValidationException           if the amount or currency is not valid.
     * @throws VaultNotFoundException        if the payment method doesn't exist or is inactive.
     * @throws PaymentMethodExpiredException if the payment method has expired.
     * @throws PaymentProcessingException    if the gateway call failed with an exception.
     */
    @NonNull
    GatewayResult chargeWithVault(
        @NonNull UUID vaultId,
        BigDecimal amount,
        String currency,
        Map<String, Object> metadata
    ) throws ValidationException, VaultNotFoundException, PaymentMethodExpiredException, PaymentProcessingException {
        inputValidator.validate(new VaultChargeParams(amount, currency, metadata));
        val entry = vaultRepository.findByUuid(vaultId)
            .filter(PaymentVaultEntry::isActive)
            .orElseThrow(() -> new VaultNotFoundException(vaultId));

        if (entry.isExpired(LocalDate.now(clock))) {
            throw new PaymentMethodExpiredException(vaultId);
        }

        final Map<String, Object> chargeMetadata = metadata != null ? new HashMap<>(metadata) : new HashMap<>();
        chargeMetadata.put(GatewayClient.METADATA_VAULT_ID, vaultId.toString());
        chargeMetadata.put(GatewayClient.METADATA_PAYMENT_METHOD_TOKEN, entry.getPaymentMethodToken());

        final GatewayResult result;
        try {
            result = gatewayClient.chargeCustomer(entry.getGatewayCustomerId(), amount, currency, chargeMetadata);
        } catch (BillingException | RuntimeException e) {
            log.error("charging payment method '{}' of customer '{}' failed", vaultId, entry.getCustomerId(), e);
            throw new PaymentProcessingException(vaultId, e);
        }

        if (result.isSuccessful()) {
            vaultRepository.markUsed(entry.getId(), OffsetDateTime.now(clock));
            evictCustomer(entry.getCustomerId());
            log.info("charged {} {} to payment method '{}' with transaction '{}'", amount, currency, vaultId,
                result.getTransactionId());
        } else {
            log.info("charging payment method '{}' was {}: {}", vaultId, result.getStatus(), result.getMessage());
        }

        return result;
    }

    /**
     * Deactivates all active cards whose expiry month has passed. Running it again without new
     * expiries deactivates nothing.
     *
     * @return the number of deactivated payment methods.
     */
    int cleanupExpired() {
        val now = OffsetDateTime.now(clock);
        val currentMonth = YearMonth.from(now);
        val expired = vaultRepository.findAllExpired(
            PaymentVaultEntry.PaymentMethodType.CARDS,
            String.format("%04d", currentMonth.getYear()),
            String.format("%02d", currentMonth.getMonthValue()));

        int count = 0;
        for (val entry : expired) {
            if (vaultRepository.deactivateAndHandOffDefault(entry, now)) {
                count++;
                evictCustomer(entry.getCustomerId());
                log.info("deactivated expired payment method '{}' of customer '{}' (expiry: {}/{})",
                    entry.getUuid(), entry.getCustomerId(), entry.getExpiryMonth(), entry.getExpiryYear());
            }
        }

        if (count > 0) {
            cache.evictIfPresent(STATISTICS_CACHE_KEY);
        }

        return count;
    }

    @NonNull
    @Cacheable(cacheNames = VaultBeans.CACHE_NAME, key = "'" + STATISTICS_CACHE_KEY + "'")
    public VaultStatistics getStatistics() {
        val currentMonth = YearMonth.now(clock);
        return new VaultStatistics(
            vaultRepository.count(),
            vaultRepository.countActive(),
            vaultRepository.countExpired(
                PaymentVaultEntry.PaymentMethodType.CARDS,
                String.format("%04d", currentMonth.getYear()),
                String.format("%02d", currentMonth.getMonthValue())));
    }

    private void evictCustomer(@NonNull String customerId) {
        cache.evictIfPresent(ACTIVE_METHODS_CACHE_KEY_PREFIX + customerId);
    }
}
