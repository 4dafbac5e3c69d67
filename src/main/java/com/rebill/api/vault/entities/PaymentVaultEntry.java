package com.rebill.api.vault.entities;

import com.rebill.api.platform.BasicEntity;
import com.rebill.api.platform.converters.JsonMapConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Table;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import lombok.val;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.YearMonth;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A data access object that maps to the {@code payment_vault} table in the database. Each row
 * holds a reusable payment method token issued by the gateway; raw card data is never stored.
 */
@Entity
@Table(name = "payment_vault")
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true, exclude = "paymentMethodToken")
@SuperBuilder
@NoArgsConstructor
public class PaymentVaultEntry extends BasicEntity {

    @NonNull
    @Column(nullable = false, updatable = false)
    private String customerId;

    @NonNull
    @Column(nullable = false, updatable = false)
    private String gatewayCustomerId;

    @NonNull
    @Column(nullable = false, updatable = false)
    private String paymentMethodToken;

    @NonNull
    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentMethodType paymentMethodType = PaymentMethodType.CREDIT_CARD;

    @Column(length = 4)
    private String last4Digits;

    @Column(length = 50)
    private String cardBrand;

    /**
     * Zero-padded expiry month, e.g. {@code 01}.
     */
    @Column(length = 2)
    private String expiryMonth;

    /**
     * Four digit expiry year, e.g. {@code 2027}.
     */
    @Column(length = 4)
    private String expiryYear;

    private String billingName;

    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "text")
    private Map<String, Object> billingAddress;

    @Builder.Default
    @Column(nullable = false)
    private boolean isActive = true;

    @Column(nullable = false)
    private boolean isDefault;

    private OffsetDateTime updatedAt;

    private OffsetDateTime lastUsedAt;

    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "text")
    private Map<String, Object> metadata;

    /**
     * @return {@literal true} if {@code today} is after the last day of the expiry month. Entries
     * with a missing or malformed expiry never expire.
     */
    public boolean isExpired(@NonNull LocalDate today) {
        if (expiryMonth == null || expiryYear == null || !expiryYear.matches("\\d{4}")) {
            return false;
        }

        try {
            val lastDay = YearMonth.of(Integer.parseInt(expiryYear), Integer.parseInt(expiryMonth)).atEndOfMonth();
            return today.isAfter(lastDay);
        } catch (NumberFormatException | DateTimeException e) {
            return false;
        }
    }

    /**
     * @return the card number for display, e.g. {@code **** **** **** 1234}, or {@code ****}
     * without known digits.
     */
    @NonNull
    public String getMaskedCardNumber() {
        return last4Digits == null || last4Digits.isEmpty() ? "****" : "**** **** **** " + last4Digits;
    }

    public enum PaymentMethodType {
        CREDIT_CARD,
        DEBIT_CARD,
        BANK_ACCOUNT,
        OTHER;

        /**
         * Types that carry an expiry date.
         */
        public static final Set<PaymentMethodType> CARDS = EnumSet.of(CREDIT_CARD, DEBIT_CARD);

        public boolean isCard() {
            return CARDS.contains(this);
        }

        @NonNull
        public static Optional<PaymentMethodType> fromValue(String value) {
            if (value == null) {
                return Optional.empty();
            }

            val normalized = value.trim().toUpperCase(Locale.ROOT);
            return Arrays.stream(values())
                .filter(t -> t.name().equals(normalized))
                .findFirst();
        }

        @NonNull
        public String toValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
