package com.rebill.api.gateway.entities;

import com.rebill.api.platform.BasicEntity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Table;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.Set;

/**
 * A data access object that maps to the {@code payment_transactions} table in the database. The
 * gateway adapter writes one row for every successful gateway response before reporting the
 * success to its caller.
 */
@Entity
@Table(name = "payment_transactions")
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class PaymentTransaction extends BasicEntity {

    @NonNull
    @Column(nullable = false, updatable = false)
    private String transactionId;

    @Column(updatable = false)
    private String originalTransactionId;

    @Column(updatable = false)
    private String usedToken;

    @NonNull
    @Column(nullable = false, precision = 12, scale = 2, updatable = false)
    private BigDecimal amount;

    @NonNull
    @Column(nullable = false, length = 3, updatable = false)
    private String currencyCode;

    @NonNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentStatus paymentStatus;

    @Column(length = 4, updatable = false)
    private String last4Digits;

    public enum PaymentStatus {
        APPROVED,
        DECLINED,
        FAILED,
        PENDING,
        REFUNDED,
        PARTIALLY_REFUNDED,
        CANCELLED;

        private static final Set<PaymentStatus> FINAL = EnumSet.of(APPROVED, REFUNDED, CANCELLED, FAILED);

        public boolean isSuccessful() {
            return this == APPROVED;
        }

        /**
         * @return whether no further processing is possible for a transaction in this status.
         */
        public boolean isFinal() {
            return FINAL.contains(this);
        }
    }
}
