package com.rebill.api.subscription.entities;

import com.rebill.api.platform.BasicEntity;
import com.rebill.api.platform.converters.JsonMapConverter;
import com.rebill.api.subscription.exceptions.InvalidFrequencyException;
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

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * A data access object that maps to the {@code subscriptions} table in the database.
 */
@Entity
@Table(name = "subscriptions")
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class Subscription extends BasicEntity {

    @NonNull
    @Column(nullable = false, updatable = false)
    private String customerId;

    @NonNull
    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @NonNull
    @Column(nullable = false, length = 3)
    private String currency;

    @NonNull
    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Status status = Status.ACTIVE;

    @NonNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Frequency frequency;

    private OffsetDateTime nextBillingAt;

    private OffsetDateTime lastBillingAt;

    private OffsetDateTime cancelledAt;

    /**
     * Number of successful charges so far.
     */
    @Column(nullable = false)
    private int billingCycle;

    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "text")
    private Map<String, Object> metadata;

    public boolean isActive() {
        return status == Status.ACTIVE;
    }

    /**
     * @return the billing date one interval of this subscription's {@link #frequency} after
     * {@code base}.
     * @throws InvalidFrequencyException if the frequency is missing.
     */
    @NonNull
    public OffsetDateTime billingDateAfter(@NonNull OffsetDateTime base) {
        if (frequency == null) {
            throw new InvalidFrequencyException(String.format("subscription '%s' has no billing frequency", getUuid()));
        }

        return frequency.next(base);
    }

    public enum Status {
        ACTIVE,
        CANCELLED,
    }

    public enum Frequency {
        DAILY,
        WEEKLY,
        MONTHLY,
        YEARLY;

        /**
         * Calendar months and years clamp to the last day of a shorter target month, e.g. one
         * month after Jan 31 is Feb 28 (or 29).
         *
         * @return the date one interval after {@code base}.
         */
        @NonNull
        public OffsetDateTime next(@NonNull OffsetDateTime base) {
            switch (this) {
                case DAILY:
                    return base.plusDays(1);
                case WEEKLY:
                    return base.plusWeeks(1);
                case MONTHLY:
                    return base.plusMonths(1);
                case YEARLY:
                    return base.plusYears(1);
                default:
                    throw new InvalidFrequencyException("unknown billing frequency: " + this);
            }
        }

        /**
         * @param value case-insensitive frequency name, e.g. {@code monthly}.
         * @return the matching frequency, or {@link Optional#empty()} if there is none.
         */
        @NonNull
        public static Optional<Frequency> fromValue(String value) {
            if (value == null) {
                return Optional.empty();
            }

            val normalized = value.trim().toUpperCase(Locale.ROOT);
            return Arrays.stream(values())
                .filter(f -> f.name().equals(normalized))
                .findFirst();
        }

        @NonNull
        public String toValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
