package com.rebill.api.subscription.entities;

import com.rebill.api.subscription.exceptions.InvalidFrequencyException;
import lombok.val;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.params.provider.Arguments.arguments;

public class SubscriptionTest {

    @ParameterizedTest(name = "{index} - {0} after {1} is {2}")
    @MethodSource("billingDateAfterTestCases")
    void billingDateAfter(Subscription.Frequency frequency, OffsetDateTime base, OffsetDateTime expected) {
        val subscription = new Subscription();
        subscription.setFrequency(frequency);
        assertEquals(expected, subscription.billingDateAfter(base));
    }

    static Stream<Arguments> billingDateAfterTestCases() {
        return Stream.of(
            // frequency, base, expected
            arguments(Subscription.Frequency.DAILY, OffsetDateTime.parse("2025-12-31T08:00:00Z"), OffsetDateTime.parse("2026-01-01T08:00:00Z")),
            arguments(Subscription.Frequency.WEEKLY, OffsetDateTime.parse("2025-02-25T08:00:00Z"), OffsetDateTime.parse("2025-03-04T08:00:00Z")),
            arguments(Subscription.Frequency.MONTHLY, OffsetDateTime.parse("2025-01-31T08:00:00Z"), OffsetDateTime.parse("2025-02-28T08:00:00Z")),
            arguments(Subscription.Frequency.MONTHLY, OffsetDateTime.parse("2024-01-31T08:00:00Z"), OffsetDateTime.parse("2024-02-29T08:00:00Z")),
            arguments(Subscription.Frequency.YEARLY, OffsetDateTime.parse("2024-02-29T08:00:00Z"), OffsetDateTime.parse("2025-02-28T08:00:00Z"))
        );
    }

    @Test
    void billingDateAfter_withoutFrequency() {
        val subscription = new Subscription();
        assertThrows(InvalidFrequencyException.class, () -> subscription.billingDateAfter(OffsetDateTime.now()));
    }

    @Test
    void frequencyFromValue() {
        assertEquals(Optional.of(Subscription.Frequency.WEEKLY), Subscription.Frequency.fromValue(" Weekly "));
        assertEquals(Optional.empty(), Subscription.Frequency.fromValue("hourly"));
        assertEquals(Optional.empty(), Subscription.Frequency.fromValue(null));
        assertEquals("yearly", Subscription.Frequency.YEARLY.toValue());
    }

    @Test
    void isActive() {
        val subscription = new Subscription();
        subscription.setStatus(Subscription.Status.ACTIVE);
        assertTrue(subscription.isActive());

        subscription.setStatus(Subscription.Status.CANCELLED);
        assertFalse(subscription.isActive());
    }
}
