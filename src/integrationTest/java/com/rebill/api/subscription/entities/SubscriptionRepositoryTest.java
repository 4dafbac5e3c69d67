package com.rebill.api.subscription.entities;

import lombok.NonNull;
import lombok.val;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
public class SubscriptionRepositoryTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-06-01T12:00:00Z");

    @Autowired
    private SubscriptionRepository repository;

    @Test
    void findByUuid() {
        val saved = repository.save(buildSubscription("cust_round_trip", NOW.plusDays(3)));
        val found = repository.findByUuid(saved.getUuid());

        assertTrue(found.isPresent());
        assertEquals(saved.getId(), found.get().getId());
        assertEquals("cust_round_trip", found.get().getCustomerId());
        assertEquals(new BigDecimal("29.99"), found.get().getAmount());
        assertEquals("USD", found.get().getCurrency());
        assertEquals(Subscription.Frequency.MONTHLY, found.get().getFrequency());
        assertEquals(Subscription.Status.ACTIVE, found.get().getStatus());
        assertEquals(Map.of("plan", "pro"), found.get().getMetadata());
        assertTrue(NOW.plusDays(3).isEqual(found.get().getNextBillingAt()));
        assertFalse(repository.findByUuid(UUID.randomUUID()).isPresent());
        assertTrue(repository.existsByUuid(saved.getUuid()));
    }

    @Test
    void findAllDueForBilling() {
        val dueEarlier = repository.save(buildSubscription("cust_due_1", NOW.minusDays(2)));
        val dueNow = repository.save(buildSubscription("cust_due_2", NOW));
        repository.save(buildSubscription("cust_not_due", NOW.plusSeconds(1)));
        val cancelled = repository.save(buildSubscription("cust_cancelled", NOW.minusDays(1)));
        repository.cancel(cancelled.getUuid(), NOW);

        val due = repository.findAllDueForBilling(NOW)
            .stream()
            .map(Subscription::getUuid)
            .collect(Collectors.toList());

        assertEquals(List.of(dueEarlier.getUuid(), dueNow.getUuid()), due);
    }

    @Test
    void findAllByCustomerId() {
        val first = repository.save(buildSubscription("cust_list", NOW.plusDays(1)));
        val second = repository.save(buildSubscription("cust_list", NOW.plusDays(2)));
        val cancelled = repository.save(buildSubscription("cust_list", NOW.plusDays(3)));
        repository.save(buildSubscription("cust_other", NOW.plusDays(1)));
        repository.cancel(cancelled.getUuid(), NOW);

        val active = repository.findAllByCustomerId("cust_list", Subscription.Status.ACTIVE)
            .stream()
            .map(Subscription::getUuid)
            .collect(Collectors.toList());

        assertEquals(List.of(second.getUuid(), first.getUuid()), active);
    }

    @Test
    void cancel() {
        val subscription = repository.save(buildSubscription("cust_cancel", NOW.plusDays(1)));
        assertEquals(1, repository.cancel(subscription.getUuid(), NOW));
        assertEquals(0, repository.cancel(subscription.getUuid(), NOW.plusHours(1)));
        assertEquals(0, repository.cancel(UUID.randomUUID(), NOW));

        val cancelled = repository.findByUuid(subscription.getUuid()).orElseThrow();
        assertEquals(Subscription.Status.CANCELLED, cancelled.getStatus());
        assertNotNull(cancelled.getCancelledAt());
        assertTrue(NOW.isEqual(cancelled.getCancelledAt()));
    }

    @Test
    void advanceBillingCycle() {
        val subscription = repository.save(buildSubscription("cust_advance", NOW));
        val next = NOW.plusMonths(1);

        assertEquals(1, repository.advanceBillingCycle(subscription.getId(), 0, NOW, next));
        // a second charge of the same cycle must not advance it again.
        assertEquals(0, repository.advanceBillingCycle(subscription.getId(), 0, NOW, next.plusMonths(1)));

        val advanced = repository.findByUuid(subscription.getUuid()).orElseThrow();
        assertEquals(1, advanced.getBillingCycle());
        assertTrue(NOW.isEqual(advanced.getLastBillingAt()));
        assertTrue(next.isEqual(advanced.getNextBillingAt()));

        repository.cancel(subscription.getUuid(), NOW);
        assertEquals(0, repository.advanceBillingCycle(subscription.getId(), 1, NOW, next.plusMonths(1)));
    }

    @Test
    void countByStatus() {
        val before = repository.countByStatus(Subscription.Status.ACTIVE);
        val subscription = repository.save(buildSubscription("cust_count", NOW));
        repository.save(buildSubscription("cust_count", NOW));
        repository.cancel(subscription.getUuid(), NOW);

        assertEquals(before + 1, repository.countByStatus(Subscription.Status.ACTIVE));
        assertTrue(repository.countByStatus(Subscription.Status.CANCELLED) >= 1);
    }

    @Test
    void deleteAll() {
        assertThrows(UnsupportedOperationException.class, () -> repository.deleteAll());
    }

    @NonNull
    private static Subscription buildSubscription(@NonNull String customerId, OffsetDateTime nextBillingAt) {
        return Subscription.builder()
            .customerId(customerId)
            .amount(new BigDecimal("29.99"))
            .currency("USD")
            .frequency(Subscription.Frequency.MONTHLY)
            .createdAt(NOW.minusMonths(1))
            .nextBillingAt(nextBillingAt)
            .metadata(Map.of("plan", "pro"))
            .build();
    }
}
