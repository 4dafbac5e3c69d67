package com.rebill.api.subscription.entities;

import com.rebill.api.platform.BasicEntityRepository;
import lombok.NonNull;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * A JPA {@link Repository} declaration for database interactions of {@link Subscription} entity.
 * State transitions are single conditional updates so that the batch scheduler and per-request
 * operations can run concurrently.
 */
@Repository
public interface SubscriptionRepository extends BasicEntityRepository<Subscription> {

    /**
     * Retrieves all subscriptions in the given {@code status} whose next billing date is at or
     * before {@code asOf}, the earliest first.
     *
     * @param asOf   a not {@literal null} timestamp.
     * @param status a not {@literal null} subscription status.
     * @return a not {@literal null} list of matching subscriptions.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from Subscription e where e.status = ?2 and e.nextBillingAt <= ?1 order by e.nextBillingAt asc, e.id asc")
    List<Subscription> findAllDueForBilling(@NonNull OffsetDateTime asOf, @NonNull Subscription.Status status);

    /**
     * @return a not {@literal null} list of active subscriptions that are due at {@code asOf}.
     */
    @NonNull
    default List<Subscription> findAllDueForBilling(@NonNull OffsetDateTime asOf) {
        return findAllDueForBilling(asOf, Subscription.Status.ACTIVE);
    }

    /**
     * @param customerId a not {@literal null} customer id.
     * @param status     a not {@literal null} subscription status.
     * @return a not {@literal null} list of the customer's subscriptions in the given status,
     * newest first.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from Subscription e where e.customerId = ?1 and e.status = ?2 order by e.createdAt desc, e.id desc")
    List<Subscription> findAllByCustomerId(@NonNull String customerId, @NonNull Subscription.Status status);

    /**
     * Cancels a subscription if it is still in the {@code expectedStatus}.
     *
     * @param uuid           a not {@literal null} external id of the subscription.
     * @param cancelledAt    a not {@literal null} cancellation timestamp.
     * @param expectedStatus status that the subscription must be in, i.e. {@code ACTIVE}.
     * @param newStatus      status to transition to, i.e. {@code CANCELLED}.
     * @return 1 if the subscription was updated, 0 if it is missing or in another status.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("update Subscription e set e.status = ?4, e.cancelledAt = ?2, e.version = e.version + 1 " +
        "where e.uuid = ?1 and e.status = ?3")
    int updateStatus(
        @NonNull UUID uuid,
        @NonNull OffsetDateTime cancelledAt,
        @NonNull Subscription.Status expectedStatus,
        @NonNull Subscription.Status newStatus
    );

    /**
     * Cancels an active subscription.
     *
     * @return 1 if the subscription was active, 0 if it is missing or already cancelled.
     */
    default int cancel(@NonNull UUID uuid, @NonNull OffsetDateTime cancelledAt) {
        return updateStatus(uuid, cancelledAt, Subscription.Status.ACTIVE, Subscription.Status.CANCELLED);
    }

    /**
     * Records a successful charge. The update only applies while the subscription is still in
     * {@code expectedStatus} and its billing cycle still equals {@code expectedBillingCycle}, so a
     * concurrent cancellation or a second charge of the same cycle leaves the row untouched.
     *
     * @param id                   internal id of the subscription.
     * @param expectedBillingCycle the billing cycle before the charge.
     * @param lastBillingAt        a not {@literal null} timestamp of the charge.
     * @param nextBillingAt        a not {@literal null} next billing date.
     * @param expectedStatus       a not {@literal null} status, i.e. {@code ACTIVE}.
     * @return 1 if the subscription was updated, 0 otherwise.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("update Subscription e set e.billingCycle = e.billingCycle + 1, e.lastBillingAt = ?3, e.nextBillingAt = ?4, " +
        "e.version = e.version + 1 where e.id = ?1 and e.billingCycle = ?2 and e.status = ?5")
    int advanceBillingCycle(
        long id,
        int expectedBillingCycle,
        @NonNull OffsetDateTime lastBillingAt,
        @NonNull OffsetDateTime nextBillingAt,
        @NonNull Subscription.Status expectedStatus
    );

    default int advanceBillingCycle(
        long id,
        int expectedBillingCycle,
        @NonNull OffsetDateTime lastBillingAt,
        @NonNull OffsetDateTime nextBillingAt
    ) {
        return advanceBillingCycle(id, expectedBillingCycle, lastBillingAt, nextBillingAt, Subscription.Status.ACTIVE);
    }

    @Transactional(readOnly = true)
    @Query("select count(e) from Subscription e where e.status = ?1")
    long countByStatus(@NonNull Subscription.Status status);
}
