package com.rebill.api.vault.entities;

import com.rebill.api.platform.BasicEntityRepository;
import jakarta.persistence.LockModeType;
import lombok.NonNull;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * A JPA {@link Repository} declaration for database interactions of {@link PaymentVaultEntry}
 * entity.
 *
 * <p>
 * A customer has at most one active default entry. Every write that touches the default flag is
 * a conditional update, and the PostgreSQL schema backs the rule with a partial unique index on
 * {@code customer_id} over active default rows. Writes that move the flag between existing entries
 * first lock the customer's active rows with {@link #lockActiveByCustomerId(String)}, so they run
 * one at a time per customer.</p>
 */
@Repository
public interface PaymentVaultEntryRepository extends BasicEntityRepository<PaymentVaultEntry> {

    /**
     * @param customerId a not {@literal null} customer id.
     * @return a not {@literal null} list of the customer's active entries, the default first and
     * the rest newest first.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from PaymentVaultEntry e where e.customerId = ?1 and e.isActive = true " +
        "order by e.isDefault desc, e.createdAt desc, e.id desc")
    List<PaymentVaultEntry> findAllActiveByCustomerId(@NonNull String customerId);

    /**
     * @param customerId a not {@literal null} customer id.
     * @param pageable   pagination options for the query.
     * @return a not {@literal null} list of the customer's active entries, newest first.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from PaymentVaultEntry e where e.customerId = ?1 and e.isActive = true order by e.createdAt desc, e.id desc")
    List<PaymentVaultEntry> findAllActiveByCustomerIdNewestFirst(@NonNull String customerId, @NonNull Pageable pageable);

    /**
     * Takes a pessimistic write lock on the customer's active entries, in id order, until the
     * surrounding transaction ends.
     *
     * @return a not {@literal null} list of the locked entries.
     */
    @NonNull
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Transactional
    @Query("select e from PaymentVaultEntry e where e.customerId = ?1 and e.isActive = true order by e.id asc")
    List<PaymentVaultEntry> lockActiveByCustomerId(@NonNull String customerId);

    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from PaymentVaultEntry e where e.customerId = ?1 and e.isActive = true and e.isDefault = true")
    Optional<PaymentVaultEntry> findDefaultByCustomerId(@NonNull String customerId);

    /**
     * Finds active entries of the given types whose expiry month is strictly before the given
     * year and month. Months and years are compared as zero-padded strings.
     *
     * @param types a not {@literal null} collection of payment method types.
     * @param year  a not {@literal null} 4-digit year, e.g. {@code 2025}.
     * @param month a not {@literal null} 2-digit month, e.g. {@code 06}.
     * @return a not {@literal null} list of expired entries.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from PaymentVaultEntry e where e.isActive = true and e.paymentMethodType in ?1 " +
        "and (e.expiryYear < ?2 or (e.expiryYear = ?2 and e.expiryMonth < ?3)) order by e.id asc")
    List<PaymentVaultEntry> findAllExpired(
        @NonNull Collection<PaymentVaultEntry.PaymentMethodType> types,
        @NonNull String year,
        @NonNull String month
    );

    @Transactional(readOnly = true)
    @Query("select count(e) from PaymentVaultEntry e where e.isActive = true and e.paymentMethodType in ?1 " +
        "and (e.expiryYear < ?2 or (e.expiryYear = ?2 and e.expiryMonth < ?3))")
    long countExpired(
        @NonNull Collection<PaymentVaultEntry.PaymentMethodType> types,
        @NonNull String year,
        @NonNull String month
    );

    @Transactional(readOnly = true)
    @Query("select count(e) from PaymentVaultEntry e where e.isActive = true")
    long countActive();

    /**
     * Makes the entry the customer's default if it is active and the customer has no other active
     * default entry.
     *
     * @return 1 if the entry became the default, 0 otherwise.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("update PaymentVaultEntry e set e.isDefault = true, e.updatedAt = ?2, e.version = e.version + 1 " +
        "where e.id = ?1 and e.isActive = true and not exists (select o.id from PaymentVaultEntry o " +
        "where o.customerId = e.customerId and o.isActive = true and o.isDefault = true)")
    int claimDefaultIfNone(long id, @NonNull OffsetDateTime now);

    /**
     * Clears the default flag on all of the customer's entries except the given one.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("update PaymentVaultEntry e set e.isDefault = false, e.updatedAt = ?3, e.version = e.version + 1 " +
        "where e.customerId = ?1 and e.id <> ?2 and e.isDefault = true")
    int clearDefaultExcept(@NonNull String customerId, long id, @NonNull OffsetDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("update PaymentVaultEntry e set e.isDefault = true, e.updatedAt = ?2, e.version = e.version + 1 " +
        "where e.id = ?1 and e.isActive = true")
    int markDefault(long id, @NonNull OffsetDateTime now);

    /**
     * Moves the customer's default flag to the given active entry. It locks the customer's active
     * entries, then clears the previous default before setting the new one, so the partial unique
     * index never sees two defaults.
     *
     * @return 1 if the entry is now the default, 0 if it is missing or inactive.
     */
    @Transactional
    default int reassignDefault(@NonNull String customerId, long id, @NonNull OffsetDateTime now) {
        lockActiveByCustomerId(customerId);
        clearDefaultExcept(customerId, id, now);
        return markDefault(id, now);
    }

    /**
     * Deactivates an active entry and clears its default flag.
     *
     * @return 1 if the entry was active, 0 otherwise.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("update PaymentVaultEntry e set e.isActive = false, e.isDefault = false, e.updatedAt = ?2, " +
        "e.version = e.version + 1 where e.id = ?1 and e.isActive = true")
    int deactivate(long id, @NonNull OffsetDateTime now);

    /**
     * Deactivates the entry and, if the customer is left without an active default, hands the
     * default flag to the customer's most recently created remaining active entry, if any. The
     * decision uses the database state, not the default flag of the given {@code entry}.
     *
     * @return {@literal false} if the entry was already inactive.
     */
    @Transactional
    default boolean deactivateAndHandOffDefault(@NonNull PaymentVaultEntry entry, @NonNull OffsetDateTime now) {
        lockActiveByCustomerId(entry.getCustomerId());
        if (deactivate(entry.getId(), now) == 0) {
            return false;
        }

        // a no-op while another active entry holds the default.
        findAllActiveByCustomerIdNewestFirst(entry.getCustomerId(), PageRequest.of(0, 1))
            .stream()
            .findFirst()
            .ifPresent(next -> claimDefaultIfNone(next.getId(), now));

        return true;
    }

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("update PaymentVaultEntry e set e.lastUsedAt = ?2, e.updatedAt = ?2, e.version = e.version + 1 where e.id = ?1")
    int markUsed(long id, @NonNull OffsetDateTime now);
}
