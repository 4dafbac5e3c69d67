package com.rebill.api.gateway.entities;

import com.rebill.api.platform.BasicEntityRepository;
import lombok.NonNull;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * A JPA {@link Repository} declaration for database interactions of {@link PaymentTransaction}
 * entity.
 */
@Repository
public interface PaymentTransactionRepository extends BasicEntityRepository<PaymentTransaction> {

    /**
     * Find {@link PaymentTransaction} rows by their gateway assigned transaction id. Refunds carry
     * their own transaction ids, so at most one row is expected per id.
     *
     * @param transactionId a not {@literal null} gateway assigned transaction id.
     * @return a not {@literal null} list of matching transactions.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from PaymentTransaction e where e.transactionId = ?1")
    List<PaymentTransaction> findAllByTransactionId(@NonNull String transactionId);

    /**
     * @param pageable pagination options for the query.
     * @return a page of transactions, newest first.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from PaymentTransaction e order by e.createdAt desc, e.id desc")
    Page<PaymentTransaction> findAllNewestFirst(@NonNull Pageable pageable);
}
