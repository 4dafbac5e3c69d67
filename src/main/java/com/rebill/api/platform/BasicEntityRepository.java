package com.rebill.api.platform;

import lombok.NonNull;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.NoRepositoryBean;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * <p>
 * {@link BasicEntityRepository} is a direct descendant of Spring's {@link CrudRepository}. It adds
 * look-ups by the external {@link BasicEntity#getUuid() uuid} of the descendants of
 * {@link BasicEntity}.</p>
 * <p>
 * Entities managed by these repositories are never hard-deleted by the application. Their
 * lifecycles end with a state transition (cancellation, deactivation) so that the audit trail is
 * retained.</p>
 *
 * @param <T> type of the {@link BasicEntity}.
 */
@NoRepositoryBean
public interface BasicEntityRepository<T extends BasicEntity> extends CrudRepository<T, Long> {

    /**
     * Retrieves an entity by its external id.
     *
     * @param uuid must not be {@literal null}.
     * @return the entity with the given uuid or {@literal Optional#empty()} if none found.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from #{#entityName} e where e.uuid = ?1")
    Optional<T> findByUuid(@NonNull UUID uuid);

    /**
     * Returns whether an entity with the given external id exists.
     *
     * @param uuid must not be {@literal null}.
     * @return {@literal true} if an entity with the given uuid exists, {@literal false} otherwise.
     */
    @Transactional(readOnly = true)
    @Query("select case when count(e) > 0 then true else false end from #{#entityName} e where e.uuid = ?1")
    boolean existsByUuid(@NonNull UUID uuid);

    @Override
    default void deleteAll() {
        throw new UnsupportedOperationException("deleting all entities is not supported");
    }
}
