package com.rebill.api.platform;

import jakarta.persistence.Column;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Version;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * <p>
 * {@link BasicEntity} is a {@link MappedSuperclass mapped superclass} that contains the following
 * common fields that <i>should</i> be present in all child entities.
 * </p>
 * <ol>
 *     <li>{@link BasicEntity#id} - the internal surrogate key of the row</li>
 *     <li>{@link BasicEntity#uuid} - the external-facing identifier of the row</li>
 *     <li>{@link BasicEntity#createdAt} - the creation timestamp of the row</li>
 *     <li>{@link BasicEntity#version} - optimistic lock used by the JPA during update queries</li>
 * </ol>
 *
 * <p>
 * The internal {@code id} never leaves the service. Clients must use {@link BasicEntityRepository}
 * to look up entities by their {@code uuid}.
 * </p>
 */
@MappedSuperclass
@Data
@SuperBuilder
@NoArgsConstructor
public abstract class BasicEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * External identifier of this row. It is assigned on construction and never changes.
     */
    @Builder.Default
    @Column(nullable = false, unique = true, updatable = false)
    private UUID uuid = UUID.randomUUID();

    /**
     * Creation timestamp of this row in the table.
     */
    @Column(nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    /**
     * Optimistic lock used by the JPA operations.
     */
    @Version
    private long version;

    @PrePersist
    void setCreatedAtIfMissing() {
        if (this.createdAt == null) {
            this.createdAt = OffsetDateTime.now();
        }
    }
}
