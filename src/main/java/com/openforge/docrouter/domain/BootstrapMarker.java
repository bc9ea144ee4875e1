package com.openforge.docrouter.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Persisted "already loaded" flag for one seed collection.
 * The unique constraint is what makes concurrent startups safe.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "bootstrap_markers",
    uniqueConstraints = @UniqueConstraint(name = "uq_bootstrap_collection", columnNames = "collection_name")
)
public class BootstrapMarker extends BaseEntity {

    @Column(name = "collection_name", nullable = false, length = 64)
    private String collectionName;

    @Column(name = "loaded_at", nullable = false)
    private LocalDateTime loadedAt;

    @Column(name = "item_count", nullable = false)
    private Integer itemCount;
}
