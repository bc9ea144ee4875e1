package com.openforge.docrouter.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.*;

/**
 * A regular expression that, when found in the filename/subject/body text,
 * votes for {@code category} with strength {@code weight}.
 *
 * Identity is (assetType, pattern): the same pattern pointing at two
 * different categories for one asset type is a rule contradiction.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "classification_patterns",
    uniqueConstraints = @UniqueConstraint(name = "uq_pattern_identity", columnNames = "identity_key"),
    indexes = {
        @Index(name = "idx_pattern_fingerprint", columnList = "fingerprint"),
        @Index(name = "idx_pattern_asset_type", columnList = "asset_type")
    }
)
public class ClassificationPattern extends BaseEntity implements KnowledgeFact {

    @Enumerated(EnumType.STRING)
    @Column(name = "asset_type", nullable = false, length = 48)
    private AssetType assetType;

    @Column(name = "category", nullable = false, length = 64)
    private String category;

    @Column(name = "pattern", nullable = false, length = 512)
    private String pattern;

    @Column(name = "weight", nullable = false)
    private double weight;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "confidence_tier", nullable = false, length = 16)
    private ConfidenceTier confidenceTier = ConfidenceTier.MEDIUM;

    @JsonIgnore
    @Column(name = "identity_key", length = 600)
    private String identityKey;

    @JsonIgnore
    @Column(name = "fingerprint", nullable = false, length = 64)
    private String fingerprint;
}
