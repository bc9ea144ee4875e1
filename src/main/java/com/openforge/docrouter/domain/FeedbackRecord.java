package com.openforge.docrouter.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.*;

/**
 * A human correction of a routing decision, kept as a semantic fact.
 * Append-only: no identity key, deduplicated by fingerprint alone.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "feedback_records",
    indexes = @Index(name = "idx_feedback_fingerprint", columnList = "fingerprint")
)
public class FeedbackRecord extends BaseEntity implements KnowledgeFact {

    @Column(name = "filename", nullable = false, length = 512)
    private String filename;

    @Column(name = "email_subject", length = 1024)
    private String emailSubject;

    @Column(name = "body_excerpt", columnDefinition = "TEXT")
    private String bodyExcerpt;

    @Column(name = "corrected_category", nullable = false, length = 64)
    private String correctedCategory;

    /** Null when the reviewer discarded the document. */
    @Column(name = "corrected_asset_id", length = 64)
    private String correctedAssetId;

    @Enumerated(EnumType.STRING)
    @Column(name = "asset_type", length = 48)
    private AssetType assetType;

    @Column(name = "original_prediction", length = 64)
    private String originalPrediction;

    @Column(name = "corrected_by", length = 128)
    private String correctedBy;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "confidence_tier", nullable = false, length = 16)
    private ConfidenceTier confidenceTier = ConfidenceTier.HIGH;

    @JsonIgnore
    @Column(name = "identity_key", length = 128)
    private String identityKey;

    @JsonIgnore
    @Column(name = "fingerprint", nullable = false, length = 64)
    private String fingerprint;
}
