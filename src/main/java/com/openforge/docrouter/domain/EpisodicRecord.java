package com.openforge.docrouter.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * One past routing decision or human correction.
 *
 * Append-only: there is no identity key, so the gate only deduplicates by
 * fingerprint. The timestamp is not part of the fingerprint, which makes a
 * replayed identical decision a duplicate rather than a second episode.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "episodic_records",
    indexes = {
        @Index(name = "idx_episode_fingerprint", columnList = "fingerprint"),
        @Index(name = "idx_episode_source_time", columnList = "source, occurred_at")
    }
)
public class EpisodicRecord extends BaseEntity implements KnowledgeFact {

    @Column(name = "filename", nullable = false, length = 512)
    private String filename;

    @Column(name = "subject_excerpt", length = 512)
    private String subjectExcerpt;

    @Column(name = "body_excerpt", length = 1024)
    private String bodyExcerpt;

    @Column(name = "predicted_category", nullable = false, length = 64)
    private String predictedCategory;

    @Column(name = "asset_id", length = 64)
    private String assetId;

    @Enumerated(EnumType.STRING)
    @Column(name = "asset_type", length = 48)
    private AssetType assetType;

    @Column(name = "confidence", nullable = false)
    private double confidence;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", nullable = false, length = 24)
    private ExperienceSource source;

    @Column(name = "occurred_at", nullable = false)
    private LocalDateTime occurredAt;

    @JsonIgnore
    @Column(name = "identity_key", length = 128)
    private String identityKey;

    @JsonIgnore
    @Column(name = "fingerprint", nullable = false, length = 64)
    private String fingerprint;

    @JsonIgnore
    @Override
    public ConfidenceTier getConfidenceTier() {
        return source == ExperienceSource.HUMAN_CORRECTION
                ? ConfidenceTier.HIGH
                : ConfidenceTier.fromScore(confidence);
    }

    @JsonIgnore
    public boolean isCorrection() {
        return source == ExperienceSource.HUMAN_CORRECTION;
    }

    /** Text fed to the similarity capability. */
    @JsonIgnore
    public String queryText() {
        StringBuilder sb = new StringBuilder(filename);
        if (subjectExcerpt != null && !subjectExcerpt.isBlank()) sb.append(' ').append(subjectExcerpt);
        return sb.toString();
    }
}
