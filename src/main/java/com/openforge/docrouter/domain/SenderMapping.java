package com.openforge.docrouter.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Which assets a sender usually writes about, and how far that association
 * is trusted. Keyed by the normalized (trimmed, lowercase) address.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "sender_mappings",
    uniqueConstraints = @UniqueConstraint(name = "uq_sender_identity", columnNames = "identity_key"),
    indexes = @Index(name = "idx_sender_fingerprint", columnList = "fingerprint")
)
public class SenderMapping extends BaseEntity implements KnowledgeFact {

    @Column(name = "sender_address", nullable = false, length = 320)
    private String senderAddress;

    @Builder.Default
    @Convert(converter = JsonColumnConverters.StringListConverter.class)
    @Column(name = "asset_ids", nullable = false, columnDefinition = "TEXT")
    private List<String> assetIds = new ArrayList<>();

    @Column(name = "trust_score", nullable = false)
    private double trustScore;

    @Column(name = "organization", length = 256)
    private String organization;

    @Builder.Default
    @Column(name = "interaction_count", nullable = false)
    private Integer interactionCount = 0;

    @JsonIgnore
    @Column(name = "identity_key", length = 320)
    private String identityKey;

    @JsonIgnore
    @Column(name = "fingerprint", nullable = false, length = 64)
    private String fingerprint;

    @JsonIgnore
    @Override
    public ConfidenceTier getConfidenceTier() {
        return ConfidenceTier.fromScore(trustScore);
    }
}
