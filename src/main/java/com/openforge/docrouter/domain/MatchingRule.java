package com.openforge.docrouter.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.*;

/**
 * A named numeric threshold or matching parameter, e.g.
 * {@code routing.high = 0.85} or {@code matching.fuzzy-threshold = 0.8}.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "matching_rules",
    uniqueConstraints = @UniqueConstraint(name = "uq_matching_rule_identity", columnNames = "identity_key"),
    indexes = @Index(name = "idx_matching_rule_fingerprint", columnList = "fingerprint")
)
public class MatchingRule extends BaseEntity implements KnowledgeFact {

    @Column(name = "rule_name", nullable = false, length = 128)
    private String ruleName;

    @Column(name = "rule_value", nullable = false)
    private double value;

    @Column(name = "description", length = 512)
    private String description;

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
